package com.questrail.kitchen.print;

/**
 * Raised when a ticket cannot be built for one manifest entry: a malformed
 * layout, or a style the target printer cannot print.
 *
 * <p>The failure is local to that entry. The dispatch service reports it as a
 * build failure and carries on with every other destination.</p>
 */
public final class TicketBuildException extends RuntimeException
{
    public TicketBuildException(String message) {
        super(message);
    }

    public TicketBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
