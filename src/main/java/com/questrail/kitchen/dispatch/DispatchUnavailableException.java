package com.questrail.kitchen.dispatch;

/**
 * The send action cannot be dispatched at all: the service is shut down, or
 * every destination is a printer and the printer transport is down.
 *
 * <p>This is the only failure a send action reports to its caller. Everything
 * else is data in the {@link DispatchReport}.</p>
 */
public final class DispatchUnavailableException extends RuntimeException
{
    public DispatchUnavailableException(String message) {
        super(message);
    }

    public DispatchUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
