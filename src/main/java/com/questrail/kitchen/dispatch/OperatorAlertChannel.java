package com.questrail.kitchen.dispatch;

/**
 * Operator-facing alert path (POS banner, manager pager, ...).
 *
 * <p>Implementations must not throw; an alert that cannot be delivered is
 * logged by the implementation itself.</p>
 */
public interface OperatorAlertChannel
{
    void alert(OperatorAlert alert);
}
