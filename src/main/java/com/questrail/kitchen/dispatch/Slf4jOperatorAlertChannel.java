package com.questrail.kitchen.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link OperatorAlertChannel}: one ERROR log line per alert.
 */
public final class Slf4jOperatorAlertChannel implements OperatorAlertChannel
{
    private static final Logger log = LoggerFactory.getLogger("kitchen.operator-alerts");

    @Override
    public void alert(OperatorAlert alert) {
        log.error("OPERATOR ALERT order {} station {} ({}): {}",
                alert.orderId(), alert.stationName(), alert.stationId(), alert.message());
    }
}
