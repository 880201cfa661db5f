package com.strata.monitoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default notifier: writes alerts to the log. Replaced by declaring another {@link AlertNotifier} bean.
 */
public class LoggingAlertNotifier implements AlertNotifier {

    private static final Logger logger = LoggerFactory.getLogger("com.strata.alerts");

    @Override
    public void notify(Alert alert) {
        if (alert.getSeverity() == Alert.Severity.CRITICAL) {
            logger.error("ALERT {}", alert);
        } else {
            logger.warn("ALERT {}", alert);
        }
    }
}
