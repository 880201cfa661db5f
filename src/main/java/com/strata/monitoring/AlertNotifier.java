package com.strata.monitoring;

/**
 * Delivery channel for operator alerts.
 */
public interface AlertNotifier {

    void notify(Alert alert);
}
