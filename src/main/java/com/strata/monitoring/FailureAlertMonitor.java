package com.strata.monitoring;

import com.strata.domain.ExecutionLogEntry;
import com.strata.storage.ExecutionLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Raises operator alerts.
 *
 * Failure-rate alerts fire when the failures in the rolling window exceed the threshold and
 * are rate-limited by the minimum alert interval; metadata-unavailable alerts are rate-limited
 * per loop the same way. Timeout alerts always fire, one per timed-out action.
 */
@Component
public class FailureAlertMonitor {

    private static final Logger logger = LoggerFactory.getLogger(FailureAlertMonitor.class);

    private static final int RECENT_ALERTS = 100;

    private final ExecutionLogRepository logRepository;
    private final AlertNotifier notifier;
    private final LifecycleMetrics metrics;
    private final Clock clock;
    private final int failureThreshold;
    private final Duration window;
    private final Duration minInterval;

    private final Map<String, Instant> lastRaised = new ConcurrentHashMap<>();
    private final Deque<Alert> recent = new ArrayDeque<>();

    public FailureAlertMonitor(ExecutionLogRepository logRepository,
                               AlertNotifier notifier,
                               LifecycleMetrics metrics,
                               Clock clock,
                               @Value("${strata.alerts.failure-threshold:5}") int failureThreshold,
                               @Value("${strata.alerts.window:PT1H}") Duration window,
                               @Value("${strata.alerts.min-interval:PT30M}") Duration minInterval) {
        this.logRepository = logRepository;
        this.notifier = notifier;
        this.metrics = metrics;
        this.clock = clock;
        this.failureThreshold = failureThreshold;
        this.window = window;
        this.minInterval = minInterval;
    }

    /**
     * Counts failures in the rolling window and alerts when there are more than the threshold.
     */
    public Optional<Alert> checkFailureRate() {
        Instant now = clock.instant();
        int failures = logRepository.countFailuresSince(now.minus(window));
        if (failures <= failureThreshold) {
            logger.debug("{} failed actions in the last {}, threshold {}", failures, window, failureThreshold);
            return Optional.empty();
        }
        String message = String.format("%d actions failed in the last %d minutes (threshold %d)",
            failures, window.toMinutes(), failureThreshold);
        return raiseLimited(AlertType.FAILURE_RATE.name(),
            new Alert(AlertType.FAILURE_RATE, Alert.Severity.WARNING, message, now));
    }

    /**
     * The worker gave up waiting; the storage engine may still be executing the action.
     */
    public Alert actionTimedOut(ExecutionLogEntry entry, Duration timeout) {
        String message = String.format("%s on partition %s.%s (policy %s) exceeded %s and was marked FAILED; "
                + "the storage operation may still be running and needs a manual check",
            entry.getAction(), entry.getDatasetId(), entry.getPartitionName(), entry.getPolicyName(), timeout);
        Alert alert = new Alert(AlertType.ACTION_TIMEOUT, Alert.Severity.CRITICAL, message, clock.instant());
        raise(alert);
        return alert;
    }

    public Optional<Alert> metadataUnavailable(String loop, Exception cause) {
        String message = String.format("%s loop stopped: %s", loop, cause.getMessage());
        return raiseLimited(AlertType.METADATA_UNAVAILABLE.name() + ":" + loop,
            new Alert(AlertType.METADATA_UNAVAILABLE, Alert.Severity.CRITICAL, message, clock.instant()));
    }

    public List<Alert> recentAlerts() {
        synchronized (recent) {
            return new ArrayList<>(recent);
        }
    }

    private Optional<Alert> raiseLimited(String key, Alert alert) {
        Instant previous = lastRaised.get(key);
        if (previous != null && alert.getRaisedAt().isBefore(previous.plus(minInterval))) {
            logger.debug("Alert {} suppressed, last raised at {}", key, previous);
            return Optional.empty();
        }
        lastRaised.put(key, alert.getRaisedAt());
        raise(alert);
        return Optional.of(alert);
    }

    private void raise(Alert alert) {
        synchronized (recent) {
            recent.addFirst(alert);
            while (recent.size() > RECENT_ALERTS) {
                recent.removeLast();
            }
        }
        metrics.recordAlert(alert.getType().name());
        try {
            notifier.notify(alert);
        } catch (RuntimeException e) {
            logger.error("Alert notifier failed for {}", alert, e);
        }
    }
}
