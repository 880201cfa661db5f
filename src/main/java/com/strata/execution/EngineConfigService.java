package com.strata.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Holds the current {@link EngineConfig}. Starts from {@code strata.execution.*} and
 * {@code strata.evaluation.*}; operational controls swap the snapshot atomically.
 */
@Service
public class EngineConfigService {

    private static final Logger log = LoggerFactory.getLogger(EngineConfigService.class);

    private static final String WINDOW_BY_DAY_PREFIX = "strata.execution.window-by-day.";

    private final AtomicReference<EngineConfig> current;

    @Autowired
    public EngineConfigService(
        @Value("${strata.execution.auto-enabled:true}") boolean autoEnabled,
        @Value("${strata.execution.window:22:00-06:00}") String window,
        @Value("${strata.execution.max-concurrent:4}") int maxConcurrent,
        @Value("${strata.execution.max-operations-per-pass:10}") int maxPerPass,
        @Value("${strata.execution.action-timeout:PT4H}") Duration actionTimeout,
        @Value("${strata.evaluation.min-reevaluation-interval:P1D}") Duration minReevaluationInterval,
        @Value("${strata.evaluation.failed-retry-delay:PT0S}") Duration failedRetryDelay,
        Environment environment) {
        Map<DayOfWeek, String> overrides = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            String value = environment.getProperty(WINDOW_BY_DAY_PREFIX + day.name().toLowerCase(Locale.ROOT));
            if (value != null) {
                overrides.put(day, value);
            }
        }
        this.current = new AtomicReference<>(EngineConfig.builder()
            .autoExecutionEnabled(autoEnabled)
            .executionWindow(ExecutionWindow.parse(window, overrides))
            .maxConcurrentOperations(maxConcurrent)
            .maxOperationsPerPass(maxPerPass)
            .actionTimeout(actionTimeout)
            .minReevaluationInterval(minReevaluationInterval)
            .failedRetryDelay(failedRetryDelay)
            .build());
        log.info("Engine configuration: {}", current.get());
    }

    public EngineConfigService(EngineConfig initial) {
        this.current = new AtomicReference<>(initial);
    }

    public EngineConfig current() {
        return current.get();
    }

    /**
     * Applies a change to the current snapshot. The new value is validated by
     * {@link EngineConfig.Builder#build()}; an invalid change leaves the config untouched.
     */
    public EngineConfig update(UnaryOperator<EngineConfig.Builder> change) {
        EngineConfig updated = current.updateAndGet(config -> change.apply(config.toBuilder()).build());
        log.info("Engine configuration changed: {}", updated);
        return updated;
    }

    public EngineConfig setAutoExecution(boolean enabled) {
        return update(builder -> builder.autoExecutionEnabled(enabled));
    }

    public EngineConfig setWindow(ExecutionWindow window) {
        return update(builder -> builder.executionWindow(window));
    }

    public EngineConfig setMaxConcurrent(int maxConcurrent) {
        return update(builder -> builder.maxConcurrentOperations(maxConcurrent));
    }

    /**
     * Stop taking new work. Actions already running finish.
     */
    public EngineConfig requestStop() {
        return update(builder -> builder.stopRequested(true));
    }

    public EngineConfig resume() {
        return update(builder -> builder.stopRequested(false));
    }
}
