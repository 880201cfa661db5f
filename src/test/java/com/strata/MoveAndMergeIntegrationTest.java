package com.strata;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.strata.classifier.TemperatureClassifier;
import com.strata.domain.ActionType;
import com.strata.domain.Dataset;
import com.strata.domain.EvaluationQueueEntry;
import com.strata.domain.ExecutionLogEntry;
import com.strata.domain.ExecutionStatus;
import com.strata.domain.ExecutionTrigger;
import com.strata.domain.Granularity;
import com.strata.domain.Partition;
import com.strata.domain.Policy;
import com.strata.domain.QueueStatus;
import com.strata.domain.StorageTier;
import com.strata.domain.TierDefinition;
import com.strata.domain.TierTemplate;
import com.strata.execution.ActionExecutor;
import com.strata.execution.EngineConfig;
import com.strata.execution.EngineConfigService;
import com.strata.execution.ExecutionEngine;
import com.strata.execution.ExecutionFailureClassifier;
import com.strata.execution.ExecutionSummary;
import com.strata.execution.ExecutionWindow;
import com.strata.execution.PartitionLockRegistry;
import com.strata.merge.PartitionMergeScheduler;
import com.strata.monitoring.FailureAlertMonitor;
import com.strata.monitoring.LifecycleMetrics;
import com.strata.policy.EligibilityChecker;
import com.strata.policy.EvaluationSummary;
import com.strata.policy.PolicyEvaluationEngine;
import com.strata.policy.SpelCustomConditionEvaluator;
import com.strata.policy.ThresholdResolver;
import com.strata.storage.DatasetRepository;
import com.strata.storage.EvaluationQueueRepository;
import com.strata.storage.ExecutionLogQuery;
import com.strata.storage.ExecutionLogRepository;
import com.strata.storage.InMemoryStorageEngine;
import com.strata.storage.MergeBacklogRepository;
import com.strata.storage.PartitionTemperatureRepository;
import com.strata.storage.PolicyRepository;
import com.strata.storage.ThresholdProfileRepository;
import com.strata.storage.TierTemplateRepository;
import com.strata.support.MutableClock;
import com.strata.support.TestDatabase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * A HOT monthly partition ages into the WARM tier, is moved there and is folded into the
 * yearly WARM partition of its year, with every component real except alerting.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Move and Merge Integration Tests")
class MoveAndMergeIntegrationTest {

    private static final Instant BEFORE_ELIGIBLE = Instant.parse("2025-11-10T23:00:00Z");
    private static final Instant AFTER_ELIGIBLE = Instant.parse("2026-01-10T23:00:00Z");

    @Mock
    private FailureAlertMonitor alertMonitor;

    private TestDatabase database;
    private MutableClock clock;
    private InMemoryStorageEngine storage;
    private PolicyRepository policyRepository;
    private EvaluationQueueRepository queueRepository;
    private ExecutionLogRepository logRepository;
    private MergeBacklogRepository backlogRepository;
    private PolicyEvaluationEngine evaluationEngine;
    private ExecutionEngine executionEngine;

    @BeforeEach
    void setUp() {
        database = TestDatabase.create();
        clock = new MutableClock(BEFORE_ELIGIBLE);
        storage = new InMemoryStorageEngine(clock);
        storage.registerLocation("TS_HOT");
        storage.registerLocation("TS_WARM");
        storage.registerCodecRatio("QUERY_HIGH", 0.5);

        policyRepository = new PolicyRepository(database.jdbcTemplate(), clock);
        queueRepository = new EvaluationQueueRepository(database.jdbcTemplate(), clock);
        logRepository = new ExecutionLogRepository(database.jdbcTemplate(), clock);
        backlogRepository = new MergeBacklogRepository(database.jdbcTemplate(), clock);
        DatasetRepository datasetRepository = new DatasetRepository(database.jdbcTemplate(), clock);
        TierTemplateRepository templateRepository = new TierTemplateRepository(database.jdbcTemplate(),
            new ObjectMapper().registerModule(new JavaTimeModule()), clock);
        PartitionLockRegistry lockRegistry = new PartitionLockRegistry();
        LifecycleMetrics metrics = new LifecycleMetrics(new SimpleMeterRegistry());
        ExecutionFailureClassifier failureClassifier = new ExecutionFailureClassifier();
        EngineConfigService configService = new EngineConfigService(EngineConfig.builder()
            .executionWindow(ExecutionWindow.parse("22:00-06:00"))
            .maxConcurrentOperations(2)
            .maxOperationsPerPass(10)
            .actionTimeout(Duration.ofSeconds(30))
            .build());

        evaluationEngine = new PolicyEvaluationEngine(
            policyRepository,
            storage,
            queueRepository,
            new PartitionTemperatureRepository(database.jdbcTemplate()),
            new ThresholdResolver(new ThresholdProfileRepository(database.jdbcTemplate(), clock), 90, 365, 1095),
            new EligibilityChecker(new TemperatureClassifier(Duration.ofHours(24), clock),
                new SpelCustomConditionEvaluator(), clock),
            lockRegistry,
            configService,
            metrics,
            clock,
            Duration.ofDays(7),
            Duration.ofDays(30));
        PartitionMergeScheduler mergeScheduler = new PartitionMergeScheduler(storage, storage, datasetRepository,
            templateRepository, backlogRepository, logRepository, lockRegistry, failureClassifier, metrics);
        executionEngine = new ExecutionEngine(queueRepository, policyRepository, storage, logRepository,
            new ActionExecutor(storage), failureClassifier, lockRegistry, configService, mergeScheduler,
            alertMonitor, metrics, clock);

        templateRepository.save(TierTemplate.builder()
            .name("standard")
            .hot(TierDefinition.builder().ageMonths(12).granularity(Granularity.MONTHLY).location("TS_HOT").codec("NONE").build())
            .warm(TierDefinition.builder().ageMonths(36).granularity(Granularity.YEARLY).location("TS_WARM").codec("QUERY_HIGH").build())
            .cold(TierDefinition.builder().ageMonths(84).granularity(Granularity.YEARLY).location("TS_COLD").codec("ARCHIVE_HIGH").build())
            .build());
        datasetRepository.save(new Dataset("sales", "standard"));

        storage.addPartition(partition("P_2024", "2024-01-01", "2024-12-01", "TS_WARM", "QUERY_HIGH", 900_000L));
        storage.addPartition(partition("P_2024_12", "2024-12-01", "2025-01-01", "TS_HOT", "NONE", 100_000L));
        storage.addPartition(partition("P_2025_01", "2025-01-01", "2025-02-01", "TS_HOT", "NONE", 100_000L));
    }

    @AfterEach
    void tearDown() {
        executionEngine.shutdown();
        database.close();
    }

    @Test
    @DisplayName("Should move an aged monthly partition to WARM and merge it into its yearly partition")
    void shouldMoveAgedPartitionAndMergeIntoYear() {
        // Given
        Policy toWarm = policyRepository.insert(Policy.builder()
            .name("hot-to-warm")
            .datasetId("sales")
            .ageMonths(12)
            .action(ActionType.MOVE)
            .location("TS_WARM")
            .codec("QUERY_HIGH")
            .destinationTier(StorageTier.WARM)
            .build());

        // When
        EvaluationSummary tooYoung = evaluationEngine.evaluateAll();

        // Then
        assertThat(tooYoung.getQueued()).isZero();
        assertThat(queueRepository.find(toWarm.getId(), "sales", "P_2024_12").orElseThrow().getReason())
            .contains("below the required 12 months");

        // When
        clock.set(AFTER_ELIGIBLE);
        EvaluationSummary aged = evaluationEngine.evaluateAll();

        // Then
        assertThat(aged.getQueued()).isEqualTo(1);
        EvaluationQueueEntry queued = queueRepository.find(toWarm.getId(), "sales", "P_2024_12").orElseThrow();
        assertThat(queued.getStatus()).isEqualTo(QueueStatus.PENDING);
        assertThat(queueRepository.find(toWarm.getId(), "sales", "P_2025_01").orElseThrow().getStatus())
            .isEqualTo(QueueStatus.SKIPPED);

        // When
        ExecutionSummary execution = executionEngine.executePending(ExecutionTrigger.SCHEDULED, null, null);

        // Then
        assertThat(execution.getSucceeded()).isEqualTo(1);
        assertThat(queueRepository.findById(queued.getId()).orElseThrow().getStatus()).isEqualTo(QueueStatus.SUCCESS);

        Partition yearly = storage.findPartition("sales", "P_2024").orElseThrow();
        assertThat(yearly.getLowerBound()).isEqualTo("2024-01-01");
        assertThat(yearly.getUpperBound()).isEqualTo("2025-01-01");
        assertThat(yearly.getLocation()).isEqualTo("TS_WARM");
        assertThat(yearly.getByteSize()).isEqualTo(950_000L);
        assertThat(storage.findPartition("sales", "P_2024_12")).isEmpty();
        assertThat(storage.findPartition("sales", "P_2025_01").orElseThrow().getLocation()).isEqualTo("TS_HOT");
        assertThat(backlogRepository.findAll()).isEmpty();

        List<ExecutionLogEntry> log = logRepository.find(ExecutionLogQuery.all());
        assertThat(log).extracting(ExecutionLogEntry::getStatus).containsOnly(ExecutionStatus.SUCCESS);
        assertThat(log.stream().map(ExecutionLogEntry::getAction).collect(Collectors.toList()))
            .containsExactlyInAnyOrder(ActionType.MOVE, ActionType.MERGE);
        verifyNoInteractions(alertMonitor);

        // When
        EvaluationSummary afterMerge = evaluationEngine.evaluateAll();

        // Then
        assertThat(afterMerge.getQueued()).isZero();
        assertThat(afterMerge.getPurged()).isEqualTo(1);
        assertThat(queueRepository.find(toWarm.getId(), "sales", "P_2024_12")).isEmpty();
    }

    private static Partition partition(String name, String lower, String upper, String location, String codec,
                                       long bytes) {
        return Partition.builder()
            .datasetId("sales")
            .name(name)
            .lowerBound(lower)
            .upperBound(upper)
            .location(location)
            .codec(codec)
            .rowCount(bytes / 10)
            .byteSize(bytes)
            .build();
    }
}
