package com.strata.policy;

import com.strata.classifier.TemperatureClassifier;
import com.strata.domain.ActionType;
import com.strata.domain.EvaluationQueueEntry;
import com.strata.domain.FailureKind;
import com.strata.domain.Partition;
import com.strata.domain.Policy;
import com.strata.domain.QueueStatus;
import com.strata.domain.Temperature;
import com.strata.domain.ThresholdProfile;
import com.strata.execution.EngineConfig;
import com.strata.execution.EngineConfigService;
import com.strata.execution.PartitionLockRegistry;
import com.strata.monitoring.LifecycleMetrics;
import com.strata.policy.EvaluationSummary.PairOutcome;
import com.strata.storage.EvaluationQueueRepository;
import com.strata.storage.InMemoryStorageEngine;
import com.strata.storage.PartitionTemperatureRepository;
import com.strata.storage.PolicyRepository;
import com.strata.storage.ThresholdProfileRepository;
import com.strata.support.MutableClock;
import com.strata.support.TestDatabase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PolicyEvaluationEngine Tests")
class PolicyEvaluationEngineTest {

    private static final Instant NOW = Instant.parse("2025-11-10T00:00:00Z");

    private TestDatabase database;
    private MutableClock clock;
    private InMemoryStorageEngine storage;
    private PolicyRepository policyRepository;
    private ThresholdProfileRepository profileRepository;
    private EvaluationQueueRepository queueRepository;
    private PartitionLockRegistry lockRegistry;
    private EngineConfigService configService;
    private PolicyEvaluationEngine engine;

    @BeforeEach
    void setUp() {
        database = TestDatabase.create();
        clock = new MutableClock(NOW);
        storage = new InMemoryStorageEngine(clock);
        policyRepository = new PolicyRepository(database.jdbcTemplate(), clock);
        profileRepository = new ThresholdProfileRepository(database.jdbcTemplate(), clock);
        queueRepository = new EvaluationQueueRepository(database.jdbcTemplate(), clock);
        lockRegistry = new PartitionLockRegistry();
        configService = new EngineConfigService(EngineConfig.builder().build());

        TemperatureClassifier classifier = new TemperatureClassifier(Duration.ofHours(24), clock);
        engine = new PolicyEvaluationEngine(
            policyRepository,
            storage,
            queueRepository,
            new PartitionTemperatureRepository(database.jdbcTemplate()),
            new ThresholdResolver(profileRepository, 90, 365, 1095),
            new EligibilityChecker(classifier, new SpelCustomConditionEvaluator(), clock),
            lockRegistry,
            configService,
            new LifecycleMetrics(new SimpleMeterRegistry()),
            clock,
            Duration.ofDays(7),
            Duration.ofDays(30));

        // 100 days old on 2025-11-10
        storage.addPartition(partition("P_2025_07", "2025-07-01", "2025-08-02"));
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    @DisplayName("Should classify with the policy's own threshold profile instead of the global default")
    void shouldPreferPolicyProfile() {
        // Given
        ThresholdProfile fastAging = profileRepository.insert(ThresholdProfile.builder()
            .name("FAST_AGING").hotDays(30).warmDays(90).coldDays(180).build());
        Policy withProfile = policyRepository.insert(coldCompress("cold-fast").thresholdProfileId(fastAging.getId()).build());
        Policy withDefault = policyRepository.insert(coldCompress("cold-default").build());

        // When
        EvaluationSummary summary = engine.evaluateAll();

        // Then
        assertThat(summary.getPoliciesEvaluated()).isEqualTo(2);
        assertThat(summary.getQueued()).isEqualTo(1);
        assertThat(summary.getSkipped()).isEqualTo(1);

        EvaluationQueueEntry fast = queueRepository.find(withProfile.getId(), "sales", "P_2025_07").orElseThrow();
        assertThat(fast.getStatus()).isEqualTo(QueueStatus.PENDING);
        assertThat(fast.isEligible()).isTrue();

        EvaluationQueueEntry slow = queueRepository.find(withDefault.getId(), "sales", "P_2025_07").orElseThrow();
        assertThat(slow.getStatus()).isEqualTo(QueueStatus.SKIPPED);
        assertThat(slow.getReason()).contains("WARM").contains("DEFAULT");
    }

    @Test
    @DisplayName("Should leave a successful pair alone until the minimum interval has passed")
    void shouldNotRequeueRecentSuccess() {
        // Given
        Policy policy = policyRepository.insert(ageCompress("age-compress").build());
        engine.evaluateAll();
        EvaluationQueueEntry entry = queueRepository.find(policy.getId(), "sales", "P_2025_07").orElseThrow();
        queueRepository.claim(entry.getId());
        queueRepository.complete(entry.getId(), QueueStatus.SUCCESS, null, 1L, "Executed compress");

        // When
        clock.advance(Duration.ofHours(1));
        EvaluationSummary again = engine.evaluateAll();

        // Then
        assertThat(again.getUnchanged()).isEqualTo(1);
        assertThat(queueRepository.find(policy.getId(), "sales", "P_2025_07").orElseThrow().getStatus())
            .isEqualTo(QueueStatus.SUCCESS);

        // When
        clock.advance(Duration.ofDays(2));
        EvaluationSummary later = engine.evaluateAll();

        // Then
        assertThat(later.getQueued()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should requeue a retryable failure on the next pass")
    void shouldRequeueRetryableFailure() {
        // Given
        Policy policy = policyRepository.insert(ageCompress("age-compress").build());
        engine.evaluateAll();
        EvaluationQueueEntry entry = queueRepository.find(policy.getId(), "sales", "P_2025_07").orElseThrow();
        queueRepository.claim(entry.getId());
        queueRepository.complete(entry.getId(), QueueStatus.FAILED, FailureKind.RETRYABLE, 1L, "TIMEOUT");

        // When
        EvaluationSummary summary = engine.evaluateAll();

        // Then
        assertThat(summary.getQueued()).isEqualTo(1);
        EvaluationQueueEntry requeued = queueRepository.find(policy.getId(), "sales", "P_2025_07").orElseThrow();
        assertThat(requeued.getStatus()).isEqualTo(QueueStatus.PENDING);
        assertThat(requeued.getAttempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should block a terminal failure until the policy version changes")
    void shouldBlockTerminalFailureUntilPolicyChanges() {
        // Given
        Policy policy = policyRepository.insert(ageCompress("age-compress").build());
        engine.evaluateAll();
        EvaluationQueueEntry entry = queueRepository.find(policy.getId(), "sales", "P_2025_07").orElseThrow();
        queueRepository.claim(entry.getId());
        queueRepository.complete(entry.getId(), QueueStatus.FAILED, FailureKind.TERMINAL, 1L, "Unknown codec");

        // When
        EvaluationSummary blocked = engine.evaluateAll();

        // Then
        assertThat(blocked.getUnchanged()).isEqualTo(1);
        assertThat(queueRepository.find(policy.getId(), "sales", "P_2025_07").orElseThrow().getStatus())
            .isEqualTo(QueueStatus.FAILED);

        // When
        policy.setVersion(policy.getVersion() + 1);
        policyRepository.update(policy);
        EvaluationSummary unblocked = engine.evaluateAll();

        // Then
        assertThat(unblocked.getQueued()).isEqualTo(1);
        assertThat(queueRepository.find(policy.getId(), "sales", "P_2025_07").orElseThrow().getPolicyVersion())
            .isEqualTo(2);
    }

    @Test
    @DisplayName("Should not evaluate a partition that is busy")
    void shouldSkipBusyPartition() {
        // Given
        Policy policy = policyRepository.insert(ageCompress("age-compress").build());
        lockRegistry.tryLock("sales.P_2025_07", "merge:sales.P_2025_08");
        Partition partition = storage.findPartition("sales", "P_2025_07").orElseThrow();

        // When
        PairOutcome outcome = engine.evaluatePair(policy, partition,
            ThresholdProfile.builder().name("DEFAULT").hotDays(90).warmDays(365).coldDays(1095).build(),
            null, configService.current(), clock.instant());

        // Then
        assertThat(outcome).isEqualTo(PairOutcome.BUSY);
        EvaluationQueueEntry entry = queueRepository.find(policy.getId(), "sales", "P_2025_07").orElseThrow();
        assertThat(entry.getStatus()).isEqualTo(QueueStatus.SKIPPED);
        assertThat(entry.getReason()).isEqualTo(PolicyEvaluationEngine.BUSY_REASON);
    }

    @Test
    @DisplayName("Should never overwrite a running entry")
    void shouldLeaveRunningEntry() {
        // Given
        Policy policy = policyRepository.insert(ageCompress("age-compress").build());
        engine.evaluateAll();
        EvaluationQueueEntry entry = queueRepository.find(policy.getId(), "sales", "P_2025_07").orElseThrow();
        queueRepository.claim(entry.getId());

        // When
        EvaluationSummary summary = engine.evaluateAll();

        // Then
        assertThat(summary.getUnchanged()).isEqualTo(1);
        assertThat(queueRepository.find(policy.getId(), "sales", "P_2025_07").orElseThrow().getStatus())
            .isEqualTo(QueueStatus.RUNNING);
    }

    @Test
    @DisplayName("Should ignore disabled policies in the scheduled pass but evaluate them on request")
    void shouldHandleDisabledPolicies() {
        // Given
        Policy policy = policyRepository.insert(ageCompress("age-compress").enabled(false).build());

        // When
        EvaluationSummary scheduled = engine.evaluateAll();
        EvaluationSummary manual = engine.evaluatePolicy(policy.getId());

        // Then
        assertThat(scheduled.getPoliciesEvaluated()).isZero();
        assertThat(manual.getQueued()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should drop queue entries of partitions that left the catalog, terminal failures included")
    void shouldPurgeEntriesOfDroppedPartitions() {
        // Given
        storage.addPartition(partition("P_2025_06", "2025-06-01", "2025-07-01"));
        Policy policy = policyRepository.insert(ageCompress("age-compress").build());
        engine.evaluateAll();
        EvaluationQueueEntry entry = queueRepository.find(policy.getId(), "sales", "P_2025_06").orElseThrow();
        queueRepository.claim(entry.getId());
        queueRepository.complete(entry.getId(), QueueStatus.FAILED, FailureKind.TERMINAL, 1L, "Unknown codec");
        storage.drop(storage.findPartition("sales", "P_2025_06").orElseThrow());

        // When
        EvaluationSummary summary = engine.evaluateAll();

        // Then
        assertThat(summary.getPurged()).isEqualTo(1);
        assertThat(queueRepository.find(policy.getId(), "sales", "P_2025_06")).isEmpty();
        assertThat(queueRepository.find(policy.getId(), "sales", "P_2025_07")).isPresent();
    }

    private static Policy.Builder coldCompress(String name) {
        return Policy.builder()
            .name(name)
            .datasetId("sales")
            .temperature(Temperature.COLD)
            .action(ActionType.COMPRESS)
            .codec("ARCHIVE_HIGH");
    }

    private static Policy.Builder ageCompress(String name) {
        return Policy.builder()
            .name(name)
            .datasetId("sales")
            .ageDays(30)
            .action(ActionType.COMPRESS)
            .codec("ARCHIVE_HIGH");
    }

    private static Partition partition(String name, String lower, String upper) {
        return Partition.builder()
            .datasetId("sales")
            .name(name)
            .lowerBound(lower)
            .upperBound(upper)
            .location("TS_HOT")
            .codec("NONE")
            .rowCount(1_000L)
            .byteSize(10_000L)
            .build();
    }
}
