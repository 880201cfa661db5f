package com.strata.execution;

import com.strata.domain.ActionType;
import com.strata.domain.EvaluationQueueEntry;
import com.strata.domain.ExecutionLogEntry;
import com.strata.domain.ExecutionStatus;
import com.strata.domain.ExecutionTrigger;
import com.strata.domain.FailureKind;
import com.strata.domain.Partition;
import com.strata.domain.Policy;
import com.strata.domain.QueueStatus;
import com.strata.domain.StorageTier;
import com.strata.merge.MergeOutcome;
import com.strata.merge.PartitionMergeScheduler;
import com.strata.monitoring.FailureAlertMonitor;
import com.strata.monitoring.LifecycleMetrics;
import com.strata.storage.EvaluationQueueRepository;
import com.strata.storage.ExecutionLogQuery;
import com.strata.storage.ExecutionLogRepository;
import com.strata.storage.InMemoryStorageEngine;
import com.strata.storage.PolicyRepository;
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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ExecutionEngine Tests")
class ExecutionEngineTest {

    private static final Instant NOW = Instant.parse("2025-11-10T23:00:00Z");

    @Mock
    private PartitionMergeScheduler mergeScheduler;

    @Mock
    private FailureAlertMonitor alertMonitor;

    private TestDatabase database;
    private MutableClock clock;
    private GatedStorageEngine storage;
    private PolicyRepository policyRepository;
    private EvaluationQueueRepository queueRepository;
    private ExecutionLogRepository logRepository;
    private PartitionLockRegistry lockRegistry;
    private EngineConfigService configService;
    private ExecutionEngine engine;

    @BeforeEach
    void setUp() {
        database = TestDatabase.create();
        clock = new MutableClock(NOW);
        storage = new GatedStorageEngine(clock);
        storage.registerLocation("TS_HOT");
        storage.registerLocation("TS_WARM");
        storage.registerCodecRatio("ARCHIVE_HIGH", 0.25);
        policyRepository = new PolicyRepository(database.jdbcTemplate(), clock);
        queueRepository = new EvaluationQueueRepository(database.jdbcTemplate(), clock);
        logRepository = new ExecutionLogRepository(database.jdbcTemplate(), clock);
        lockRegistry = new PartitionLockRegistry();
        configService = new EngineConfigService(EngineConfig.builder()
            .executionWindow(ExecutionWindow.parse("22:00-06:00"))
            .maxConcurrentOperations(2)
            .maxOperationsPerPass(10)
            .actionTimeout(Duration.ofSeconds(10))
            .build());
        engine = new ExecutionEngine(queueRepository, policyRepository, storage, logRepository,
            new ActionExecutor(storage), new ExecutionFailureClassifier(), lockRegistry, configService,
            mergeScheduler, alertMonitor, new LifecycleMetrics(new SimpleMeterRegistry()), clock);
    }

    @AfterEach
    void tearDown() {
        storage.open();
        engine.shutdown();
        database.close();
    }

    @Test
    @DisplayName("Should execute a queued action and record it in the log and the queue")
    void shouldExecuteQueuedAction() {
        // Given
        Policy policy = policyRepository.insert(compress("compress-old"));
        storage.addPartition(partition("P_2024_01", "2024-01-01", "2024-02-01"));
        EvaluationQueueEntry entry = enqueue(policy, "P_2024_01");

        // When
        ExecutionSummary summary = engine.executePending(ExecutionTrigger.MANUAL, null, null);

        // Then
        assertThat(summary.isStarted()).isTrue();
        assertThat(summary.getClaimed()).isEqualTo(1);
        assertThat(summary.getSucceeded()).isEqualTo(1);

        EvaluationQueueEntry completed = queueRepository.findById(entry.getId()).orElseThrow();
        assertThat(completed.getStatus()).isEqualTo(QueueStatus.SUCCESS);
        assertThat(completed.getReason()).isEqualTo("Executed compress");
        assertThat(completed.getExecutionId()).isNotNull();

        ExecutionLogEntry logEntry = logRepository.findById(completed.getExecutionId()).orElseThrow();
        assertThat(logEntry.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(logEntry.getTrigger()).isEqualTo(ExecutionTrigger.MANUAL);
        assertThat(logEntry.getSizeBefore()).isEqualTo(40_000L);
        assertThat(logEntry.getSizeAfter()).isEqualTo(10_000L);
        assertThat(logEntry.getCodecAfter()).isEqualTo("ARCHIVE_HIGH");

        assertThat(storage.findPartition("sales", "P_2024_01").orElseThrow().getCodec()).isEqualTo("ARCHIVE_HIGH");
        assertThat(lockRegistry.snapshot()).isEmpty();
    }

    @Test
    @DisplayName("Should hand a completed MOVE to the merge scheduler while the partition is still held")
    void shouldNotifyMergeSchedulerAfterMove() {
        // Given
        Policy policy = policyRepository.insert(move("to-warm", "TS_WARM"));
        storage.addPartition(partition("P_2024_01", "2024-01-01", "2024-02-01"));
        EvaluationQueueEntry entry = enqueue(policy, "P_2024_01");
        AtomicInteger heldDuringMerge = new AtomicInteger();
        when(mergeScheduler.onMoveCompleted(any(Policy.class), any(Partition.class), any(ExecutionTrigger.class), anyString()))
            .thenAnswer(invocation -> {
                if (lockRegistry.isLocked("sales.P_2024_01")) {
                    heldDuringMerge.incrementAndGet();
                }
                return null;
            });

        // When
        engine.executePending(ExecutionTrigger.SCHEDULED, null, null);

        // Then
        verify(mergeScheduler).onMoveCompleted(any(Policy.class),
            argThat(moved -> "TS_WARM".equals(moved.getLocation())),
            eq(ExecutionTrigger.SCHEDULED), eq("execution:" + entry.getId()));
        assertThat(heldDuringMerge.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should record a storage rejection as a terminal failure")
    void shouldRecordTerminalFailure() {
        // Given
        Policy policy = policyRepository.insert(move("to-nowhere", "TS_NOWHERE"));
        storage.addPartition(partition("P_2024_01", "2024-01-01", "2024-02-01"));
        EvaluationQueueEntry entry = enqueue(policy, "P_2024_01");

        // When
        ExecutionSummary summary = engine.executePending(ExecutionTrigger.MANUAL, null, null);

        // Then
        assertThat(summary.getFailed()).isEqualTo(1);
        EvaluationQueueEntry failed = queueRepository.findById(entry.getId()).orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(QueueStatus.FAILED);
        assertThat(failed.getFailureKind()).isEqualTo(FailureKind.TERMINAL);

        ExecutionLogEntry logEntry = logRepository.findById(failed.getExecutionId()).orElseThrow();
        assertThat(logEntry.getErrorCode()).isEqualTo("STORAGE_RELOCATE");
        assertThat(logEntry.getErrorMessage()).contains("TS_NOWHERE");
        verifyNoInteractions(mergeScheduler);
        assertThat(lockRegistry.snapshot()).isEmpty();
    }

    @Test
    @DisplayName("Should fail terminally when the partition vanished after evaluation")
    void shouldFailForVanishedPartition() {
        // Given
        Policy policy = policyRepository.insert(compress("compress-old"));
        EvaluationQueueEntry entry = enqueue(policy, "P_2019_01");

        // When
        engine.executePending(ExecutionTrigger.MANUAL, null, null);

        // Then
        EvaluationQueueEntry failed = queueRepository.findById(entry.getId()).orElseThrow();
        assertThat(failed.getFailureKind()).isEqualTo(FailureKind.TERMINAL);
        assertThat(logRepository.findById(failed.getExecutionId()).orElseThrow().getErrorCode())
            .isEqualTo("PARTITION_NOT_FOUND");
    }

    @Test
    @DisplayName("Should mark a timed-out action failed but keep the partition busy until the call returns")
    void shouldKeepPartitionBusyAfterTimeout() throws Exception {
        // Given
        configService.update(builder -> builder.actionTimeout(Duration.ofMillis(200)));
        Policy policy = policyRepository.insert(compress("compress-old"));
        storage.addPartition(partition("P_2024_01", "2024-01-01", "2024-02-01"));
        EvaluationQueueEntry entry = enqueue(policy, "P_2024_01");
        storage.close();

        // When
        ExecutionSummary summary = engine.executePending(ExecutionTrigger.MANUAL, null, null);

        // Then
        assertThat(summary.getTimedOut()).isEqualTo(1);
        assertThat(summary.getFailed()).isEqualTo(1);
        EvaluationQueueEntry failed = queueRepository.findById(entry.getId()).orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(QueueStatus.FAILED);
        assertThat(failed.getFailureKind()).isEqualTo(FailureKind.RETRYABLE);
        assertThat(logRepository.findById(failed.getExecutionId()).orElseThrow().getErrorCode()).isEqualTo("TIMEOUT");
        verify(alertMonitor).actionTimedOut(any(ExecutionLogEntry.class), eq(Duration.ofMillis(200)));
        assertThat(lockRegistry.isLocked("sales.P_2024_01")).isTrue();

        // When
        storage.open();

        // Then
        waitUntil(() -> !lockRegistry.isLocked("sales.P_2024_01"));
        assertThat(lockRegistry.isLocked("sales.P_2024_01")).isFalse();
    }

    @Test
    @DisplayName("Should still hand a MOVE to the merge scheduler when it finishes after timing out")
    void shouldMergeMoveThatFinishesAfterTimeout() throws Exception {
        // Given
        configService.update(builder -> builder.actionTimeout(Duration.ofMillis(200)));
        Policy policy = policyRepository.insert(move("to-warm", "TS_WARM"));
        storage.addPartition(partition("P_2024_12", "2024-12-01", "2025-01-01"));
        EvaluationQueueEntry entry = enqueue(policy, "P_2024_12");
        AtomicInteger heldDuringMerge = new AtomicInteger();
        when(mergeScheduler.onMoveCompleted(any(Policy.class), any(Partition.class), any(ExecutionTrigger.class), anyString()))
            .thenAnswer(invocation -> {
                if (lockRegistry.isLocked("sales.P_2024_12")) {
                    heldDuringMerge.incrementAndGet();
                }
                return MergeOutcome.MERGED;
            });
        storage.close();

        // When
        ExecutionSummary summary = engine.executePending(ExecutionTrigger.SCHEDULED, null, null);

        // Then
        assertThat(summary.getTimedOut()).isEqualTo(1);
        assertThat(queueRepository.findById(entry.getId()).orElseThrow().getStatus()).isEqualTo(QueueStatus.FAILED);
        verifyNoInteractions(mergeScheduler);

        // When
        storage.open();

        // Then
        verify(mergeScheduler, timeout(5_000)).onMoveCompleted(any(Policy.class),
            argThat(moved -> "TS_WARM".equals(moved.getLocation())),
            eq(ExecutionTrigger.SCHEDULED), eq("execution:" + entry.getId()));
        waitUntil(() -> !lockRegistry.isLocked("sales.P_2024_12"));
        assertThat(heldDuringMerge.get()).isEqualTo(1);
        assertThat(lockRegistry.isLocked("sales.P_2024_12")).isFalse();
        assertThat(storage.findPartition("sales", "P_2024_12").orElseThrow().getLocation()).isEqualTo("TS_WARM");
    }

    @Test
    @DisplayName("Should release the partition without merging when a timed-out action later fails")
    void shouldReleaseLateFailureWithoutMerge() throws Exception {
        // Given
        configService.update(builder -> builder.actionTimeout(Duration.ofMillis(200)));
        Policy policy = policyRepository.insert(move("to-nowhere", "TS_NOWHERE"));
        storage.addPartition(partition("P_2024_12", "2024-12-01", "2025-01-01"));
        enqueue(policy, "P_2024_12");
        storage.close();

        // When
        engine.executePending(ExecutionTrigger.SCHEDULED, null, null);
        storage.open();

        // Then
        waitUntil(() -> !lockRegistry.isLocked("sales.P_2024_12"));
        assertThat(lockRegistry.isLocked("sales.P_2024_12")).isFalse();
        verifyNoInteractions(mergeScheduler);
    }

    @Test
    @DisplayName("Should not start while the execution window is closed, even manually")
    void shouldRespectExecutionWindow() {
        // Given
        Policy policy = policyRepository.insert(compress("compress-old"));
        storage.addPartition(partition("P_2024_01", "2024-01-01", "2024-02-01"));
        EvaluationQueueEntry entry = enqueue(policy, "P_2024_01");
        clock.set(Instant.parse("2025-11-10T12:00:00Z"));

        // When
        ExecutionSummary summary = engine.executePending(ExecutionTrigger.MANUAL, null, null);

        // Then
        assertThat(summary.isStarted()).isFalse();
        assertThat(summary.getNotStartedReason()).startsWith("Outside execution window");
        assertThat(queueRepository.findById(entry.getId()).orElseThrow().getStatus()).isEqualTo(QueueStatus.PENDING);
    }

    @Test
    @DisplayName("Should honour stop requests and the auto-execution flag")
    void shouldHonourStopAndAutoFlag() {
        // Given
        Policy policy = policyRepository.insert(compress("compress-old"));
        storage.addPartition(partition("P_2024_01", "2024-01-01", "2024-02-01"));
        enqueue(policy, "P_2024_01");

        // When / Then
        configService.requestStop();
        assertThat(engine.executePending(ExecutionTrigger.MANUAL, null, null).getNotStartedReason())
            .isEqualTo(ExecutionEngine.STOP_REQUESTED);

        configService.resume();
        configService.setAutoExecution(false);
        assertThat(engine.executePending(ExecutionTrigger.SCHEDULED, null, null).getNotStartedReason())
            .isEqualTo(ExecutionEngine.AUTO_EXECUTION_DISABLED);
        assertThat(engine.executePending(ExecutionTrigger.MANUAL, null, null).getSucceeded()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should allow only one execution pass at a time")
    void shouldRunOnePassAtATime() throws Exception {
        // Given
        Policy policy = policyRepository.insert(compress("compress-old"));
        storage.addPartition(partition("P_2024_01", "2024-01-01", "2024-02-01"));
        enqueue(policy, "P_2024_01");
        storage.close();
        CompletableFuture<ExecutionSummary> first = CompletableFuture.supplyAsync(
            () -> engine.executePending(ExecutionTrigger.SCHEDULED, null, null));
        waitUntil(() -> lockRegistry.isLocked("sales.P_2024_01"));

        // When
        ExecutionSummary second = engine.executePending(ExecutionTrigger.MANUAL, null, null);
        storage.open();

        // Then
        assertThat(second.getNotStartedReason()).isEqualTo(ExecutionEngine.PASS_IN_PROGRESS);
        assertThat(first.get(10, TimeUnit.SECONDS).getSucceeded()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should never run more actions at once than the configured limit")
    void shouldBoundConcurrency() {
        // Given
        Policy policy = policyRepository.insert(compress("compress-old"));
        for (int month = 1; month <= 6; month++) {
            String name = String.format("P_2024_%02d", month);
            LocalDate lower = LocalDate.of(2024, month, 1);
            storage.addPartition(partition(name, lower.toString(), lower.plusMonths(1).toString()));
            enqueue(policy, name);
        }
        storage.delayEachCall(Duration.ofMillis(100));

        // When
        ExecutionSummary summary = engine.executePending(ExecutionTrigger.MANUAL, null, null);

        // Then
        assertThat(summary.getSucceeded()).isEqualTo(6);
        assertThat(storage.maxInFlight()).isBetween(1, 2);
    }

    @Test
    @DisplayName("Should never run two actions on the same partition at once, whatever the worker count")
    void shouldSerializeActionsPerPartition() {
        // Given
        configService.update(builder -> builder.maxConcurrentOperations(4));
        storage.registerCodecRatio("QUERY_LOW", 0.5);
        storage.registerCodecRatio("ARCHIVE_LOW", 0.4);
        List<Policy> policies = List.of(
            policyRepository.insert(compress("compress-high")),
            policyRepository.insert(compress("compress-query").toBuilder().codec("QUERY_LOW").build()),
            policyRepository.insert(compress("compress-archive").toBuilder().codec("ARCHIVE_LOW").build()));
        storage.addPartition(partition("P_2024_01", "2024-01-01", "2024-02-01"));
        storage.addPartition(partition("P_2024_02", "2024-02-01", "2024-03-01"));
        for (Policy policy : policies) {
            enqueue(policy, "P_2024_01");
            enqueue(policy, "P_2024_02");
        }
        storage.delayEachCall(Duration.ofMillis(100));

        // When
        int succeeded = 0;
        for (int pass = 0; pass < 10 && queueRepository.countByStatus(QueueStatus.PENDING) > 0; pass++) {
            succeeded += engine.executePending(ExecutionTrigger.MANUAL, null, null).getSucceeded();
        }

        // Then
        assertThat(succeeded).isEqualTo(6);
        assertThat(queueRepository.countByStatus(QueueStatus.SUCCESS)).isEqualTo(6);
        assertThat(storage.maxInFlight("sales.P_2024_01")).isEqualTo(1);
        assertThat(storage.maxInFlight("sales.P_2024_02")).isEqualTo(1);
        assertThat(storage.maxInFlight()).isBetween(1, 4);
        assertThat(lockRegistry.snapshot()).isEmpty();
    }

    @Test
    @DisplayName("Should claim by priority, then oldest boundary, within the per-pass limit")
    void shouldClaimInPriorityOrder() {
        // Given
        configService.update(builder -> builder.maxOperationsPerPass(1).maxConcurrentOperations(1));
        Policy urgent = policyRepository.insert(compress("urgent").toBuilder().priority(10).build());
        Policy routine = policyRepository.insert(compress("routine").toBuilder().priority(200).build());
        storage.addPartition(partition("P_2023_01", "2023-01-01", "2023-02-01"));
        storage.addPartition(partition("P_2024_01", "2024-01-01", "2024-02-01"));
        EvaluationQueueEntry routineEntry = enqueue(routine, "P_2023_01");
        EvaluationQueueEntry urgentEntry = enqueue(urgent, "P_2024_01");

        // When
        ExecutionSummary summary = engine.executePending(ExecutionTrigger.MANUAL, null, null);

        // Then
        assertThat(summary.getClaimed()).isEqualTo(1);
        assertThat(queueRepository.findById(urgentEntry.getId()).orElseThrow().getStatus()).isEqualTo(QueueStatus.SUCCESS);
        assertThat(queueRepository.findById(routineEntry.getId()).orElseThrow().getStatus()).isEqualTo(QueueStatus.PENDING);
    }

    @Test
    @DisplayName("Should skip entries queued under an older policy version")
    void shouldSkipStaleVersion() {
        // Given
        Policy policy = policyRepository.insert(compress("compress-old"));
        storage.addPartition(partition("P_2024_01", "2024-01-01", "2024-02-01"));
        EvaluationQueueEntry entry = enqueue(policy, "P_2024_01");
        policy.setVersion(2);
        policyRepository.update(policy);

        // When
        ExecutionSummary summary = engine.executePending(ExecutionTrigger.MANUAL, null, null);

        // Then
        assertThat(summary.getClaimed()).isZero();
        assertThat(summary.getSkipped()).isEqualTo(1);
        EvaluationQueueEntry skipped = queueRepository.findById(entry.getId()).orElseThrow();
        assertThat(skipped.getStatus()).isEqualTo(QueueStatus.SKIPPED);
        assertThat(skipped.getReason()).startsWith("Policy changed since evaluation");
    }

    @Test
    @DisplayName("Should leave an entry queued while its partition is busy")
    void shouldLeaveBusyPartitionQueued() {
        // Given
        Policy policy = policyRepository.insert(compress("compress-old"));
        storage.addPartition(partition("P_2024_01", "2024-01-01", "2024-02-01"));
        EvaluationQueueEntry entry = enqueue(policy, "P_2024_01");
        lockRegistry.tryLock("sales.P_2024_01", "merge:sales.P_2024_02");

        // When
        ExecutionSummary summary = engine.executePending(ExecutionTrigger.MANUAL, null, null);

        // Then
        assertThat(summary.getClaimed()).isZero();
        assertThat(queueRepository.findById(entry.getId()).orElseThrow().getStatus()).isEqualTo(QueueStatus.PENDING);
        List<ExecutionLogEntry> log = logRepository.find(ExecutionLogQuery.all());
        assertThat(log).isEmpty();
    }

    private EvaluationQueueEntry enqueue(Policy policy, String partitionName) {
        Partition partition = storage.findPartition("sales", partitionName).orElse(null);
        queueRepository.upsertEvaluation(EvaluationQueueEntry.builder()
            .policyId(policy.getId())
            .policyName(policy.getName())
            .datasetId("sales")
            .partitionName(partitionName)
            .priority(policy.getPriority())
            .partitionBoundary(partition != null ? LocalDate.parse(partition.getUpperBound()) : null)
            .eligible(true)
            .status(QueueStatus.PENDING)
            .reason("Partition meets all policy criteria")
            .policyVersion(policy.getVersion())
            .evaluatedAt(clock.instant())
            .build());
        return queueRepository.find(policy.getId(), "sales", partitionName).orElseThrow();
    }

    private static Policy compress(String name) {
        return Policy.builder().name(name).datasetId("sales").ageDays(30)
            .action(ActionType.COMPRESS).codec("ARCHIVE_HIGH").build();
    }

    private static Policy move(String name, String location) {
        return Policy.builder().name(name).datasetId("sales").ageMonths(12)
            .action(ActionType.MOVE).location(location).codec("QUERY_HIGH")
            .destinationTier(StorageTier.WARM).build();
    }

    private static Partition partition(String name, String lower, String upper) {
        return Partition.builder()
            .datasetId("sales")
            .name(name)
            .lowerBound(lower)
            .upperBound(upper)
            .location("TS_HOT")
            .codec("NONE")
            .rowCount(4_000L)
            .byteSize(40_000L)
            .build();
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
    }

    /**
     * In-memory engine whose storage calls can be held back and slowed down.
     */
    static class GatedStorageEngine extends InMemoryStorageEngine {

        private volatile CountDownLatch gate = new CountDownLatch(0);
        private volatile Duration delay = Duration.ZERO;
        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger maxInFlight = new AtomicInteger();
        private final Map<String, AtomicInteger> inFlightByPartition = new ConcurrentHashMap<>();
        private final Map<String, AtomicInteger> maxInFlightByPartition = new ConcurrentHashMap<>();

        GatedStorageEngine(Clock clock) {
            super(clock);
        }

        void close() {
            gate = new CountDownLatch(1);
        }

        void open() {
            gate.countDown();
        }

        void delayEachCall(Duration delay) {
            this.delay = delay;
        }

        int maxInFlight() {
            return maxInFlight.get();
        }

        int maxInFlight(String partitionKey) {
            AtomicInteger max = maxInFlightByPartition.get(partitionKey);
            return max == null ? 0 : max.get();
        }

        @Override
        public Partition setCodec(Partition partition, String codec) {
            enter(partition);
            try {
                return super.setCodec(partition, codec);
            } finally {
                leave(partition);
            }
        }

        @Override
        public Partition relocate(Partition partition, String location, String codec) {
            enter(partition);
            try {
                return super.relocate(partition, location, codec);
            } finally {
                leave(partition);
            }
        }

        private void enter(Partition partition) {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            int onPartition = inFlightByPartition.computeIfAbsent(partition.getKey(), k -> new AtomicInteger())
                .incrementAndGet();
            maxInFlightByPartition.computeIfAbsent(partition.getKey(), k -> new AtomicInteger())
                .accumulateAndGet(onPartition, Math::max);
            try {
                gate.await();
                if (!delay.isZero()) {
                    Thread.sleep(delay.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while gated", e);
            }
        }

        private void leave(Partition partition) {
            inFlight.decrementAndGet();
            inFlightByPartition.get(partition.getKey()).decrementAndGet();
        }
    }
}
