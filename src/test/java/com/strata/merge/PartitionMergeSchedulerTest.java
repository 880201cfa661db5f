package com.strata.merge;

import com.strata.domain.ActionType;
import com.strata.domain.Dataset;
import com.strata.domain.DeferredMerge;
import com.strata.domain.ExecutionLogEntry;
import com.strata.domain.ExecutionStatus;
import com.strata.domain.ExecutionTrigger;
import com.strata.domain.FailureKind;
import com.strata.domain.Granularity;
import com.strata.domain.Partition;
import com.strata.domain.Policy;
import com.strata.domain.StorageTier;
import com.strata.domain.TierDefinition;
import com.strata.domain.TierTemplate;
import com.strata.execution.ExecutionFailureClassifier;
import com.strata.execution.PartitionLockRegistry;
import com.strata.monitoring.LifecycleMetrics;
import com.strata.storage.DatasetRepository;
import com.strata.storage.ExecutionLogQuery;
import com.strata.storage.ExecutionLogRepository;
import com.strata.storage.InMemoryStorageEngine;
import com.strata.storage.MergeBacklogRepository;
import com.strata.storage.StorageOperationException;
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

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PartitionMergeScheduler Tests")
class PartitionMergeSchedulerTest {

    private static final String OWNER = "execution:7";

    @Mock
    private DatasetRepository datasetRepository;

    @Mock
    private TierTemplateRepository templateRepository;

    private TestDatabase database;
    private FlakyStorageEngine storage;
    private MergeBacklogRepository backlogRepository;
    private ExecutionLogRepository logRepository;
    private PartitionLockRegistry lockRegistry;
    private PartitionMergeScheduler scheduler;

    @BeforeEach
    void setUp() {
        database = TestDatabase.create();
        Clock clock = new MutableClock(Instant.parse("2025-11-10T23:00:00Z"));
        storage = new FlakyStorageEngine(clock);
        backlogRepository = new MergeBacklogRepository(database.jdbcTemplate(), clock);
        logRepository = new ExecutionLogRepository(database.jdbcTemplate(), clock);
        lockRegistry = new PartitionLockRegistry();
        scheduler = new PartitionMergeScheduler(storage, storage, datasetRepository, templateRepository,
            backlogRepository, logRepository, lockRegistry, new ExecutionFailureClassifier(),
            new LifecycleMetrics(new SimpleMeterRegistry()));
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    @DisplayName("Should merge a moved monthly partition into the yearly partition of its year")
    void shouldMergeIntoYearlyPartition() {
        // Given
        givenStandardTemplate();
        storage.addPartition(partition("P_2024", "2024-01-01", "2024-11-01", "TS_WARM", 900_000L));
        Partition moved = movedToWarm("P_2024_11", "2024-11-01", "2024-12-01");
        lockRegistry.tryLock(moved.getKey(), OWNER);

        // When
        MergeOutcome outcome = scheduler.onMoveCompleted(toWarm(), moved, ExecutionTrigger.SCHEDULED, OWNER);

        // Then
        assertThat(outcome).isEqualTo(MergeOutcome.MERGED);
        Partition yearly = storage.findPartition("sales", "P_2024").orElseThrow();
        assertThat(yearly.getLowerBound()).isEqualTo("2024-01-01");
        assertThat(yearly.getUpperBound()).isEqualTo("2024-12-01");
        assertThat(yearly.getByteSize()).isEqualTo(1_000_000L);
        assertThat(storage.findPartition("sales", "P_2024_11")).isEmpty();

        List<ExecutionLogEntry> log = logRepository.find(ExecutionLogQuery.all());
        assertThat(log).hasSize(1);
        assertThat(log.get(0).getAction()).isEqualTo(ActionType.MERGE);
        assertThat(log.get(0).getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(log.get(0).getDetail()).isEqualTo("Merge into P_2024");

        assertThat(lockRegistry.owner("sales.P_2024_11")).contains(OWNER);
        assertThat(lockRegistry.isLocked("sales.P_2024")).isFalse();
        assertThat(backlogRepository.findAll()).isEmpty();
    }

    @Test
    @DisplayName("Should let the first partition of a period become its merge target")
    void shouldSeedPeriod() {
        // Given
        givenStandardTemplate();
        Partition moved = movedToWarm("P_2025_01", "2025-01-01", "2025-02-01");

        // When
        MergeOutcome outcome = scheduler.onMoveCompleted(toWarm(), moved, ExecutionTrigger.SCHEDULED, OWNER);

        // Then
        assertThat(outcome).isEqualTo(MergeOutcome.SEED);
        assertThat(storage.findPartition("sales", "P_2025_01")).isPresent();
        assertThat(backlogRepository.findAll()).isEmpty();
    }

    @Test
    @DisplayName("Should not merge when the destination tier is not coarser or no template applies")
    void shouldSkipWhenNotApplicable() {
        // Given
        givenStandardTemplate();
        Partition monthly = partition("P_2025_10", "2025-10-01", "2025-11-01", "TS_HOT", 100_000L);
        storage.addPartition(monthly);
        Policy toHot = Policy.builder().name("back-to-hot").datasetId("sales").ageDays(1)
            .action(ActionType.MOVE).location("TS_HOT").codec("NONE").destinationTier(StorageTier.HOT).build();

        // When / Then
        assertThat(scheduler.onMoveCompleted(toHot, monthly, ExecutionTrigger.MANUAL, OWNER))
            .isEqualTo(MergeOutcome.NOT_APPLICABLE);

        when(datasetRepository.findById("events")).thenReturn(Optional.empty());
        Partition orphan = monthly.toBuilder().datasetId("events").build();
        assertThat(scheduler.onMoveCompleted(toWarm(), orphan, ExecutionTrigger.MANUAL, OWNER))
            .isEqualTo(MergeOutcome.NOT_APPLICABLE);
    }

    @Test
    @DisplayName("Should defer partitions that are not adjacent to the period partition")
    void shouldDeferNonAdjacent() {
        // Given
        givenStandardTemplate();
        storage.addPartition(partition("P_2024", "2024-01-01", "2024-10-01", "TS_WARM", 900_000L));
        Partition moved = movedToWarm("P_2024_11", "2024-11-01", "2024-12-01");

        // When
        MergeOutcome outcome = scheduler.onMoveCompleted(toWarm(), moved, ExecutionTrigger.SCHEDULED, OWNER);

        // Then
        assertThat(outcome).isEqualTo(MergeOutcome.DEFERRED);
        assertThat(storage.findPartition("sales", "P_2024_11")).isPresent();
        List<DeferredMerge> backlog = backlogRepository.findAll();
        assertThat(backlog).hasSize(1);
        assertThat(backlog.get(0).getPartitionName()).isEqualTo("P_2024_11");
        assertThat(backlog.get(0).getTargetTier()).isEqualTo(StorageTier.WARM);
        assertThat(backlog.get(0).getTargetGranularity()).isEqualTo(Granularity.YEARLY);
        assertThat(backlog.get(0).getReason()).contains("not adjacent");
    }

    @Test
    @DisplayName("Should defer partitions stored in a different location than the period partition")
    void shouldDeferAcrossLocations() {
        // Given
        givenStandardTemplate();
        storage.addPartition(partition("P_2024", "2024-01-01", "2024-11-01", "TS_COLD", 900_000L));
        Partition moved = movedToWarm("P_2024_11", "2024-11-01", "2024-12-01");

        // When
        MergeOutcome outcome = scheduler.onMoveCompleted(toWarm(), moved, ExecutionTrigger.SCHEDULED, OWNER);

        // Then
        assertThat(outcome).isEqualTo(MergeOutcome.DEFERRED);
        assertThat(backlogRepository.findAll()).extracting(DeferredMerge::getReason)
            .containsExactly("Partition P_2024 is in TS_COLD, P_2024_11 is in TS_WARM");
    }

    @Test
    @DisplayName("Should defer while the period partition is busy and merge on the backlog retry")
    void shouldRetryBusyMergeFromBacklog() {
        // Given
        givenStandardTemplate();
        storage.addPartition(partition("P_2024", "2024-01-01", "2024-11-01", "TS_WARM", 900_000L));
        Partition moved = movedToWarm("P_2024_11", "2024-11-01", "2024-12-01");
        lockRegistry.tryLock("sales.P_2024", "execution:3");

        // When
        MergeOutcome outcome = scheduler.onMoveCompleted(toWarm(), moved, ExecutionTrigger.SCHEDULED, null);

        // Then
        assertThat(outcome).isEqualTo(MergeOutcome.DEFERRED);
        assertThat(scheduler.backlog()).hasSize(1);
        assertThat(lockRegistry.isLocked("sales.P_2024_11")).isFalse();

        // When
        lockRegistry.unlock("sales.P_2024", "execution:3");
        int merged = scheduler.retryBacklog();

        // Then
        assertThat(merged).isEqualTo(1);
        assertThat(scheduler.backlog()).isEmpty();
        assertThat(storage.findPartition("sales", "P_2024").orElseThrow().getUpperBound()).isEqualTo("2024-12-01");
    }

    @Test
    @DisplayName("Should isolate a rejected merge and keep the moved partition standalone")
    void shouldIsolateMergeFailure() {
        // Given
        givenStandardTemplate();
        storage.addPartition(partition("P_2024", "2024-01-01", "2024-11-01", "TS_WARM", 900_000L));
        Partition moved = movedToWarm("P_2024_11", "2024-11-01", "2024-12-01");
        storage.rejectMerges = true;

        // When
        MergeOutcome outcome = scheduler.onMoveCompleted(toWarm(), moved, ExecutionTrigger.SCHEDULED, OWNER);

        // Then
        assertThat(outcome).isEqualTo(MergeOutcome.FAILED);
        assertThat(storage.findPartition("sales", "P_2024_11")).isPresent();
        assertThat(storage.findPartition("sales", "P_2024").orElseThrow().getUpperBound()).isEqualTo("2024-11-01");

        ExecutionLogEntry failed = logRepository.find(ExecutionLogQuery.all()).get(0);
        assertThat(failed.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(failed.getErrorCode()).isEqualTo("STORAGE_MERGE");
        assertThat(failed.getFailureKind()).isEqualTo(FailureKind.RETRYABLE);
        assertThat(backlogRepository.findAll()).extracting(DeferredMerge::getReason)
            .allSatisfy(reason -> assertThat(reason).startsWith("Merge failed"));
    }

    @Test
    @DisplayName("Should drop backlog entries whose partition no longer exists")
    void shouldDropVanishedBacklogEntries() {
        // Given
        backlogRepository.defer("sales", "P_2023_04", StorageTier.WARM, Granularity.YEARLY, "No partition found");

        // When
        int merged = scheduler.retryBacklog();

        // Then
        assertThat(merged).isZero();
        assertThat(backlogRepository.findAll()).isEmpty();
    }

    @Test
    @DisplayName("Should forget a period partition's merge lock once no merge uses it")
    void shouldReleaseTargetLocksAfterMerges() throws Exception {
        // Given
        givenStandardTemplate();
        storage.addPartition(partition("P_2024", "2024-01-01", "2024-11-01", "TS_WARM", 900_000L));
        storage.addPartition(partition("P_2023", "2023-01-01", "2023-12-01", "TS_WARM", 900_000L));
        Partition november = movedToWarm("P_2024_11", "2024-11-01", "2024-12-01");
        Partition december = movedToWarm("P_2023_12", "2023-12-01", "2024-01-01");
        lockRegistry.tryLock("sales.P_2023", "execution:3");

        // When
        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            Future<MergeOutcome> first = callers.submit(
                () -> scheduler.onMoveCompleted(toWarm(), november, ExecutionTrigger.SCHEDULED, null));
            Future<MergeOutcome> second = callers.submit(
                () -> scheduler.onMoveCompleted(toWarm(), december, ExecutionTrigger.SCHEDULED, null));

            // Then
            assertThat(first.get(10, TimeUnit.SECONDS)).isEqualTo(MergeOutcome.MERGED);
            assertThat(second.get(10, TimeUnit.SECONDS)).isEqualTo(MergeOutcome.DEFERRED);
        } finally {
            callers.shutdownNow();
        }
        assertThat(scheduler.activeTargetLocks()).isZero();

        // When
        storage.rejectMerges = true;
        lockRegistry.unlock("sales.P_2023", "execution:3");
        scheduler.retryBacklog();

        // Then
        assertThat(scheduler.activeTargetLocks()).isZero();
        assertThat(scheduler.backlog()).extracting(DeferredMerge::getPartitionName).containsExactly("P_2023_12");
    }

    private void givenStandardTemplate() {
        TierTemplate template = TierTemplate.builder()
            .name("standard")
            .hot(TierDefinition.builder().ageMonths(12).granularity(Granularity.MONTHLY).location("TS_HOT").codec("NONE").build())
            .warm(TierDefinition.builder().ageMonths(36).granularity(Granularity.YEARLY).location("TS_WARM").codec("QUERY_HIGH").build())
            .cold(TierDefinition.builder().ageMonths(84).granularity(Granularity.YEARLY).location("TS_COLD").codec("ARCHIVE_HIGH").build())
            .build();
        lenient().when(datasetRepository.findById("sales")).thenReturn(Optional.of(new Dataset("sales", "standard")));
        lenient().when(templateRepository.findByName("standard")).thenReturn(Optional.of(template));
    }

    private Partition movedToWarm(String name, String lower, String upper) {
        Partition partition = partition(name, lower, upper, "TS_WARM", 100_000L);
        storage.addPartition(partition);
        return partition;
    }

    private static Policy toWarm() {
        return Policy.builder().name("hot-to-warm").datasetId("sales").ageMonths(12)
            .action(ActionType.MOVE).location("TS_WARM").codec("QUERY_HIGH").destinationTier(StorageTier.WARM).build();
    }

    private static Partition partition(String name, String lower, String upper, String location, long bytes) {
        return Partition.builder()
            .datasetId("sales")
            .name(name)
            .lowerBound(lower)
            .upperBound(upper)
            .location(location)
            .codec("QUERY_HIGH")
            .rowCount(bytes / 10)
            .byteSize(bytes)
            .build();
    }

    static class FlakyStorageEngine extends InMemoryStorageEngine {

        private volatile boolean rejectMerges;

        FlakyStorageEngine(Clock clock) {
            super(clock);
        }

        @Override
        public synchronized Partition merge(Partition coarse, Partition fine) {
            if (rejectMerges) {
                throw new StorageOperationException("Merge rejected by storage", "merge", fine.getKey(), FailureKind.RETRYABLE);
            }
            return super.merge(coarse, fine);
        }
    }
}
