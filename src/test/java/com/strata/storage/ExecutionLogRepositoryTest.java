package com.strata.storage;

import com.strata.domain.ActionType;
import com.strata.domain.ExecutionLogEntry;
import com.strata.domain.ExecutionStatus;
import com.strata.domain.ExecutionTrigger;
import com.strata.domain.FailureKind;
import com.strata.support.MutableClock;
import com.strata.support.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ExecutionLogRepository Tests")
class ExecutionLogRepositoryTest {

    private static final Instant START = Instant.parse("2025-11-10T01:00:00Z");

    private TestDatabase database;
    private MutableClock clock;
    private ExecutionLogRepository repository;

    @BeforeEach
    void setUp() {
        database = TestDatabase.create();
        clock = new MutableClock(START);
        repository = new ExecutionLogRepository(database.jdbcTemplate(), clock);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    @DisplayName("Should open entries as RUNNING and complete them once with duration")
    void shouldStartAndComplete() {
        // Given
        ExecutionLogEntry entry = repository.start(entry(1L, "P_2024_01", ActionType.COMPRESS, 40_000L));

        // When
        clock.advance(Duration.ofSeconds(3));
        entry.setStatus(ExecutionStatus.SUCCESS);
        entry.setSizeAfter(10_000L);
        entry.setCodecAfter("ARCHIVE_HIGH");
        boolean completed = repository.complete(entry);

        // Then
        assertThat(completed).isTrue();
        ExecutionLogEntry stored = repository.findById(entry.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(stored.getTrigger()).isEqualTo(ExecutionTrigger.SCHEDULED);
        assertThat(stored.getStartedAt()).isEqualTo(START);
        assertThat(stored.getEndedAt()).isEqualTo(START.plusSeconds(3));
        assertThat(stored.getDurationMs()).isEqualTo(3_000L);
        assertThat(stored.getSizeAfter()).isEqualTo(10_000L);

        assertThat(repository.complete(entry)).isFalse();
    }

    @Test
    @DisplayName("Should reject completing an entry as RUNNING")
    void shouldRejectRunningCompletion() {
        // Given
        ExecutionLogEntry entry = repository.start(entry(1L, "P_2024_01", ActionType.COMPRESS, 40_000L));

        // When / Then
        assertThatThrownBy(() -> repository.complete(entry))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("RUNNING");
    }

    @Test
    @DisplayName("Should filter the log and return newest entries first")
    void shouldQueryNewestFirst() {
        // Given
        complete(entry(1L, "P_2024_01", ActionType.COMPRESS, 40_000L), ExecutionStatus.SUCCESS, 10_000L);
        clock.advance(Duration.ofMinutes(5));
        complete(entry(2L, "P_2024_02", ActionType.MOVE, 40_000L), ExecutionStatus.FAILED, null);
        clock.advance(Duration.ofMinutes(5));
        complete(entry(1L, "P_2024_03", ActionType.COMPRESS, 40_000L), ExecutionStatus.SUCCESS, 20_000L);

        // When
        List<ExecutionLogEntry> all = repository.find(ExecutionLogQuery.all());
        List<ExecutionLogEntry> forPolicy = repository.find(ExecutionLogQuery.all().policy(1L));
        List<ExecutionLogEntry> failures = repository.find(ExecutionLogQuery.all().status(ExecutionStatus.FAILED));
        List<ExecutionLogEntry> window = repository.find(ExecutionLogQuery.all()
            .from(START.plusSeconds(60)).to(START.plusSeconds(400)));

        // Then
        assertThat(all).extracting(ExecutionLogEntry::getPartitionName)
            .containsExactly("P_2024_03", "P_2024_02", "P_2024_01");
        assertThat(forPolicy).hasSize(2);
        assertThat(failures).extracting(ExecutionLogEntry::getPartitionName).containsExactly("P_2024_02");
        assertThat(window).extracting(ExecutionLogEntry::getPartitionName).containsExactly("P_2024_02");
        assertThat(repository.find(ExecutionLogQuery.all().limit(1))).hasSize(1);
    }

    @Test
    @DisplayName("Should aggregate success rate and space saved per policy")
    void shouldAggregateStatistics() {
        // Given
        complete(entry(1L, "P_2024_01", ActionType.COMPRESS, 40_000L), ExecutionStatus.SUCCESS, 10_000L);
        complete(entry(1L, "P_2024_02", ActionType.COMPRESS, 40_000L), ExecutionStatus.SUCCESS, 20_000L);
        complete(entry(1L, "P_2024_03", ActionType.COMPRESS, 40_000L), ExecutionStatus.FAILED, null);
        complete(entry(null, "P_2024_04", ActionType.MERGE, 40_000L), ExecutionStatus.SUCCESS, 80_000L);

        // When
        List<PolicyExecutionStats> stats = repository.statistics();

        // Then
        assertThat(stats).hasSize(1);
        PolicyExecutionStats policy = stats.get(0);
        assertThat(policy.getPolicyId()).isEqualTo(1L);
        assertThat(policy.getSuccesses()).isEqualTo(2);
        assertThat(policy.getFailures()).isEqualTo(1);
        assertThat(policy.getSpaceSavedBytes()).isEqualTo(50_000L);
        assertThat(policy.getSuccessRate()).isEqualTo(66.67);
    }

    @Test
    @DisplayName("Should count recent failures and apply retention without touching running entries")
    void shouldCountFailuresAndApplyRetention() {
        // Given
        complete(entry(1L, "P_2024_01", ActionType.COMPRESS, 40_000L), ExecutionStatus.FAILED, null);
        ExecutionLogEntry running = repository.start(entry(1L, "P_2024_02", ActionType.COMPRESS, 40_000L));
        clock.advance(Duration.ofDays(40));
        complete(entry(1L, "P_2024_03", ActionType.COMPRESS, 40_000L), ExecutionStatus.FAILED, null);

        // When
        int recentFailures = repository.countFailuresSince(clock.instant().minus(Duration.ofHours(1)));
        int deleted = repository.deleteCompletedBefore(clock.instant().minus(Duration.ofDays(30)));

        // Then
        assertThat(recentFailures).isEqualTo(1);
        assertThat(deleted).isEqualTo(1);
        assertThat(repository.findById(running.getId())).isPresent();
        assertThat(repository.find(ExecutionLogQuery.all())).hasSize(2);
    }

    private void complete(ExecutionLogEntry entry, ExecutionStatus status, Long sizeAfter) {
        repository.start(entry);
        entry.setStatus(status);
        entry.setSizeAfter(sizeAfter);
        if (status == ExecutionStatus.FAILED) {
            entry.setErrorCode("STORAGE_SET_CODEC");
            entry.setErrorMessage("Storage unavailable");
            entry.setFailureKind(FailureKind.RETRYABLE);
        }
        repository.complete(entry);
    }

    private static ExecutionLogEntry entry(Long policyId, String partitionName, ActionType action, Long sizeBefore) {
        return ExecutionLogEntry.builder()
            .policyId(policyId)
            .policyName(policyId != null ? "policy-" + policyId : null)
            .datasetId("sales")
            .partitionName(partitionName)
            .action(action)
            .sizeBefore(sizeBefore)
            .build();
    }
}
