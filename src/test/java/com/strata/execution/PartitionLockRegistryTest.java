package com.strata.execution;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PartitionLockRegistry Tests")
class PartitionLockRegistryTest {

    @Test
    @DisplayName("Should grant a partition to one owner at a time")
    void shouldGrantSingleOwner() {
        // Given
        PartitionLockRegistry registry = new PartitionLockRegistry();

        // When
        boolean first = registry.tryLock("sales.P_2024_11", "execution:1");
        boolean second = registry.tryLock("sales.P_2024_11", "merge:sales.P_2024_12");

        // Then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(registry.owner("sales.P_2024_11")).contains("execution:1");
        assertThat(registry.snapshot()).containsEntry("sales.P_2024_11", "execution:1");
    }

    @Test
    @DisplayName("Should only release a partition for its owner")
    void shouldReleaseForOwnerOnly() {
        // Given
        PartitionLockRegistry registry = new PartitionLockRegistry();
        registry.tryLock("sales.P_2024_11", "execution:1");

        // When / Then
        assertThat(registry.unlock("sales.P_2024_11", "execution:2")).isFalse();
        assertThat(registry.isLocked("sales.P_2024_11")).isTrue();
        assertThat(registry.unlock("sales.P_2024_11", "execution:1")).isTrue();
        assertThat(registry.isLocked("sales.P_2024_11")).isFalse();
    }
}
