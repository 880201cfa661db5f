package com.strata.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PartitionBoundaries Tests")
class PartitionBoundariesTest {

    @Test
    @DisplayName("Should read ISO and engine literal boundaries")
    void shouldParseLiterals() {
        // When / Then
        assertThat(PartitionBoundaries.parse("2024-12-01")).contains(LocalDate.of(2024, 12, 1));
        assertThat(PartitionBoundaries.parse("2024-12-01T00:00:00")).contains(LocalDate.of(2024, 12, 1));
        assertThat(PartitionBoundaries.parse("TO_DATE(' 2024-12-01 00:00:00', 'SYYYY-MM-DD HH24:MI:SS')"))
            .contains(LocalDate.of(2024, 12, 1));
        assertThat(PartitionBoundaries.parse("TIMESTAMP' 2023-01-01 00:00:00'")).contains(LocalDate.of(2023, 1, 1));
    }

    @Test
    @DisplayName("Should treat open, missing and unreadable boundaries as empty")
    void shouldReturnEmptyForUnreadable() {
        // When / Then
        assertThat(PartitionBoundaries.isOpen(" maxvalue ")).isTrue();
        assertThat(PartitionBoundaries.parse("MAXVALUE")).isEmpty();
        assertThat(PartitionBoundaries.parse(null)).isEmpty();
        assertThat(PartitionBoundaries.parse("garbage")).isEmpty();
        assertThat(PartitionBoundaries.parse("2024-13-45")).isEmpty();
    }
}
