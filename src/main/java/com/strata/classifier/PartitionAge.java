package com.strata.classifier;

import com.strata.domain.Partition;
import com.strata.domain.PartitionBoundaries;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Age of a partition, measured from its upper boundary date.
 *
 * A partition with an open upper boundary still receives rows and has age 0.
 * A boundary that cannot be read yields an empty result.
 */
public final class PartitionAge {

    static final LocalDate OPEN_SORT_BOUNDARY = LocalDate.of(9999, 12, 31);

    private PartitionAge() {
    }

    public static Optional<Long> days(Partition partition, LocalDate today) {
        if (PartitionBoundaries.isOpen(partition.getUpperBound())) {
            return Optional.of(0L);
        }
        return PartitionBoundaries.parse(partition.getUpperBound())
            .map(boundary -> Math.max(0L, ChronoUnit.DAYS.between(boundary, today)));
    }

    /**
     * Whole calendar months between the boundary and {@code today}.
     */
    public static Optional<Long> months(Partition partition, LocalDate today) {
        if (PartitionBoundaries.isOpen(partition.getUpperBound())) {
            return Optional.of(0L);
        }
        return PartitionBoundaries.parse(partition.getUpperBound())
            .map(boundary -> Math.max(0L, ChronoUnit.MONTHS.between(boundary, today)));
    }

    /**
     * Boundary used to order queue entries, oldest first. An open partition sorts last;
     * an unreadable boundary is empty and sorts first, like the COLD partition it is classified as.
     */
    public static Optional<LocalDate> sortBoundary(Partition partition) {
        if (PartitionBoundaries.isOpen(partition.getUpperBound())) {
            return Optional.of(OPEN_SORT_BOUNDARY);
        }
        return PartitionBoundaries.parse(partition.getUpperBound());
    }
}
