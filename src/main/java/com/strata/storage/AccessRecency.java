package com.strata.storage;

import java.time.Instant;

/**
 * Last read and last write of a partition; either may be unknown.
 */
public class AccessRecency {

    private final Instant lastRead;
    private final Instant lastWrite;

    public AccessRecency(Instant lastRead, Instant lastWrite) {
        this.lastRead = lastRead;
        this.lastWrite = lastWrite;
    }

    public Instant getLastRead() {
        return lastRead;
    }

    public Instant getLastWrite() {
        return lastWrite;
    }
}
