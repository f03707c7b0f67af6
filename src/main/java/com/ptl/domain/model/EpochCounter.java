package com.ptl.domain.model;

/**
 * Global epoch counter shared by the epoch manager and the tranche vaults.
 * Advanced only when an epoch is closed.
 */
public class EpochCounter {
    private long currentEpochId;

    public EpochCounter() {
        this(1L);
    }

    public EpochCounter(long currentEpochId) {
        this.currentEpochId = currentEpochId;
    }

    public long current() {
        return currentEpochId;
    }

    public long advance() {
        return ++currentEpochId;
    }
}
