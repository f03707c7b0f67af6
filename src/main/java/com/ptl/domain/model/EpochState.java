package com.ptl.domain.model;

/**
 * Settlement state of one tranche-epoch. Transitions happen only while an epoch is being closed.
 */
public enum EpochState {
    OPEN,
    PARTIALLY_FILLED,
    FULFILLED
}
