package com.ptl.domain.policy;

import com.ptl.domain.model.TrancheAssets;
import com.ptl.domain.model.TrancheLosses;

import java.math.BigInteger;

/**
 * Tranche assets and losses after a recovery; remainingRecovery is left for the first-loss covers.
 */
public record RecoveryDistribution(BigInteger remainingRecovery, TrancheAssets newAssets, TrancheLosses newLosses) {
}
