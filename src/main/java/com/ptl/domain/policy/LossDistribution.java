package com.ptl.domain.policy;

import com.ptl.domain.model.TrancheAssets;
import com.ptl.domain.model.TrancheLosses;

/**
 * Tranche assets after a loss, and the loss each tranche took.
 */
public record LossDistribution(TrancheAssets newAssets, TrancheLosses lossDelta) {
}
