package com.ptl.domain.model;

import lombok.Value;

import java.math.BigInteger;
import java.util.List;

/**
 * Settlement deltas for one tranche computed while closing an epoch.
 * Sent to the tranche vault as a single batched message.
 */
@Value
public class EpochSettlement {
    TrancheType tranche;
    List<EpochInfo> epochsProcessed;  // updated infos, oldest first
    BigInteger sharesProcessed;
    BigInteger amountProcessed;

    public boolean isEmpty() {
        return epochsProcessed.isEmpty();
    }
}
