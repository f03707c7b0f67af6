package com.ptl.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Static parameters of a first-loss cover.
 */
@Value
@Builder
public class FirstLossCoverConfig {
    int coverRatePerLossBps;        // share of each loss this cover takes
    BigInteger coverCapPerLoss;     // max amount covered for a single loss event
    int riskYieldMultiplierBps;     // profit weight relative to junior assets
    BigInteger minLiquidity;        // providers cannot redeem below this
    BigInteger maxLiquidity;        // deposits cannot push totalAssets above this
}
