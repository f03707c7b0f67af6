package com.ptl.adapter.out.fee;

import com.ptl.application.port.out.FeeCollector;
import com.ptl.domain.math.FixedPointMath;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Takes the protocol fee off the top, then the pool owner and EA rewards off what remains.
 */
@Slf4j
public class PoolFeeManager implements FeeCollector {

    private final int protocolFeeBps;
    private final int poolOwnerRewardBps;
    private final int eaRewardBps;
    private AccruedIncomes accruedIncomes = AccruedIncomes.zero();

    public PoolFeeManager(int protocolFeeBps, int poolOwnerRewardBps, int eaRewardBps) {
        if (poolOwnerRewardBps + eaRewardBps > 10_000 || protocolFeeBps > 10_000) {
            throw new IllegalArgumentException("Fee rates cannot exceed 100%");
        }
        this.protocolFeeBps = protocolFeeBps;
        this.poolOwnerRewardBps = poolOwnerRewardBps;
        this.eaRewardBps = eaRewardBps;
    }

    @Override
    public BigInteger calcPoolProfit(BigInteger profit) {
        return split(profit).poolProfit();
    }

    @Override
    public BigInteger distributePoolFees(BigInteger profit) {
        FeeSplit split = split(profit);
        AccruedIncomes updated = accruedIncomes.plus(split.protocolFee(), split.poolOwnerReward(), split.eaReward());
        FixedPointMath.checked(updated.protocolIncome(), "protocolIncome");
        FixedPointMath.checked(updated.poolOwnerIncome(), "poolOwnerIncome");
        FixedPointMath.checked(updated.eaIncome(), "eaIncome");
        accruedIncomes = updated;
        log.info("Pool fees accrued: protocol={}, poolOwner={}, ea={}, poolProfit={}",
                split.protocolFee(), split.poolOwnerReward(), split.eaReward(), split.poolProfit());
        return split.poolProfit();
    }

    @Override
    public AccruedIncomes getAccruedIncomes() {
        return accruedIncomes;
    }

    private FeeSplit split(BigInteger profit) {
        BigInteger protocolFee = FixedPointMath.applyBps(profit, protocolFeeBps);
        BigInteger remaining = profit.subtract(protocolFee);
        BigInteger poolOwnerReward = FixedPointMath.applyBps(remaining, poolOwnerRewardBps);
        BigInteger eaReward = FixedPointMath.applyBps(remaining, eaRewardBps);
        BigInteger poolProfit = remaining.subtract(poolOwnerReward).subtract(eaReward);
        return new FeeSplit(protocolFee, poolOwnerReward, eaReward, poolProfit);
    }

    private record FeeSplit(BigInteger protocolFee, BigInteger poolOwnerReward, BigInteger eaReward,
                            BigInteger poolProfit) {
    }
}
