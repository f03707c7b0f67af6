package com.ptl.domain.policy;

import com.ptl.domain.model.SeniorYieldTracker;
import com.ptl.domain.model.TrancheAssets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class FixedSeniorYieldTranchesPolicyTest {

    private static final LocalDate START = LocalDate.of(2026, 1, 1);

    private FixedSeniorYieldTranchesPolicy policy;
    private TrancheAssets assets;

    @BeforeEach
    void setUp() {
        // 10% a year on 3600 senior assets accrues 1 per day
        policy = new FixedSeniorYieldTranchesPolicy(1000);
        assets = new TrancheAssets(BigInteger.valueOf(3600), BigInteger.valueOf(1000));
        policy.refreshYieldTracker(assets, START);
    }

    @Test
    void splitProfit_shouldPayAccruedYieldToSeniorAndTheRestToJunior() {
        ProfitSplit split = policy.splitProfit(BigInteger.valueOf(100), assets, START.plusDays(10));

        assertEquals(BigInteger.TEN, split.seniorProfit());
        assertEquals(BigInteger.valueOf(90), split.juniorProfit());
    }

    @Test
    void splitProfit_shouldNotChangeTheTracker() {
        policy.splitProfit(BigInteger.valueOf(100), assets, START.plusDays(10));

        SeniorYieldTracker tracker = policy.getSeniorYieldTracker().orElseThrow();
        assertEquals(BigInteger.ZERO, tracker.getUnpaidYield());
        assertEquals(START, tracker.getLastUpdatedDate());
    }

    @Test
    void onProfitDistributed_shouldCarryUnpaidYieldForward() {
        LocalDate day10 = START.plusDays(10);
        ProfitSplit split = policy.splitProfit(BigInteger.valueOf(4), assets, day10);
        assertEquals(BigInteger.valueOf(4), split.seniorProfit());
        assertEquals(BigInteger.ZERO, split.juniorProfit());

        TrancheAssets newAssets = new TrancheAssets(BigInteger.valueOf(3604), BigInteger.valueOf(1000));
        policy.onProfitDistributed(split, newAssets, day10);

        SeniorYieldTracker tracker = policy.getSeniorYieldTracker().orElseThrow();
        assertEquals(BigInteger.valueOf(6), tracker.getUnpaidYield());
        assertEquals(BigInteger.valueOf(3604), tracker.getTotalAssets());
        assertEquals(day10, tracker.getLastUpdatedDate());
    }

    @Test
    void refreshYieldTracker_shouldAccrueOnTheOldBaseBeforeResyncing() {
        TrancheAssets afterDeposit = new TrancheAssets(BigInteger.valueOf(7200), BigInteger.valueOf(2000));
        policy.refreshYieldTracker(afterDeposit, START.plusDays(5));

        SeniorYieldTracker tracker = policy.getSeniorYieldTracker().orElseThrow();
        assertEquals(BigInteger.valueOf(5), tracker.getUnpaidYield());
        assertEquals(BigInteger.valueOf(7200), tracker.getTotalAssets());
    }

    @Test
    void riskAdjustedPolicy_shouldNotExposeATracker() {
        assertTrue(new RiskAdjustedTranchesPolicy(0).getSeniorYieldTracker().isEmpty());
    }
}
