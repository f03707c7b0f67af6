package com.ptl.application.service;

import com.ptl.adapter.out.memory.InMemoryPoolSafe;
import com.ptl.adapter.out.memory.InMemoryTrancheShareLedger;
import com.ptl.adapter.out.memory.InMemoryUnderlyingToken;
import com.ptl.application.port.in.EpochSettlementUseCase.EpochCloseResult;
import com.ptl.application.port.in.EpochSettlementUseCase.TrancheCloseSummary;
import com.ptl.domain.exception.ConstraintBlockedException;
import com.ptl.domain.math.FixedPointMath;
import com.ptl.domain.model.EpochCounter;
import com.ptl.domain.model.EpochInfo;
import com.ptl.domain.model.EpochState;
import com.ptl.domain.model.TrancheAssets;
import com.ptl.domain.model.TrancheLedger;
import com.ptl.domain.model.TrancheType;
import com.ptl.domain.model.WithdrawableAmount;
import com.ptl.domain.policy.RiskAdjustedTranchesPolicy;
import com.ptl.domain.policy.TranchesPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Epoch close against in-memory token, safe and share ledgers
 */
class EpochManagerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    private InMemoryUnderlyingToken token;
    private InMemoryPoolSafe safe;
    private TrancheLedger ledger;
    private TranchesPolicy policy;
    private EpochCounter counter;
    private Map<TrancheType, TrancheVaultService> vaults;
    private LenderService lenders;

    @BeforeEach
    void setUp() {
        token = new InMemoryUnderlyingToken();
        safe = new InMemoryPoolSafe(token);
        ledger = new TrancheLedger(List.of());
        policy = new RiskAdjustedTranchesPolicy(2000);
        counter = new EpochCounter();
        vaults = new EnumMap<>(TrancheType.class);
        for (TrancheType tranche : TrancheType.values()) {
            vaults.put(tranche, new TrancheVaultService(tranche, new InMemoryTrancheShareLedger(tranche),
                    token, safe, counter));
        }
        lenders = new LenderService(ledger, policy, safe, vaults,
                new LenderService.DepositLimits(BigInteger.ONE, BigInteger.ZERO, 40000), CLOCK);
    }

    private EpochManager manager(int flexWindowEpochs) {
        return new EpochManager(ledger, policy, safe, vaults, counter, 40000, flexWindowEpochs, CLOCK);
    }

    private void deposit(TrancheType tranche, String lender, long amount) {
        token.mint(lender, BigInteger.valueOf(amount));
        lenders.deposit(tranche, lender, BigInteger.valueOf(amount));
    }

    private void redeem(TrancheType tranche, String lender, long shares) {
        lenders.addRedemptionRequest(tranche, lender, BigInteger.valueOf(shares));
    }

    private void moveOutOfSafe(long amount) {
        token.transfer(InMemoryPoolSafe.DEFAULT_ACCOUNT, "loans", BigInteger.valueOf(amount));
    }

    @Test
    void closeEpoch_shouldPartiallyFillAtTheCurrentPrice() {
        // Given senior priced at 2 after a gain and 1500 of liquidity
        deposit(TrancheType.JUNIOR, "jane", 1000);
        deposit(TrancheType.SENIOR, "alice", 400);
        deposit(TrancheType.SENIOR, "bob", 600);
        ledger.updateAssets(new TrancheAssets(BigInteger.valueOf(2000), BigInteger.valueOf(1000)));
        redeem(TrancheType.SENIOR, "alice", 400);
        redeem(TrancheType.SENIOR, "bob", 600);
        moveOutOfSafe(500);

        // When
        EpochCloseResult result = manager(0).closeEpoch();

        // Then
        TrancheCloseSummary senior = result.tranches().get(TrancheType.SENIOR);
        assertEquals(FixedPointMath.PRICE_SCALE.multiply(BigInteger.TWO), senior.price());
        assertEquals(BigInteger.valueOf(750), senior.sharesProcessed());
        assertEquals(BigInteger.valueOf(1500), senior.amountProcessed());
        assertEquals(BigInteger.valueOf(500), result.unmetDemand());
        assertEquals(1L, result.closedEpochId());
        assertEquals(2L, result.nextEpochId());

        List<EpochInfo> pending = vaults.get(TrancheType.SENIOR).unprocessedEpochs();
        assertEquals(1, pending.size());
        assertEquals(EpochState.PARTIALLY_FILLED, pending.get(0).getState());
        assertEquals(new TrancheAssets(BigInteger.valueOf(500), BigInteger.valueOf(1000)), ledger.getAssets());
        assertEquals(BigInteger.valueOf(250), vaults.get(TrancheType.SENIOR).totalSupply());
        assertEquals(BigInteger.ZERO, safe.totalBalance());
        assertEquals(BigInteger.valueOf(1500), token.balanceOf("vault:SENIOR"));
        assertEquals(BigInteger.valueOf(500), safe.getRedemptionReservation());

        WithdrawableAmount alice = lenders.withdrawableAssets(TrancheType.SENIOR, "alice");
        assertEquals(BigInteger.valueOf(300), alice.shares());
        assertEquals(BigInteger.valueOf(600), alice.amount());
        assertEquals(BigInteger.valueOf(600), lenders.disburse(TrancheType.SENIOR, "alice"));
        assertEquals(BigInteger.valueOf(600), token.balanceOf("alice"));
        assertEquals(BigInteger.ZERO, lenders.withdrawableAssets(TrancheType.SENIOR, "alice").amount());
    }

    @Test
    void closeEpoch_shouldExhaustOlderEpochsFirst() {
        // Given a partially filled epoch followed by a new request
        deposit(TrancheType.JUNIOR, "jane", 500);
        deposit(TrancheType.SENIOR, "alice", 500);
        moveOutOfSafe(950);
        redeem(TrancheType.SENIOR, "alice", 100);
        EpochManager manager = manager(0);
        manager.closeEpoch();
        redeem(TrancheType.SENIOR, "alice", 100);
        token.transfer("loans", InMemoryPoolSafe.DEFAULT_ACCOUNT, BigInteger.valueOf(120));

        // When
        EpochCloseResult result = manager.closeEpoch();

        // Then the older 50 are paid before the newer epoch gets 70
        TrancheCloseSummary senior = result.tranches().get(TrancheType.SENIOR);
        assertEquals(2, senior.epochsTouched());
        assertEquals(BigInteger.valueOf(120), senior.amountProcessed());
        List<EpochInfo> pending = vaults.get(TrancheType.SENIOR).unprocessedEpochs();
        assertEquals(1, pending.size());
        assertEquals(2L, pending.get(0).getEpochId());
        assertEquals(BigInteger.valueOf(70), pending.get(0).getTotalSharesProcessed());
        assertEquals(BigInteger.valueOf(170), lenders.withdrawableAssets(TrancheType.SENIOR, "alice").amount());
    }

    @Test
    void closeEpoch_shouldHoldJuniorBackWhenSeniorWouldBreachTheRatio() {
        // Given senior at exactly 4x junior
        deposit(TrancheType.JUNIOR, "jane", 200);
        deposit(TrancheType.SENIOR, "alice", 800);
        redeem(TrancheType.JUNIOR, "jane", 100);

        // When
        EpochCloseResult result = manager(0).closeEpoch();

        // Then
        assertEquals(BigInteger.ZERO, result.tranches().get(TrancheType.JUNIOR).amountProcessed());
        assertEquals(BigInteger.valueOf(100), result.unmetDemand());
        assertEquals(EpochState.OPEN, vaults.get(TrancheType.JUNIOR).unprocessedEpochs().get(0).getState());
        assertEquals(2L, counter.current());
    }

    @Test
    void closeEpoch_shouldReleaseJuniorOnceSeniorRedemptionsLowerTheRatio() {
        // Given
        deposit(TrancheType.JUNIOR, "jane", 200);
        deposit(TrancheType.SENIOR, "alice", 800);
        redeem(TrancheType.JUNIOR, "jane", 200);
        redeem(TrancheType.SENIOR, "alice", 400);

        // When
        EpochCloseResult result = manager(0).closeEpoch();

        // Then senior 400 leaves 400 that needs 100 of junior
        assertEquals(BigInteger.valueOf(400), result.tranches().get(TrancheType.SENIOR).amountProcessed());
        assertEquals(BigInteger.valueOf(100), result.tranches().get(TrancheType.JUNIOR).amountProcessed());
        assertEquals(new TrancheAssets(BigInteger.valueOf(400), BigInteger.valueOf(100)), ledger.getAssets());
        assertEquals(BigInteger.valueOf(100), result.unmetDemand());
    }

    @Test
    void closeEpoch_shouldServeMatureJuniorBeforeImmatureSenior() {
        // Given a junior request one epoch old and a fresh senior request
        deposit(TrancheType.JUNIOR, "jane", 1000);
        deposit(TrancheType.SENIOR, "alice", 1000);
        redeem(TrancheType.JUNIOR, "jane", 100);
        counter.advance();
        redeem(TrancheType.SENIOR, "alice", 100);
        moveOutOfSafe(1850);

        // When
        EpochCloseResult result = manager(1).closeEpoch();

        // Then
        assertEquals(BigInteger.valueOf(100), result.tranches().get(TrancheType.JUNIOR).amountProcessed());
        assertEquals(BigInteger.valueOf(50), result.tranches().get(TrancheType.SENIOR).amountProcessed());
        assertEquals(EpochState.PARTIALLY_FILLED,
                vaults.get(TrancheType.SENIOR).unprocessedEpochs().get(0).getState());
        assertTrue(vaults.get(TrancheType.JUNIOR).unprocessedEpochs().isEmpty());
    }

    @Test
    void closeEpoch_shouldServeCappedMatureJuniorBeforeNewerJuniorInTheFlexWindow() {
        // Given senior at exactly 4x junior, an old junior request held back by the ratio cap,
        // then a senior redemption and a newer junior request in the closing epoch
        deposit(TrancheType.JUNIOR, "jane", 100);
        deposit(TrancheType.JUNIOR, "joe", 100);
        deposit(TrancheType.SENIOR, "alice", 800);
        redeem(TrancheType.JUNIOR, "jane", 100);
        counter.advance();
        redeem(TrancheType.SENIOR, "alice", 400);
        redeem(TrancheType.JUNIOR, "joe", 100);

        // When
        EpochCloseResult result = manager(1).closeEpoch();

        // Then the room freed by senior goes to the older junior epoch
        assertEquals(BigInteger.valueOf(400), result.tranches().get(TrancheType.SENIOR).amountProcessed());
        assertEquals(BigInteger.valueOf(100), result.tranches().get(TrancheType.JUNIOR).amountProcessed());
        List<EpochInfo> juniorPending = vaults.get(TrancheType.JUNIOR).unprocessedEpochs();
        assertEquals(1, juniorPending.size());
        assertEquals(2L, juniorPending.get(0).getEpochId());
        assertEquals(EpochState.OPEN, juniorPending.get(0).getState());
        assertEquals(BigInteger.valueOf(100), lenders.withdrawableAssets(TrancheType.JUNIOR, "jane").amount());
        assertEquals(BigInteger.ZERO, lenders.withdrawableAssets(TrancheType.JUNIOR, "joe").amount());

        TrancheAssets after = ledger.getAssets();
        assertTrue(after.getJuniorAssets().multiply(BigInteger.valueOf(40000))
                .compareTo(after.getSeniorAssets().multiply(BigInteger.valueOf(10000))) >= 0);
    }

    @Test
    void closeEpoch_shouldKeepFillingPastEpochsFulfilledEarlierInTheSameClose() {
        // Given two mature senior epochs and a newer one, with enough liquidity for all
        deposit(TrancheType.JUNIOR, "jane", 1000);
        deposit(TrancheType.SENIOR, "alice", 1000);
        redeem(TrancheType.SENIOR, "alice", 100);
        counter.advance();
        redeem(TrancheType.SENIOR, "alice", 100);
        counter.advance();
        redeem(TrancheType.SENIOR, "alice", 100);

        // When the flex pass walks the queue again from the oldest epoch
        EpochCloseResult result = manager(1).closeEpoch();

        // Then
        assertEquals(3, result.tranches().get(TrancheType.SENIOR).epochsTouched());
        assertEquals(BigInteger.valueOf(300), result.tranches().get(TrancheType.SENIOR).amountProcessed());
        assertTrue(vaults.get(TrancheType.SENIOR).unprocessedEpochs().isEmpty());
    }

    @Test
    void closeEpoch_shouldTreatTheClosingEpochAsMatureWithoutAFlexWindow() {
        // Given
        deposit(TrancheType.JUNIOR, "jane", 1000);
        deposit(TrancheType.SENIOR, "alice", 1000);
        redeem(TrancheType.SENIOR, "alice", 100);

        // When
        EpochCloseResult result = manager(0).closeEpoch();

        // Then
        assertEquals(BigInteger.valueOf(100), result.tranches().get(TrancheType.SENIOR).amountProcessed());
    }

    @Test
    void closeEpoch_shouldRejectPendingDemandWithoutLiquidity() {
        // Given
        deposit(TrancheType.JUNIOR, "jane", 500);
        deposit(TrancheType.SENIOR, "alice", 500);
        redeem(TrancheType.SENIOR, "alice", 100);
        moveOutOfSafe(1000);
        EpochManager manager = manager(0);

        // When / Then
        assertThrows(ConstraintBlockedException.class, manager::closeEpoch);
        assertEquals(1L, manager.currentEpochId());
        assertEquals(EpochState.OPEN, manager.unprocessedEpochs(TrancheType.SENIOR).get(0).getState());
        assertEquals(BigInteger.valueOf(500), vaults.get(TrancheType.SENIOR).totalSupply());
    }

    @Test
    void closeEpoch_shouldAdvanceWhenThereIsNoDemand() {
        EpochManager manager = manager(0);

        EpochCloseResult result = manager.closeEpoch();

        assertEquals(1L, result.closedEpochId());
        assertEquals(2L, result.nextEpochId());
        assertEquals(BigInteger.ZERO, result.unmetDemand());
        assertEquals(2L, manager.currentEpochId());
    }
}
