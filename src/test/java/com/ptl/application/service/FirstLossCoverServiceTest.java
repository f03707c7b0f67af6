package com.ptl.application.service;

import com.ptl.adapter.out.memory.InMemoryUnderlyingToken;
import com.ptl.domain.exception.ConstraintBlockedException;
import com.ptl.domain.exception.PreconditionViolationException;
import com.ptl.domain.model.FirstLossCover;
import com.ptl.domain.model.FirstLossCoverConfig;
import com.ptl.domain.model.TrancheLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FirstLossCoverServiceTest {

    private InMemoryUnderlyingToken token;
    private FirstLossCover cover;
    private FirstLossCoverService service;

    @BeforeEach
    void setUp() {
        token = new InMemoryUnderlyingToken();
        token.mint("borrower", BigInteger.valueOf(1000));
        cover = new FirstLossCover("borrower", FirstLossCoverConfig.builder()
                .coverRatePerLossBps(5000)
                .coverCapPerLoss(BigInteger.valueOf(500))
                .riskYieldMultiplierBps(10000)
                .minLiquidity(BigInteger.valueOf(100))
                .maxLiquidity(BigInteger.valueOf(800))
                .build());
        service = new FirstLossCoverService(new TrancheLedger(List.of(cover)), token);
    }

    @Test
    void depositCover_shouldMoveFundsIntoTheCoverAccount() {
        // When
        BigInteger shares = service.depositCover(0, "borrower", BigInteger.valueOf(400));

        // Then
        assertEquals(BigInteger.valueOf(400), shares);
        assertEquals(BigInteger.valueOf(400), cover.getTotalAssets());
        assertEquals(BigInteger.valueOf(400), token.balanceOf("flc:borrower"));
        assertEquals(BigInteger.valueOf(600), token.balanceOf("borrower"));
    }

    @Test
    void depositCover_shouldBlockDepositsAboveMaxLiquidity() {
        service.depositCover(0, "borrower", BigInteger.valueOf(700));

        assertThrows(ConstraintBlockedException.class,
                () -> service.depositCover(0, "borrower", BigInteger.valueOf(101)));
        assertEquals(BigInteger.valueOf(300), token.balanceOf("borrower"));
    }

    @Test
    void depositCover_shouldRejectProvidersWithoutFunds() {
        assertThrows(PreconditionViolationException.class,
                () -> service.depositCover(0, "stranger", BigInteger.valueOf(10)));
        assertEquals(BigInteger.ZERO, cover.getTotalAssets());
    }

    @Test
    void redeemCover_shouldPayOutAtTheCurrentShareValue() {
        // Given the cover earned 100 of profit
        service.depositCover(0, "borrower", BigInteger.valueOf(400));
        cover.applyProfit(BigInteger.valueOf(100));
        token.mint("flc:borrower", BigInteger.valueOf(100));

        // When
        BigInteger assets = service.redeemCover(0, "borrower", BigInteger.valueOf(200));

        // Then
        assertEquals(BigInteger.valueOf(250), assets);
        assertEquals(BigInteger.valueOf(850), token.balanceOf("borrower"));
        assertEquals(BigInteger.valueOf(200), cover.sharesOf("borrower"));
    }

    @Test
    void redeemCover_shouldKeepMinLiquidity() {
        service.depositCover(0, "borrower", BigInteger.valueOf(400));

        assertThrows(PreconditionViolationException.class,
                () -> service.redeemCover(0, "borrower", BigInteger.valueOf(301)));
    }

    @Test
    void redeemCover_shouldBlockWhenTheCoverAccountIsShort() {
        // Given booked profit that has not arrived in the cover account
        service.depositCover(0, "borrower", BigInteger.valueOf(400));
        cover.applyProfit(BigInteger.valueOf(400));

        // When / Then
        assertThrows(ConstraintBlockedException.class,
                () -> service.redeemCover(0, "borrower", BigInteger.valueOf(250)));
        assertEquals(BigInteger.valueOf(400), cover.sharesOf("borrower"));
    }

    @Test
    void operations_shouldRejectUnknownCoverIndex() {
        assertThrows(PreconditionViolationException.class,
                () -> service.depositCover(1, "borrower", BigInteger.TEN));
        assertThrows(PreconditionViolationException.class,
                () -> service.redeemCover(-1, "borrower", BigInteger.TEN));
    }
}
