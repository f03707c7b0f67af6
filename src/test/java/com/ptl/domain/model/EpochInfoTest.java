package com.ptl.domain.model;

import com.ptl.domain.exception.PreconditionViolationException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class EpochInfoTest {

    @Test
    void state_shouldMoveFromOpenToPartiallyFilledToFulfilled() {
        EpochInfo epoch = EpochInfo.open(1, BigInteger.valueOf(1000));
        assertEquals(EpochState.OPEN, epoch.getState());

        EpochInfo partial = epoch.process(BigInteger.valueOf(750), BigInteger.valueOf(1500));
        assertEquals(EpochState.PARTIALLY_FILLED, partial.getState());
        assertEquals(BigInteger.valueOf(250), partial.getRemainingShares());
        assertFalse(partial.isFulfilled());

        EpochInfo done = partial.process(BigInteger.valueOf(250), BigInteger.valueOf(500));
        assertEquals(EpochState.FULFILLED, done.getState());
        assertEquals(BigInteger.valueOf(2000), done.getTotalAmountProcessed());
        assertTrue(done.isFulfilled());
    }

    @Test
    void process_shouldRejectMoreSharesThanRequested() {
        EpochInfo epoch = EpochInfo.open(1, BigInteger.valueOf(100));
        assertThrows(PreconditionViolationException.class,
                () -> epoch.process(BigInteger.valueOf(101), BigInteger.valueOf(101)));
    }
}
