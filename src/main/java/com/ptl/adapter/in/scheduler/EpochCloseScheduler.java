package com.ptl.adapter.in.scheduler;

import com.ptl.application.port.in.EpochSettlementUseCase;
import com.ptl.application.port.in.EpochSettlementUseCase.EpochCloseResult;
import com.ptl.domain.exception.ConstraintBlockedException;
import com.ptl.domain.exception.LedgerException;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

/**
 * Closes the redemption epoch on a fixed cadence.
 * Runs on the deploying verticle's context, so closes never interleave with API calls.
 */
@Slf4j
public class EpochCloseScheduler {

    private final Vertx vertx;
    private final EpochSettlementUseCase epochUseCase;
    private final long intervalMs;
    private Long timerId;

    public EpochCloseScheduler(Vertx vertx, EpochSettlementUseCase epochUseCase, long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive");
        }
        this.vertx = vertx;
        this.epochUseCase = epochUseCase;
        this.intervalMs = intervalMs;
    }

    public void start() {
        if (timerId != null) {
            return;
        }
        timerId = vertx.setPeriodic(intervalMs, id -> closeEpoch());
        log.info("Epoch close scheduler started (interval: {} ms)", intervalMs);
    }

    public void stop() {
        if (timerId != null) {
            vertx.cancelTimer(timerId);
            timerId = null;
            log.info("Epoch close scheduler stopped");
        }
    }

    public boolean isRunning() {
        return timerId != null;
    }

    /**
     * One scheduled close. A blocked close is retried at the next tick.
     */
    void closeEpoch() {
        try {
            EpochCloseResult result = epochUseCase.closeEpoch();
            log.info("Scheduled close of epoch {} done, next epoch {}", result.closedEpochId(), result.nextEpochId());
        } catch (ConstraintBlockedException e) {
            log.info("Scheduled epoch close deferred: {}", e.getMessage());
        } catch (LedgerException e) {
            log.warn("Scheduled epoch close rejected [{}]: {}", e.getTag().getValue(), e.getMessage());
        }
    }
}
