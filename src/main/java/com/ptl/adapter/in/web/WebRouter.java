package com.ptl.adapter.in.web;

import com.ptl.adapter.in.web.cover.FirstLossCoverHandler;
import com.ptl.adapter.in.web.epoch.EpochHandler;
import com.ptl.adapter.in.web.pnl.PnlDistributionHandler;
import com.ptl.adapter.in.web.pool.PoolStateHandler;
import com.ptl.adapter.in.web.tranche.DepositHandler;
import com.ptl.adapter.in.web.tranche.RedemptionHandler;
import io.vertx.ext.web.Router;
import lombok.Builder;

/**
 * Router configuration for the ledger endpoints
 */
@Builder
public class WebRouter {

    private final Router router;
    private final PnlDistributionHandler profitHandler;
    private final PnlDistributionHandler lossHandler;
    private final PnlDistributionHandler recoveryHandler;
    private final EpochHandler epochHandler;
    private final DepositHandler depositHandler;
    private final RedemptionHandler redemptionHandler;
    private final FirstLossCoverHandler coverHandler;
    private final PoolStateHandler poolStateHandler;

    public void setupRoutes() {
        // CORS headers
        router.route().handler(ctx -> {
            ctx.response()
                    .putHeader("Access-Control-Allow-Origin", "*")
                    .putHeader("Access-Control-Allow-Methods", "GET, POST, DELETE, OPTIONS")
                    .putHeader("Access-Control-Allow-Headers", "Content-Type, Authorization, X-Requested-With");
            ctx.next();
        });

        // Handle OPTIONS preflight requests
        router.options("/api/*").handler(ctx -> ctx.response().setStatusCode(204).end());

        // PnL events from the loan ledger
        router.post("/api/pnl/profit").handler(profitHandler);
        router.post("/api/pnl/loss").handler(lossHandler);
        router.post("/api/pnl/recovery").handler(recoveryHandler);

        // Epochs
        router.post("/api/epochs/close").handler(epochHandler::handleClose);
        router.get("/api/epochs/current").handler(epochHandler::handleCurrent);

        // Tranche vaults
        router.post("/api/tranches/:tranche/deposits").handler(depositHandler);
        router.post("/api/tranches/:tranche/redemptions").handler(redemptionHandler::handleAdd);
        router.delete("/api/tranches/:tranche/redemptions").handler(redemptionHandler::handleCancel);
        router.get("/api/tranches/:tranche/lenders/:lender/cancellable").handler(redemptionHandler::handleCancellable);
        router.get("/api/tranches/:tranche/lenders/:lender/withdrawable").handler(redemptionHandler::handleWithdrawable);
        router.post("/api/tranches/:tranche/lenders/:lender/disburse").handler(redemptionHandler::handleDisburse);

        // First loss covers
        router.post("/api/covers/:index/deposits").handler(coverHandler::handleDeposit);
        router.post("/api/covers/:index/redemptions").handler(coverHandler::handleRedeem);

        // Pool state
        router.get("/api/pool").handler(poolStateHandler);

        // Health check endpoint
        router.get("/health")
                .handler(ctx -> {
                    ctx.response()
                            .putHeader("Content-Type", "application/json")
                            .end("{\"status\":\"UP\",\"service\":\"pooled-tranche-ledger\"}");
                });
    }
}
