package com.ptl.adapter.in.web.pnl;

import com.ptl.adapter.in.web.ResponseWriter;
import com.ptl.adapter.in.web.dto.AmountRequest;
import com.ptl.application.port.in.PnlDistributionUseCase;
import com.ptl.application.port.in.PnlDistributionUseCase.LossDistributionResult;
import com.ptl.application.port.in.PnlDistributionUseCase.ProfitDistributionResult;
import com.ptl.application.port.in.PnlDistributionUseCase.RecoveryDistributionResult;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import static com.ptl.adapter.in.web.LedgerJson.amount;
import static com.ptl.adapter.in.web.LedgerJson.amounts;

/**
 * HTTP handler for PnL events from the loan ledger
 * Handles POST /api/pnl/profit, /api/pnl/loss and /api/pnl/recovery
 */
@Slf4j
@RequiredArgsConstructor
public class PnlDistributionHandler implements Handler<RoutingContext> {

    public enum PnlEvent { PROFIT, LOSS, RECOVERY }

    private final PnlDistributionUseCase pnlUseCase;
    private final PnlEvent event;

    @Override
    public void handle(RoutingContext context) {
        ResponseWriter.respond(context, 200, event.name().toLowerCase() + " distributed", () -> {
            AmountRequest request = ResponseWriter.requireBody(context).mapTo(AmountRequest.class);
            log.info("Received {} event: {}", event, request.amount());
            switch (event) {
                case PROFIT:
                    return toJson(pnlUseCase.distributeProfit(request.amount()));
                case LOSS:
                    return toJson(pnlUseCase.distributeLoss(request.amount()));
                default:
                    return toJson(pnlUseCase.distributeLossRecovery(request.amount()));
            }
        });
    }

    private static JsonObject toJson(ProfitDistributionResult result) {
        return new JsonObject()
                .put("profit", amount(result.profit()))
                .put("poolProfit", amount(result.poolProfit()))
                .put("seniorProfit", amount(result.seniorProfit()))
                .put("juniorProfit", amount(result.juniorProfit()))
                .put("coverProfits", amounts(result.coverProfits()));
    }

    private static JsonObject toJson(LossDistributionResult result) {
        return new JsonObject()
                .put("loss", amount(result.loss()))
                .put("coverLosses", amounts(result.coverLosses()))
                .put("juniorLoss", amount(result.juniorLoss()))
                .put("seniorLoss", amount(result.seniorLoss()));
    }

    private static JsonObject toJson(RecoveryDistributionResult result) {
        return new JsonObject()
                .put("recovery", amount(result.recovery()))
                .put("seniorRecovery", amount(result.seniorRecovery()))
                .put("juniorRecovery", amount(result.juniorRecovery()))
                .put("coverRecoveries", amounts(result.coverRecoveries()));
    }
}
