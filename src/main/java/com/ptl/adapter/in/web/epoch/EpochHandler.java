package com.ptl.adapter.in.web.epoch;

import com.ptl.adapter.in.web.LedgerJson;
import com.ptl.adapter.in.web.ResponseWriter;
import com.ptl.application.port.in.EpochSettlementUseCase;
import com.ptl.application.port.in.EpochSettlementUseCase.EpochCloseResult;
import com.ptl.application.port.in.EpochSettlementUseCase.TrancheCloseSummary;
import com.ptl.domain.model.TrancheType;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

import static com.ptl.adapter.in.web.LedgerJson.amount;

/**
 * HTTP handler for the redemption epoch
 * Handles POST /api/epochs/close and GET /api/epochs/current
 */
@Slf4j
@RequiredArgsConstructor
public class EpochHandler {

    private final EpochSettlementUseCase epochUseCase;

    public void handleClose(RoutingContext context) {
        ResponseWriter.respond(context, 200, "Epoch closed", () -> {
            log.info("Manual epoch close requested");
            return toJson(epochUseCase.closeEpoch());
        });
    }

    public void handleCurrent(RoutingContext context) {
        ResponseWriter.respond(context, 200, "Current epoch", () -> {
            JsonObject pending = new JsonObject();
            for (TrancheType tranche : TrancheType.values()) {
                pending.put(tranche.getValue(), LedgerJson.epochs(epochUseCase.unprocessedEpochs(tranche)));
            }
            return new JsonObject()
                    .put("epochId", epochUseCase.currentEpochId())
                    .put("unprocessedEpochs", pending);
        });
    }

    public static JsonObject toJson(EpochCloseResult result) {
        JsonObject tranches = new JsonObject();
        for (Map.Entry<TrancheType, TrancheCloseSummary> entry : result.tranches().entrySet()) {
            TrancheCloseSummary summary = entry.getValue();
            tranches.put(entry.getKey().getValue(), new JsonObject()
                    .put("price", amount(summary.price()))
                    .put("epochsTouched", summary.epochsTouched())
                    .put("sharesProcessed", amount(summary.sharesProcessed()))
                    .put("amountProcessed", amount(summary.amountProcessed())));
        }
        return new JsonObject()
                .put("closedEpochId", result.closedEpochId())
                .put("nextEpochId", result.nextEpochId())
                .put("tranches", tranches)
                .put("unmetDemand", amount(result.unmetDemand()));
    }
}
