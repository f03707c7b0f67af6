package com.ptl.adapter.in.web.pool;

import com.ptl.adapter.in.web.LedgerJson;
import com.ptl.adapter.in.web.ResponseWriter;
import com.ptl.application.port.in.PoolQueryUseCase;
import com.ptl.application.port.in.PoolQueryUseCase.CoverSnapshot;
import com.ptl.application.port.in.PoolQueryUseCase.PoolSnapshot;
import com.ptl.application.port.in.PoolQueryUseCase.TrancheSnapshot;
import com.ptl.domain.model.TrancheType;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

import java.util.Map;

import static com.ptl.adapter.in.web.LedgerJson.amount;

/**
 * HTTP handler for the pool ledger state
 * Handles GET /api/pool
 */
@RequiredArgsConstructor
public class PoolStateHandler implements Handler<RoutingContext> {

    private final PoolQueryUseCase queryUseCase;

    @Override
    public void handle(RoutingContext context) {
        ResponseWriter.respond(context, 200, "Pool state", () -> toJson(queryUseCase.snapshot()));
    }

    private static JsonObject toJson(PoolSnapshot snapshot) {
        JsonObject tranches = new JsonObject();
        for (Map.Entry<TrancheType, TrancheSnapshot> entry : snapshot.tranches().entrySet()) {
            TrancheSnapshot tranche = entry.getValue();
            tranches.put(entry.getKey().getValue(), new JsonObject()
                    .put("totalSupply", amount(tranche.totalSupply()))
                    .put("price", amount(tranche.price()))
                    .put("unprocessedEpochs", LedgerJson.epochs(tranche.unprocessedEpochs())));
        }

        JsonArray covers = new JsonArray();
        for (CoverSnapshot cover : snapshot.firstLossCovers()) {
            covers.add(new JsonObject()
                    .put("name", cover.name())
                    .put("totalAssets", amount(cover.totalAssets()))
                    .put("coveredLoss", amount(cover.coveredLoss()))
                    .put("totalShares", amount(cover.totalShares()))
                    .put("weight", amount(cover.weight())));
        }

        JsonObject fees = new JsonObject()
                .put("protocolIncome", amount(snapshot.accruedIncomes().protocolIncome()))
                .put("poolOwnerIncome", amount(snapshot.accruedIncomes().poolOwnerIncome()))
                .put("eaIncome", amount(snapshot.accruedIncomes().eaIncome()));

        return new JsonObject()
                .put("currentEpochId", snapshot.currentEpochId())
                .put("assets", LedgerJson.assets(snapshot.assets()))
                .put("losses", LedgerJson.losses(snapshot.losses()))
                .put("tranches", tranches)
                .put("firstLossCovers", covers)
                .put("seniorYieldTracker", LedgerJson.tracker(snapshot.seniorYieldTracker()))
                .put("availableLiquidity", amount(snapshot.availableLiquidity()))
                .put("redemptionReservation", amount(snapshot.redemptionReservation()))
                .put("accruedFees", fees);
    }
}
