package com.ptl.adapter.in.web;

import com.ptl.domain.model.EpochInfo;
import com.ptl.domain.model.SeniorYieldTracker;
import com.ptl.domain.model.TrancheAssets;
import com.ptl.domain.model.TrancheLosses;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.math.BigInteger;
import java.util.List;

/**
 * JSON views of ledger values. Amounts are written as decimal strings so 96-bit values survive JSON clients.
 */
public final class LedgerJson {

    private LedgerJson() {
    }

    public static String amount(BigInteger value) {
        return value == null ? null : value.toString();
    }

    public static JsonArray amounts(List<BigInteger> values) {
        JsonArray array = new JsonArray();
        values.forEach(value -> array.add(amount(value)));
        return array;
    }

    public static JsonObject assets(TrancheAssets assets) {
        return new JsonObject()
                .put("seniorAssets", amount(assets.getSeniorAssets()))
                .put("juniorAssets", amount(assets.getJuniorAssets()));
    }

    public static JsonObject losses(TrancheLosses losses) {
        return new JsonObject()
                .put("seniorLoss", amount(losses.getSeniorLoss()))
                .put("juniorLoss", amount(losses.getJuniorLoss()));
    }

    public static JsonObject epoch(EpochInfo epoch) {
        return new JsonObject()
                .put("epochId", epoch.getEpochId())
                .put("state", epoch.getState().name())
                .put("totalSharesRequested", amount(epoch.getTotalSharesRequested()))
                .put("totalSharesProcessed", amount(epoch.getTotalSharesProcessed()))
                .put("totalAmountProcessed", amount(epoch.getTotalAmountProcessed()));
    }

    public static JsonArray epochs(List<EpochInfo> epochs) {
        JsonArray array = new JsonArray();
        epochs.forEach(epoch -> array.add(epoch(epoch)));
        return array;
    }

    public static JsonObject tracker(SeniorYieldTracker tracker) {
        if (tracker == null) {
            return null;
        }
        return new JsonObject()
                .put("totalAssets", amount(tracker.getTotalAssets()))
                .put("unpaidYield", amount(tracker.getUnpaidYield()))
                .put("lastUpdatedDate", tracker.getLastUpdatedDate() == null
                        ? null : tracker.getLastUpdatedDate().toString());
    }
}
