package com.ptl.adapter.in.web.tranche;

import com.ptl.adapter.in.web.ResponseWriter;
import com.ptl.adapter.in.web.dto.SharesRequest;
import com.ptl.application.port.in.RedemptionUseCase;
import com.ptl.domain.model.TrancheType;
import com.ptl.domain.model.WithdrawableAmount;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

import java.math.BigInteger;

/**
 * HTTP handler for redemption requests and payouts of a tranche vault
 */
@RequiredArgsConstructor
public class RedemptionHandler {

    private final RedemptionUseCase redemptionUseCase;

    /**
     * POST /api/tranches/{tranche}/redemptions
     */
    public void handleAdd(RoutingContext context) {
        ResponseWriter.respond(context, 202, "Redemption request queued", () -> {
            TrancheType tranche = ResponseWriter.trancheParam(context);
            SharesRequest request = ResponseWriter.requireBody(context).mapTo(SharesRequest.class);
            String lender = ResponseWriter.requireText(request.lender(), "lender");
            redemptionUseCase.addRedemptionRequest(tranche, lender, request.shares());
            return cancellable(tranche, lender);
        });
    }

    /**
     * DELETE /api/tranches/{tranche}/redemptions
     */
    public void handleCancel(RoutingContext context) {
        ResponseWriter.respond(context, 200, "Redemption request cancelled", () -> {
            TrancheType tranche = ResponseWriter.trancheParam(context);
            SharesRequest request = ResponseWriter.requireBody(context).mapTo(SharesRequest.class);
            String lender = ResponseWriter.requireText(request.lender(), "lender");
            redemptionUseCase.cancelRedemptionRequest(tranche, lender, request.shares());
            return cancellable(tranche, lender);
        });
    }

    /**
     * GET /api/tranches/{tranche}/lenders/{lender}/cancellable
     */
    public void handleCancellable(RoutingContext context) {
        ResponseWriter.respond(context, 200, "Cancellable redemption shares", () ->
                cancellable(ResponseWriter.trancheParam(context), context.pathParam("lender")));
    }

    /**
     * GET /api/tranches/{tranche}/lenders/{lender}/withdrawable
     */
    public void handleWithdrawable(RoutingContext context) {
        ResponseWriter.respond(context, 200, "Withdrawable assets", () -> {
            TrancheType tranche = ResponseWriter.trancheParam(context);
            String lender = context.pathParam("lender");
            WithdrawableAmount withdrawable = redemptionUseCase.withdrawableAssets(tranche, lender);
            return new JsonObject()
                    .put("tranche", tranche.getValue())
                    .put("lender", lender)
                    .put("shares", withdrawable.shares().toString())
                    .put("amount", withdrawable.amount().toString());
        });
    }

    /**
     * POST /api/tranches/{tranche}/lenders/{lender}/disburse
     */
    public void handleDisburse(RoutingContext context) {
        ResponseWriter.respond(context, 200, "Disbursed", () -> {
            TrancheType tranche = ResponseWriter.trancheParam(context);
            String lender = context.pathParam("lender");
            BigInteger paid = redemptionUseCase.disburse(tranche, lender);
            return new JsonObject()
                    .put("tranche", tranche.getValue())
                    .put("lender", lender)
                    .put("amount", paid.toString());
        });
    }

    private JsonObject cancellable(TrancheType tranche, String lender) {
        return new JsonObject()
                .put("tranche", tranche.getValue())
                .put("lender", lender)
                .put("cancellableShares", redemptionUseCase.cancellableRedemptionShares(tranche, lender).toString());
    }
}
