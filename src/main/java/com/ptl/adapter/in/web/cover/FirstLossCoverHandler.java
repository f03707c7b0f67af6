package com.ptl.adapter.in.web.cover;

import com.ptl.adapter.in.web.ResponseWriter;
import com.ptl.adapter.in.web.dto.CoverRequest;
import com.ptl.application.port.in.FirstLossCoverUseCase;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

import java.math.BigInteger;

/**
 * HTTP handler for first-loss-cover providers
 * Handles POST /api/covers/{index}/deposits and POST /api/covers/{index}/redemptions
 */
@RequiredArgsConstructor
public class FirstLossCoverHandler {

    private final FirstLossCoverUseCase coverUseCase;

    public void handleDeposit(RoutingContext context) {
        ResponseWriter.respond(context, 201, "Cover deposit accepted", () -> {
            int index = coverIndex(context);
            CoverRequest request = ResponseWriter.requireBody(context).mapTo(CoverRequest.class);
            String provider = ResponseWriter.requireText(request.provider(), "provider");
            BigInteger shares = coverUseCase.depositCover(index, provider, request.amount());
            return new JsonObject()
                    .put("coverIndex", index)
                    .put("provider", provider)
                    .put("shares", shares.toString());
        });
    }

    public void handleRedeem(RoutingContext context) {
        ResponseWriter.respond(context, 200, "Cover shares redeemed", () -> {
            int index = coverIndex(context);
            CoverRequest request = ResponseWriter.requireBody(context).mapTo(CoverRequest.class);
            String provider = ResponseWriter.requireText(request.provider(), "provider");
            BigInteger assets = coverUseCase.redeemCover(index, provider, request.shares());
            return new JsonObject()
                    .put("coverIndex", index)
                    .put("provider", provider)
                    .put("amount", assets.toString());
        });
    }

    private static int coverIndex(RoutingContext context) {
        String raw = context.pathParam("index");
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Cover index must be a number: " + raw, e);
        }
    }
}
