package com.ptl.adapter.in.web.tranche;

import com.ptl.adapter.in.web.ResponseWriter;
import com.ptl.adapter.in.web.dto.DepositRequest;
import com.ptl.application.port.in.TrancheDepositUseCase;
import com.ptl.domain.model.TrancheType;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * HTTP handler for lender deposits
 * Handles POST /api/tranches/{tranche}/deposits
 */
@Slf4j
@RequiredArgsConstructor
public class DepositHandler implements Handler<RoutingContext> {

    private final TrancheDepositUseCase depositUseCase;

    @Override
    public void handle(RoutingContext context) {
        ResponseWriter.respond(context, 201, "Deposit accepted", () -> {
            TrancheType tranche = ResponseWriter.trancheParam(context);
            DepositRequest request = ResponseWriter.requireBody(context).mapTo(DepositRequest.class);
            String lender = ResponseWriter.requireText(request.lender(), "lender");

            BigInteger shares = depositUseCase.deposit(tranche, lender, request.amount());
            return new JsonObject()
                    .put("tranche", tranche.getValue())
                    .put("lender", lender)
                    .put("shares", shares.toString());
        });
    }
}
