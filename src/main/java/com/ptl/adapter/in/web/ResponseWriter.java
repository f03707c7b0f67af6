package com.ptl.adapter.in.web;

import com.ptl.domain.exception.ErrorTag;
import com.ptl.domain.exception.LedgerException;
import com.ptl.domain.model.TrancheType;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Shared response and error mapping for the ledger handlers.
 */
@Slf4j
public final class ResponseWriter {

    private ResponseWriter() {
    }

    /**
     * Runs a ledger call and writes its result, mapping rejections to their HTTP status.
     */
    public static void respond(RoutingContext context, int successStatus, String message, Supplier<JsonObject> call) {
        JsonObject data;
        try {
            data = call.get();
        } catch (LedgerException e) {
            log.warn("{} {} rejected [{}]: {}", context.request().method(), context.request().path(),
                    e.getTag().getValue(), e.getMessage());
            sendError(context, statusFor(e.getTag()), e.getTag().getValue(), e.getMessage());
            return;
        } catch (IllegalArgumentException | DecodeException e) {
            log.warn("Invalid request to {}: {}", context.request().path(), e.getMessage());
            sendError(context, 400, ErrorTag.PRECONDITION_VIOLATION.getValue(),
                    "Invalid request format: " + e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.error("Unexpected failure handling {}", context.request().path(), e);
            sendError(context, 500, null, "Internal error: " + e.getMessage());
            return;
        }
        sendSuccess(context, successStatus, message, data);
    }

    public static void sendSuccess(RoutingContext context, int statusCode, String message, JsonObject data) {
        JsonObject body = JsonObject.mapFrom(ApiResponse.success(message));
        if (data != null) {
            body.put("data", data);
        }
        send(context, statusCode, body);
    }

    public static void sendError(RoutingContext context, int statusCode, String tag, String message) {
        send(context, statusCode, JsonObject.mapFrom(ApiResponse.error(tag, message)));
    }

    public static int statusFor(ErrorTag tag) {
        switch (tag) {
            case PRECONDITION_VIOLATION:
                return 400;
            case CONSTRAINT_BLOCKED:
                return 409;
            case ARITHMETIC_OVERFLOW:
                return 422;
            default:
                return 500;
        }
    }

    /**
     * Request body as JSON; rejects a missing body.
     */
    public static JsonObject requireBody(RoutingContext context) {
        JsonObject body = context.body().asJsonObject();
        if (body == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        return body;
    }

    public static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    public static TrancheType trancheParam(RoutingContext context) {
        String value = context.pathParam("tranche");
        if (!TrancheType.isValid(value)) {
            throw new IllegalArgumentException("Unknown tranche: " + value);
        }
        return TrancheType.fromValue(value);
    }

    private static void send(RoutingContext context, int statusCode, JsonObject body) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(body.encode());
    }
}
