package com.ptl.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope of every API response; payloads go under "data".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse(
        String status,
        String message,
        String tag
) {
    public static ApiResponse success(String message) {
        return new ApiResponse("success", message, null);
    }

    public static ApiResponse error(String tag, String message) {
        return new ApiResponse("error", message, tag);
    }
}
