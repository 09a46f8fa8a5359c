package com.openforge.scanmate.web;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope of the request/response API: {status, data} or {status:"error", error}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse(String status, Object data, String error) {

    public static ApiResponse success(Object data) {
        return new ApiResponse("success", data, null);
    }

    public static ApiResponse error(String message) {
        return new ApiResponse("error", null, message);
    }
}
