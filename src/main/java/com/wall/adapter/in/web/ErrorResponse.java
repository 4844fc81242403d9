package com.wall.adapter.in.web;

import com.wall.infrastructure.context.RequestContext;

/**
 * Error body shared by every endpoint: a stable machine-readable code, a human-readable message
 * and the id of the request for log correlation.
 */
public record ErrorResponse(
    String error,
    String message,
    String requestId
) {
    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, RequestContext.getRequestId());
    }
}
