package com.wall.infrastructure.filter;

import com.wall.infrastructure.context.RequestContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every request with an id (taken from {@code X-Request-Id} or generated), exposes it to logging through
 * the MDC and echoes it on the response.
 */
@Component
@Order(1)
public class RequestIdFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestIdFilter.class);

    static final String REQUEST_ID_HEADER = "X-Request-Id";
    static final String APP_HEADER = "X-App";
    static final String APP_NAME = "wall-api";

    private static final int MAX_REQUEST_ID_LENGTH = 128;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        String requestId = getOrGenerateRequestId(request);
        RequestContext.set(requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        response.setHeader(APP_HEADER, APP_NAME);

        log.debug("Request started: method={}, path={}", request.getMethod(), request.getRequestURI());

        try {
            filterChain.doFilter(request, response);
        } finally {
            RequestContext.clear();
        }
    }

    private String getOrGenerateRequestId(HttpServletRequest request) {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank() || requestId.length() > MAX_REQUEST_ID_LENGTH) {
            requestId = UUID.randomUUID().toString();
        }
        return requestId;
    }
}
