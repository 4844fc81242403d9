package com.wall.infrastructure.filter;

import com.wall.application.port.in.AuthenticateUseCase;
import com.wall.infrastructure.context.RequestContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Resolves an optional {@code Authorization: Bearer} token to the signed-in user.
 * Authentication never blocks a request: a missing, invalid or expired token leaves it anonymous.
 */
@Component
@Order(2)
public class BearerTokenFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(BearerTokenFilter.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthenticateUseCase authenticateUseCase;

    public BearerTokenFilter(AuthenticateUseCase authenticateUseCase) {
        this.authenticateUseCase = authenticateUseCase;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        String token = extractToken(request);
        if (token != null) {
            try {
                authenticateUseCase.authenticate(token).ifPresentOrElse(
                    RequestContext::setUser,
                    () -> log.debug("Ignoring invalid bearer token")
                );
            } catch (DataAccessException e) {
                log.warn("Could not resolve bearer token, continuing anonymously: {}", e.getMessage());
            }
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            RequestContext.clearUser();
        }
    }

    private String extractToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
