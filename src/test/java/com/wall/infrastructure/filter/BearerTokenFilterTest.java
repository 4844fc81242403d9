package com.wall.infrastructure.filter;

import com.wall.application.port.in.AuthenticateUseCase;
import com.wall.domain.model.User;
import com.wall.infrastructure.context.RequestContext;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class BearerTokenFilterTest {

    private final AuthenticateUseCase authenticateUseCase = mock(AuthenticateUseCase.class);
    private final BearerTokenFilter filter = new BearerTokenFilter(authenticateUseCase);

    private final User user =
        new User(UUID.randomUUID(), "ada@example.com", "ada_l", "hash", Instant.parse("2024-01-01T00:00:00Z"));

    private static MockHttpServletRequest request(String authorization) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/posts");
        if (authorization != null) {
            request.addHeader("Authorization", authorization);
        }
        return request;
    }

    @Test
    void shouldExposeUserOnlyWhileHandling() throws Exception {
        when(authenticateUseCase.authenticate("good-token")).thenReturn(Optional.of(user));
        AtomicReference<Optional<User>> seen = new AtomicReference<>();
        AtomicReference<String> seenInMdc = new AtomicReference<>();

        filter.doFilter(request("Bearer good-token"), new MockHttpServletResponse(), (req, res) -> {
            seen.set(RequestContext.getUser());
            seenInMdc.set(MDC.get("userId"));
        });

        assertEquals(Optional.of(user), seen.get());
        assertEquals(user.id().toString(), seenInMdc.get());
        assertTrue(RequestContext.getUser().isEmpty());
        assertNull(MDC.get("userId"));
    }

    @Test
    void shouldAcceptLowercaseScheme() throws Exception {
        when(authenticateUseCase.authenticate("good-token")).thenReturn(Optional.of(user));
        AtomicReference<Optional<User>> seen = new AtomicReference<>();

        filter.doFilter(request("bearer good-token"), new MockHttpServletResponse(),
            (req, res) -> seen.set(RequestContext.getUser()));

        assertEquals(Optional.of(user), seen.get());
    }

    @Test
    void shouldStayAnonymousWithoutBearerToken() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request(null), new MockHttpServletResponse(), chain);
        filter.doFilter(request("Basic YWRhOnB3"), new MockHttpServletResponse(), new MockFilterChain());
        filter.doFilter(request("Bearer   "), new MockHttpServletResponse(), new MockFilterChain());

        assertNotNull(chain.getRequest());
        verifyNoInteractions(authenticateUseCase);
    }

    @Test
    void shouldStayAnonymousForInvalidToken() throws Exception {
        when(authenticateUseCase.authenticate("forged")).thenReturn(Optional.empty());
        AtomicReference<Optional<User>> seen = new AtomicReference<>();

        filter.doFilter(request("Bearer forged"), new MockHttpServletResponse(),
            (req, res) -> seen.set(RequestContext.getUser()));

        assertTrue(seen.get().isEmpty());
    }

    @Test
    void shouldContinueWhenUserLookupFails() throws Exception {
        when(authenticateUseCase.authenticate("good-token"))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("Bearer good-token"), new MockHttpServletResponse(), chain);

        assertNotNull(chain.getRequest());
        assertTrue(RequestContext.getUser().isEmpty());
    }
}
