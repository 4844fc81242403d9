package com.wall.infrastructure.security;

import com.wall.application.port.out.TokenProvider;
import com.wall.infrastructure.config.AppProperties;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * HS256-signed JWTs whose subject is the user id.
 */
@Component
public class JwtTokenProvider implements TokenProvider {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenProvider.class);

    private final SecretKey key;
    private final Duration ttl;
    private final Clock clock;
    private final JwtParser parser;

    @Autowired
    public JwtTokenProvider(AppProperties appProperties) {
        this(appProperties, Clock.systemUTC());
    }

    JwtTokenProvider(AppProperties appProperties, Clock clock) {
        AppProperties.Auth auth = appProperties.getAuth();
        // Throws WeakKeyException for secrets under 256 bits, failing startup
        this.key = Keys.hmacShaKeyFor(auth.getTokenSecret().getBytes(StandardCharsets.UTF_8));
        this.ttl = auth.getTokenTtl();
        this.clock = clock;
        this.parser = Jwts.parser()
            .verifyWith(key)
            .clock(() -> Date.from(clock.instant()))
            .build();
    }

    @Override
    public String issue(UUID userId) {
        Instant now = clock.instant();
        return Jwts.builder()
            .subject(userId.toString())
            .issuedAt(Date.from(now))
            .expiration(Date.from(now.plus(ttl)))
            .signWith(key)
            .compact();
    }

    @Override
    public Optional<UUID> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            String subject = parser.parseSignedClaims(token).getPayload().getSubject();
            return Optional.of(UUID.fromString(subject));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected access token: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
