package com.wall.adapter.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * Liveness probe. Answers as long as the process serves requests; dependency checks live under
 * {@code /actuator/health}.
 */
@RestController
@Tag(name = "Operations")
public class HealthController {

    @GetMapping("/healthz")
    @Operation(summary = "Liveness probe")
    public HealthResponse healthz() {
        return new HealthResponse(true, Instant.now());
    }

    public record HealthResponse(boolean ok, Instant ts) {}
}
