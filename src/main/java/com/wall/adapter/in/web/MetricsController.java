package com.wall.adapter.in.web;

import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Operations")
public class MetricsController {

    static final String TEXT_FORMAT_004 = "text/plain; version=0.0.4; charset=utf-8";

    private final PrometheusMeterRegistry registry;

    public MetricsController(PrometheusMeterRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/metrics")
    @Operation(summary = "Prometheus scrape endpoint")
    public ResponseEntity<String> metrics() {
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_TYPE, TEXT_FORMAT_004)
            .body(registry.scrape());
    }
}
