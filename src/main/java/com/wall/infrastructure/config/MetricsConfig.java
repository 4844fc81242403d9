package com.wall.infrastructure.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Owns the process-wide Prometheus registry scraped at {@code GET /metrics}.
 *
 * The registry is declared here rather than left to auto-configuration so that it exists under every
 * profile, including tests, and so the namespace filter is in place before the first meter registers.
 */
@Configuration
public class MetricsConfig {

    private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

    @Bean
    public PrometheusMeterRegistry prometheusMeterRegistry(AppProperties appProperties) {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        String namespace = appProperties.getMetrics().getNamespace();
        if (namespace != null && !namespace.isBlank()) {
            registry.config().meterFilter(namespaceFilter(namespace.trim()));
        }

        List<Tag> tags = appProperties.getMetrics().getTags().entrySet().stream()
            .map(e -> Tag.of(e.getKey(), e.getValue()))
            .toList();
        registry.config().commonTags(tags);

        log.info("Prometheus registry ready: namespace='{}', commonTags={}", namespace, tags);
        return registry;
    }

    static MeterFilter namespaceFilter(String namespace) {
        String prefix = namespace + ".";
        return new MeterFilter() {
            @Override
            public Meter.Id map(Meter.Id id) {
                return id.getName().startsWith(prefix) ? id : id.withName(prefix + id.getName());
            }
        };
    }
}
