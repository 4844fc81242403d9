package com.wall.adapter.out.traffic;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.wall.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Synthetic client that keeps demo dashboards moving. It talks to the API over HTTP exactly like an
 * external client would: each tick probes health, reads a feed page and sometimes posts or comments.
 *
 * Failures are logged and the next tick carries on; a load generator must outlive the service restarts
 * it is meant to observe.
 */
@Component
@ConditionalOnProperty(name = "app.traffic.enabled", havingValue = "true")
public class TrafficGenerator {

    private static final Logger log = LoggerFactory.getLogger(TrafficGenerator.class);

    private static final List<Integer> PAGE_SIZES = List.of(5, 10, 20);
    private static final List<String> POST_TYPES = List.of("text", "link", "photo");

    private final RestClient restClient;
    private final AppProperties.Traffic settings;
    private final Random random;

    @Autowired
    public TrafficGenerator(RestClient.Builder restClientBuilder, AppProperties appProperties) {
        this(restClientBuilder, appProperties, new Random());
    }

    TrafficGenerator(RestClient.Builder restClientBuilder, AppProperties appProperties, Random random) {
        this.settings = appProperties.getTraffic();
        this.restClient = restClientBuilder.baseUrl(settings.getBaseUrl()).build();
        this.random = random;
    }

    @Scheduled(fixedDelayString = "${app.traffic.interval-ms:750}")
    public void tick() {
        try {
            restClient.get().uri("/healthz").retrieve().toBodilessEntity();
            restClient.get()
                .uri("/posts?limit={limit}", PAGE_SIZES.get(random.nextInt(PAGE_SIZES.size())))
                .retrieve()
                .toBodilessEntity();

            if (random.nextDouble() < settings.getPostProbability()) {
                createPost();
            }
            if (random.nextDouble() < settings.getCommentProbability()) {
                commentOnLatest();
            }
        } catch (RestClientException e) {
            log.warn("Traffic tick failed against {}: {}", settings.getBaseUrl(), e.getMessage());
        }
    }

    /**
     * Publishes a post of a random type with the payload that type requires.
     *
     * @return the id of the created post
     */
    String createPost() {
        String type = POST_TYPES.get(random.nextInt(POST_TYPES.size()));
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("type", type);
        payload.put("title", "Synthetic event " + Instant.now());
        payload.put("author_name", settings.getAuthorName());
        switch (type) {
            case "text" -> payload.put("body", "Shift review: workflow simulated by traffic generator.");
            case "link" -> payload.put("link_url", "https://example.com/devops-portfolio");
            default -> payload.put("image_url", "https://picsum.photos/300");
        }

        CreatedPost created = restClient.post()
            .uri("/posts")
            .contentType(MediaType.APPLICATION_JSON)
            .body(payload)
            .retrieve()
            .body(CreatedPost.class);
        String id = created != null ? created.id() : null;
        log.debug("Synthetic post created: id={}, type={}", id, type);
        return id;
    }

    /**
     * Comments on the newest post, if there is one.
     *
     * @return whether a comment was sent
     */
    boolean commentOnLatest() {
        LatestPage latest = restClient.get()
            .uri("/posts?limit=1")
            .retrieve()
            .body(LatestPage.class);
        if (latest == null || latest.items() == null || latest.items().isEmpty()) {
            return false;
        }

        String postId = latest.items().get(0).id();
        restClient.post()
            .uri("/posts/{id}/comments", postId)
            .contentType(MediaType.APPLICATION_JSON)
            .body(Map.of(
                "body", "Automated engagement for observability tests.",
                "author_name", settings.getAuthorName()))
            .retrieve()
            .toBodilessEntity();
        log.debug("Synthetic comment sent: postId={}", postId);
        return true;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CreatedPost(@JsonProperty("id") String id) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LatestPage(@JsonProperty("items") List<CreatedPost> items) {}
}
