package com.wall.integration.e2e;

import com.wall.integration.base.FullStackTestBase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests that drive the public API the way clients and the metrics scraper do.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@EnabledIf("isDockerAvailable")
@DisplayName("Wall Journey E2E Tests")
@SuppressWarnings({"unchecked", "rawtypes"})
class WallJourneyIntegrationTest extends FullStackTestBase {

    @Autowired
    private TestRestTemplate restTemplate;

    private static HttpEntity<Map<String, Object>> json(Map<String, Object> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    private String scrape() {
        ResponseEntity<String> response = restTemplate.getForEntity("/metrics", String.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        return response.getBody();
    }

    private static double sample(String scrape, String metric, String labelFragment) {
        return scrape.lines()
            .filter(line -> line.startsWith(metric + "{") && line.contains(labelFragment))
            .mapToDouble(line -> Double.parseDouble(line.substring(line.lastIndexOf(' ') + 1)))
            .sum();
    }

    @Test
    @DisplayName("100 concurrent creates are all stored and all counted")
    void concurrentCreatesAreCountedExactly() throws Exception {
        // Given
        String before = scrape();
        ExecutorService pool = Executors.newFixedThreadPool(20);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<HttpStatusCode>> results = new ArrayList<>();

        // When
        try {
            for (int i = 0; i < 100; i++) {
                Map<String, Object> body = Map.of("type", "text", "title", "burst " + i, "body", "load");
                results.add(pool.submit(() -> {
                    start.await();
                    return restTemplate.postForEntity("/posts", json(body), Map.class).getStatusCode();
                }));
            }
            start.countDown();
            for (Future<HttpStatusCode> result : results) {
                assertEquals(HttpStatus.CREATED, result.get(30, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        // Then
        assertEquals(100, countRows("posts"));
        String after = scrape();
        assertEquals(100.0, sample(after, "posts_created_total", "type=\"text\"")
            - sample(before, "posts_created_total", "type=\"text\""), after);
    }

    @Test
    @DisplayName("Post, read, comment and read again")
    void postCommentJourney() {
        // Step 1: an empty wall
        String before = scrape();
        Map<String, Object> empty = restTemplate.getForObject("/posts", Map.class);
        assertTrue(((List<?>) empty.get("items")).isEmpty());

        // Step 2: publish one post of each type
        restTemplate.postForEntity("/posts", json(Map.of("type", "text", "title", "Hi", "body", "hello")), Map.class);
        restTemplate.postForEntity("/posts",
            json(Map.of("type", "link", "title", "Read", "link_url", "https://example.com")), Map.class);
        ResponseEntity<Map> photo = restTemplate.postForEntity("/posts",
            json(Map.of("type", "photo", "title", "Look", "image_url", "https://example.com/p.jpg")), Map.class);
        String photoId = (String) photo.getBody().get("id");

        // Step 3: the newest post leads the feed
        Map<String, Object> page = restTemplate.getForObject("/posts", Map.class);
        List<Map<String, Object>> items = (List<Map<String, Object>>) page.get("items");
        assertEquals(3, items.size());
        assertEquals(photoId, items.get(0).get("id"));
        assertEquals(List.of("photo", "link", "text"), items.stream().map(i -> i.get("type")).toList());

        // Step 4: comment on the photo and see the count in the feed
        ResponseEntity<Map> comment = restTemplate.postForEntity("/posts/" + photoId + "/comments",
            json(Map.of("body", "Beautiful", "author_name", "Grace")), Map.class);
        assertEquals(HttpStatus.CREATED, comment.getStatusCode());

        Map<String, Object> refreshed = restTemplate.getForObject("/posts", Map.class);
        Map<String, Object> first = ((List<Map<String, Object>>) refreshed.get("items")).get(0);
        assertEquals(1, first.get("comment_count"));

        // Step 5: the scrape reflects all of it
        String after = scrape();
        assertEquals(1.0, sample(after, "posts_created_total", "type=\"photo\"")
            - sample(before, "posts_created_total", "type=\"photo\""));
        assertEquals(1.0, sample(after, "comments_created_total", "")
            - sample(before, "comments_created_total", ""));
        assertTrue(sample(after, "feed_cache_misses_total", "")
            - sample(before, "feed_cache_misses_total", "") >= 3.0, after);
    }

    @Test
    @DisplayName("Every response carries a request id and the app header")
    void responsesCarryCorrelationHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Request-Id", "journey-1");

        ResponseEntity<String> response = restTemplate.exchange(
            "/posts", HttpMethod.GET, new HttpEntity<>(headers), String.class);

        assertEquals("journey-1", response.getHeaders().getFirst("X-Request-Id"));
        assertEquals("wall-api", response.getHeaders().getFirst("X-App"));
    }
}
