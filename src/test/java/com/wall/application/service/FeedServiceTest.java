package com.wall.application.service;

import com.wall.application.port.out.FeedCache;
import com.wall.application.port.out.FeedCache.FeedKey;
import com.wall.application.port.out.MetricsPort;
import com.wall.application.port.out.PostRepository;
import com.wall.domain.error.ValidationError;
import com.wall.domain.model.FeedCursor;
import com.wall.domain.model.FeedPage;
import com.wall.domain.model.Post;
import com.wall.domain.model.PostType;
import com.wall.infrastructure.config.AppProperties;
import com.wall.infrastructure.exception.FeedCacheException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for FeedService.
 * Tests pagination, cache-aside reads and degradation when the cache fails.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("FeedService")
class FeedServiceTest {

    @Mock
    private PostRepository postRepository;

    @Mock
    private FeedCache feedCache;

    @Mock
    private MetricsPort metrics;

    private AppProperties appProperties;
    private FeedService feedService;

    @BeforeEach
    void setUp() {
        lenient().when(metrics.recordFeedReadDuration(any()))
            .thenAnswer(invocation -> invocation.<Supplier<?>>getArgument(0).get());
        appProperties = new AppProperties();
        appProperties.getFeed().getCache().setTtl(Duration.ofSeconds(5));
        feedService = new FeedService(postRepository, feedCache, appProperties, metrics);
    }

    private static List<Post> posts(int count) {
        List<Post> posts = new ArrayList<>();
        Instant now = Instant.parse("2024-06-01T12:00:00Z");
        for (int i = 0; i < count; i++) {
            posts.add(new Post(UUID.randomUUID(), PostType.TEXT, "Post " + i, "body", null, null, "Guest",
                now.minusSeconds(i), 0));
        }
        return posts;
    }

    @Nested
    @DisplayName("cache hit")
    class CacheHitTests {

        @Test
        @DisplayName("Should serve a cached page without touching the database")
        void shouldServeFromCache() {
            // Given
            FeedKey key = new FeedKey(0, 10, null);
            FeedPage cached = FeedPage.of(posts(2), null);
            when(feedCache.keyFor(10, null)).thenReturn(key);
            when(feedCache.get(key)).thenReturn(Optional.of(cached));

            // When
            var result = feedService.listPosts(null, null);

            // Then
            assertSame(cached, result.getOrThrow());
            verify(metrics).incrementFeedRequests();
            verify(metrics).incrementFeedCacheHits();
            verify(metrics, never()).incrementFeedCacheMisses();
            verifyNoInteractions(postRepository);
            verify(feedCache, never()).put(any(), any(), any());
        }
    }

    @Nested
    @DisplayName("cache miss")
    class CacheMissTests {

        @Test
        @DisplayName("Should read limit + 1 rows and hand out a cursor when more posts exist")
        void shouldComputeNextCursor() {
            // Given
            List<Post> rows = posts(4);
            FeedKey key = new FeedKey(3, 3, null);
            when(feedCache.keyFor(3, null)).thenReturn(key);
            when(feedCache.get(key)).thenReturn(Optional.empty());
            when(postRepository.findPage(null, 4)).thenReturn(rows);

            // When
            FeedPage page = feedService.listPosts(3, null).getOrThrow();

            // Then
            assertEquals(rows.subList(0, 3), page.items());
            assertEquals(FeedCursor.after(rows.get(2)).encode(), page.nextCursor());
            verify(metrics).incrementFeedCacheMisses();
            verify(feedCache).put(key, page, Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("Should return no cursor on the last page")
        void shouldEndPagination() {
            // Given
            List<Post> rows = posts(2);
            when(feedCache.keyFor(10, null)).thenReturn(new FeedKey(0, 10, null));
            when(postRepository.findPage(null, 11)).thenReturn(rows);

            // When
            FeedPage page = feedService.listPosts(null, null).getOrThrow();

            // Then
            assertEquals(2, page.items().size());
            assertNull(page.nextCursor());
            assertFalse(page.hasMore());
        }

        @Test
        @DisplayName("Should pass the decoded cursor to the repository")
        void shouldFollowCursor() {
            // Given
            FeedCursor position = new FeedCursor(Instant.parse("2024-06-01T11:00:00Z"), UUID.randomUUID());
            String cursor = position.encode();
            when(feedCache.keyFor(5, cursor)).thenReturn(new FeedKey(0, 5, cursor));
            when(postRepository.findPage(position, 6)).thenReturn(List.of());

            // When
            FeedPage page = feedService.listPosts(5, cursor).getOrThrow();

            // Then
            assertTrue(page.items().isEmpty());
            verify(postRepository).findPage(position, 6);
        }
    }

    @Nested
    @DisplayName("limit and cursor handling")
    class ParameterTests {

        @Test
        @DisplayName("Should clamp oversized limits to the configured maximum")
        void shouldClampLargeLimit() {
            // Given
            when(feedCache.keyFor(50, null)).thenReturn(new FeedKey(0, 50, null));

            // When
            feedService.listPosts(1000, null);

            // Then
            verify(postRepository).findPage(null, 51);
        }

        @Test
        @DisplayName("Should cap the default page size when the maximum is lower")
        void shouldClampDefaultToMaximum() {
            // Given
            appProperties.getFeed().setDefaultPageSize(10);
            appProperties.getFeed().setMaxPageSize(5);
            List<Post> rows = posts(12);
            when(feedCache.keyFor(5, null)).thenReturn(new FeedKey(0, 5, null));
            when(postRepository.findPage(null, 6)).thenReturn(rows.subList(0, 6));

            // When
            FeedPage page = feedService.listPosts(null, null).getOrThrow();

            // Then
            assertEquals(5, page.items().size());
            assertNotNull(page.nextCursor());
            verify(postRepository).findPage(null, 6);
        }

        @Test
        @DisplayName("Should raise non-positive limits to one")
        void shouldClampSmallLimit() {
            // Given
            when(feedCache.keyFor(1, null)).thenReturn(new FeedKey(0, 1, null));

            // When
            feedService.listPosts(-5, null);

            // Then
            verify(postRepository).findPage(null, 2);
        }

        @Test
        @DisplayName("Should treat a blank cursor as the first page")
        void shouldIgnoreBlankCursor() {
            // Given
            when(feedCache.keyFor(10, null)).thenReturn(new FeedKey(0, 10, null));

            // When
            feedService.listPosts(null, "   ");

            // Then
            verify(postRepository).findPage(null, 11);
        }

        @Test
        @DisplayName("Should reject an invalid cursor before counting or caching")
        void shouldRejectInvalidCursor() {
            // When
            var result = feedService.listPosts(10, "definitely-not-a-cursor");

            // Then
            assertInstanceOf(ValidationError.InvalidCursor.class, result.errorOrNull());
            verifyNoInteractions(feedCache, postRepository, metrics);
        }
    }

    @Nested
    @DisplayName("cache failures")
    class CacheFailureTests {

        @Test
        @DisplayName("Should fall back to the database when the cache is unreachable")
        void shouldServeFromDatabaseWhenKeyFails() {
            // Given
            List<Post> rows = posts(1);
            when(feedCache.keyFor(10, null)).thenThrow(new FeedCacheException("down", new RuntimeException()));
            when(postRepository.findPage(null, 11)).thenReturn(rows);

            // When
            var result = feedService.listPosts(null, null);

            // Then
            assertTrue(result.isSuccess());
            assertEquals(rows, result.getOrThrow().items());
            verify(metrics).incrementFeedCacheErrors("key");
            verify(metrics).incrementFeedCacheMisses();
            verify(feedCache, never()).get(any());
            verify(feedCache, never()).put(any(), any(), any());
        }

        @Test
        @DisplayName("Should treat a failed read as a miss")
        void shouldTreatFailedGetAsMiss() {
            // Given
            FeedKey key = new FeedKey(0, 10, null);
            when(feedCache.keyFor(10, null)).thenReturn(key);
            when(feedCache.get(key)).thenThrow(new FeedCacheException("timeout", new RuntimeException()));
            when(postRepository.findPage(null, 11)).thenReturn(posts(1));

            // When
            var result = feedService.listPosts(null, null);

            // Then
            assertTrue(result.isSuccess());
            verify(metrics).incrementFeedCacheErrors("get");
            verify(metrics).incrementFeedCacheMisses();
        }

        @Test
        @DisplayName("Should still answer when storing the page fails")
        void shouldSwallowFailedPut() {
            // Given
            FeedKey key = new FeedKey(0, 10, null);
            when(feedCache.keyFor(10, null)).thenReturn(key);
            when(feedCache.get(key)).thenReturn(Optional.empty());
            when(postRepository.findPage(null, 11)).thenReturn(posts(1));
            doThrow(new FeedCacheException("read-only replica", new RuntimeException()))
                .when(feedCache).put(eq(key), any(), any());

            // When
            var result = feedService.listPosts(null, null);

            // Then
            assertEquals(1, result.getOrThrow().items().size());
            verify(metrics).incrementFeedCacheErrors("put");
        }
    }
}
