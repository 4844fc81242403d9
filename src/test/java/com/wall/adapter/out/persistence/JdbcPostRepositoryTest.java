package com.wall.adapter.out.persistence;

import com.wall.domain.model.FeedCursor;
import com.wall.domain.model.Post;
import com.wall.domain.model.PostType;
import com.wall.infrastructure.id.UUIDv7Generator;
import com.wall.integration.base.FullStackTestBase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@EnabledIf("isDockerAvailable")
class JdbcPostRepositoryTest extends FullStackTestBase {

    @Autowired
    private JdbcPostRepository postRepository;

    private final UUIDv7Generator idGenerator = new UUIDv7Generator();

    private Post post(String title, Instant createdAt) {
        return new Post(idGenerator.generate(), PostType.TEXT, title, "body", null, null, "Guest", createdAt, 0);
    }

    @Test
    void shouldSaveAndFindPost() {
        // Given
        Post post = Post.create(idGenerator.generate(), PostType.PHOTO, "Sunset", null, null,
            "https://example.com/sunset.jpg", "Ada").getOrThrow();

        // When
        postRepository.save(post);
        List<Post> found = postRepository.findPage(null, 10);

        // Then
        assertEquals(List.of(post), found);
        assertTrue(postRepository.exists(post.id()));
        assertFalse(postRepository.exists(UUID.randomUUID()));
    }

    @Test
    void shouldReturnNewestFirst() {
        // Given
        Instant base = Instant.parse("2024-06-01T12:00:00Z");
        Post oldest = post("oldest", base);
        Post middle = post("middle", base.plusSeconds(60));
        Post newest = post("newest", base.plusSeconds(120));
        postRepository.save(middle);
        postRepository.save(newest);
        postRepository.save(oldest);

        // When
        List<Post> page = postRepository.findPage(null, 10);

        // Then
        assertEquals(List.of(newest.id(), middle.id(), oldest.id()), page.stream().map(Post::id).toList());
    }

    @Test
    void shouldContinueStrictlyAfterCursor() {
        // Given
        Instant base = Instant.parse("2024-06-01T12:00:00Z");
        for (int i = 0; i < 5; i++) {
            postRepository.save(post("post " + i, base.plusSeconds(i)));
        }
        List<Post> first = postRepository.findPage(null, 2);

        // When
        List<Post> second = postRepository.findPage(FeedCursor.after(first.get(1)), 2);

        // Then
        assertEquals(List.of("post 4", "post 3"), first.stream().map(Post::title).toList());
        assertEquals(List.of("post 2", "post 1"), second.stream().map(Post::title).toList());
    }

    @Test
    void shouldBreakTimestampTiesById() {
        // Given
        Instant sameInstant = Instant.parse("2024-06-01T12:00:00Z");
        Post a = post("a", sameInstant);
        Post b = post("b", sameInstant);
        Post c = post("c", sameInstant);
        postRepository.save(a);
        postRepository.save(b);
        postRepository.save(c);

        // When
        List<Post> first = postRepository.findPage(null, 1);
        List<Post> rest = postRepository.findPage(FeedCursor.after(first.get(0)), 10);

        // Then
        assertEquals(c.id(), first.get(0).id());
        assertEquals(List.of(b.id(), a.id()), rest.stream().map(Post::id).toList());
    }

    @Test
    void shouldIncrementCommentCountOnlyForExistingPost() {
        // Given
        Post post = post("counted", Instant.now());
        postRepository.save(post);

        // When
        boolean updated = postRepository.incrementCommentCount(post.id());
        boolean missing = postRepository.incrementCommentCount(UUID.randomUUID());

        // Then
        assertTrue(updated);
        assertFalse(missing);
        assertEquals(1, commentCountOf(post.id()));
    }

    @Test
    void shouldRejectUnknownTypeAtSchemaLevel() {
        assertThrows(DataIntegrityViolationException.class, () -> jdbcTemplate.update(
            "INSERT INTO posts (id, type, title, author_name, created_at) VALUES (?, 'video', 't', 'Guest', now())",
            UUID.randomUUID()));
    }
}
