package com.wall.adapter.out.persistence;

import com.wall.application.port.out.PostRepository;
import com.wall.domain.model.FeedCursor;
import com.wall.domain.model.Post;
import com.wall.domain.model.PostType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

@Repository
public class JdbcPostRepository implements PostRepository {

    private static final String COLUMNS =
        "id, type, title, body, link_url, image_url, author_name, created_at, comment_count";

    private final JdbcTemplate jdbc;

    private static final RowMapper<Post> ROW_MAPPER = (rs, rowNum) -> new Post(
        rs.getObject("id", UUID.class),
        PostType.fromTrusted(rs.getString("type")),
        rs.getString("title"),
        rs.getString("body"),
        rs.getString("link_url"),
        rs.getString("image_url"),
        rs.getString("author_name"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getInt("comment_count")
    );

    public JdbcPostRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(Post post) {
        jdbc.update("""
            INSERT INTO posts (id, type, title, body, link_url, image_url, author_name, created_at, comment_count)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            post.id(),
            post.type().wireName(),
            post.title(),
            post.body(),
            post.linkUrl(),
            post.imageUrl(),
            post.authorName(),
            Timestamp.from(post.createdAt()),
            post.commentCount()
        );
    }

    @Override
    public boolean exists(UUID id) {
        Boolean exists = jdbc.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM posts WHERE id = ?)",
            Boolean.class,
            id
        );
        return Boolean.TRUE.equals(exists);
    }

    @Override
    public List<Post> findPage(FeedCursor cursor, int limit) {
        if (cursor == null) {
            return jdbc.query("""
                SELECT %s
                FROM posts
                ORDER BY created_at DESC, id DESC
                LIMIT ?
                """.formatted(COLUMNS),
                ROW_MAPPER,
                limit
            );
        }
        return jdbc.query("""
            SELECT %s
            FROM posts
            WHERE (created_at, id) < (?, ?)
            ORDER BY created_at DESC, id DESC
            LIMIT ?
            """.formatted(COLUMNS),
            ROW_MAPPER,
            Timestamp.from(cursor.createdAt()),
            cursor.id(),
            limit
        );
    }

    @Override
    public boolean incrementCommentCount(UUID postId) {
        int updated = jdbc.update(
            "UPDATE posts SET comment_count = comment_count + 1 WHERE id = ?",
            postId
        );
        return updated > 0;
    }
}
