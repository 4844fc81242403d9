package com.wall.adapter.out.persistence;

import com.wall.application.port.out.CommentRepository;
import com.wall.domain.model.Comment;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

@Repository
public class JdbcCommentRepository implements CommentRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<Comment> ROW_MAPPER = (rs, rowNum) -> new Comment(
        rs.getObject("id", UUID.class),
        rs.getObject("post_id", UUID.class),
        rs.getString("body"),
        rs.getString("author_name"),
        rs.getTimestamp("created_at").toInstant()
    );

    public JdbcCommentRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(Comment comment) {
        jdbc.update("""
            INSERT INTO comments (id, post_id, body, author_name, created_at)
            VALUES (?, ?, ?, ?, ?)
            """,
            comment.id(),
            comment.postId(),
            comment.body(),
            comment.authorName(),
            Timestamp.from(comment.createdAt())
        );
    }

    @Override
    public List<Comment> findByPostId(UUID postId) {
        return jdbc.query("""
            SELECT id, post_id, body, author_name, created_at
            FROM comments
            WHERE post_id = ?
            ORDER BY created_at ASC, id ASC
            """,
            ROW_MAPPER,
            postId
        );
    }
}
