package com.wall.application.port.out;

import com.wall.domain.model.Comment;

import java.util.List;
import java.util.UUID;

public interface CommentRepository {
    void save(Comment comment);

    /**
     * Find comments of a post ordered by creation time ascending.
     */
    List<Comment> findByPostId(UUID postId);
}
