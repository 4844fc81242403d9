package com.wall.application.port.in;

import com.wall.domain.model.Comment;

import java.util.List;
import java.util.UUID;

public interface ListCommentsUseCase {

    /**
     * Returns the comments of a post, oldest first.
     *
     * @throws com.wall.infrastructure.exception.PostNotFoundException if the post does not exist
     */
    List<Comment> listComments(UUID postId);
}
