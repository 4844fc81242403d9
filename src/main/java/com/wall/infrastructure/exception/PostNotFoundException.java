package com.wall.infrastructure.exception;

import java.util.UUID;

public class PostNotFoundException extends BusinessException {

    public PostNotFoundException(UUID postId) {
        super("POST_NOT_FOUND", "Post not found: " + postId);
    }
}
