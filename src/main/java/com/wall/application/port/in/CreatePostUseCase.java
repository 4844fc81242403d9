package com.wall.application.port.in;

import com.wall.domain.error.PostError;
import com.wall.domain.model.Post;
import com.wall.domain.model.Result;

public interface CreatePostUseCase {
    Result<Post, PostError> createPost(CreatePostCommand command);
}
