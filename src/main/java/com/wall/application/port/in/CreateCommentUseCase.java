package com.wall.application.port.in;

import com.wall.domain.error.CommentError;
import com.wall.domain.model.Comment;
import com.wall.domain.model.Result;

public interface CreateCommentUseCase {
    Result<Comment, CommentError> createComment(String postId, String body, String authorName);
}
