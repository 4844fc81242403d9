package com.wall.adapter.in.web;

import com.wall.application.port.in.CreateCommentUseCase;
import com.wall.application.port.in.ListCommentsUseCase;
import com.wall.domain.error.CommentError;
import com.wall.domain.model.Comment;
import com.wall.domain.model.Post;
import com.wall.domain.model.Result;
import com.wall.domain.model.User;
import com.wall.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/posts/{postId}/comments")
@Tag(name = "Comments", description = "Comments on wall posts")
public class CommentController {

    private final CreateCommentUseCase createCommentUseCase;
    private final ListCommentsUseCase listCommentsUseCase;

    public CommentController(CreateCommentUseCase createCommentUseCase, ListCommentsUseCase listCommentsUseCase) {
        this.createCommentUseCase = createCommentUseCase;
        this.listCommentsUseCase = listCommentsUseCase;
    }

    @PostMapping
    @Operation(summary = "Comment on a post", description = "Fails with 404 when the post does not exist")
    public ResponseEntity<?> createComment(
            @Parameter(description = "Post ID") @PathVariable String postId,
            @RequestBody CreateCommentRequest request) {

        String authorName = RequestContext.getUser().map(User::username).orElse(request.authorName());
        Result<Comment, CommentError> result =
            createCommentUseCase.createComment(postId, request.body(), authorName);

        if (result.isSuccess()) {
            return ResponseEntity.status(HttpStatus.CREATED).body(CommentResponse.from(result.getOrThrow()));
        }
        CommentError error = result.errorOrNull();
        HttpStatus status = error instanceof CommentError.PostNotFound ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(ErrorResponse.of(error.code(), error.message()));
    }

    @GetMapping
    @Operation(summary = "List comments", description = "Returns all comments of a post, oldest first")
    public ResponseEntity<?> listComments(@Parameter(description = "Post ID") @PathVariable String postId) {
        var postIdResult = Post.parseId(postId);
        if (postIdResult.isFailure()) {
            var error = postIdResult.errorOrNull();
            return ResponseEntity.badRequest().body(ErrorResponse.of(error.code(), error.message()));
        }

        List<CommentResponse> comments = listCommentsUseCase.listComments(postIdResult.getOrThrow()).stream()
            .map(CommentResponse::from)
            .toList();
        return ResponseEntity.ok(comments);
    }

    public record CreateCommentRequest(String body, String authorName) {}

    public record CommentResponse(
        UUID id,
        UUID postId,
        Instant createdAt,
        String body,
        String authorName
    ) {
        public static CommentResponse from(Comment comment) {
            return new CommentResponse(
                comment.id(), comment.postId(), comment.createdAt(), comment.body(), comment.authorName());
        }
    }
}
