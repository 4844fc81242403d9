package com.wall.adapter.in.web;

import com.wall.application.port.in.CreatePostCommand;
import com.wall.application.port.in.CreatePostUseCase;
import com.wall.application.port.in.ListPostsUseCase;
import com.wall.domain.error.PostError;
import com.wall.domain.error.ValidationError;
import com.wall.domain.model.FeedPage;
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
@RequestMapping("/posts")
@Tag(name = "Posts", description = "Wall posts and the feed")
public class PostController {

    private final CreatePostUseCase createPostUseCase;
    private final ListPostsUseCase listPostsUseCase;

    public PostController(CreatePostUseCase createPostUseCase, ListPostsUseCase listPostsUseCase) {
        this.createPostUseCase = createPostUseCase;
        this.listPostsUseCase = listPostsUseCase;
    }

    @PostMapping
    @Operation(summary = "Create a post", description = "Text posts need a body, link posts a link_url and photo posts an image_url")
    public ResponseEntity<?> createPost(@RequestBody CreatePostRequest request) {
        Result<Post, PostError> result = createPostUseCase.createPost(new CreatePostCommand(
            request.type(),
            request.title(),
            request.body(),
            request.linkUrl(),
            request.imageUrl(),
            authorName(request.authorName())
        ));

        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(PostResponse.from(result.getOrThrow()))
            : toErrorResponse(result.errorOrNull().code(), result.errorOrNull().message());
    }

    @GetMapping
    @Operation(summary = "List posts", description = "Returns the feed newest first; follow next_cursor for older posts")
    public ResponseEntity<?> listPosts(
            @Parameter(description = "Number of posts to return (clamped to the configured maximum)")
            @RequestParam(required = false) Integer limit,
            @Parameter(description = "Pagination cursor from the previous page")
            @RequestParam(required = false) String cursor) {

        Result<FeedPage, ValidationError> result = listPostsUseCase.listPosts(limit, cursor);
        return result.isSuccess()
            ? ResponseEntity.ok(FeedResponse.from(result.getOrThrow()))
            : toErrorResponse(result.errorOrNull().code(), result.errorOrNull().message());
    }

    /**
     * A signed-in user always posts under their username.
     */
    private static String authorName(String requested) {
        return RequestContext.getUser().map(User::username).orElse(requested);
    }

    private ResponseEntity<ErrorResponse> toErrorResponse(String code, String message) {
        return ResponseEntity.badRequest().body(ErrorResponse.of(code, message));
    }

    public record CreatePostRequest(
        String type,
        String title,
        String body,
        String linkUrl,
        String imageUrl,
        String authorName
    ) {}

    public record PostResponse(
        UUID id,
        Instant createdAt,
        String type,
        String title,
        String body,
        String linkUrl,
        String imageUrl,
        String authorName,
        int commentCount
    ) {
        public static PostResponse from(Post post) {
            return new PostResponse(
                post.id(),
                post.createdAt(),
                post.type().wireName(),
                post.title(),
                post.body(),
                post.linkUrl(),
                post.imageUrl(),
                post.authorName(),
                post.commentCount()
            );
        }
    }

    public record FeedResponse(
        List<PostResponse> items,
        String nextCursor
    ) {
        public static FeedResponse from(FeedPage page) {
            return new FeedResponse(page.items().stream().map(PostResponse::from).toList(), page.nextCursor());
        }
    }
}
