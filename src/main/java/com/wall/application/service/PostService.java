package com.wall.application.service;

import com.wall.application.port.in.CreatePostCommand;
import com.wall.application.port.in.CreatePostUseCase;
import com.wall.application.port.out.IdGenerator;
import com.wall.application.port.out.MetricsPort;
import com.wall.application.port.out.PostRepository;
import com.wall.domain.error.PostError;
import com.wall.domain.model.Post;
import com.wall.domain.model.PostType;
import com.wall.domain.model.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;

@Service
public class PostService implements CreatePostUseCase {

    private static final Logger log = LoggerFactory.getLogger(PostService.class);

    private final PostRepository postRepository;
    private final FeedInvalidator feedInvalidator;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;
    private final TransactionTemplate transactionTemplate;

    public PostService(
            PostRepository postRepository,
            FeedInvalidator feedInvalidator,
            IdGenerator idGenerator,
            MetricsPort metrics,
            PlatformTransactionManager transactionManager) {
        this.postRepository = postRepository;
        this.feedInvalidator = feedInvalidator;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * The write timer spans the commit, and the created counter only moves once the commit went through.
     */
    @Override
    public Result<Post, PostError> createPost(CreatePostCommand command) {
        return metrics.recordWriteDuration("create_post", () -> {
            Result<Post, PostError> result = transactionTemplate.execute(status -> doCreatePost(command));
            if (result.isSuccess()) {
                Post post = result.getOrThrow();
                metrics.incrementPostsCreated(post.type());
                log.info("Post created successfully: postId={}, type={}, author={}",
                    post.id(), post.type().wireName(), post.authorName());
            }
            return result;
        });
    }

    private Result<Post, PostError> doCreatePost(CreatePostCommand command) {
        log.debug("Creating post: type={}, titleLength={}",
            command.type(), command.title() != null ? command.title().length() : 0);

        var typeResult = PostType.parse(command.type()).<PostError>mapError(PostError.ValidationFailed::new);
        if (typeResult.isFailure()) {
            log.warn("Post validation failed: {}", typeResult.errorOrNull().message());
            return Result.failure(typeResult.errorOrNull());
        }

        UUID postId = idGenerator.generate();
        var postResult = Post.create(
            postId,
            typeResult.getOrThrow(),
            command.title(),
            command.body(),
            command.linkUrl(),
            command.imageUrl(),
            command.authorName()
        );
        if (postResult.isFailure()) {
            log.warn("Post validation failed: {}", postResult.errorOrNull().message());
            return Result.failure(new PostError.ValidationFailed(postResult.errorOrNull()));
        }

        Post post = postResult.getOrThrow();
        postRepository.save(post);
        log.debug("Post saved to database: postId={}", postId);

        // A new post lands at the head of the feed and shifts every cached page
        feedInvalidator.invalidateAfterCommit("post_created");

        return Result.success(post);
    }
}
