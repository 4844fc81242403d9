package com.wall.application.service;

import com.wall.application.port.in.CreateCommentUseCase;
import com.wall.application.port.in.ListCommentsUseCase;
import com.wall.application.port.out.CommentRepository;
import com.wall.application.port.out.IdGenerator;
import com.wall.application.port.out.MetricsPort;
import com.wall.application.port.out.PostRepository;
import com.wall.domain.error.CommentError;
import com.wall.domain.model.Comment;
import com.wall.domain.model.Post;
import com.wall.domain.model.Result;
import com.wall.infrastructure.config.AppProperties;
import com.wall.infrastructure.exception.PostNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;

@Service
public class CommentService implements CreateCommentUseCase, ListCommentsUseCase {

    private static final Logger log = LoggerFactory.getLogger(CommentService.class);

    private final CommentRepository commentRepository;
    private final PostRepository postRepository;
    private final FeedInvalidator feedInvalidator;
    private final IdGenerator idGenerator;
    private final AppProperties appProperties;
    private final MetricsPort metrics;
    private final TransactionTemplate transactionTemplate;

    public CommentService(
            CommentRepository commentRepository,
            PostRepository postRepository,
            FeedInvalidator feedInvalidator,
            IdGenerator idGenerator,
            AppProperties appProperties,
            MetricsPort metrics,
            PlatformTransactionManager transactionManager) {
        this.commentRepository = commentRepository;
        this.postRepository = postRepository;
        this.feedInvalidator = feedInvalidator;
        this.idGenerator = idGenerator;
        this.appProperties = appProperties;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public Result<Comment, CommentError> createComment(String postId, String body, String authorName) {
        return metrics.recordWriteDuration("create_comment", () -> {
            Result<Comment, CommentError> result =
                transactionTemplate.execute(status -> doCreateComment(postId, body, authorName));
            if (result.isSuccess()) {
                Comment comment = result.getOrThrow();
                metrics.incrementCommentsCreated();
                log.info("Comment created successfully: commentId={}, postId={}, author={}",
                    comment.id(), comment.postId(), comment.authorName());
            }
            return result;
        });
    }

    private Result<Comment, CommentError> doCreateComment(String postIdValue, String body, String authorName) {
        var postIdResult = Post.parseId(postIdValue).<CommentError>mapError(CommentError.ValidationFailed::new);
        if (postIdResult.isFailure()) {
            log.warn("Comment rejected: {}", postIdResult.errorOrNull().message());
            return Result.failure(postIdResult.errorOrNull());
        }
        UUID postId = postIdResult.getOrThrow();

        var commentResult = Comment.create(idGenerator.generate(), postId, body, authorName);
        if (commentResult.isFailure()) {
            log.warn("Comment validation failed for post={}: {}", postId, commentResult.errorOrNull().message());
            return Result.failure(new CommentError.ValidationFailed(commentResult.errorOrNull()));
        }

        // The count update doubles as the existence check: zero rows means no post and nothing written
        if (!postRepository.incrementCommentCount(postId)) {
            log.warn("Comment rejected, post not found: {}", postId);
            return Result.failure(new CommentError.PostNotFound(postId));
        }

        Comment comment = commentResult.getOrThrow();
        commentRepository.save(comment);
        log.debug("Comment saved to database: commentId={}", comment.id());

        // Feed pages embed comment counts
        if (appProperties.getFeed().getCache().isInvalidateOnComment()) {
            feedInvalidator.invalidateAfterCommit("comment_created");
        }

        return Result.success(comment);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Comment> listComments(UUID postId) {
        if (!postRepository.exists(postId)) {
            throw new PostNotFoundException(postId);
        }
        List<Comment> comments = commentRepository.findByPostId(postId);
        log.debug("Returning {} comments for post={}", comments.size(), postId);
        return comments;
    }
}
