package com.wall.application.port.out;

import com.wall.domain.model.FeedCursor;
import com.wall.domain.model.Post;

import java.util.List;
import java.util.UUID;

public interface PostRepository {
    void save(Post post);
    boolean exists(UUID id);

    /**
     * Find posts ordered by (createdAt, id) descending.
     * With a cursor, only posts strictly older than the cursor position are returned.
     */
    List<Post> findPage(FeedCursor cursor, int limit);

    /**
     * Bumps the stored comment count of a post.
     *
     * @return false if no such post exists, in which case nothing was changed
     */
    boolean incrementCommentCount(UUID postId);
}
