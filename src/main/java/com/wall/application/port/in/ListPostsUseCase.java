package com.wall.application.port.in;

import com.wall.domain.error.ValidationError;
import com.wall.domain.model.FeedPage;
import com.wall.domain.model.Result;

public interface ListPostsUseCase {

    /**
     * Returns a newest-first page of posts.
     *
     * @param limit  requested page size; null means the configured default, out-of-range values are clamped
     * @param cursor opaque cursor from a previous page, or null for the first page
     */
    Result<FeedPage, ValidationError> listPosts(Integer limit, String cursor);
}
