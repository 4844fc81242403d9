package com.wall.application.port.in;

/**
 * Raw post input as received from a client. Validation happens in the domain.
 */
public record CreatePostCommand(
    String type,
    String title,
    String body,
    String linkUrl,
    String imageUrl,
    String authorName
) {}
