package com.wall.domain.model;

import com.wall.domain.error.ValidationError.PostValidationError;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PostTypeTest {

    @Test
    void shouldParseWireNamesCaseInsensitively() {
        assertEquals(PostType.TEXT, PostType.parse("text").getOrThrow());
        assertEquals(PostType.LINK, PostType.parse(" LINK ").getOrThrow());
        assertEquals(PostType.PHOTO, PostType.parse("Photo").getOrThrow());
    }

    @Test
    void shouldRejectUnknownType() {
        var result = PostType.parse("video");

        assertEquals(new PostValidationError.InvalidType("video"), result.errorOrNull());
        assertEquals("POST_TYPE_INVALID", result.errorOrNull().code());
    }

    @Test
    void shouldRejectMissingType() {
        assertTrue(PostType.parse(null).isFailure());
        assertTrue(PostType.parse("").isFailure());
    }

    @Test
    void shouldMapStoredValues() {
        for (PostType type : PostType.values()) {
            assertEquals(type, PostType.fromTrusted(type.wireName()));
        }
    }

    @Test
    void shouldFailOnCorruptedStoredValue() {
        assertThrows(IllegalStateException.class, () -> PostType.fromTrusted("TEXT"));
    }
}
