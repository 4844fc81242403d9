package com.wall.domain.model;

import java.util.List;

public record Recipe(
    String id,
    String title,
    List<String> tags
) {
    public Recipe {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
