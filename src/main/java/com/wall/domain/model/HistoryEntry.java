package com.wall.domain.model;

public record HistoryEntry(
    String id,
    String title
) {}
