package com.wall.domain.model;

public record Place(
    String id,
    String name,
    String city
) {}
