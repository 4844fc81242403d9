package com.wall.domain.model;

public record AccessToken(String value, String type) {

    public static AccessToken bearer(String value) {
        return new AccessToken(value, "bearer");
    }
}
