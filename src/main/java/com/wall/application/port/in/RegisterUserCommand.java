package com.wall.application.port.in;

public record RegisterUserCommand(String email, String username, String password) {

    @Override
    public String toString() {
        return "RegisterUserCommand[email=" + email + ", username=" + username + "]";
    }
}
