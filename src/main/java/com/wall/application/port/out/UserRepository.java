package com.wall.application.port.out;

import com.wall.domain.model.User;

import java.util.Optional;
import java.util.UUID;

public interface UserRepository {

    /**
     * @throws org.springframework.dao.DuplicateKeyException if the username or email is taken
     */
    void save(User user);

    Optional<User> findById(UUID id);

    Optional<User> findByUsername(String username);

    boolean existsByUsernameOrEmail(String username, String email);
}
