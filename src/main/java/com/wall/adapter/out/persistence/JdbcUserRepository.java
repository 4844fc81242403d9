package com.wall.adapter.out.persistence;

import com.wall.application.port.out.UserRepository;
import com.wall.domain.model.User;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcUserRepository implements UserRepository {

    private static final String COLUMNS = "id, email, username, password_hash, created_at";

    private final JdbcTemplate jdbc;

    private static final RowMapper<User> ROW_MAPPER = (rs, rowNum) -> new User(
        rs.getObject("id", UUID.class),
        rs.getString("email"),
        rs.getString("username"),
        rs.getString("password_hash"),
        rs.getTimestamp("created_at").toInstant()
    );

    public JdbcUserRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(User user) {
        jdbc.update(
            "INSERT INTO users (id, email, username, password_hash, created_at) VALUES (?, ?, ?, ?, ?)",
            user.id(),
            user.email(),
            user.username(),
            user.passwordHash(),
            Timestamp.from(user.createdAt())
        );
    }

    @Override
    public Optional<User> findById(UUID id) {
        return jdbc.query("SELECT %s FROM users WHERE id = ?".formatted(COLUMNS), ROW_MAPPER, id)
            .stream()
            .findFirst();
    }

    @Override
    public Optional<User> findByUsername(String username) {
        return jdbc.query("SELECT %s FROM users WHERE username = ?".formatted(COLUMNS), ROW_MAPPER, username)
            .stream()
            .findFirst();
    }

    @Override
    public boolean existsByUsernameOrEmail(String username, String email) {
        Boolean exists = jdbc.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM users WHERE username = ? OR email = ?)",
            Boolean.class,
            username,
            email
        );
        return Boolean.TRUE.equals(exists);
    }
}
