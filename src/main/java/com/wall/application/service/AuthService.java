package com.wall.application.service;

import com.wall.application.port.in.AuthenticateUseCase;
import com.wall.application.port.in.LoginUseCase;
import com.wall.application.port.in.RegisterUserCommand;
import com.wall.application.port.in.RegisterUserUseCase;
import com.wall.application.port.out.IdGenerator;
import com.wall.application.port.out.PasswordHasher;
import com.wall.application.port.out.TokenProvider;
import com.wall.application.port.out.UserRepository;
import com.wall.domain.error.AuthError;
import com.wall.domain.error.ValidationError;
import com.wall.domain.model.AccessToken;
import com.wall.domain.model.Result;
import com.wall.domain.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Accounts are optional: they only give posts and comments a stable author name.
 */
@Service
public class AuthService implements RegisterUserUseCase, LoginUseCase, AuthenticateUseCase {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final TokenProvider tokenProvider;
    private final IdGenerator idGenerator;

    public AuthService(
            UserRepository userRepository,
            PasswordHasher passwordHasher,
            TokenProvider tokenProvider,
            IdGenerator idGenerator) {
        this.userRepository = userRepository;
        this.passwordHasher = passwordHasher;
        this.tokenProvider = tokenProvider;
        this.idGenerator = idGenerator;
    }

    @Override
    public Result<AccessToken, AuthError> register(RegisterUserCommand command) {
        var email = User.normalizeEmail(command.email());
        if (email.isFailure()) {
            return rejected(email.errorOrNull());
        }
        var username = User.normalizeUsername(command.username());
        if (username.isFailure()) {
            return rejected(username.errorOrNull());
        }
        var password = User.checkPassword(command.password());
        if (password.isFailure()) {
            return rejected(password.errorOrNull());
        }

        if (userRepository.existsByUsernameOrEmail(username.getOrThrow(), email.getOrThrow())) {
            log.warn("Registration rejected, account exists: username={}", username.getOrThrow());
            return Result.failure(AuthError.UserAlreadyExists.INSTANCE);
        }

        User user = User.create(
            idGenerator.generate(),
            email.getOrThrow(),
            username.getOrThrow(),
            passwordHasher.hash(password.getOrThrow())
        );
        try {
            userRepository.save(user);
        } catch (DuplicateKeyException e) {
            // Lost a race with a concurrent registration of the same name
            log.warn("Registration rejected, account exists: username={}", user.username());
            return Result.failure(AuthError.UserAlreadyExists.INSTANCE);
        }

        log.info("User registered: userId={}, username={}", user.id(), user.username());
        return Result.success(AccessToken.bearer(tokenProvider.issue(user.id())));
    }

    @Override
    public Result<AccessToken, AuthError> login(String username, String password) {
        Optional<User> user = username == null
            ? Optional.empty()
            : userRepository.findByUsername(username.trim());

        if (user.isEmpty() || password == null || !passwordHasher.matches(password, user.get().passwordHash())) {
            log.warn("Login failed: username={}", username);
            return Result.failure(AuthError.InvalidCredentials.INSTANCE);
        }

        log.debug("Login succeeded: userId={}", user.get().id());
        return Result.success(AccessToken.bearer(tokenProvider.issue(user.get().id())));
    }

    @Override
    public Optional<User> authenticate(String accessToken) {
        return tokenProvider.verify(accessToken).flatMap(userRepository::findById);
    }

    private static Result<AccessToken, AuthError> rejected(ValidationError error) {
        log.warn("Registration validation failed: {}", error.message());
        return Result.failure(new AuthError.ValidationFailed(error));
    }
}
