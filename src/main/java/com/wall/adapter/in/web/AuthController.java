package com.wall.adapter.in.web;

import com.wall.application.port.in.LoginUseCase;
import com.wall.application.port.in.RegisterUserCommand;
import com.wall.application.port.in.RegisterUserUseCase;
import com.wall.domain.error.AuthError;
import com.wall.domain.model.AccessToken;
import com.wall.domain.model.Result;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
@Tag(name = "Auth", description = "Optional accounts; a bearer token sets the author name of new posts and comments")
public class AuthController {

    private final RegisterUserUseCase registerUserUseCase;
    private final LoginUseCase loginUseCase;

    public AuthController(RegisterUserUseCase registerUserUseCase, LoginUseCase loginUseCase) {
        this.registerUserUseCase = registerUserUseCase;
        this.loginUseCase = loginUseCase;
    }

    @PostMapping("/register")
    @Operation(summary = "Register an account", description = "Returns an access token for the new account")
    public ResponseEntity<?> register(@RequestBody RegisterRequest request) {
        Result<AccessToken, AuthError> result = registerUserUseCase.register(
            new RegisterUserCommand(request.email(), request.username(), request.password()));

        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(AuthTokenResponse.from(result.getOrThrow()))
            : toErrorResponse(result.errorOrNull());
    }

    @PostMapping("/login")
    @Operation(summary = "Log in", description = "Exchanges username and password for an access token")
    public ResponseEntity<?> login(@RequestBody LoginRequest request) {
        Result<AccessToken, AuthError> result = loginUseCase.login(request.username(), request.password());

        return result.isSuccess()
            ? ResponseEntity.ok(AuthTokenResponse.from(result.getOrThrow()))
            : toErrorResponse(result.errorOrNull());
    }

    private ResponseEntity<ErrorResponse> toErrorResponse(AuthError error) {
        HttpStatus status;
        if (error instanceof AuthError.UserAlreadyExists) {
            status = HttpStatus.CONFLICT;
        } else if (error instanceof AuthError.InvalidCredentials) {
            status = HttpStatus.UNAUTHORIZED;
        } else {
            status = HttpStatus.BAD_REQUEST;
        }
        return ResponseEntity.status(status).body(ErrorResponse.of(error.code(), error.message()));
    }

    public record RegisterRequest(String email, String username, String password) {}

    public record LoginRequest(String username, String password) {}

    public record AuthTokenResponse(String accessToken, String tokenType) {
        public static AuthTokenResponse from(AccessToken token) {
            return new AuthTokenResponse(token.value(), token.type());
        }
    }
}
