package com.wall.application.port.in;

import com.wall.domain.error.AuthError;
import com.wall.domain.model.AccessToken;
import com.wall.domain.model.Result;

public interface RegisterUserUseCase {
    Result<AccessToken, AuthError> register(RegisterUserCommand command);
}
