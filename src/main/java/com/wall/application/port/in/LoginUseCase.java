package com.wall.application.port.in;

import com.wall.domain.error.AuthError;
import com.wall.domain.model.AccessToken;
import com.wall.domain.model.Result;

public interface LoginUseCase {
    Result<AccessToken, AuthError> login(String username, String password);
}
