package com.wall.infrastructure.context;

import com.wall.domain.model.User;
import org.slf4j.MDC;

import java.util.Optional;

public final class RequestContext {

    private static final String REQUEST_ID_KEY = "requestId";
    private static final String USER_ID_KEY = "userId";

    private static final ThreadLocal<String> currentRequestId = new ThreadLocal<>();
    private static final ThreadLocal<User> currentUser = new ThreadLocal<>();

    private RequestContext() {}

    public static void set(String requestId) {
        currentRequestId.set(requestId);
        MDC.put(REQUEST_ID_KEY, requestId);
    }

    public static String getRequestId() {
        return currentRequestId.get();
    }

    public static void setUser(User user) {
        currentUser.set(user);
        MDC.put(USER_ID_KEY, user.id().toString());
    }

    /**
     * The signed-in user, or empty for anonymous requests.
     */
    public static Optional<User> getUser() {
        return Optional.ofNullable(currentUser.get());
    }

    public static void clearUser() {
        currentUser.remove();
        MDC.remove(USER_ID_KEY);
    }

    public static void clear() {
        currentRequestId.remove();
        MDC.remove(REQUEST_ID_KEY);
        clearUser();
    }
}
