package com.soora.shop.security;

import com.soora.shop.domain.model.User.Role;

import java.util.Objects;

/**
 * Identity and role of the caller of the current request.
 * Controllers resolve it once via {@link SecurityUtils#currentCaller()} and pass it into
 * services explicitly.
 *
 * @author Soora Platform Team
 */
public final class CallerContext {

    private final String userId;
    private final Role role;

    public CallerContext(String userId, Role role) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.role = Objects.requireNonNull(role, "role");
    }

    public static CallerContext customer(String userId) {
        return new CallerContext(userId, Role.CUSTOMER);
    }

    public String getUserId() {
        return userId;
    }

    public Role getRole() {
        return role;
    }

    @Override
    public String toString() {
        return "CallerContext{userId=" + userId + ", role=" + role + "}";
    }
}
