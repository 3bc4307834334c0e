package com.soora.shop.security;

import com.soora.shop.domain.model.User.Role;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Utility class for reading the authenticated caller from the security context.
 *
 * @author Soora Platform Team
 */
public class SecurityUtils {

    /**
     * Get the currently authenticated user ID.
     *
     * @return User ID from authentication context, or null if not authenticated
     */
    public static String getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication != null && authentication.isAuthenticated()) {
            Object principal = authentication.getPrincipal();
            if (principal instanceof String) {
                return (String) principal;
            }
        }

        return null;
    }

    /**
     * Check if the current user has a specific role.
     *
     * @param role Role to check (without ROLE_ prefix)
     * @return true if user has the role, false otherwise
     */
    public static boolean hasRole(String role) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            return false;
        }

        String roleWithPrefix = role.startsWith("ROLE_") ? role : "ROLE_" + role;

        return authentication.getAuthorities().stream()
            .anyMatch(authority -> authority.getAuthority().equals(roleWithPrefix));
    }

    /**
     * Resolve the caller of the current request.
     *
     * @return Caller identity and role
     * @throws AccessDeniedException if the request is not authenticated
     */
    public static CallerContext currentCaller() {
        String userId = getCurrentUserId();

        if (userId == null) {
            throw new AccessDeniedException("User not authenticated");
        }

        Role role = hasRole(Role.ADMIN.name()) ? Role.ADMIN : Role.CUSTOMER;
        return new CallerContext(userId, role);
    }
}
