package com.phillippitts.tempokey.service.security;

import com.phillippitts.tempokey.exception.PermissionDeniedException;

import java.util.EnumSet;
import java.util.Set;

/**
 * Identity and roles of the caller, passed explicitly into every privileged operation.
 *
 * @param userId caller ID, or null when anonymous
 * @param roles  granted roles
 */
public record CallerContext(String userId, Set<Role> roles) {

    public CallerContext {
        roles = roles == null || roles.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(roles));
    }

    public static CallerContext anonymous() {
        return new CallerContext(null, Set.of());
    }

    public static CallerContext of(String userId, Role... roles) {
        return new CallerContext(userId, roles.length == 0 ? Set.of() : EnumSet.of(roles[0], roles));
    }

    public boolean has(Role role) {
        return roles.contains(role) || (role == Role.ADMIN && roles.contains(Role.SUPER_ADMIN));
    }

    /**
     * @throws PermissionDeniedException when the caller lacks {@code role}
     */
    public void require(Role role, String operation) {
        if (!has(role)) {
            throw new PermissionDeniedException(operation, role.name());
        }
    }

    /** Name recorded as reviewer on audit fields. */
    public String auditName() {
        return userId == null ? "anonymous" : userId;
    }
}
