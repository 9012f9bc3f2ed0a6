package com.phillippitts.tempokey.service.security;

import com.phillippitts.tempokey.config.properties.AdminProperties;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Objects;

/**
 * Builds a {@link CallerContext} from the authenticated user ID (the {@code X-User-ID} header set by
 * the fronting auth layer) and the configured admin lists.
 */
@Component
public class CallerContextResolver {

    private final AdminProperties props;

    public CallerContextResolver(AdminProperties props) {
        this.props = Objects.requireNonNull(props);
    }

    public CallerContext resolve(String userId) {
        if (userId == null || userId.isBlank()) {
            return CallerContext.anonymous();
        }
        String id = userId.trim();
        EnumSet<Role> roles = EnumSet.noneOf(Role.class);
        if (props.getSuperUserIds().contains(id)) {
            roles.add(Role.SUPER_ADMIN);
            roles.add(Role.ADMIN);
        } else if (props.getUserIds().contains(id)) {
            roles.add(Role.ADMIN);
        }
        return new CallerContext(id, roles);
    }
}
