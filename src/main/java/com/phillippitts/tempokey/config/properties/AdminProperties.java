package com.phillippitts.tempokey.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

import java.util.List;
import java.util.Set;

/**
 * Caller IDs granted administrative roles. Super users are implicitly admins.
 */
@ConfigurationProperties(prefix = "tempo.admin")
public class AdminProperties {

    private final Set<String> userIds;
    private final Set<String> superUserIds;

    @ConstructorBinding
    public AdminProperties(List<String> userIds, List<String> superUserIds) {
        this.userIds = userIds == null ? Set.of() : Set.copyOf(userIds);
        this.superUserIds = superUserIds == null ? Set.of() : Set.copyOf(superUserIds);
    }

    public Set<String> getUserIds() {
        return userIds;
    }

    public Set<String> getSuperUserIds() {
        return superUserIds;
    }
}
