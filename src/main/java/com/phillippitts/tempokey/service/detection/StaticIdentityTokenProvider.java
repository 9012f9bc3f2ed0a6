package com.phillippitts.tempokey.service.detection;

import com.phillippitts.tempokey.config.properties.DetectionProperties;
import org.springframework.stereotype.Component;

import java.util.Optional;

/** Token taken verbatim from {@code tempo.detection.bearer-token}. */
@Component
class StaticIdentityTokenProvider implements IdentityTokenProvider {

    private final String token;

    StaticIdentityTokenProvider(DetectionProperties props) {
        this.token = props.getBearerToken();
    }

    @Override
    public Optional<String> currentToken() {
        return token == null || token.isBlank() ? Optional.empty() : Optional.of(token);
    }
}
