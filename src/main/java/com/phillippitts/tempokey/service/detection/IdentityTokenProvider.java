package com.phillippitts.tempokey.service.detection;

import java.util.Optional;

/**
 * Supplies the bearer credential presented to the estimation service.
 */
public interface IdentityTokenProvider {

    /** @return the current token, or empty to send no Authorization header */
    Optional<String> currentToken();
}
