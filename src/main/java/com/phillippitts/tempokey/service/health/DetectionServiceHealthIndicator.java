package com.phillippitts.tempokey.service.health;

import com.phillippitts.tempokey.config.properties.DetectionProperties;
import com.phillippitts.tempokey.exception.DetectionUnavailableException;
import com.phillippitts.tempokey.service.detection.DetectionAdapter;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the remote estimation service.
 *
 * <ul>
 *   <li>UP: health check answered 2xx with an empty or "ok" body</li>
 *   <li>UNCONFIGURED: no base URL set; reads from the cache still work</li>
 *   <li>DOWN: check failed</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health and {@code GET /api/tempo/health}.
 */
@Component
public class DetectionServiceHealthIndicator implements HealthIndicator {

    private final DetectionAdapter detection;
    private final DetectionProperties props;

    public DetectionServiceHealthIndicator(DetectionAdapter detection, DetectionProperties props) {
        this.detection = detection;
        this.props = props;
    }

    @Override
    public Health health() {
        if (!props.isConfigured()) {
            return Health.status("UNCONFIGURED")
                    .withDetail("message", "tempo.detection.base-url not set")
                    .build();
        }
        try {
            detection.checkHealth();
            return Health.up()
                    .withDetail("message", "Estimation service reachable")
                    .withDetail("baseUrl", props.getBaseUrl())
                    .build();
        } catch (DetectionUnavailableException e) {
            return Health.down()
                    .withDetail("message", "Estimation service unavailable")
                    .withDetail("baseUrl", props.getBaseUrl())
                    .withDetail("reason", e.getMessage())
                    .build();
        }
    }
}
