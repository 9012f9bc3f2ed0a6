package com.phillippitts.tempokey.service.health;

import com.phillippitts.tempokey.testutil.FakeDetectionAdapter;
import com.phillippitts.tempokey.testutil.TestProperties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;

class DetectionServiceHealthIndicatorTest {

    @Test
    void unconfiguredServiceReportsCustomStatus() {
        Health h = new DetectionServiceHealthIndicator(new FakeDetectionAdapter(), TestProperties.detection(""))
                .health();

        assertThat(h.getStatus().getCode()).isEqualTo("UNCONFIGURED");
    }

    @Test
    void reachableServiceIsUp() {
        Health h = new DetectionServiceHealthIndicator(new FakeDetectionAdapter(),
                TestProperties.detection("http://detect.test")).health();

        assertThat(h.getStatus()).isEqualTo(Status.UP);
        assertThat(h.getDetails()).containsEntry("baseUrl", "http://detect.test");
    }

    @Test
    void failingHealthCheckIsDownWithReason() {
        Health h = new DetectionServiceHealthIndicator(new FakeDetectionAdapter().down(true),
                TestProperties.detection("http://detect.test")).health();

        assertThat(h.getStatus()).isEqualTo(Status.DOWN);
        assertThat(h.getDetails()).containsKey("reason");
    }
}
