package com.phillippitts.tempokey.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void tempoKeyExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        TempoKeyException ex = new TempoKeyException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void invalidRequestExceptionShouldIncludeField() {
        InvalidRequestException ex = new InvalidRequestException("skip", "skip must be a list of integers");

        assertThat(ex.getField()).isEqualTo("skip");
        assertThat(ex).isInstanceOf(TempoKeyException.class);
    }

    @Test
    void trackNotFoundExceptionShouldIncludeTrackId() {
        TrackNotFoundException ex = new TrackNotFoundException("trk-42");

        assertThat(ex.getMessage()).contains("trk-42");
        assertThat(ex.getTrackId()).isEqualTo("trk-42");
    }

    @Test
    void providerUnavailableExceptionShouldNameProvider() {
        ProviderUnavailableException ex = new ProviderUnavailableException("deezer", "HTTP 500");

        assertThat(ex.getMessage()).contains("HTTP 500").contains("deezer");
        assertThat(ex.getProvider()).isEqualTo("deezer");
    }

    @Test
    void detectionUnavailableExceptionDefaultsToRetryable() {
        DetectionUnavailableException ex = new DetectionUnavailableException("connection refused");

        assertThat(ex.isRetryable()).isTrue();
        assertThat(ex.getStatusCode()).isZero();
    }

    @Test
    void permissionDeniedExceptionShouldNameRole() {
        PermissionDeniedException ex = new PermissionDeniedException("invalidate", "ADMIN");

        assertThat(ex.getMessage()).contains("invalidate").contains("ADMIN");
        assertThat(ex.getRequiredRole()).isEqualTo("ADMIN");
    }
}
