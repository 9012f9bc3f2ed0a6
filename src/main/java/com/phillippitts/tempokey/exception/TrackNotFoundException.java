package com.phillippitts.tempokey.exception;

/**
 * Thrown when a track is unknown to the catalog, or an administrative action targets a track
 * that has no cache record.
 */
public class TrackNotFoundException extends TempoKeyException {

    private final String trackId;

    public TrackNotFoundException(String trackId) {
        super("Track not found: " + trackId);
        this.trackId = trackId;
    }

    public String getTrackId() {
        return trackId;
    }
}
