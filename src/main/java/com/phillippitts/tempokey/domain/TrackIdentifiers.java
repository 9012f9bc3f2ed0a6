package com.phillippitts.tempokey.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Stable key set derived from a catalog track.
 */
public record TrackIdentifiers(
        String trackId,
        String isrc,
        String title,
        List<String> artists,
        String catalogPreviewUrl
) {
    public TrackIdentifiers {
        Objects.requireNonNull(trackId, "trackId");
        artists = artists == null ? List.of() : List.copyOf(artists);
    }

    /** Rebuilds identifiers from a stored record when the catalog no longer knows the track. */
    public static TrackIdentifiers fromRecord(CacheRecord r) {
        List<String> artists = r.artist() == null ? List.of()
                : Arrays.stream(r.artist().split(",")).map(String::trim).filter(a -> !a.isEmpty()).toList();
        return new TrackIdentifiers(r.trackId(), r.isrc(), r.title() == null ? "" : r.title(), artists, null);
    }

    public boolean hasIsrc() {
        return isrc != null && !isrc.isBlank();
    }

    /** Artists joined for display and storage. */
    public String artistLine() {
        return String.join(", ", artists);
    }

    /** Artists joined the way storefront text search expects them. */
    public String searchArtists() {
        return String.join(" ", artists);
    }
}
