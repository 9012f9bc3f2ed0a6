package com.phillippitts.tempokey.service.identity;

import com.phillippitts.tempokey.domain.CatalogTrack;
import com.phillippitts.tempokey.domain.TrackIdentifiers;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Derives the cache key set from a catalog track. Pure; performs no I/O.
 */
@Component
public class IdentifierExtractor {

    /**
     * @throws IllegalArgumentException if the track carries no ID; that is a caller bug, not a
     *                                  recoverable condition
     */
    public TrackIdentifiers extract(CatalogTrack track) {
        Objects.requireNonNull(track, "track");
        if (track.id() == null || track.id().isBlank()) {
            throw new IllegalArgumentException("Catalog track has no id");
        }
        List<String> artists = track.artists().stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(a -> !a.isEmpty())
                .toList();
        return new TrackIdentifiers(
                track.id().trim(),
                normalizeIsrc(track.isrc()),
                track.name() == null ? "" : track.name().trim(),
                artists,
                blankToNull(track.previewUrl())
        );
    }

    /**
     * Upper-cases an ISRC and strips the separators some catalogs include. Returns null for blank
     * input.
     */
    public static String normalizeIsrc(String isrc) {
        if (isrc == null) {
            return null;
        }
        String s = isrc.replaceAll("[\\s-]", "").toUpperCase(Locale.ROOT);
        return s.isEmpty() ? null : s;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
