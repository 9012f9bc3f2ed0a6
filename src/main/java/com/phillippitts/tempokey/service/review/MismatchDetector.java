package com.phillippitts.tempokey.service.review;

import com.phillippitts.tempokey.domain.PreviewCandidate;
import com.phillippitts.tempokey.domain.TrackIdentifiers;
import com.phillippitts.tempokey.service.identity.IdentifierExtractor;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Decides whether the audio a provider returned belongs to the requested track.
 *
 * <p>ISRCs are compared when both sides have one. Otherwise the detected title and artist are
 * compared loosely (case, accents, punctuation and bracketed suffixes ignored; containment either
 * way counts as agreement). With nothing to compare the candidate is trusted.
 */
@Component
public class MismatchDetector {

    public boolean isMismatch(TrackIdentifiers requested, PreviewCandidate candidate) {
        if (candidate == null || !candidate.success()) {
            return false;
        }
        String detectedIsrc = IdentifierExtractor.normalizeIsrc(candidate.detectedIsrc());
        if (requested.hasIsrc() && detectedIsrc != null) {
            return !requested.isrc().equals(detectedIsrc);
        }
        if (candidate.detectedTitle() != null && !requested.title().isBlank()
                && !looselyEqual(requested.title(), candidate.detectedTitle())) {
            return true;
        }
        if (candidate.detectedArtist() != null && !requested.artists().isEmpty()) {
            return requested.artists().stream().noneMatch(a -> looselyEqual(a, candidate.detectedArtist()));
        }
        return false;
    }

    static boolean looselyEqual(String a, String b) {
        String x = simplify(a);
        String y = simplify(b);
        if (x.isEmpty() || y.isEmpty()) {
            return true;
        }
        return x.contains(y) || y.contains(x);
    }

    static String simplify(String s) {
        String noBrackets = s.replaceAll("[\\(\\[][^\\)\\]]*[\\)\\]]", " ");
        String ascii = Normalizer.normalize(noBrackets, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        return ascii.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").trim();
    }
}
