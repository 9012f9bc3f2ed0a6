package com.phillippitts.tempokey.service.normalize;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Corrects octave errors in detected tempi and rounds them to the stored precision.
 *
 * <p>Values below {@value #MIN_BPM} are doubled and values above {@value #MAX_BPM} halved until
 * they fall into {@code [MIN_BPM, MAX_BPM]}; the result is rounded half-up to one decimal.
 * Applying the transform to its own output returns the same value.
 */
@Component
public class TempoNormalizer {

    public static final double MIN_BPM = 70.0;
    public static final double MAX_BPM = 200.0;

    /**
     * @param raw detector output
     * @return normalized tempo, or null when {@code raw} is null, non-finite or not positive
     */
    public Double normalize(Double raw) {
        if (raw == null || raw.isNaN() || raw.isInfinite() || raw <= 0.0) {
            return null;
        }
        double v = raw;
        while (v < MIN_BPM) {
            v *= 2.0;
        }
        while (v > MAX_BPM) {
            v /= 2.0;
        }
        return round1(v);
    }

    /** Rounds to one decimal place, half-up. */
    public static double round1(double v) {
        return BigDecimal.valueOf(v).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
