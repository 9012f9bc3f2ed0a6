package com.phillippitts.tempokey.util;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives a two-letter storefront country from an {@code Accept-Language} header.
 */
public final class CountryCodes {

    private static final Map<String, String> LANGUAGE_TO_COUNTRY = Map.ofEntries(
            Map.entry("en", "us"),
            Map.entry("it", "it"),
            Map.entry("fr", "fr"),
            Map.entry("de", "de"),
            Map.entry("es", "es"),
            Map.entry("ja", "jp")
    );

    private static final Pattern REGION = Pattern.compile("^[a-z]{2,3}-([a-z]{2})$");
    private static final Pattern COUNTRY = Pattern.compile("^[a-z]{2}$");

    private CountryCodes() {
    }

    /**
     * Walks the header's language ranges in order and returns the first usable country.
     *
     * @param acceptLanguage raw header value, e.g. {@code "en-GB,en;q=0.9,it;q=0.8"}
     * @param fallback       returned when nothing in the header maps to a country
     */
    public static String fromAcceptLanguage(String acceptLanguage, String fallback) {
        if (acceptLanguage == null || acceptLanguage.isBlank()) {
            return fallback;
        }
        for (String range : acceptLanguage.split(",")) {
            String tag = range.split(";")[0].trim().toLowerCase(Locale.ROOT);
            Matcher m = REGION.matcher(tag);
            if (m.matches()) {
                return m.group(1);
            }
            String mapped = LANGUAGE_TO_COUNTRY.get(tag);
            if (mapped != null) {
                return mapped;
            }
        }
        return fallback;
    }

    /** @return the lower-cased code when it looks like a country, else {@code fallback} */
    public static String normalize(String country, String fallback) {
        if (country == null) {
            return fallback;
        }
        String c = country.trim().toLowerCase(Locale.ROOT);
        return COUNTRY.matcher(c).matches() ? c : fallback;
    }
}
