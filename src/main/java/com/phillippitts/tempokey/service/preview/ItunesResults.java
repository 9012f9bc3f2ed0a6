package com.phillippitts.tempokey.service.preview;

import org.json.JSONArray;
import org.json.JSONObject;

/** Helpers for the storefront's {@code {resultCount, results[]}} envelope. */
final class ItunesResults {

    private ItunesResults() {
    }

    static JSONObject firstWithPreview(JSONObject body) {
        if (body.optInt("resultCount", 0) <= 0) {
            return null;
        }
        JSONArray results = body.optJSONArray("results");
        if (results == null || results.isEmpty()) {
            return null;
        }
        JSONObject first = results.optJSONObject(0);
        if (first == null || optText(first, "previewUrl") == null) {
            return null;
        }
        return first;
    }

    static String optText(JSONObject o, String field) {
        String v = o.optString(field, null);
        return v == null || v.isBlank() ? null : v;
    }
}
