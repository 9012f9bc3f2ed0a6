package com.phillippitts.tempokey.service.cache;

import com.phillippitts.tempokey.domain.PreviewCandidate;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/** Column codec for the candidate list. */
final class PreviewCandidatesJson {
    private static final Logger LOG = LogManager.getLogger(PreviewCandidatesJson.class);

    private PreviewCandidatesJson() {}

    static String write(List<PreviewCandidate> candidates) {
        JSONArray arr = new JSONArray();
        for (PreviewCandidate c : candidates) {
            JSONObject o = new JSONObject();
            o.put("provider", c.provider());
            o.put("success", c.success());
            putIfPresent(o, "url", c.url());
            putIfPresent(o, "detectedIsrc", c.detectedIsrc());
            putIfPresent(o, "detectedTitle", c.detectedTitle());
            putIfPresent(o, "detectedArtist", c.detectedArtist());
            arr.put(o);
        }
        return arr.toString();
    }

    static List<PreviewCandidate> read(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        List<PreviewCandidate> out = new ArrayList<>();
        try {
            JSONArray arr = new JSONArray(json);
            for (int i = 0; i < arr.length(); i++) {
                JSONObject o = arr.optJSONObject(i);
                if (o == null || !o.has("provider")) {
                    continue;
                }
                out.add(new PreviewCandidate(opt(o, "url"), o.getString("provider"), o.optBoolean("success", false),
                        opt(o, "detectedIsrc"), opt(o, "detectedTitle"), opt(o, "detectedArtist")));
            }
        } catch (JSONException e) {
            LOG.warn("Unreadable preview_candidates column, treating as empty: {}", e.getMessage());
            return List.of();
        }
        return out;
    }

    private static void putIfPresent(JSONObject o, String field, String value) {
        if (value != null) {
            o.put(field, value);
        }
    }

    private static String opt(JSONObject o, String field) {
        return o.isNull(field) ? null : o.optString(field, null);
    }
}
