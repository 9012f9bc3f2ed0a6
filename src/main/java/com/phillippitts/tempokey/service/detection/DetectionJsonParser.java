package com.phillippitts.tempokey.service.detection;

import com.phillippitts.tempokey.domain.Algorithm;
import com.phillippitts.tempokey.exception.DetectionUnavailableException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses estimation service payloads.
 *
 * <p>Per-algorithm fields are suffixed with the algorithm's wire name ({@code bpm_raw_essentia},
 * {@code key_librosa}, ...). The single-excerpt endpoint also answers with the unsuffixed legacy
 * fields {@code bpm}, {@code bpm_raw}, {@code confidence}, which belong to the primary algorithm.
 */
final class DetectionJsonParser {

    private DetectionJsonParser() {}

    static List<RawEstimate> parseAnalysis(String json) {
        JSONObject obj = object(json);
        List<RawEstimate> out = perAlgorithm(obj);
        if (!out.isEmpty()) {
            return out;
        }
        Double raw = number(obj, "bpm_raw");
        if (raw == null) {
            raw = number(obj, "bpm");
        }
        RawEstimate legacy = new RawEstimate(Algorithm.primary(), raw, number(obj, "confidence"),
                text(obj, "key"), scale(obj, "scale"), number(obj, "key_confidence"));
        return legacy.isEmpty() ? List.of() : List.of(legacy);
    }

    static String parseBatchId(String json) {
        String id = text(object(json), "batch_id");
        if (id == null) {
            throw new DetectionUnavailableException("Batch submission answered without batch_id");
        }
        return id;
    }

    static BatchRecord parseRecord(String line) {
        return record(object(line));
    }

    static BatchPoll parsePoll(String json) {
        JSONObject obj = object(json);
        List<BatchRecord> records = new ArrayList<>();
        JSONArray results = obj.optJSONArray("results");
        if (results != null) {
            for (int i = 0; i < results.length(); i++) {
                JSONObject r = results.optJSONObject(i);
                if (r != null && r.has("index")) {
                    records.add(record(r));
                }
            }
        }
        return new BatchPoll(records, obj.optBoolean("done", false));
    }

    private static BatchRecord record(JSONObject obj) {
        if (!obj.has("index")) {
            throw new DetectionUnavailableException("Stream record without index");
        }
        int index = obj.optInt("index", -1);
        if (index < 0) {
            throw new DetectionUnavailableException("Stream record with invalid index");
        }
        return new BatchRecord(index, obj.optBoolean("final", false), text(obj, "error"), perAlgorithm(obj));
    }

    private static List<RawEstimate> perAlgorithm(JSONObject obj) {
        List<RawEstimate> out = new ArrayList<>();
        for (Algorithm a : Algorithm.values()) {
            String s = "_" + a.wireName();
            Double raw = number(obj, "bpm_raw" + s);
            if (raw == null) {
                raw = number(obj, "bpm" + s);
            }
            RawEstimate e = new RawEstimate(a, raw, number(obj, "bpm_confidence" + s),
                    text(obj, "key" + s), scale(obj, "scale" + s), number(obj, "keyscale_confidence" + s));
            if (!e.isEmpty()) {
                out.add(e);
            }
        }
        return out;
    }

    private static JSONObject object(String json) {
        if (json == null || json.isBlank()) {
            throw new DetectionUnavailableException("Empty response from estimation service");
        }
        try {
            return new JSONObject(json);
        } catch (JSONException e) {
            throw new DetectionUnavailableException("Malformed response from estimation service", e);
        }
    }

    private static Double number(JSONObject o, String field) {
        if (!o.has(field) || o.isNull(field)) {
            return null;
        }
        double v = o.optDouble(field, Double.NaN);
        return Double.isNaN(v) || Double.isInfinite(v) ? null : v;
    }

    private static String text(JSONObject o, String field) {
        if (!o.has(field) || o.isNull(field)) {
            return null;
        }
        String v = o.optString(field, "").trim();
        return v.isEmpty() ? null : v;
    }

    private static String scale(JSONObject o, String field) {
        String v = text(o, field);
        return v == null ? null : v.toLowerCase(Locale.ROOT);
    }
}
