package com.phillippitts.tempokey.service.bulk;

import com.phillippitts.tempokey.service.detection.BatchRecord;
import com.phillippitts.tempokey.service.detection.RawEstimate;
import com.phillippitts.tempokey.service.normalize.TempoNormalizer;
import org.json.JSONObject;

/**
 * NDJSON line written to bulk stream consumers: the upstream per-algorithm fields with the
 * normalized tempo in {@code bpm_<algorithm>}, plus the owning {@code trackId} when known.
 */
final class BatchRecordJson {

    private BatchRecordJson() {}

    static String write(BatchRecord rec, String trackId, TempoNormalizer normalizer) {
        return toJson(rec, trackId, normalizer).toString();
    }

    static JSONObject toJson(BatchRecord rec, String trackId, TempoNormalizer normalizer) {
        JSONObject o = new JSONObject();
        o.put("index", rec.index());
        o.put("final", rec.finalRecord());
        if (trackId != null) {
            o.put("trackId", trackId);
        }
        if (rec.hasError()) {
            o.put("error", rec.error());
        }
        for (RawEstimate e : rec.estimates()) {
            String s = "_" + e.algorithm().wireName();
            o.putOpt("bpm" + s, normalizer.normalize(e.tempoRaw()));
            o.putOpt("bpm_raw" + s, e.tempoRaw());
            o.putOpt("bpm_confidence" + s, e.tempoConfidence());
            o.putOpt("key" + s, e.key());
            o.putOpt("scale" + s, e.scale());
            o.putOpt("keyscale_confidence" + s, e.keyConfidence());
        }
        return o;
    }
}
