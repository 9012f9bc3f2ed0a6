package com.phillippitts.tempokey.service.cache;

import com.phillippitts.tempokey.domain.Algorithm;
import com.phillippitts.tempokey.domain.AlgorithmResult;
import com.phillippitts.tempokey.domain.CacheRecord;
import com.phillippitts.tempokey.domain.CacheUpdate;
import com.phillippitts.tempokey.domain.ReviewStatus;
import com.phillippitts.tempokey.domain.ValueSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Relational store on table {@code track_tempo_cache}.
 *
 * <p>Merges run in a transaction: {@code SELECT ... FOR UPDATE}, apply the update, then
 * {@code UPDATE} or {@code INSERT}. Two first-time writers racing on the same track collide on
 * the primary key; the loser retries once and then sees the winner's row.
 */
public class JdbcCacheStore implements CacheStore {
    private static final Logger LOG = LogManager.getLogger(JdbcCacheStore.class);

    static final String TABLE = "track_tempo_cache";
    private static final List<String> COLUMNS = columns();
    private static final String SELECT = "SELECT " + String.join(", ", COLUMNS) + " FROM " + TABLE;
    private static final String INSERT = "INSERT INTO " + TABLE + " (" + String.join(", ", COLUMNS)
            + ") VALUES (" + String.join(", ", COLUMNS.stream().map(c -> "?").toList()) + ")";
    private static final String UPDATE = "UPDATE " + TABLE + " SET "
            + String.join(", ", COLUMNS.subList(1, COLUMNS.size()).stream().map(c -> c + " = ?").toList())
            + " WHERE track_id = ?";

    private final JdbcTemplate jdbc;
    private final NamedParameterJdbcTemplate named;
    private final TransactionTemplate tx;
    private final Clock clock;
    private final RowMapper<CacheRecord> mapper = (rs, n) -> map(rs);

    public JdbcCacheStore(JdbcTemplate jdbc, TransactionTemplate tx, Clock clock) {
        this.jdbc = Objects.requireNonNull(jdbc);
        this.named = new NamedParameterJdbcTemplate(jdbc);
        this.tx = Objects.requireNonNull(tx);
        this.clock = Objects.requireNonNull(clock);
    }

    private static List<String> columns() {
        List<String> cols = new ArrayList<>(List.of("track_id", "isrc", "artist", "title"));
        for (Algorithm a : Algorithm.values()) {
            String p = a.wireName() + "_";
            cols.addAll(List.of(p + "tempo", p + "tempo_raw", p + "tempo_confidence",
                    p + "key", p + "scale", p + "key_confidence"));
        }
        cols.addAll(List.of("manual_tempo", "manual_key", "manual_scale", "tempo_selected", "key_selected",
                "preview_candidates", "source", "error", "auto_mismatch_flag", "review_status",
                "reviewed_by", "reviewed_at", "updated_at"));
        return List.copyOf(cols);
    }

    @Override
    public Optional<CacheRecord> get(String trackId) {
        return jdbc.query(SELECT + " WHERE track_id = ?", mapper, trackId).stream().findFirst();
    }

    @Override
    public Optional<CacheRecord> findByIsrc(String isrc) {
        if (isrc == null) {
            return Optional.empty();
        }
        return jdbc.query(SELECT + " WHERE isrc = ? ORDER BY updated_at DESC LIMIT 1", mapper, isrc)
                .stream().findFirst();
    }

    @Override
    public Map<String, CacheRecord> getBatchByIsrc(Collection<String> isrcs) {
        Map<String, CacheRecord> out = new HashMap<>();
        if (isrcs.isEmpty()) {
            return out;
        }
        List<CacheRecord> rows = named.query(SELECT + " WHERE isrc IN (:isrcs) ORDER BY updated_at DESC",
                new MapSqlParameterSource("isrcs", List.copyOf(isrcs)), mapper);
        for (CacheRecord r : rows) {
            out.putIfAbsent(r.isrc(), r);
        }
        return out;
    }

    @Override
    public CacheRecord merge(String trackId, CacheUpdate update) {
        return withRetry(trackId, () -> tx.execute(status -> {
            CacheRecord existing = lock(trackId);
            CacheRecord merged = update.applyTo(trackId, existing, clock.instant());
            write(merged, existing == null);
            return merged;
        }));
    }

    @Override
    public Optional<CacheRecord> mergeExisting(String trackId, CacheUpdate update) {
        return Optional.ofNullable(tx.execute(status -> {
            CacheRecord existing = lock(trackId);
            if (existing == null) {
                return null;
            }
            CacheRecord merged = update.applyTo(trackId, existing, clock.instant());
            write(merged, false);
            return merged;
        }));
    }

    @Override
    public boolean delete(String trackId) {
        return jdbc.update("DELETE FROM " + TABLE + " WHERE track_id = ?", trackId) > 0;
    }

    @Override
    public List<CacheRecord> findMismatches(int limit) {
        return jdbc.query(SELECT + " WHERE auto_mismatch_flag = TRUE OR review_status IS NOT NULL"
                + " ORDER BY updated_at DESC LIMIT ?", mapper, limit);
    }

    @Override
    public List<CacheRecord> findPendingMismatches(int limit) {
        return jdbc.query(SELECT + " WHERE auto_mismatch_flag = TRUE"
                + " AND (review_status IS NULL OR review_status <> ?)"
                + " ORDER BY updated_at DESC LIMIT ?", mapper, ReviewStatus.MATCH.wireName(), limit);
    }

    private CacheRecord withRetry(String trackId, Supplier<CacheRecord> op) {
        try {
            return op.get();
        } catch (DuplicateKeyException e) {
            LOG.debug("Concurrent first insert for track {}; retrying merge", trackId);
            return op.get();
        }
    }

    private CacheRecord lock(String trackId) {
        return jdbc.query(SELECT + " WHERE track_id = ? FOR UPDATE", mapper, trackId).stream()
                .findFirst().orElse(null);
    }

    private void write(CacheRecord r, boolean insert) {
        List<Object> values = values(r);
        if (insert) {
            jdbc.update(INSERT, values.toArray());
        } else {
            List<Object> args = new ArrayList<>(values.subList(1, values.size()));
            args.add(r.trackId());
            jdbc.update(UPDATE, args.toArray());
        }
    }

    private static List<Object> values(CacheRecord r) {
        List<Object> v = new ArrayList<>(List.of(r.trackId()));
        v.add(r.isrc());
        v.add(r.artist());
        v.add(r.title());
        for (Algorithm a : Algorithm.values()) {
            AlgorithmResult res = r.result(a);
            v.add(res.tempo());
            v.add(res.tempoRaw());
            v.add(res.tempoConfidence());
            v.add(res.key());
            v.add(res.scale());
            v.add(res.keyConfidence());
        }
        v.add(r.manualTempo());
        v.add(r.manualKey());
        v.add(r.manualScale());
        v.add(r.tempoSelected().wireName());
        v.add(r.keySelected().wireName());
        v.add(PreviewCandidatesJson.write(r.previewCandidates()));
        v.add(r.source());
        v.add(r.error());
        v.add(r.isAutoMismatchFlag());
        v.add(r.reviewStatus() == null ? null : r.reviewStatus().wireName());
        v.add(r.reviewedBy());
        v.add(timestamp(r.reviewedAt()));
        v.add(timestamp(r.updatedAt()));
        return v;
    }

    private static CacheRecord map(ResultSet rs) throws SQLException {
        CacheRecord.Builder b = CacheRecord.builder(rs.getString("track_id"))
                .isrc(rs.getString("isrc"))
                .artist(rs.getString("artist"))
                .title(rs.getString("title"));
        for (Algorithm a : Algorithm.values()) {
            String p = a.wireName() + "_";
            b.result(a, new AlgorithmResult(
                    number(rs, p + "tempo"),
                    number(rs, p + "tempo_raw"),
                    number(rs, p + "tempo_confidence"),
                    rs.getString(p + "key"),
                    rs.getString(p + "scale"),
                    number(rs, p + "key_confidence")));
        }
        return b.manualTempo(number(rs, "manual_tempo"))
                .manualKey(rs.getString("manual_key"))
                .manualScale(rs.getString("manual_scale"))
                .tempoSelected(parse(rs.getString("tempo_selected"), ValueSource::fromWireName))
                .keySelected(parse(rs.getString("key_selected"), ValueSource::fromWireName))
                .previewCandidates(PreviewCandidatesJson.read(rs.getString("preview_candidates")))
                .source(rs.getString("source"))
                .error(rs.getString("error"))
                .autoMismatchFlag(rs.getBoolean("auto_mismatch_flag"))
                .reviewStatus(parse(rs.getString("review_status"), ReviewStatus::fromWireName))
                .reviewedBy(rs.getString("reviewed_by"))
                .reviewedAt(instant(rs.getTimestamp("reviewed_at")))
                .updatedAt(instant(rs.getTimestamp("updated_at")))
                .build();
    }

    // Unknown enum values in old rows fall back to the default rather than failing the read.
    private static <T> T parse(String value, Function<String, T> parser) {
        if (value == null) {
            return null;
        }
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            LOG.warn("Ignoring unknown stored value '{}': {}", value, e.getMessage());
            return null;
        }
    }

    private static Double number(ResultSet rs, String column) throws SQLException {
        double v = rs.getDouble(column);
        return rs.wasNull() ? null : v;
    }

    private static Timestamp timestamp(Instant i) {
        return i == null ? null : Timestamp.from(i);
    }

    private static Instant instant(Timestamp t) {
        return t == null ? null : t.toInstant();
    }
}
