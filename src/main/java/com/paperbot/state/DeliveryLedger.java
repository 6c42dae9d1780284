package com.paperbot.state;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * JSON-file backed store of what has already been announced.
 * Loaded once per run, mutated in memory, committed once after everything was sent.
 *
 * <p>The id list is a FIFO bounded by {@code maxDeliveredIds}. An id evicted from a very long
 * history can be announced again if the feed republishes it inside the cutoff window; the
 * bound is meant to be far above what one lookback window ever produces.
 */
public final class DeliveryLedger {
    static final String KEY_DELIVERED_IDS = "delivered_ids";
    static final String KEY_LAST_SUCCESS_AT = "last_success_at";
    static final String KEY_LAST_SEEN_PUBLISHED_AT = "last_seen_published_at";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final Path path;
    private final int maxDeliveredIds;
    private final Logger logger;

    public DeliveryLedger(Path path, int maxDeliveredIds) {
        this(path, maxDeliveredIds, LogManager.getLogger(DeliveryLedger.class));
    }

    public DeliveryLedger(Path path, int maxDeliveredIds, Logger logger) {
        if (maxDeliveredIds < 1) {
            throw new IllegalArgumentException("maxDeliveredIds must be >= 1, got " + maxDeliveredIds);
        }
        this.path = path;
        this.maxDeliveredIds = maxDeliveredIds;
        this.logger = logger;
    }

    public Path path() {
        return path;
    }

    /**
     * Reads the ledger, creating and persisting an empty one on first use.
     *
     * @throws LedgerCorruptionException when the file exists but is not a valid ledger
     */
    public Ledger load() throws IOException {
        if (!Files.exists(path)) {
            Ledger fresh = Ledger.empty();
            commit(fresh);
            logger.info("ledger initialized path={}", path.toAbsolutePath());
            return fresh;
        }
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            throw new LedgerCorruptionException("ledger is not valid UTF-8: " + path.toAbsolutePath(), e);
        }
        Ledger ledger = parse(text);
        int evicted = ledger.evictOldest(maxDeliveredIds);
        if (evicted > 0) {
            logger.warn("ledger held more ids than max_delivered_ids={}, evicted {} oldest", maxDeliveredIds, evicted);
        }
        logger.info("ledger loaded path={} delivered_ids={} last_success_at={}",
                path.toAbsolutePath(), ledger.size(), format(ledger.lastSuccessAt()));
        return ledger;
    }

    /**
     * Applies the outcome of a successful run to the in-memory ledger.
     */
    public void record(
            Ledger ledger,
            Iterable<String> deliveredIds,
            Instant now,
            Map<String, Instant> lastSeenPublishedByTopic
    ) {
        int added = 0;
        if (deliveredIds != null) {
            for (String id : deliveredIds) {
                if (id != null && !id.isBlank() && ledger.addDelivered(id)) {
                    added++;
                }
            }
        }
        int evicted = ledger.evictOldest(maxDeliveredIds);
        ledger.setLastSuccessAt(now);
        if (lastSeenPublishedByTopic != null) {
            for (Map.Entry<String, Instant> e : lastSeenPublishedByTopic.entrySet()) {
                Instant candidate = e.getValue();
                if (e.getKey() == null || candidate == null) {
                    continue;
                }
                Instant previous = ledger.lastSeenPublishedAt().get(e.getKey());
                if (previous == null || candidate.isAfter(previous)) {
                    ledger.putLastSeen(e.getKey(), candidate);
                }
            }
        }
        logger.debug("ledger record: added={} evicted={} size={}", added, evicted, ledger.size());
    }

    /**
     * Replaces the persisted ledger with the given snapshot via write-then-rename.
     */
    public void commit(Ledger ledger) throws IOException {
        Path target = path.toAbsolutePath();
        Path dir = target.getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tmp, toJson(ledger).toString(2) + "\n", StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    static JSONObject toJson(Ledger ledger) {
        JSONObject o = new JSONObject();
        o.put(KEY_DELIVERED_IDS, new JSONArray(ledger.deliveredIds()));
        o.put(KEY_LAST_SUCCESS_AT, ledger.lastSuccessAt() == null ? JSONObject.NULL : format(ledger.lastSuccessAt()));
        JSONObject lastSeen = new JSONObject();
        for (Map.Entry<String, Instant> e : ledger.lastSeenPublishedAt().entrySet()) {
            lastSeen.put(e.getKey(), format(e.getValue()));
        }
        o.put(KEY_LAST_SEEN_PUBLISHED_AT, lastSeen);
        return o;
    }

    static Ledger parse(String text) {
        JSONObject o;
        try {
            o = new JSONObject(text);
        } catch (JSONException e) {
            throw new LedgerCorruptionException("ledger is not a JSON object: " + e.getMessage(), e);
        }

        Ledger ledger = Ledger.empty();
        if (!o.isNull(KEY_DELIVERED_IDS)) {
            Object raw = o.get(KEY_DELIVERED_IDS);
            if (!(raw instanceof JSONArray)) {
                throw new LedgerCorruptionException(KEY_DELIVERED_IDS + " must be an array");
            }
            JSONArray ids = (JSONArray) raw;
            for (int i = 0; i < ids.length(); i++) {
                Object id = ids.get(i);
                if (!(id instanceof String)) {
                    throw new LedgerCorruptionException(KEY_DELIVERED_IDS + "[" + i + "] is not a string");
                }
                if (!((String) id).isBlank()) {
                    ledger.addDelivered((String) id);
                }
            }
        }

        if (!o.isNull(KEY_LAST_SUCCESS_AT)) {
            ledger.setLastSuccessAt(parseTimestamp(KEY_LAST_SUCCESS_AT, o.get(KEY_LAST_SUCCESS_AT)));
        }

        if (!o.isNull(KEY_LAST_SEEN_PUBLISHED_AT)) {
            Object raw = o.get(KEY_LAST_SEEN_PUBLISHED_AT);
            if (!(raw instanceof JSONObject)) {
                throw new LedgerCorruptionException(KEY_LAST_SEEN_PUBLISHED_AT + " must be an object");
            }
            JSONObject map = (JSONObject) raw;
            for (String topic : map.keySet()) {
                if (map.isNull(topic)) {
                    continue;
                }
                ledger.putLastSeen(topic, parseTimestamp(KEY_LAST_SEEN_PUBLISHED_AT + "." + topic, map.get(topic)));
            }
        }
        return ledger;
    }

    private static Instant parseTimestamp(String field, Object raw) {
        if (!(raw instanceof String)) {
            throw new LedgerCorruptionException(field + " must be an ISO-8601 string");
        }
        try {
            return OffsetDateTime.parse((String) raw, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            throw new LedgerCorruptionException(field + " is not an ISO-8601 timestamp: " + raw, e);
        }
    }

    static String format(Instant instant) {
        return instant == null ? null : ISO.format(instant);
    }
}
