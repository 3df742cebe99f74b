package com.example.zenflow.service;

import com.example.zenflow.exception.CorruptRecordException;
import com.example.zenflow.exception.StoreUnavailableException;
import com.example.zenflow.kv.InMemoryKvClient;
import com.example.zenflow.kv.KvClient;
import com.example.zenflow.model.AggregateState;
import com.example.zenflow.model.PracticeSession;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * The only channel between the writer and reader processes: a shared key/value store plus a
 * payload-less "changed" broadcast.
 * <p>
 * Only one process may call {@link #commit} and {@link #signalChanged}. There is no cross-process
 * lock or compare-and-swap, so a second writer would need one before it could be added.
 * <p>
 * When the shared store cannot be reached the gateway switches to a process-local store and reports
 * {@link #isDegraded()}. Commits made in that mode are not visible to any other process. The shared
 * store is rechecked on a fixed delay; once it answers again the gateway switches back, subscribes the
 * listeners that missed it and runs the {@link #onRecovered recovery callbacks}.
 */
@Service
public class ProgressSyncGateway {

    private static final Logger logger = LoggerFactory.getLogger(ProgressSyncGateway.class);

    static final String TOTAL_MINUTES = "totalMinutes";
    static final String TOTAL_SESSIONS = "totalSessions";
    static final String CURRENT_STREAK = "currentStreak";
    static final String LONGEST_STREAK = "longestStreak";
    static final String LAST_SESSION_DATE = "lastSessionDate";
    static final String SESSIONS = "sessions";
    static final String CHANGED = "changed";

    private final KvClient sharedKv;
    private final KvClient localKv = new InMemoryKvClient();
    private final ObjectMapper objectMapper;
    private final ProgressAggregator aggregator;
    private final String namespace;
    // not yet registered on the shared channel
    private final List<Runnable> pendingSharedListeners = new CopyOnWriteArrayList<>();
    private final List<Runnable> recoveryListeners = new CopyOnWriteArrayList<>();

    private volatile boolean degraded;
    private volatile AggregateState lastKnown = AggregateState.EMPTY;

    public ProgressSyncGateway(KvClient sharedKv, ObjectMapper objectMapper, ProgressAggregator aggregator,
                               @Value("${zenflow.store.namespace:zenflow:progress:}") String namespace) {
        this.sharedKv = sharedKv;
        this.objectMapper = objectMapper;
        this.aggregator = aggregator;
        this.namespace = namespace;
    }

    /**
     * Checks the shared store once and falls back to the local store if it cannot be opened.
     */
    @PostConstruct
    public void open() {
        try {
            sharedKv.get(key(TOTAL_MINUTES));
            logger.info("Shared progress store opened, namespace {}", namespace);
        } catch (RuntimeException e) {
            degrade(new StoreUnavailableException("Shared progress store cannot be opened", e));
        }
    }

    /**
     * Writes the aggregate with a single atomic multi-set.
     */
    public void commit(AggregateState state) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(key(TOTAL_MINUTES), Integer.toString(state.getTotalMinutes()));
        values.put(key(TOTAL_SESSIONS), Integer.toString(state.getTotalSessions()));
        values.put(key(CURRENT_STREAK), Integer.toString(state.getCurrentStreak()));
        values.put(key(LONGEST_STREAK), Integer.toString(state.getLongestStreak()));
        values.put(key(LAST_SESSION_DATE), state.findLastSessionDate().map(Instant::toString).orElse(""));
        withStore(kv -> {
            kv.mset(values);
            return null;
        });
        lastKnown = state;
        logger.info("Committed progress: {} min, {} sessions, streak {} (longest {}){}",
                state.getTotalMinutes(), state.getTotalSessions(), state.getCurrentStreak(),
                state.getLongestStreak(), degraded ? " [local only]" : "");
    }

    public void appendSession(PracticeSession session) {
        String encoded = encodeSession(session);
        withStore(kv -> {
            kv.rpush(key(SESSIONS), encoded);
            return null;
        });
    }

    /**
     * Rewrites the mirrored session list. Used by repair only.
     */
    public void replaceSessions(List<PracticeSession> sessions) {
        List<String> encoded = new ArrayList<>(sessions.size());
        for (PracticeSession session : sessions) {
            encoded.add(encodeSession(session));
        }
        withStore(kv -> {
            kv.del(key(SESSIONS));
            for (String value : encoded) {
                kv.rpush(key(SESSIONS), value);
            }
            return null;
        });
    }

    /**
     * Fire-and-forget broadcast with an empty body. Readers re-read everything when they see it.
     */
    public void signalChanged() {
        withStore(kv -> {
            kv.publish(channel(), "");
            return null;
        });
        logger.debug("Signalled change on {}", channel());
    }

    /**
     * Registers a callback for change signals on both the shared channel and the local fallback.
     */
    public void subscribe(Runnable listener) {
        localKv.subscribe(channel(), listener);
        if (degraded) {
            pendingSharedListeners.add(listener);
            return;
        }
        try {
            sharedKv.subscribe(channel(), listener);
        } catch (RuntimeException e) {
            pendingSharedListeners.add(listener);
            degrade(new StoreUnavailableException("Cannot subscribe to " + channel(), e));
        }
    }

    /**
     * Registers a callback run after the gateway has switched back from the local store.
     */
    public void onRecovered(Runnable listener) {
        recoveryListeners.add(listener);
    }

    @Scheduled(fixedDelayString = "${zenflow.store.recovery-interval-ms:30000}",
            initialDelayString = "${zenflow.store.recovery-interval-ms:30000}")
    public void recheckSharedStore() {
        if (!degraded || !tryRecover()) {
            return;
        }
        for (Runnable listener : recoveryListeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                logger.error("Recovery callback failed", e);
            }
        }
    }

    /**
     * Switches back to the shared store if it answers and every pending listener can be subscribed.
     */
    synchronized boolean tryRecover() {
        if (!degraded) {
            return false;
        }
        try {
            sharedKv.get(key(TOTAL_MINUTES));
            for (Runnable listener : pendingSharedListeners) {
                sharedKv.subscribe(channel(), listener);
                pendingSharedListeners.remove(listener);
            }
        } catch (RuntimeException e) {
            logger.debug("Shared progress store still unavailable: {}", e.getMessage());
            return false;
        }
        degraded = false;
        logger.info("Shared progress store reachable again, namespace {}; leaving local fallback", namespace);
        return true;
    }

    /**
     * Returns the last committed aggregate, or {@link AggregateState#EMPTY} if nothing was ever committed.
     * A corrupt aggregate is rebuilt from the decodable entries of the session mirror.
     */
    public AggregateState load() {
        List<String> keys = List.of(key(TOTAL_MINUTES), key(TOTAL_SESSIONS), key(CURRENT_STREAK),
                key(LONGEST_STREAK), key(LAST_SESSION_DATE));
        Map<String, String> raw = withStore(kv -> kv.mget(keys));

        AggregateState state;
        if (raw.values().stream().allMatch(Objects::isNull)) {
            state = AggregateState.EMPTY;
        } else {
            try {
                state = decodeState(raw);
            } catch (CorruptRecordException e) {
                logger.warn("Corrupt aggregate record at {}: {}; rebuilding from session mirror",
                        e.getKey(), e.getMessage());
                state = aggregator.replay(loadSessions());
            }
        }
        lastKnown = state;
        return state;
    }

    /**
     * Returns the mirrored sessions in append order, skipping entries that cannot be decoded.
     */
    public List<PracticeSession> loadSessions() {
        List<String> raw = withStore(kv -> kv.lrange(key(SESSIONS)));
        List<PracticeSession> sessions = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            try {
                sessions.add(decodeSession(raw.get(i)));
            } catch (CorruptRecordException e) {
                logger.warn("Skipping corrupt session entry #{} in {}: {}", i, e.getKey(), e.getMessage());
            }
        }
        return sessions;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public String getNamespace() {
        return namespace;
    }

    public String channel() {
        return key(CHANGED);
    }

    public Map<String, Object> getGatewayStatus() {
        return Map.of(
            "degraded", degraded,
            "store", degraded ? "LOCAL_FALLBACK" : "SHARED",
            "namespace", namespace,
            "channel", channel()
        );
    }

    String key(String field) {
        return namespace + field;
    }

    private <T> T withStore(Function<KvClient, T> operation) {
        if (!degraded) {
            try {
                return operation.apply(sharedKv);
            } catch (RuntimeException e) {
                degrade(new StoreUnavailableException("Shared progress store failed", e));
            }
        }
        return operation.apply(localKv);
    }

    private synchronized void degrade(StoreUnavailableException cause) {
        if (degraded) {
            return;
        }
        logger.warn("{}; falling back to process-local store. Other processes will not see progress updates.",
                cause.getMessage(), cause);
        // keep totals monotone across the switch
        AggregateState seed = lastKnown;
        degraded = true;
        if (seed.getTotalSessions() > 0 || seed.getTotalMinutes() > 0) {
            commit(seed);
        }
    }

    private AggregateState decodeState(Map<String, String> raw) {
        int totalMinutes = decodeCount(raw, TOTAL_MINUTES);
        int totalSessions = decodeCount(raw, TOTAL_SESSIONS);
        int currentStreak = decodeCount(raw, CURRENT_STREAK);
        int longestStreak = decodeCount(raw, LONGEST_STREAK);
        if (longestStreak < currentStreak) {
            throw new CorruptRecordException(key(LONGEST_STREAK),
                    "longest streak " + longestStreak + " below current streak " + currentStreak);
        }
        String date = raw.get(key(LAST_SESSION_DATE));
        Instant lastSessionDate = null;
        if (date != null && !date.isEmpty()) {
            try {
                lastSessionDate = Instant.parse(date);
            } catch (DateTimeParseException e) {
                throw new CorruptRecordException(key(LAST_SESSION_DATE), "unparseable instant '" + date + "'", e);
            }
        }
        return AggregateState.builder()
                .totalMinutes(totalMinutes)
                .totalSessions(totalSessions)
                .currentStreak(currentStreak)
                .longestStreak(longestStreak)
                .lastSessionDate(lastSessionDate)
                .build();
    }

    private int decodeCount(Map<String, String> raw, String field) {
        String value = raw.get(key(field));
        if (value == null) {
            throw new CorruptRecordException(key(field), "missing value");
        }
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < 0) {
                throw new CorruptRecordException(key(field), "negative value " + parsed);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new CorruptRecordException(key(field), "not a number: '" + value + "'", e);
        }
    }

    private PracticeSession decodeSession(String json) {
        PracticeSession session;
        try {
            session = objectMapper.readValue(json, PracticeSession.class);
        } catch (JsonProcessingException e) {
            throw new CorruptRecordException(key(SESSIONS), "undecodable session: " + e.getOriginalMessage(), e);
        }
        if (session == null || session.getTimestamp() == null || session.getDurationMinutes() <= 0) {
            throw new CorruptRecordException(key(SESSIONS), "incomplete session " + json);
        }
        return session;
    }

    private String encodeSession(PracticeSession session) {
        try {
            return objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode session " + session, e);
        }
    }
}
