package com.example.zenflow.service;

import com.example.zenflow.exception.InvalidDurationException;
import com.example.zenflow.kv.InMemoryKvClient;
import com.example.zenflow.kv.KvClient;
import com.example.zenflow.model.AggregateState;
import com.example.zenflow.model.PracticeSession;
import com.example.zenflow.repo.PracticeSessionRepo;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProgressServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-12T09:30:00Z");

    @Mock
    private PracticeSessionRepo sessionRepo;

    @Mock
    private KvClient mockKv;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final ProgressAggregator aggregator = new ProgressAggregator(ZoneOffset.UTC);
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private ProgressSyncGateway gateway;
    private ProgressService progressService;

    @BeforeEach
    void setUp() {
        lenient().when(sessionRepo.save(any(PracticeSession.class))).thenAnswer(inv -> inv.getArgument(0));
        gateway = new ProgressSyncGateway(new InMemoryKvClient(), objectMapper, aggregator, "zenflow:progress:");
        gateway.open();
        progressService = new ProgressService(sessionRepo, gateway, aggregator, clock);
    }

    private static PracticeSession session(Instant at, int minutes) {
        return PracticeSession.builder().timestamp(at).durationMinutes(minutes).build();
    }

    @Test
    void testRecordSession_AccumulatesTotals() {
        progressService.recordSession(10);
        progressService.recordSession(15);
        AggregateState state = progressService.recordSession(20);

        assertEquals(45, state.getTotalMinutes());
        assertEquals(3, state.getTotalSessions());
        assertEquals(1, state.getCurrentStreak());
        assertEquals(state, progressService.getState());
        assertEquals(3, gateway.loadSessions().size());
        verify(sessionRepo, times(3)).save(any(PracticeSession.class));
    }

    @Test
    void testRecordSession_DefaultsToClockTime() {
        AggregateState state = progressService.recordSession(5);

        assertEquals(NOW, state.getLastSessionDate());
    }

    @Test
    void testRecordSession_TruncatesToMilliseconds() {
        AggregateState state = progressService.recordSession(5, NOW.plusNanos(123_456_789));

        assertEquals(NOW.plusMillis(123), state.getLastSessionDate());
    }

    @Test
    void testRecordSession_NonPositiveDurationRejected() {
        AtomicInteger signals = new AtomicInteger();
        gateway.subscribe(signals::incrementAndGet);

        InvalidDurationException zero = assertThrows(InvalidDurationException.class,
                () -> progressService.recordSession(0));
        assertThrows(InvalidDurationException.class, () -> progressService.recordSession(-5, NOW));

        assertEquals(0, zero.getDurationMinutes());
        assertEquals(AggregateState.EMPTY, gateway.load());
        assertEquals(0, signals.get());
        verify(sessionRepo, never()).save(any(PracticeSession.class));
    }

    @Test
    void testRecordSession_CommitsBeforeSignalling() {
        ProgressSyncGateway mockedGateway = new ProgressSyncGateway(mockKv, objectMapper, aggregator, "zenflow:progress:");
        ProgressService service = new ProgressService(sessionRepo, mockedGateway, aggregator, clock);

        service.recordSession(10);

        InOrder inOrder = inOrder(sessionRepo, mockKv);
        inOrder.verify(sessionRepo).save(any(PracticeSession.class));
        inOrder.verify(mockKv).rpush(eq("zenflow:progress:sessions"), anyString());
        inOrder.verify(mockKv).mset(any());
        inOrder.verify(mockKv).publish("zenflow:progress:changed", "");
    }

    @Test
    void testSignalledReader_SeesCommittedState() {
        List<Integer> seenTotals = new CopyOnWriteArrayList<>();
        gateway.subscribe(() -> seenTotals.add(gateway.load().getTotalMinutes()));

        progressService.recordSession(10);
        progressService.recordSession(20);

        assertEquals(List.of(10, 30), seenTotals);
    }

    @Test
    void testConcurrentRecordSession_NoLostUpdates() throws Exception {
        int threads = 8;
        int perThread = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    progressService.recordSession(1);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        AggregateState state = progressService.getState();
        assertEquals(threads * perThread, state.getTotalMinutes());
        assertEquals(threads * perThread, state.getTotalSessions());
        assertEquals(threads * perThread, gateway.loadSessions().size());
    }

    @Test
    void testRebuildFromHistory_MatchesIncrementalState() {
        List<PracticeSession> history = List.of(
                session(NOW.minus(2, ChronoUnit.DAYS), 10),
                session(NOW.minus(1, ChronoUnit.DAYS), 15),
                session(NOW, 20));
        AggregateState incremental = AggregateState.EMPTY;
        for (PracticeSession s : history) {
            incremental = progressService.recordSession(s.getDurationMinutes(), s.getTimestamp());
        }
        when(sessionRepo.findAllByOrderByTimestampAsc()).thenReturn(history);

        AggregateState rebuilt = progressService.rebuildFromHistory();

        assertEquals(incremental, rebuilt);
        assertEquals(3, rebuilt.getCurrentStreak());
        assertEquals(3, gateway.loadSessions().size());
    }

    @Test
    void testGetSessions_LimitAndRange() {
        List<PracticeSession> newestFirst = List.of(
                session(NOW, 20),
                session(NOW.minus(1, ChronoUnit.DAYS), 15),
                session(NOW.minus(2, ChronoUnit.DAYS), 10));
        when(sessionRepo.findAllByOrderByTimestampDesc()).thenReturn(newestFirst);
        when(sessionRepo.findInRange(NOW.minus(1, ChronoUnit.DAYS), NOW)).thenReturn(newestFirst.subList(0, 2));

        assertEquals(2, progressService.getSessions(2).size());
        assertEquals(3, progressService.getSessions((Integer) null).size());

        List<PracticeSession> range = progressService.getSessions(NOW.minus(1, ChronoUnit.DAYS), NOW);
        assertEquals(2, range.size());
        assertEquals(20, range.get(0).getDurationMinutes());
    }

    @Test
    void testGetTodaySessions_QueriesCalendarDayBounds() {
        Instant startOfDay = Instant.parse("2026-03-12T00:00:00Z");
        Instant startOfNextDay = Instant.parse("2026-03-13T00:00:00Z");
        when(sessionRepo.findFromUntil(startOfDay, startOfNextDay)).thenReturn(List.of(
                session(Instant.parse("2026-03-12T23:59:00Z"), 5),
                session(startOfDay, 10)));

        List<PracticeSession> today = progressService.getTodaySessions();

        assertEquals(2, today.size());
        assertEquals(15, today.stream().mapToInt(PracticeSession::getDurationMinutes).sum());
        verify(sessionRepo, never()).findAllByOrderByTimestampDesc();
    }

    @Test
    void testDegradedGateway_SeededFromEventStore() {
        when(mockKv.get(anyString())).thenThrow(new RedisConnectionFailureException("connection refused"));
        ProgressSyncGateway degradedGateway = new ProgressSyncGateway(mockKv, objectMapper, aggregator, "zenflow:progress:");
        degradedGateway.open();
        when(sessionRepo.findAllByOrderByTimestampAsc()).thenReturn(List.of(
                session(NOW.minus(1, ChronoUnit.DAYS), 30),
                session(NOW, 12)));
        ProgressService service = new ProgressService(sessionRepo, degradedGateway, aggregator, clock);

        service.reconcileOnStartup();
        AggregateState state = service.recordSession(8);

        assertTrue(degradedGateway.isDegraded());
        assertEquals(50, state.getTotalMinutes());
        assertEquals(2, state.getCurrentStreak());
    }

    private List<PracticeSession> backEventStoreWithList() {
        List<PracticeSession> eventStore = new CopyOnWriteArrayList<>();
        when(sessionRepo.save(any(PracticeSession.class))).thenAnswer(inv -> {
            PracticeSession saved = inv.getArgument(0);
            eventStore.add(saved);
            return saved;
        });
        when(sessionRepo.findAllByOrderByTimestampAsc()).thenAnswer(inv -> List.copyOf(eventStore));
        return eventStore;
    }

    @Test
    void testRestartAgainstEmptySharedStore_TotalsFollowEventStore() {
        // Given: two sessions recorded, then the shared store loses everything across a restart
        List<PracticeSession> eventStore = backEventStoreWithList();
        progressService.recordSession(10, NOW.minus(1, ChronoUnit.DAYS));
        progressService.recordSession(15, NOW);
        ProgressSyncGateway freshGateway = new ProgressSyncGateway(new InMemoryKvClient(), objectMapper, aggregator,
                "zenflow:progress:");
        freshGateway.open();
        ProgressService restarted = new ProgressService(sessionRepo, freshGateway, aggregator, clock);

        // When
        restarted.reconcileOnStartup();
        AggregateState state = restarted.recordSession(20, NOW);

        // Then
        int eventStoreSum = eventStore.stream().mapToInt(PracticeSession::getDurationMinutes).sum();
        assertEquals(45, eventStoreSum);
        assertEquals(eventStoreSum, state.getTotalMinutes());
        assertEquals(3, state.getTotalSessions());
        assertEquals(2, state.getCurrentStreak());
        assertEquals(3, freshGateway.loadSessions().size());
    }

    @Test
    void testStaleSharedStore_ReconciledBeforeNextSession() {
        // Given: the event store has sessions the shared store never saw
        backEventStoreWithList();
        progressService.recordSession(10, NOW.minus(1, ChronoUnit.DAYS));
        progressService.recordSession(15, NOW);
        InMemoryKvClient staleKv = new InMemoryKvClient();
        ProgressSyncGateway staleGateway = new ProgressSyncGateway(staleKv, objectMapper, aggregator, "zenflow:progress:");
        staleGateway.open();
        staleGateway.commit(AggregateState.builder().totalMinutes(10).totalSessions(1).currentStreak(1)
                .longestStreak(1).lastSessionDate(NOW.minus(1, ChronoUnit.DAYS)).build());
        ProgressService restarted = new ProgressService(sessionRepo, staleGateway, aggregator, clock);

        // When: no startup reconciliation ran
        AggregateState state = restarted.recordSession(20, NOW);

        // Then
        assertEquals(45, state.getTotalMinutes());
        assertEquals(3, state.getTotalSessions());
    }

    @Test
    void testSharedStoreFlushedMidLife_NextSessionReplaysEventStore() {
        // Given
        backEventStoreWithList();
        InMemoryKvClient flushableKv = new InMemoryKvClient();
        ProgressSyncGateway flushableGateway = new ProgressSyncGateway(flushableKv, objectMapper, aggregator,
                "zenflow:progress:");
        flushableGateway.open();
        ProgressService service = new ProgressService(sessionRepo, flushableGateway, aggregator, clock);
        service.recordSession(10, NOW);
        service.recordSession(15, NOW);

        // When: the shared store is wiped behind the writer's back
        for (String field : List.of("totalMinutes", "totalSessions", "currentStreak", "longestStreak",
                "lastSessionDate", "sessions")) {
            flushableKv.del("zenflow:progress:" + field);
        }
        AggregateState state = service.recordSession(20, NOW);

        // Then
        assertEquals(45, state.getTotalMinutes());
        assertEquals(state, flushableGateway.load());
        assertEquals(3, flushableGateway.loadSessions().size());
    }

    @Test
    void testSharedStoreRecovers_WriterRebuildsSharedState() {
        // Given: the writer starts degraded and records while degraded
        backEventStoreWithList();
        when(mockKv.get(anyString())).thenThrow(new RedisConnectionFailureException("connection refused"));
        ProgressSyncGateway flakyGateway = new ProgressSyncGateway(mockKv, objectMapper, aggregator, "zenflow:progress:");
        flakyGateway.open();
        ProgressService service = new ProgressService(sessionRepo, flakyGateway, aggregator, clock);
        service.reconcileOnStartup();
        service.recordSession(10, NOW);
        service.recordSession(15, NOW);
        assertTrue(flakyGateway.isDegraded());
        verify(mockKv, never()).mset(any());

        // When: the shared store answers again
        doReturn(java.util.Optional.empty()).when(mockKv).get(anyString());
        flakyGateway.recheckSharedStore();

        // Then
        assertFalse(flakyGateway.isDegraded());
        verify(mockKv).mset(argThat(values -> "25".equals(values.get("zenflow:progress:totalMinutes"))
                && "2".equals(values.get("zenflow:progress:totalSessions"))));
        verify(mockKv).publish("zenflow:progress:changed", "");
    }
}
