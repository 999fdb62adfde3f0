package com.faceattendance.service;

import com.faceattendance.exception.AttendanceException;
import com.faceattendance.exception.ErrorCode;
import com.faceattendance.model.Attendance;
import com.faceattendance.model.EntryType;
import com.faceattendance.repository.AttendanceRepository;
import com.faceattendance.repository.LatestEventView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.stubbing.Answer;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AttendanceDeduplicatorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T08:00:00Z");
    private static final Duration COOLDOWN = Duration.ofMinutes(5);

    private AttendanceRepository repository;
    private AttendanceDeduplicator deduplicator;
    private final List<Attendance> saved = new CopyOnWriteArrayList<>();
    private final AtomicLong ids = new AtomicLong();

    private final Answer<Attendance> persist = invocation -> {
        Attendance attendance = invocation.getArgument(0);
        attendance.setId(ids.incrementAndGet());
        saved.add(attendance);
        return attendance;
    };

    @BeforeEach
    void setUp() {
        repository = mock(AttendanceRepository.class);
        when(repository.save(any(Attendance.class))).thenAnswer(persist);
        deduplicator = new AttendanceDeduplicator(repository, COOLDOWN);
    }

    @Test
    void firstEventIsAcceptedAndPersisted() {
        DedupDecision decision = deduplicator.decide("U1", EntryType.ENTRY, 0.93, T0);

        assertTrue(decision.isAccepted());
        assertEquals(DedupDecision.Reason.ACCEPTED, decision.getReason());
        assertEquals(T0, decision.getLastEventAt());
        assertEquals(1, saved.size());
        Attendance event = saved.get(0);
        assertEquals("U1", event.getUserId());
        assertEquals(EntryType.ENTRY, event.getEventType());
        assertEquals(0.93, event.getConfidence(), 1e-9);
        assertEquals(T0, deduplicator.lastAcceptedAt("U1", EntryType.ENTRY));
    }

    @Test
    void repeatWithinCooldownIsAlreadyMarkedWithFirstTimestamp() {
        deduplicator.decide("U1", EntryType.ENTRY, 0.9, T0);

        DedupDecision second = deduplicator.decide("U1", EntryType.ENTRY, 0.95, T0.plusSeconds(30));
        DedupDecision atBoundary = deduplicator.decide("U1", EntryType.ENTRY, 0.95, T0.plus(COOLDOWN));

        assertFalse(second.isAccepted());
        assertEquals(DedupDecision.Reason.ALREADY_MARKED, second.getReason());
        assertEquals(T0, second.getLastEventAt());
        assertNull(second.getEvent());
        assertFalse(atBoundary.isAccepted());
        assertEquals(1, saved.size());
    }

    @Test
    void acceptedAgainOnceCooldownHasElapsed() {
        deduplicator.decide("U1", EntryType.ENTRY, 0.9, T0);
        deduplicator.decide("U1", EntryType.ENTRY, 0.9, T0.plusSeconds(60));

        Instant later = T0.plus(COOLDOWN).plusSeconds(1);
        DedupDecision third = deduplicator.decide("U1", EntryType.ENTRY, 0.9, later);

        assertTrue(third.isAccepted());
        assertEquals(2, saved.size());
        assertEquals(later, deduplicator.lastAcceptedAt("U1", EntryType.ENTRY));
    }

    @Test
    void entryAndExitAreIndependent() {
        assertTrue(deduplicator.decide("U1", EntryType.ENTRY, 0.9, T0).isAccepted());
        assertTrue(deduplicator.decide("U1", EntryType.EXIT, 0.9, T0.plusSeconds(1)).isAccepted());
        assertFalse(deduplicator.decide("U1", EntryType.ENTRY, 0.9, T0.plusSeconds(2)).isAccepted());
        assertFalse(deduplicator.decide("U1", EntryType.EXIT, 0.9, T0.plusSeconds(3)).isAccepted());
        assertEquals(2, saved.size());
    }

    @Test
    void exitWithoutPriorEntryIsAccepted() {
        assertTrue(deduplicator.decide("U2", EntryType.EXIT, 0.8, T0).isAccepted());
    }

    @Test
    void failedWriteLeavesCacheUntouchedSoRetrySucceeds() {
        doThrow(new DataAccessResourceFailureException("database down"))
                .doAnswer(persist)
                .when(repository).save(any(Attendance.class));

        AttendanceException e = assertThrows(AttendanceException.class,
                () -> deduplicator.decide("U1", EntryType.ENTRY, 0.9, T0));
        assertEquals(ErrorCode.PERSISTENCE_FAILURE, e.getErrorCode());
        assertNull(deduplicator.lastAcceptedAt("U1", EntryType.ENTRY));

        assertTrue(deduplicator.decide("U1", EntryType.ENTRY, 0.9, T0.plusSeconds(1)).isAccepted());
        assertEquals(1, saved.size());
    }

    @Test
    void concurrentFramesOfSamePersonYieldOneEvent() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<DedupDecision>> futures = new CopyOnWriteArrayList<>();
            for (int i = 0; i < threads; i++) {
                final int offset = i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return deduplicator.decide("U1", EntryType.ENTRY, 0.9, T0.plusMillis(offset));
                }));
            }
            start.countDown();

            int accepted = 0;
            for (Future<DedupDecision> future : futures) {
                if (future.get(10, TimeUnit.SECONDS).isAccepted()) {
                    accepted++;
                }
            }
            assertEquals(1, accepted);
        } finally {
            pool.shutdownNow();
        }
        verify(repository, times(1)).save(any(Attendance.class));
    }

    @Test
    void differentPeopleAreAllAcceptedConcurrently() throws Exception {
        int people = 12;
        ExecutorService pool = Executors.newFixedThreadPool(people);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<DedupDecision>> futures = new CopyOnWriteArrayList<>();
            for (int i = 0; i < people; i++) {
                final String userId = "U" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return deduplicator.decide(userId, EntryType.ENTRY, 0.9, T0);
                }));
            }
            start.countDown();
            for (Future<DedupDecision> future : futures) {
                assertTrue(future.get(10, TimeUnit.SECONDS).isAccepted());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(people, saved.size());
    }

    @Test
    void warmUpSeedsCooldownFromHistory() {
        when(repository.findLatestPerUserAndType()).thenReturn(List.of(
                view("U1", EntryType.ENTRY, T0),
                view("U1", EntryType.EXIT, T0.minus(Duration.ofHours(2)))));

        assertEquals(2, deduplicator.warmUp());

        DedupDecision entry = deduplicator.decide("U1", EntryType.ENTRY, 0.9, T0.plusSeconds(10));
        assertFalse(entry.isAccepted());
        assertEquals(T0, entry.getLastEventAt());
        assertTrue(deduplicator.decide("U1", EntryType.EXIT, 0.9, T0.plusSeconds(10)).isAccepted());
    }

    @Test
    void refreshForgetsDeletedEvent() {
        deduplicator.decide("U1", EntryType.ENTRY, 0.9, T0);
        when(repository.findTopByUserIdAndEventTypeOrderByOccurredAtDesc("U1", EntryType.ENTRY))
                .thenReturn(Optional.empty());

        deduplicator.refresh("U1", EntryType.ENTRY);

        assertNull(deduplicator.lastAcceptedAt("U1", EntryType.ENTRY));
        assertTrue(deduplicator.decide("U1", EntryType.ENTRY, 0.9, T0.plusSeconds(5)).isAccepted());
    }

    @Test
    void alreadyMarkedDoesNotTouchStorage() {
        deduplicator.decide("U1", EntryType.ENTRY, 0.9, T0);
        deduplicator.decide("U1", EntryType.ENTRY, 0.9, T0.plusSeconds(1));
        deduplicator.decide("U1", EntryType.ENTRY, 0.9, T0.plusSeconds(2));

        verify(repository, times(1)).save(any(Attendance.class));
        verify(repository, never()).findLatestPerUserAndType();
    }

    private static LatestEventView view(String userId, EntryType type, Instant at) {
        return new LatestEventView() {
            @Override
            public String getUserId() { return userId; }

            @Override
            public EntryType getEventType() { return type; }

            @Override
            public Instant getLastOccurredAt() { return at; }
        };
    }
}
