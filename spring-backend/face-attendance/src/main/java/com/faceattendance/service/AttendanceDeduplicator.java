package com.faceattendance.service;

import com.faceattendance.config.AttendanceProperties;
import com.faceattendance.exception.AttendanceException;
import com.faceattendance.exception.ErrorCode;
import com.faceattendance.model.Attendance;
import com.faceattendance.model.EntryType;
import com.faceattendance.repository.AttendanceRepository;
import com.faceattendance.repository.LatestEventView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Decides whether a recognized person gets a new attendance event now.
 *
 * <p>The last accepted time per (user, event type) lives in memory, seeded
 * from the attendance table at startup and written through on every
 * acceptance. Check, insert and cache update happen under a lock scoped to
 * that single key, so two frames of the same person cannot both be accepted
 * while different people never wait on each other.
 */
@Service
public class AttendanceDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(AttendanceDeduplicator.class);

    private final AttendanceRepository attendanceRepository;
    private final Duration cooldown;

    private final Map<Key, Instant> lastAccepted = new ConcurrentHashMap<>();
    private final Map<Key, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Autowired
    public AttendanceDeduplicator(AttendanceRepository attendanceRepository, AttendanceProperties properties) {
        this(attendanceRepository, properties.getCooldown());
    }

    public AttendanceDeduplicator(AttendanceRepository attendanceRepository, Duration cooldown) {
        if (cooldown == null || cooldown.isNegative()) {
            throw new IllegalArgumentException("Cooldown must be zero or positive: " + cooldown);
        }
        this.attendanceRepository = attendanceRepository;
        this.cooldown = cooldown;
    }

    public Duration getCooldown() {
        return cooldown;
    }

    /**
     * Accepts and persists an event unless one of the same type was accepted
     * for this user within the cooldown window.
     *
     * @throws AttendanceException {@code PERSISTENCE_FAILURE} if the insert fails; the
     *                             cache is left as it was so a retry can succeed
     */
    public DedupDecision decide(String userId, EntryType eventType, double similarity, Instant now) {
        return decide(userId, eventType, similarity, now, event -> { });
    }

    /**
     * As {@link #decide(String, EntryType, double, Instant)}; {@code beforeSave}
     * may fill in further columns of an accepted event before it is inserted.
     */
    public DedupDecision decide(String userId, EntryType eventType, double similarity, Instant now,
                                Consumer<Attendance> beforeSave) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(now, "now");

        Key key = new Key(userId, eventType);
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            Instant last = lastAccepted.get(key);
            if (last != null && Duration.between(last, now).compareTo(cooldown) <= 0) {
                log.debug("{} already marked for {} at {}", eventType, userId, last);
                return DedupDecision.alreadyMarked(last);
            }

            Attendance event = new Attendance();
            event.setUserId(userId);
            event.setEventType(eventType);
            event.setOccurredAt(now);
            event.setConfidence(similarity);
            beforeSave.accept(event);

            Attendance saved;
            try {
                saved = attendanceRepository.save(event);
            } catch (DataAccessException e) {
                log.error("Failed to record {} for {}", eventType, userId, e);
                throw new AttendanceException(ErrorCode.PERSISTENCE_FAILURE,
                        "Failed to record attendance for " + userId, e);
            }

            lastAccepted.put(key, saved.getOccurredAt());
            log.info("{} marked for {} (similarity {}, event {})",
                    eventType.label(), userId, String.format("%.4f", similarity), saved.getId());
            return DedupDecision.accepted(saved);
        } finally {
            lock.unlock();
        }
    }

    /** Last accepted time for the key, if any. */
    public Instant lastAcceptedAt(String userId, EntryType eventType) {
        return lastAccepted.get(new Key(userId, eventType));
    }

    /**
     * Seeds the cache with the latest stored event per key.
     *
     * @return number of keys loaded
     */
    public int warmUp() {
        int loaded = 0;
        for (LatestEventView view : attendanceRepository.findLatestPerUserAndType()) {
            if (view.getUserId() == null || view.getEventType() == null || view.getLastOccurredAt() == null) {
                continue;
            }
            lastAccepted.merge(new Key(view.getUserId(), view.getEventType()), view.getLastOccurredAt(),
                    (a, b) -> a.isAfter(b) ? a : b);
            loaded++;
        }
        log.info("Attendance cooldown cache warmed with {} key(s), cooldown {}", loaded, cooldown);
        return loaded;
    }

    /**
     * Reloads one key from storage, e.g. after an event was deleted by an
     * administrator.
     */
    public void refresh(String userId, EntryType eventType) {
        Key key = new Key(userId, eventType);
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            attendanceRepository.findTopByUserIdAndEventTypeOrderByOccurredAtDesc(userId, eventType)
                    .ifPresentOrElse(
                            latest -> lastAccepted.put(key, latest.getOccurredAt()),
                            () -> lastAccepted.remove(key));
        } finally {
            lock.unlock();
        }
    }

    private static final class Key {
        private final String userId;
        private final EntryType eventType;

        Key(String userId, EntryType eventType) {
            this.userId = userId;
            this.eventType = eventType;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key other = (Key) o;
            return userId.equals(other.userId) && eventType == other.eventType;
        }

        @Override
        public int hashCode() {
            return userId.hashCode() * 31 + eventType.hashCode();
        }
    }
}
