package com.faceattendance.repository;

import com.faceattendance.model.Attendance;
import com.faceattendance.model.EntryType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface AttendanceRepository extends JpaRepository<Attendance, Long> {

    List<Attendance> findAllByOrderByOccurredAtDesc();

    // Half-open range [from, to), newest first
    List<Attendance> findByOccurredAtGreaterThanEqualAndOccurredAtLessThanOrderByOccurredAtDesc(
            Instant from, Instant to);

    Optional<Attendance> findTopByUserIdAndEventTypeOrderByOccurredAtDesc(String userId, EntryType eventType);

    /** Latest accepted event per (user, event type); seeds the cooldown cache at startup. */
    @Query("select a.userId as userId, a.eventType as eventType, max(a.occurredAt) as lastOccurredAt "
            + "from Attendance a where a.userId is not null group by a.userId, a.eventType")
    List<LatestEventView> findLatestPerUserAndType();
}
