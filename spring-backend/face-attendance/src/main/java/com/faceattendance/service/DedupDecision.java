package com.faceattendance.service;

import com.faceattendance.model.Attendance;
import lombok.Value;

import java.time.Instant;

/**
 * Result of {@link AttendanceDeduplicator#decide}. When accepted, {@code event}
 * is the persisted row and {@code lastEventAt} its time; otherwise
 * {@code lastEventAt} is the time of the earlier event that blocked this one.
 */
@Value
public class DedupDecision {

    public enum Reason {
        ACCEPTED,
        ALREADY_MARKED
    }

    boolean accepted;
    Reason reason;
    Instant lastEventAt;
    Attendance event;

    static DedupDecision accepted(Attendance event) {
        return new DedupDecision(true, Reason.ACCEPTED, event.getOccurredAt(), event);
    }

    static DedupDecision alreadyMarked(Instant lastEventAt) {
        return new DedupDecision(false, Reason.ALREADY_MARKED, lastEventAt, null);
    }
}
