package com.faceattendance.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * One accepted attendance event. Rows are appended and never updated;
 * user_id is not a foreign key so deleting a user keeps its history.
 */
@Entity
@Table(name = "attendance", indexes = {
        @Index(name = "idx_attendance_user_type", columnList = "user_id, event_type"),
        @Index(name = "idx_attendance_occurred_at", columnList = "occurred_at")
})
public class Attendance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id")
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 8)
    private EntryType eventType;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    private double confidence;

    @Column(name = "is_late", nullable = false)
    private boolean late;

    // Minutes after the office login time; set only for late entries
    @Column(name = "minutes_late")
    private Integer minutesLate;

    @Column(name = "is_early_exit", nullable = false)
    private boolean earlyExit;

    // getters & setters
    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public EntryType getEventType() { return eventType; }
    public void setEventType(EntryType eventType) { this.eventType = eventType; }

    public Instant getOccurredAt() { return occurredAt; }
    public void setOccurredAt(Instant occurredAt) { this.occurredAt = occurredAt; }

    public double getConfidence() { return confidence; }
    public void setConfidence(double confidence) { this.confidence = confidence; }

    public boolean isLate() { return late; }
    public void setLate(boolean late) { this.late = late; }

    public Integer getMinutesLate() { return minutesLate; }
    public void setMinutesLate(Integer minutesLate) { this.minutesLate = minutesLate; }

    public boolean isEarlyExit() { return earlyExit; }
    public void setEarlyExit(boolean earlyExit) { this.earlyExit = earlyExit; }
}
