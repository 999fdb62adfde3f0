package com.faceattendance.dto;

import com.faceattendance.model.Attendance;
import com.faceattendance.model.EntryType;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;

@Value
public class AttendanceRecord {

    Long id;

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("event_type")
    EntryType eventType;

    Instant timestamp;

    double confidence;

    @JsonProperty("is_late")
    boolean late;

    @JsonProperty("minutes_late")
    Integer minutesLate;

    @JsonProperty("is_early_exit")
    boolean earlyExit;

    @JsonProperty("early_exit_reason")
    String earlyExitReason;

    public static AttendanceRecord of(Attendance attendance, String earlyExitReason) {
        return new AttendanceRecord(attendance.getId(), attendance.getUserId(), attendance.getEventType(),
                attendance.getOccurredAt(), attendance.getConfidence(), attendance.isLate(),
                attendance.getMinutesLate(), attendance.isEarlyExit(), earlyExitReason);
    }
}
