package com.faceattendance.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Row of an {@code attendance_update} broadcast. Recorded events carry the
 * similarity and punctuality flags, submitted early-exit reasons the reason.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AttendanceUpdate {

    /** "entry", "exit" or "early_exit_reason". */
    String action;

    @JsonProperty("user_id")
    String userId;

    String name;

    Instant timestamp;

    Double similarity;

    @JsonProperty("attendance_id")
    Long attendanceId;

    @JsonProperty("is_late")
    Boolean late;

    @JsonProperty("minutes_late")
    Integer minutesLate;

    @JsonProperty("is_early_exit")
    Boolean earlyExit;

    String reason;
}
