package com.faceattendance.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;

/**
 * Per-face line of a capture or streaming response:
 * {@code {message, user_id, name, timestamp?, similarity}}, plus the event id
 * and punctuality flags when a new event was recorded.
 */
@Value
@AllArgsConstructor
public class UserOutcome {

    public enum Status {
        MARKED,
        ALREADY_MARKED,
        UNMATCHED,
        /** Recognized, but the event could not be stored. */
        FAILED
    }

    @JsonIgnore
    Status status;

    String message;

    @JsonProperty("user_id")
    String userId;

    String name;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    Instant timestamp;

    double similarity;

    @JsonProperty("attendance_id")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    Long attendanceId;

    @JsonProperty("is_late")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    Boolean late;

    @JsonProperty("minutes_late")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    Integer minutesLate;

    @JsonProperty("is_early_exit")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    Boolean earlyExit;

    public UserOutcome(Status status, String message, String userId, String name, Instant timestamp, double similarity) {
        this(status, message, userId, name, timestamp, similarity, null, null, null, null);
    }
}
