package com.faceattendance.dto;

import com.faceattendance.model.EarlyExitReason;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;

@Value
public class EarlyExitReasonView {

    Long id;

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("user_name")
    String userName;

    @JsonProperty("attendance_id")
    Long attendanceId;

    String reason;

    Instant timestamp;

    public static EarlyExitReasonView of(EarlyExitReason reason, String userName) {
        return new EarlyExitReasonView(reason.getId(), reason.getUserId(), userName,
                reason.getAttendanceId(), reason.getReason(), reason.getCreatedAt());
    }
}
