package com.faceattendance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class EarlyExitRequest {

    @JsonProperty("attendance_id")
    private Long attendanceId;

    private String reason;
}
