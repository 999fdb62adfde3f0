package com.faceattendance.dto;

import com.faceattendance.model.OfficeTiming;
import com.faceattendance.service.OfficeTimingService;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;

/** Body of {@code GET /office-timings}; all fields null when none are set. */
@Value
public class OfficeTimingView {

    @JsonProperty("login_time")
    String loginTime;

    @JsonProperty("logout_time")
    String logoutTime;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static OfficeTimingView of(OfficeTiming timing) {
        if (timing == null) {
            return new OfficeTimingView(null, null, null);
        }
        return new OfficeTimingView(OfficeTimingService.format(timing.getLoginTime()),
                OfficeTimingService.format(timing.getLogoutTime()), timing.getUpdatedAt());
    }
}
