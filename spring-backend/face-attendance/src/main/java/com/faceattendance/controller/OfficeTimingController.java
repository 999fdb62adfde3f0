package com.faceattendance.controller;

import com.faceattendance.dto.OfficeTimingView;
import com.faceattendance.model.OfficeTiming;
import com.faceattendance.service.OfficeTimingService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@CrossOrigin(origins = "*") // Allow frontend access
public class OfficeTimingController {

    private final OfficeTimingService officeTimingService;

    public OfficeTimingController(OfficeTimingService officeTimingService) {
        this.officeTimingService = officeTimingService;
    }

    @GetMapping("/office-timings")
    public OfficeTimingView getTimings() {
        return OfficeTimingView.of(officeTimingService.current().orElse(null));
    }

    // 🔹 Set office login/logout times (HH:MM)
    @PostMapping("/office-timings")
    public ResponseEntity<?> updateTimings(
            @RequestParam(value = "login_time", required = false) String loginTime,
            @RequestParam(value = "logout_time", required = false) String logoutTime
    ) {
        OfficeTiming saved = officeTimingService.update(loginTime, logoutTime);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Office timings updated successfully");
        body.put("login_time", OfficeTimingService.format(saved.getLoginTime()));
        body.put("logout_time", OfficeTimingService.format(saved.getLogoutTime()));
        return ResponseEntity.ok(body);
    }

    // 🔹 Zone used for office hours and by-date listings
    @GetMapping("/timezone")
    public Map<String, String> getTimezone() {
        return Map.of("timezone", officeTimingService.getZone().getId());
    }
}
