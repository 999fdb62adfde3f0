package com.faceattendance.controller;

import com.faceattendance.dto.EarlyExitReasonView;
import com.faceattendance.dto.EarlyExitRequest;
import com.faceattendance.service.EarlyExitService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@CrossOrigin(origins = "*") // Allow frontend access
public class EarlyExitController {

    private final EarlyExitService earlyExitService;

    public EarlyExitController(EarlyExitService earlyExitService) {
        this.earlyExitService = earlyExitService;
    }

    // 🔹 Reason for leaving before office logout time
    @PostMapping("/early-exit-reason")
    public ResponseEntity<?> submitReason(@RequestBody EarlyExitRequest request) {
        if (request.getAttendanceId() == null || request.getReason() == null || request.getReason().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("detail", "Missing required fields"));
        }
        if (earlyExitService.submit(request.getAttendanceId(), request.getReason()).isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("detail", "Attendance record not found"));
        }
        return ResponseEntity.ok(Map.of("message", "Early exit reason submitted successfully"));
    }

    @GetMapping("/early-exit-reasons")
    public List<EarlyExitReasonView> getReasons() {
        Map<String, String> names = earlyExitService.userNames();
        return earlyExitService.listReasons().stream()
                .map(reason -> EarlyExitReasonView.of(reason, names.getOrDefault(reason.getUserId(), "Unknown")))
                .collect(Collectors.toList());
    }
}
