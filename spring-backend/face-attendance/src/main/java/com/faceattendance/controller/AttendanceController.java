package com.faceattendance.controller;

import com.faceattendance.config.AttendanceProperties;
import com.faceattendance.dto.AttendanceRecord;
import com.faceattendance.dto.FrameOutcome;
import com.faceattendance.model.Attendance;
import com.faceattendance.model.EntryType;
import com.faceattendance.repository.AttendanceRepository;
import com.faceattendance.service.AttendanceDeduplicator;
import com.faceattendance.service.AttendancePipeline;
import com.faceattendance.service.EarlyExitService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/attendance")
@CrossOrigin(origins = "*") // Allow frontend access
public class AttendanceController {
    private static final Logger log = LoggerFactory.getLogger(AttendanceController.class);

    private final AttendancePipeline pipeline;
    private final AttendanceRepository attendanceRepository;
    private final AttendanceDeduplicator deduplicator;
    private final EarlyExitService earlyExitService;
    private final ZoneId zone;

    public AttendanceController(AttendancePipeline pipeline,
                                AttendanceRepository attendanceRepository,
                                AttendanceDeduplicator deduplicator,
                                EarlyExitService earlyExitService,
                                AttendanceProperties properties) {
        this.pipeline = pipeline;
        this.attendanceRepository = attendanceRepository;
        this.deduplicator = deduplicator;
        this.earlyExitService = earlyExitService;
        this.zone = ZoneId.of(properties.getZoneId());
    }

    // 🔹 Mark attendance once from an uploaded image
    @PostMapping
    public ResponseEntity<?> markAttendance(
            @RequestParam(value = "image", required = false) MultipartFile image,
            @RequestParam(value = "entry_type", required = false) String entryType
    ) throws IOException {
        if (image == null || image.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("detail", "Face image is required"));
        }
        EntryType type = EntryType.fromWire(entryType);

        FrameOutcome outcome = pipeline.capture(image.getBytes(), type);
        switch (outcome.getKind()) {
            case NO_FACE:
                return ResponseEntity.badRequest().body(Map.of("detail", "No face detected in image"));
            case NO_MATCH:
            case ERROR:
                return ResponseEntity.badRequest().body(Map.of("detail", outcome.getError()));
            default:
                return ResponseEntity.ok(outcome.toBody());
        }
    }

    @GetMapping
    public List<AttendanceRecord> getAttendance() {
        return toRecords(attendanceRepository.findAllByOrderByOccurredAtDesc());
    }

    // 🔹 All events of one calendar day in the configured zone
    @GetMapping("/by-date/{date}")
    public List<AttendanceRecord> getAttendanceByDate(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return toRecords(attendanceRepository
                .findByOccurredAtGreaterThanEqualAndOccurredAtLessThanOrderByOccurredAtDesc(
                        date.atStartOfDay(zone).toInstant(),
                        date.plusDays(1).atStartOfDay(zone).toInstant()));
    }

    @DeleteMapping("/{attendanceId}")
    public ResponseEntity<?> deleteAttendance(@PathVariable Long attendanceId) {
        Optional<Attendance> attendance = attendanceRepository.findById(attendanceId);
        if (attendance.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("detail", "Attendance record not found"));
        }
        Attendance removed = attendance.get();
        attendanceRepository.delete(removed);
        earlyExitService.forget(attendanceId);
        if (removed.getUserId() != null) {
            deduplicator.refresh(removed.getUserId(), removed.getEventType());
        }
        log.info("Attendance record deleted successfully: ID {}", attendanceId);
        return ResponseEntity.ok(Map.of("message", "Attendance record deleted successfully"));
    }

    private List<AttendanceRecord> toRecords(List<Attendance> events) {
        Map<Long, String> reasons = earlyExitService.reasonsFor(
                events.stream().map(Attendance::getId).collect(Collectors.toList()));
        return events.stream()
                .map(event -> AttendanceRecord.of(event, reasons.get(event.getId())))
                .collect(Collectors.toList());
    }
}
