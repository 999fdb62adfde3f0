package com.faceattendance.service;

import com.faceattendance.dto.AttendanceUpdate;
import com.faceattendance.model.Attendance;
import com.faceattendance.model.EarlyExitReason;
import com.faceattendance.model.EntryType;
import com.faceattendance.model.User;
import com.faceattendance.repository.AttendanceRepository;
import com.faceattendance.repository.EarlyExitReasonRepository;
import com.faceattendance.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reasons people give for leaving before the office logout time. A reason
 * belongs to one exit event.
 */
@Service
public class EarlyExitService {
    private static final Logger log = LoggerFactory.getLogger(EarlyExitService.class);

    static final String UNKNOWN_USER = "Unknown";

    private final AttendanceRepository attendanceRepository;
    private final EarlyExitReasonRepository reasonRepository;
    private final UserRepository userRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public EarlyExitService(AttendanceRepository attendanceRepository,
                            EarlyExitReasonRepository reasonRepository,
                            UserRepository userRepository,
                            ApplicationEventPublisher eventPublisher,
                            Clock clock) {
        this.attendanceRepository = attendanceRepository;
        this.reasonRepository = reasonRepository;
        this.userRepository = userRepository;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Stores a reason for the given exit event and broadcasts it.
     *
     * @return empty if no attendance record has that id
     * @throws IllegalArgumentException for a missing reason or a record that is not an exit
     */
    public Optional<EarlyExitReason> submit(Long attendanceId, String reason) {
        if (attendanceId == null || reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Missing required fields");
        }
        Optional<Attendance> attendance = attendanceRepository.findById(attendanceId);
        if (attendance.isEmpty()) {
            log.warn("Attendance record not found for early exit reason: {}", attendanceId);
            return Optional.empty();
        }
        Attendance exit = attendance.get();
        if (exit.getEventType() != EntryType.EXIT) {
            throw new IllegalArgumentException("Early exit reason can only be given for an exit record");
        }

        EarlyExitReason entry = new EarlyExitReason();
        entry.setUserId(exit.getUserId());
        entry.setAttendanceId(exit.getId());
        entry.setReason(reason.trim());
        entry.setCreatedAt(clock.instant());
        EarlyExitReason saved = reasonRepository.save(entry);

        String name = userRepository.findByUserId(exit.getUserId()).map(User::getName).orElse(UNKNOWN_USER);
        eventPublisher.publishEvent(new AttendanceRecordedEvent(List.of(AttendanceUpdate.builder()
                .action("early_exit_reason")
                .userId(exit.getUserId())
                .name(name)
                .timestamp(saved.getCreatedAt())
                .attendanceId(exit.getId())
                .earlyExit(exit.isEarlyExit())
                .reason(saved.getReason())
                .build())));
        log.info("Early exit reason submitted for {} (attendance {})", exit.getUserId(), exit.getId());
        return Optional.of(saved);
    }

    public List<EarlyExitReason> listReasons() {
        return reasonRepository.findAllByOrderByCreatedAtDesc();
    }

    /** Latest reason per attendance id, for the listings. */
    public Map<Long, String> reasonsFor(Collection<Long> attendanceIds) {
        Map<Long, String> reasons = new HashMap<>();
        if (attendanceIds.isEmpty()) {
            return reasons;
        }
        for (EarlyExitReason reason : reasonRepository.findByAttendanceIdIn(attendanceIds)) {
            reasons.merge(reason.getAttendanceId(), reason.getReason(), (older, newer) -> newer);
        }
        return reasons;
    }

    /** Drops the reasons of a deleted attendance record. */
    public void forget(Long attendanceId) {
        long removed = reasonRepository.deleteByAttendanceId(attendanceId);
        if (removed > 0) {
            log.debug("Removed {} early exit reason(s) of attendance {}", removed, attendanceId);
        }
    }

    public Map<String, String> userNames() {
        Map<String, String> names = new HashMap<>();
        for (User user : userRepository.findAll()) {
            names.put(user.getUserId(), user.getName());
        }
        return names;
    }
}
