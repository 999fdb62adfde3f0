package com.faceattendance.service;

import com.faceattendance.config.AttendanceProperties;
import com.faceattendance.model.EntryType;
import com.faceattendance.model.OfficeTiming;
import com.faceattendance.repository.OfficeTimingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Office hours used to flag late entries and early exits. The stored row is
 * cached in memory so frames never query it; {@link #update} writes through.
 */
@Service
public class OfficeTimingService {
    private static final Logger log = LoggerFactory.getLogger(OfficeTimingService.class);

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    private final OfficeTimingRepository officeTimingRepository;
    private final Clock clock;
    private final ZoneId zone;
    private final Duration gracePeriod;

    private final AtomicReference<OfficeTiming> current = new AtomicReference<>();

    public OfficeTimingService(OfficeTimingRepository officeTimingRepository,
                               Clock clock,
                               AttendanceProperties properties) {
        this.officeTimingRepository = officeTimingRepository;
        this.clock = clock;
        this.zone = ZoneId.of(properties.getZoneId());
        this.gracePeriod = properties.getLateGracePeriod();
    }

    public ZoneId getZone() {
        return zone;
    }

    /** Reads the stored timings into the cache. */
    public void load() {
        current.set(officeTimingRepository.findFirstByOrderByIdAsc().orElse(null));
        log.info("Office timings: {}", current.get() == null ? "not set" : describe(current.get()));
    }

    public Optional<OfficeTiming> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Stores new office hours, replacing the previous ones.
     *
     * @param loginTime  {@code HH:mm}
     * @param logoutTime {@code HH:mm}
     * @throws IllegalArgumentException when either time cannot be parsed
     */
    public synchronized OfficeTiming update(String loginTime, String logoutTime) {
        LocalTime login = parse(loginTime);
        LocalTime logout = parse(logoutTime);

        OfficeTiming timing = officeTimingRepository.findFirstByOrderByIdAsc().orElseGet(OfficeTiming::new);
        timing.setLoginTime(login);
        timing.setLogoutTime(logout);
        timing.setUpdatedAt(clock.instant());
        OfficeTiming saved = officeTimingRepository.save(timing);
        current.set(saved);
        log.info("Office timings updated: {}", describe(saved));
        return saved;
    }

    /**
     * Compares an event time with the office hours of the same local day.
     * Without stored timings every event is on time.
     */
    public Punctuality evaluate(EntryType eventType, Instant at) {
        OfficeTiming timing = current.get();
        if (timing == null) {
            return Punctuality.ON_TIME;
        }
        ZonedDateTime local = at.atZone(zone);

        if (eventType == EntryType.ENTRY) {
            if (timing.getLoginTime() == null) {
                return Punctuality.ON_TIME;
            }
            ZonedDateTime login = local.toLocalDate().atTime(timing.getLoginTime()).atZone(zone);
            ZonedDateTime graceEnd = login.plus(gracePeriod);
            if (!local.isAfter(graceEnd)) {
                return Punctuality.ON_TIME;
            }
            int minutesLate = (int) Duration.between(login, local).toMinutes();
            return Punctuality.late(minutesLate, String.format("Late arrival: %s (%d minutes late, Office time: %s, Grace period: %s)",
                    HH_MM.format(local), minutesLate, HH_MM.format(login), HH_MM.format(graceEnd)));
        }

        if (timing.getLogoutTime() == null) {
            return Punctuality.ON_TIME;
        }
        ZonedDateTime logout = local.toLocalDate().atTime(timing.getLogoutTime()).atZone(zone);
        if (local.isBefore(logout)) {
            return Punctuality.earlyExit(String.format("Early exit: %s (Office time: %s)",
                    HH_MM.format(local), HH_MM.format(logout)));
        }
        return Punctuality.ON_TIME;
    }

    public static String format(LocalTime time) {
        return time == null ? null : HH_MM.format(time);
    }

    private static LocalTime parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Invalid time format. Use HH:MM");
        }
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid time format. Use HH:MM", e);
        }
    }

    private static String describe(OfficeTiming timing) {
        return format(timing.getLoginTime()) + " - " + format(timing.getLogoutTime());
    }
}
