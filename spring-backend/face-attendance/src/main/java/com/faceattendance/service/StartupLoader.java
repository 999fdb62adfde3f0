package com.faceattendance.service;

import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

/**
 * Rebuilds in-memory state from the database once all singletons exist,
 * which is before the embedded web server starts taking REST and WebSocket
 * traffic.
 */
@Component
public class StartupLoader implements SmartInitializingSingleton {

    private final RegistrationService registrationService;
    private final AttendanceDeduplicator deduplicator;
    private final OfficeTimingService officeTimings;

    public StartupLoader(RegistrationService registrationService,
                         AttendanceDeduplicator deduplicator,
                         OfficeTimingService officeTimings) {
        this.registrationService = registrationService;
        this.deduplicator = deduplicator;
        this.officeTimings = officeTimings;
    }

    @Override
    public void afterSingletonsInstantiated() {
        registrationService.reloadGallery();
        deduplicator.warmUp();
        officeTimings.load();
    }
}
