package com.faceattendance.service;

import com.faceattendance.dto.AttendanceUpdate;

import java.util.List;

/**
 * Published after a frame produced at least one new attendance event.
 */
public class AttendanceRecordedEvent {

    private final List<AttendanceUpdate> updates;

    public AttendanceRecordedEvent(List<AttendanceUpdate> updates) {
        this.updates = List.copyOf(updates);
    }

    public List<AttendanceUpdate> getUpdates() {
        return updates;
    }
}
