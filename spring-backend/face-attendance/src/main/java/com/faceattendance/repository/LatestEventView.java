package com.faceattendance.repository;

import com.faceattendance.model.EntryType;

import java.time.Instant;

public interface LatestEventView {

    String getUserId();

    EntryType getEventType();

    Instant getLastOccurredAt();
}
