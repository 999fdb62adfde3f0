package com.faceattendance.service;

import com.faceattendance.model.Attendance;
import lombok.Value;

/**
 * How an event compares with the office hours. {@code note} is appended to
 * the client message when set.
 */
@Value
public class Punctuality {

    public static final Punctuality ON_TIME = new Punctuality(false, null, false, null);

    boolean late;
    Integer minutesLate;
    boolean earlyExit;
    String note;

    static Punctuality late(int minutesLate, String note) {
        return new Punctuality(true, minutesLate, false, note);
    }

    static Punctuality earlyExit(String note) {
        return new Punctuality(false, null, true, note);
    }

    void applyTo(Attendance event) {
        event.setLate(late);
        event.setMinutesLate(minutesLate);
        event.setEarlyExit(earlyExit);
    }
}
