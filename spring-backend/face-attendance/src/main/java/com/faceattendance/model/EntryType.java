package com.faceattendance.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EntryType {
    ENTRY,
    EXIT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Display form used in client messages, e.g. "Entry". */
    public String label() {
        return this == ENTRY ? "Entry" : "Exit";
    }

    /**
     * Parses the {@code entry_type} field sent by clients. A missing value
     * means entry.
     *
     * @throws IllegalArgumentException for anything other than entry/exit
     */
    public static EntryType fromWire(String value) {
        if (value == null || value.isBlank()) {
            return ENTRY;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "entry":
                return ENTRY;
            case "exit":
                return EXIT;
            default:
                throw new IllegalArgumentException("Invalid entry_type: " + value);
        }
    }
}
