package com.faceattendance.streaming;

/**
 * Lifecycle of one streaming connection. DECODING, MATCHING and RESPONDING
 * are the per-frame states; the session returns to OPEN after each frame.
 * CLOSED is terminal.
 */
public enum SessionState {
    CONNECTING,
    OPEN,
    DECODING,
    MATCHING,
    RESPONDING,
    CLOSED
}
