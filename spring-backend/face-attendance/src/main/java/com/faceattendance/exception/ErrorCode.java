package com.faceattendance.exception;

/**
 * Failure categories of the recognition path. No-match outcomes and
 * "already marked" are results, not errors, and have no code here.
 */
public enum ErrorCode {
    DECODE_ERROR,
    NO_FACE_DETECTED,
    INVALID_EMBEDDING,
    INVALID_IDENTITY,
    PROVIDER_TIMEOUT,
    PROVIDER_FAILURE,
    PERSISTENCE_FAILURE
}
