package com.faceattendance.exception;

/**
 * Standard runtime exception of the attendance engine: an {@link ErrorCode}
 * plus a client-presentable message.
 */
public class AttendanceException extends RuntimeException {

    private final ErrorCode errorCode;

    public AttendanceException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AttendanceException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public static AttendanceException decodeError(String message) {
        return new AttendanceException(ErrorCode.DECODE_ERROR, message);
    }

    public static AttendanceException noFaceDetected() {
        return new AttendanceException(ErrorCode.NO_FACE_DETECTED, "No face detected in image");
    }

    public static AttendanceException invalidEmbedding(String message) {
        return new AttendanceException(ErrorCode.INVALID_EMBEDDING, message);
    }

    public static AttendanceException invalidIdentity(String message) {
        return new AttendanceException(ErrorCode.INVALID_IDENTITY, message);
    }
}
