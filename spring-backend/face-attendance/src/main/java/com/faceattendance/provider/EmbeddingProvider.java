package com.faceattendance.provider;

import java.util.List;

/**
 * External face detection and embedding service.
 */
public interface EmbeddingProvider {

    /**
     * Detects faces in an encoded image and returns one embedding per face.
     *
     * @param image encoded image bytes (JPEG, PNG, ...)
     * @return detected faces in provider order; empty when no face was found
     * @throws com.faceattendance.exception.AttendanceException
     *         {@code DECODE_ERROR}, {@code PROVIDER_TIMEOUT} or {@code PROVIDER_FAILURE}
     */
    List<DetectedFace> extract(byte[] image);
}
