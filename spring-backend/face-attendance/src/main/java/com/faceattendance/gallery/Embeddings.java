package com.faceattendance.gallery;

import com.faceattendance.exception.AttendanceException;

/**
 * Vector helpers shared by the gallery and the matcher.
 */
public final class Embeddings {

    private static final double MIN_NORM = 1e-10;

    private Embeddings() {}

    public static double l2Norm(float[] v) {
        double sum = 0;
        for (float x : v) sum += (double) x * x;
        return Math.sqrt(sum);
    }

    /**
     * Rejects vectors that cannot take part in cosine similarity.
     *
     * @throws AttendanceException with {@code INVALID_EMBEDDING}
     */
    public static void validate(float[] v, int expectedDimension) {
        if (v == null || v.length == 0) {
            throw AttendanceException.invalidEmbedding("Embedding is empty");
        }
        if (v.length != expectedDimension) {
            throw AttendanceException.invalidEmbedding(
                    "Embedding dimension " + v.length + " does not match expected " + expectedDimension);
        }
        for (float x : v) {
            if (!Float.isFinite(x)) {
                throw AttendanceException.invalidEmbedding("Embedding contains non-finite values");
            }
        }
        if (l2Norm(v) < MIN_NORM) {
            throw AttendanceException.invalidEmbedding("Embedding has zero norm");
        }
    }

    public static boolean isDegenerate(double norm) {
        return norm < MIN_NORM;
    }
}
