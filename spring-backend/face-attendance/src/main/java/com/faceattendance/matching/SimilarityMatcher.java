package com.faceattendance.matching;

import com.faceattendance.exception.AttendanceException;
import com.faceattendance.gallery.Embeddings;
import com.faceattendance.gallery.GallerySnapshot;
import com.faceattendance.gallery.Identity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Cosine-similarity matcher. Stateless and read-only against the snapshot it
 * is given, so any number of calls may run concurrently.
 */
@Component
public class SimilarityMatcher {

    /**
     * Finds the best identity for {@code query}.
     *
     * <ul>
     *   <li>empty snapshot: {@link MatchReason#EMPTY_GALLERY}</li>
     *   <li>two or more identities exactly tied at the maximum: {@link MatchReason#AMBIGUOUS_MATCH}</li>
     *   <li>maximum below {@code threshold}: {@link MatchReason#BELOW_THRESHOLD}</li>
     * </ul>
     *
     * @param threshold minimum similarity in [0, 1]
     * @throws AttendanceException {@code INVALID_EMBEDDING} for a zero-norm query or a
     *                             dimension mismatch
     */
    public MatchResult match(float[] query, GallerySnapshot snapshot, double threshold) {
        checkThreshold(threshold);
        if (snapshot.isEmpty()) {
            return MatchResult.emptyGallery();
        }
        double queryNorm = queryNorm(query);

        Identity best = null;
        double bestSimilarity = Double.NEGATIVE_INFINITY;
        int tied = 0;
        for (Identity candidate : snapshot.identities()) {
            double similarity = cosine(query, queryNorm, candidate);
            if (similarity > bestSimilarity) {
                best = candidate;
                bestSimilarity = similarity;
                tied = 1;
            } else if (similarity == bestSimilarity) {
                tied++;
            }
        }

        if (tied > 1) {
            return MatchResult.ambiguous(bestSimilarity);
        }
        if (bestSimilarity >= threshold) {
            return MatchResult.matched(best, bestSimilarity);
        }
        return MatchResult.belowThreshold(bestSimilarity);
    }

    /**
     * Similarity of {@code query} against every identity, highest first. Each
     * row is flagged against {@code threshold}; no acceptance decision is made.
     */
    public List<SimilarityRow> rank(float[] query, GallerySnapshot snapshot, double threshold) {
        checkThreshold(threshold);
        List<SimilarityRow> rows = new ArrayList<>(snapshot.size());
        if (snapshot.isEmpty()) {
            return rows;
        }
        double queryNorm = queryNorm(query);
        for (Identity candidate : snapshot.identities()) {
            double similarity = cosine(query, queryNorm, candidate);
            rows.add(new SimilarityRow(candidate.getUserId(), candidate.getName(), similarity,
                    similarity >= threshold));
        }
        rows.sort(Comparator.comparingDouble(SimilarityRow::getSimilarity).reversed());
        return rows;
    }

    /**
     * dot(a, b) / (|a| * |b|), clamped to [-1, 1].
     *
     * @throws AttendanceException {@code INVALID_EMBEDDING} if either vector has zero
     *                             norm or the lengths differ
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        double normA = queryNorm(a);
        double normB = queryNorm(b);
        if (a.length != b.length) {
            throw AttendanceException.invalidEmbedding(
                    "Embedding dimension mismatch: " + a.length + " vs " + b.length);
        }
        return clamp(dot(a, b) / (normA * normB));
    }

    private static double cosine(float[] query, double queryNorm, Identity candidate) {
        float[] stored = candidate.embeddingView();
        if (stored.length != query.length) {
            throw AttendanceException.invalidEmbedding(
                    "Embedding dimension " + query.length + " does not match gallery dimension " + stored.length);
        }
        if (Embeddings.isDegenerate(candidate.getNorm())) {
            throw AttendanceException.invalidEmbedding("Stored embedding for " + candidate.getUserId() + " has zero norm");
        }
        return clamp(dot(query, stored) / (queryNorm * candidate.getNorm()));
    }

    private static double queryNorm(float[] v) {
        if (v == null || v.length == 0) {
            throw AttendanceException.invalidEmbedding("Embedding is empty");
        }
        double norm = Embeddings.l2Norm(v);
        if (Embeddings.isDegenerate(norm)) {
            throw AttendanceException.invalidEmbedding("Embedding has zero norm");
        }
        return norm;
    }

    private static double dot(float[] a, float[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    private static double clamp(double v) {
        return Math.max(-1.0, Math.min(1.0, v));
    }

    private static void checkThreshold(double threshold) {
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("Threshold must be within [0, 1]: " + threshold);
        }
    }
}
