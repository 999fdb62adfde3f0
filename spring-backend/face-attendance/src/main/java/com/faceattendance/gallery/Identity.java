package com.faceattendance.gallery;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable gallery entry: a registered person and the embedding used to
 * recognize them. The L2 norm is computed once here so matching does not
 * recompute it for every query.
 */
public final class Identity {

    private final String userId;
    private final String name;
    private final float[] embedding;
    private final double norm;
    private final Instant registeredAt;

    public Identity(String userId, String name, float[] embedding, Instant registeredAt) {
        this.userId = userId;
        this.name = name;
        this.embedding = embedding == null ? null : embedding.clone();
        this.norm = embedding == null ? 0.0 : Embeddings.l2Norm(embedding);
        this.registeredAt = registeredAt;
    }

    public String getUserId() { return userId; }

    public String getName() { return name; }

    /** Returns a copy; use {@link #embeddingView()} on hot paths. */
    public float[] getEmbedding() { return embedding == null ? null : embedding.clone(); }

    /** The backing array, without copying. Callers must not modify it. */
    public float[] embeddingView() { return embedding; }

    public double getNorm() { return norm; }

    public Instant getRegisteredAt() { return registeredAt; }

    public int dimension() { return embedding == null ? 0 : embedding.length; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Identity)) return false;
        Identity other = (Identity) o;
        return Objects.equals(userId, other.userId)
                && Objects.equals(name, other.name)
                && Arrays.equals(embedding, other.embedding)
                && Objects.equals(registeredAt, other.registeredAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, name, registeredAt) * 31 + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "Identity{" +
                "userId='" + userId + '\'' +
                ", name='" + name + '\'' +
                ", dimension=" + dimension() +
                ", registeredAt=" + registeredAt +
                '}';
    }
}
