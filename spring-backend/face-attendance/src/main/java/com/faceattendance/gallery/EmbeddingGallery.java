package com.faceattendance.gallery;

import com.faceattendance.config.AttendanceProperties;
import com.faceattendance.exception.AttendanceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory set of registered embeddings, one per user id.
 *
 * <p>Readers call {@link #snapshot()} which is a single volatile read. Writers
 * serialize on this object, copy the current entries, apply their change and
 * publish a new snapshot; readers holding an older snapshot are never
 * blocked. A mutation is visible to the next {@code snapshot()} call, not to
 * matching operations already in flight.
 */
@Component
public class EmbeddingGallery {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingGallery.class);

    private final int dimension;
    private final AtomicReference<GallerySnapshot> current = new AtomicReference<>(GallerySnapshot.empty());

    @Autowired
    public EmbeddingGallery(AttendanceProperties properties) {
        this(properties.getEmbeddingDimension());
    }

    public EmbeddingGallery(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Embedding dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    public int dimension() {
        return dimension;
    }

    public GallerySnapshot snapshot() {
        return current.get();
    }

    /**
     * Inserts or replaces the identity keyed by its user id.
     *
     * @throws AttendanceException {@code INVALID_IDENTITY} or {@code INVALID_EMBEDDING};
     *                             the gallery is left unchanged
     */
    public void upsert(Identity identity) {
        validate(identity);
        synchronized (this) {
            Map<String, Identity> next = copyEntries();
            Identity previous = next.put(identity.getUserId(), identity);
            publish(next);
            log.debug("{} identity {} (gallery size {})",
                    previous == null ? "Added" : "Replaced", identity.getUserId(), next.size());
        }
    }

    /** Removes the identity if present. */
    public void remove(String userId) {
        if (userId == null) {
            return;
        }
        synchronized (this) {
            GallerySnapshot snapshot = current.get();
            boolean present = snapshot.identities().stream().anyMatch(i -> i.getUserId().equals(userId));
            if (!present) {
                return;
            }
            Map<String, Identity> next = copyEntries();
            next.remove(userId);
            publish(next);
            log.debug("Removed identity {} (gallery size {})", userId, next.size());
        }
    }

    /**
     * Adds the given identities in one publish. Identities already present
     * win, so a registration that lands while the caller was still reading
     * storage is not overwritten or dropped. Invalid entries are skipped with
     * a warning.
     *
     * @return the gallery size after the load
     */
    public int loadAll(Collection<Identity> identities) {
        Map<String, Identity> loaded = new LinkedHashMap<>();
        for (Identity identity : identities) {
            try {
                validate(identity);
                loaded.put(identity.getUserId(), identity);
            } catch (AttendanceException e) {
                log.warn("Skipping identity {}: {}", identity == null ? null : identity.getUserId(), e.getMessage());
            }
        }
        synchronized (this) {
            Map<String, Identity> next = copyEntries();
            loaded.forEach(next::putIfAbsent);
            publish(next);
            return next.size();
        }
    }

    private void validate(Identity identity) {
        if (identity == null) {
            throw AttendanceException.invalidIdentity("Identity is required");
        }
        if (identity.getUserId() == null || identity.getUserId().isBlank()) {
            throw AttendanceException.invalidIdentity("User ID is required");
        }
        if (identity.getName() == null || identity.getName().isBlank()) {
            throw AttendanceException.invalidIdentity("Name is required");
        }
        Embeddings.validate(identity.embeddingView(), dimension);
    }

    private Map<String, Identity> copyEntries() {
        Map<String, Identity> copy = new LinkedHashMap<>();
        for (Identity identity : current.get().identities()) {
            copy.put(identity.getUserId(), identity);
        }
        return copy;
    }

    private void publish(Map<String, Identity> entries) {
        long version = current.get().version() + 1;
        current.set(new GallerySnapshot(new ArrayList<>(entries.values()), version));
    }
}
