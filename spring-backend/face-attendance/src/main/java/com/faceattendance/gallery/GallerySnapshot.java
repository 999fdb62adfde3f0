package com.faceattendance.gallery;

import java.util.Collections;
import java.util.List;

/**
 * Point-in-time, immutable view of the gallery. A matching call holds on to
 * one snapshot for its whole duration and never sees later mutations.
 */
public final class GallerySnapshot {

    private static final GallerySnapshot EMPTY = new GallerySnapshot(Collections.emptyList(), 0L);

    private final List<Identity> identities;
    private final long version;

    GallerySnapshot(List<Identity> identities, long version) {
        this.identities = Collections.unmodifiableList(identities);
        this.version = version;
    }

    public static GallerySnapshot empty() {
        return EMPTY;
    }

    /** Builds a detached snapshot, mainly for tests and diagnostics. */
    public static GallerySnapshot of(List<Identity> identities) {
        return new GallerySnapshot(List.copyOf(identities), 0L);
    }

    public List<Identity> identities() {
        return identities;
    }

    public int size() {
        return identities.size();
    }

    public boolean isEmpty() {
        return identities.isEmpty();
    }

    /** Monotonic publish counter; 0 for detached snapshots. */
    public long version() {
        return version;
    }
}
