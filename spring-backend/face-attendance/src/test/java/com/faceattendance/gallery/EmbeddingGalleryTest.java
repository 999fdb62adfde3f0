package com.faceattendance.gallery;

import com.faceattendance.exception.AttendanceException;
import com.faceattendance.exception.ErrorCode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddingGalleryTest {

    private static final Instant T0 = Instant.parse("2024-03-01T08:00:00Z");

    private final EmbeddingGallery gallery = new EmbeddingGallery(3);

    @Test
    void upsertPublishesToNextSnapshot() {
        GallerySnapshot before = gallery.snapshot();
        gallery.upsert(identity("U1", "Alice", 1f, 0f, 0f));

        assertTrue(before.isEmpty());
        GallerySnapshot after = gallery.snapshot();
        assertEquals(1, after.size());
        assertEquals("U1", after.identities().get(0).getUserId());
        assertTrue(after.version() > before.version());
    }

    @Test
    void upsertReplacesByUserId() {
        gallery.upsert(identity("U1", "Alice", 1f, 0f, 0f));
        gallery.upsert(identity("U1", "Alice B.", 0f, 1f, 0f));

        GallerySnapshot snapshot = gallery.snapshot();
        assertEquals(1, snapshot.size());
        assertEquals("Alice B.", snapshot.identities().get(0).getName());
        assertArrayEquals(new float[]{0f, 1f, 0f}, snapshot.identities().get(0).getEmbedding());
    }

    @Test
    void heldSnapshotDoesNotSeeLaterMutations() {
        gallery.upsert(identity("U1", "Alice", 1f, 0f, 0f));
        GallerySnapshot held = gallery.snapshot();

        gallery.upsert(identity("U2", "Bob", 0f, 1f, 0f));
        gallery.remove("U1");

        assertEquals(1, held.size());
        assertEquals("U1", held.identities().get(0).getUserId());
        assertEquals("U2", gallery.snapshot().identities().get(0).getUserId());
    }

    @Test
    void wrongDimensionIsRejectedAndGalleryUnchanged() {
        gallery.upsert(identity("U1", "Alice", 1f, 0f, 0f));

        AttendanceException e = assertThrows(AttendanceException.class,
                () -> gallery.upsert(identity("U2", "Bob", 1f, 0f)));
        assertEquals(ErrorCode.INVALID_EMBEDDING, e.getErrorCode());
        assertEquals(1, gallery.snapshot().size());
    }

    @Test
    void zeroNormAndNonFiniteEmbeddingsAreRejected() {
        assertEquals(ErrorCode.INVALID_EMBEDDING, assertThrows(AttendanceException.class,
                () -> gallery.upsert(identity("U1", "Alice", 0f, 0f, 0f))).getErrorCode());
        assertEquals(ErrorCode.INVALID_EMBEDDING, assertThrows(AttendanceException.class,
                () -> gallery.upsert(identity("U1", "Alice", Float.NaN, 1f, 0f))).getErrorCode());
        assertTrue(gallery.snapshot().isEmpty());
    }

    @Test
    void blankIdOrNameIsRejected() {
        assertEquals(ErrorCode.INVALID_IDENTITY, assertThrows(AttendanceException.class,
                () -> gallery.upsert(identity("", "Alice", 1f, 0f, 0f))).getErrorCode());
        assertEquals(ErrorCode.INVALID_IDENTITY, assertThrows(AttendanceException.class,
                () -> gallery.upsert(identity("U1", "  ", 1f, 0f, 0f))).getErrorCode());
        assertTrue(gallery.snapshot().isEmpty());
    }

    @Test
    void removeIsIdempotent() {
        gallery.upsert(identity("U1", "Alice", 1f, 0f, 0f));
        gallery.remove("U1");
        long version = gallery.snapshot().version();

        gallery.remove("U1");
        gallery.remove("missing");
        gallery.remove(null);

        assertTrue(gallery.snapshot().isEmpty());
        assertEquals(version, gallery.snapshot().version());
    }

    @Test
    void loadAllSkipsInvalidEntries() {
        int loaded = gallery.loadAll(List.of(
                identity("U1", "Alice", 1f, 0f, 0f),
                identity("U2", "Bob", 1f, 0f),
                identity("U3", "Carol", 0f, 0f, 1f)));

        assertEquals(2, loaded);
        assertEquals(2, gallery.snapshot().size());
    }

    @Test
    void loadAllKeepsIdentitiesPublishedMeanwhile() {
        Identity registeredDuringLoad = identity("U9", "Ivy", 0f, 1f, 0f);
        gallery.upsert(registeredDuringLoad);

        int size = gallery.loadAll(List.of(
                identity("U1", "Alice", 1f, 0f, 0f),
                identity("U9", "Stale Ivy", 0f, 0f, 1f)));

        assertEquals(2, size);
        assertEquals(2, gallery.snapshot().size());
        assertEquals("Ivy", gallery.snapshot().identities().stream()
                .filter(i -> i.getUserId().equals("U9"))
                .findFirst().orElseThrow().getName());
    }

    @Test
    void identityKeepsItsOwnCopyOfTheEmbedding() {
        float[] vector = {1f, 0f, 0f};
        Identity identity = new Identity("U1", "Alice", vector, T0);
        vector[0] = 5f;
        identity.getEmbedding()[1] = 7f;

        assertArrayEquals(new float[]{1f, 0f, 0f}, identity.getEmbedding());
        assertEquals(1.0, identity.getNorm(), 1e-9);
    }

    @Test
    void readersProceedWhileWritersPublish() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?> writer = pool.submit(() -> {
                start.await();
                for (int i = 0; i < 200; i++) {
                    gallery.upsert(identity("U" + i, "User " + i, 1f, i, 0f));
                }
                return null;
            });
            Future<?>[] readers = new Future<?>[4];
            for (int r = 0; r < readers.length; r++) {
                readers[r] = pool.submit(() -> {
                    start.await();
                    long lastVersion = -1;
                    for (int i = 0; i < 500; i++) {
                        GallerySnapshot snapshot = gallery.snapshot();
                        assertTrue(snapshot.version() >= lastVersion);
                        assertEquals(snapshot.size(), snapshot.identities().size());
                        lastVersion = snapshot.version();
                    }
                    return null;
                });
            }
            start.countDown();
            writer.get(10, TimeUnit.SECONDS);
            for (Future<?> reader : readers) {
                reader.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(200, gallery.snapshot().size());
    }

    private static Identity identity(String id, String name, float... embedding) {
        return new Identity(id, name, embedding, T0);
    }
}
