package com.faceattendance.matching;

import com.faceattendance.gallery.GallerySnapshot;
import com.faceattendance.gallery.Identity;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FrameProcessorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T08:00:00Z");

    private final FrameProcessor processor = new FrameProcessor(new SimilarityMatcher());

    private final GallerySnapshot snapshot = GallerySnapshot.of(List.of(
            new Identity("U1", "Alice", new float[]{1f, 0f, 0f, 0f}, T0),
            new Identity("U2", "Bob", new float[]{0f, 1f, 0f, 0f}, T0),
            new Identity("U3", "Carol", new float[]{0f, 0f, 1f, 0f}, T0)));

    @Test
    void noQueriesGiveNoResults() {
        assertTrue(processor.process(Collections.emptyList(), snapshot, 0.6).isEmpty());
        assertTrue(processor.process(null, snapshot, 0.6).isEmpty());
    }

    @Test
    void resultsFollowInputOrder() {
        List<float[]> queries = new ArrayList<>();
        List<String> expected = new ArrayList<>();
        String[] ids = {"U1", "U2", "U3"};
        for (int i = 0; i < 60; i++) {
            float[] q = new float[4];
            q[i % 3] = 1f;
            q[3] = 0.1f;
            queries.add(q);
            expected.add(ids[i % 3]);
        }

        List<MatchResult> results = processor.process(queries, snapshot, 0.6);

        assertEquals(queries.size(), results.size());
        for (int i = 0; i < results.size(); i++) {
            assertEquals(expected.get(i), results.get(i).getUserId(), "position " + i);
        }
    }

    @Test
    void unmatchedFacesKeepTheirSlot() {
        List<MatchResult> results = processor.process(List.of(
                new float[]{1f, 0f, 0f, 0f},
                new float[]{0f, 0f, 0f, 1f}), snapshot, 0.6);

        assertEquals(2, results.size());
        assertTrue(results.get(0).isAccepted());
        assertEquals("U1", results.get(0).getUserId());
        assertFalse(results.get(1).isAccepted());
        assertEquals(MatchReason.BELOW_THRESHOLD, results.get(1).getReason());
    }
}
