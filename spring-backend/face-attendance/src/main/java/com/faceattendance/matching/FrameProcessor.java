package com.faceattendance.matching;

import com.faceattendance.gallery.GallerySnapshot;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Matches every face found in one frame against the same snapshot. Results
 * come back in input order. Nothing is deduplicated or persisted here.
 */
@Component
public class FrameProcessor {

    private final SimilarityMatcher matcher;

    public FrameProcessor(SimilarityMatcher matcher) {
        this.matcher = matcher;
    }

    /**
     * @return one result per query; empty when the frame had no faces, which
     * the caller reports as "no face detected"
     */
    public List<MatchResult> process(List<float[]> queries, GallerySnapshot snapshot, double threshold) {
        if (queries == null || queries.isEmpty()) {
            return Collections.emptyList();
        }
        if (queries.size() == 1) {
            return List.of(matcher.match(queries.get(0), snapshot, threshold));
        }
        // Ordered parallel stream keeps input order in the collected list
        return queries.parallelStream()
                .map(query -> matcher.match(query, snapshot, threshold))
                .collect(Collectors.toList());
    }
}
