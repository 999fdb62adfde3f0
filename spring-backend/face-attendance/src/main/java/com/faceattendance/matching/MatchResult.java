package com.faceattendance.matching;

import com.faceattendance.gallery.Identity;
import lombok.Value;

/**
 * Outcome of matching one query embedding against a gallery snapshot.
 * {@code userId} and {@code name} are set only when the match is accepted.
 */
@Value
public class MatchResult {

    String userId;
    String name;
    double similarity;
    boolean accepted;
    MatchReason reason;

    public static MatchResult matched(Identity identity, double similarity) {
        return new MatchResult(identity.getUserId(), identity.getName(), similarity, true, MatchReason.MATCHED);
    }

    public static MatchResult belowThreshold(double bestSimilarity) {
        return new MatchResult(null, null, bestSimilarity, false, MatchReason.BELOW_THRESHOLD);
    }

    public static MatchResult ambiguous(double similarity) {
        return new MatchResult(null, null, similarity, false, MatchReason.AMBIGUOUS_MATCH);
    }

    public static MatchResult emptyGallery() {
        return new MatchResult(null, null, 0.0, false, MatchReason.EMPTY_GALLERY);
    }
}
