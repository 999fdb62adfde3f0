package com.faceattendance.dto;

import com.faceattendance.matching.SimilarityRow;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/** Body of {@code POST /debug/face-recognition}. */
@Value
public class DiagnosticResponse {

    @JsonProperty("match_found")
    boolean matchFound;

    @JsonProperty("best_match")
    Candidate bestMatch;

    double threshold;

    @JsonProperty("all_similarities")
    List<Candidate> allSimilarities;

    @Value
    public static class Candidate {

        @JsonProperty("user_id")
        String userId;

        String name;

        double similarity;

        public static Candidate of(SimilarityRow row) {
            return new Candidate(row.getUserId(), row.getName(), row.getSimilarity());
        }
    }
}
