package com.faceattendance.matching;

import lombok.Value;

/** One line of the ranked diagnostic list. */
@Value
public class SimilarityRow {

    String userId;
    String name;
    double similarity;
    boolean match;
}
