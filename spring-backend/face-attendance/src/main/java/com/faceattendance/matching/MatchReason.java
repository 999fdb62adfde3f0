package com.faceattendance.matching;

public enum MatchReason {
    MATCHED,
    BELOW_THRESHOLD,
    AMBIGUOUS_MATCH,
    EMPTY_GALLERY
}
