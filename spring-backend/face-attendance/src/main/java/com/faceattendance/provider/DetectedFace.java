package com.faceattendance.provider;

import lombok.Value;

/** One face returned by the embedding provider. */
@Value
public class DetectedFace {

    float[] embedding;

    /** [x1, y1, x2, y2] in pixels; may be null if the provider omits it. */
    float[] boundingBox;
}
