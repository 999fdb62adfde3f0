package com.faceattendance.service;

/** Stages of one frame's trip through the pipeline. */
public enum PipelineStage {
    DECODING,
    MATCHING,
    RESPONDING
}
