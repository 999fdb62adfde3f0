package com.faceattendance.service;

/**
 * Notified before each pipeline stage starts. Throwing
 * {@link java.util.concurrent.CancellationException} abandons the frame at
 * that point; work already issued, such as a persisted event, is not undone.
 */
@FunctionalInterface
public interface StageListener {

    StageListener NONE = stage -> { };

    void beforeStage(PipelineStage stage);
}
