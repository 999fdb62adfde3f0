package com.faceattendance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under the {@code attendance.*} prefix.
 */
@Data
@ConfigurationProperties(prefix = "attendance")
public class AttendanceProperties {

    /** Vector length produced by the embedding provider. */
    private int embeddingDimension = 512;

    /** Minimum cosine similarity for a match to be accepted. */
    private double matchThreshold = 0.6;

    /**
     * Minimum time between two accepted events of the same type for the same
     * person. Must stay well above the client's frame interval.
     */
    private Duration cooldown = Duration.ofMinutes(5);

    /** Zone used for calendar dates in by-date listings and for office hours. */
    private String zoneId = "Asia/Kolkata";

    /** Entries later than the office login time plus this period are flagged late. */
    private Duration lateGracePeriod = Duration.ofHours(1);

    private final Provider provider = new Provider();

    private final Streaming streaming = new Streaming();

    @Data
    public static class Provider {

        /** Base URL of the embedding service. */
        private String url = "http://localhost:8000";

        /** Connect and read timeout for one extraction call. */
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Streaming {

        /** Threads shared by all WebSocket sessions for frame processing. */
        private int workerThreads = 4;

        /** Frames a single session may have queued or in flight. */
        private int maxPendingFrames = 2;

        /** Largest inbound text message; frames arrive as base64 data URLs. */
        private int maxMessageBytes = 4 * 1024 * 1024;
    }
}
