package com.faceattendance.service;

import com.faceattendance.config.AttendanceProperties;
import com.faceattendance.dto.AttendanceUpdate;
import com.faceattendance.dto.DiagnosticResponse;
import com.faceattendance.dto.FrameOutcome;
import com.faceattendance.dto.UserOutcome;
import com.faceattendance.exception.AttendanceException;
import com.faceattendance.exception.ErrorCode;
import com.faceattendance.gallery.EmbeddingGallery;
import com.faceattendance.gallery.GallerySnapshot;
import com.faceattendance.matching.FrameProcessor;
import com.faceattendance.matching.MatchReason;
import com.faceattendance.matching.MatchResult;
import com.faceattendance.matching.SimilarityMatcher;
import com.faceattendance.matching.SimilarityRow;
import com.faceattendance.model.Attendance;
import com.faceattendance.model.EntryType;
import com.faceattendance.provider.DetectedFace;
import com.faceattendance.provider.EmbeddingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Image in, attendance outcome out: decode check, embedding extraction,
 * matching against the current gallery snapshot and deduplication of every
 * accepted match. Shared by the single-shot REST capture and the streaming
 * sessions.
 */
@Service
public class AttendancePipeline {
    private static final Logger log = LoggerFactory.getLogger(AttendancePipeline.class);

    static final String NO_MATCH_MESSAGE = "No matching user found";
    static final String AMBIGUOUS_MESSAGE = "Ambiguous match";

    private final EmbeddingProvider embeddingProvider;
    private final EmbeddingGallery gallery;
    private final FrameProcessor frameProcessor;
    private final SimilarityMatcher matcher;
    private final AttendanceDeduplicator deduplicator;
    private final OfficeTimingService officeTimings;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final double threshold;

    public AttendancePipeline(EmbeddingProvider embeddingProvider,
                              EmbeddingGallery gallery,
                              FrameProcessor frameProcessor,
                              SimilarityMatcher matcher,
                              AttendanceDeduplicator deduplicator,
                              OfficeTimingService officeTimings,
                              ApplicationEventPublisher eventPublisher,
                              Clock clock,
                              AttendanceProperties properties) {
        this.embeddingProvider = embeddingProvider;
        this.gallery = gallery;
        this.frameProcessor = frameProcessor;
        this.matcher = matcher;
        this.deduplicator = deduplicator;
        this.officeTimings = officeTimings;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.threshold = properties.getMatchThreshold();
    }

    public double getThreshold() {
        return threshold;
    }

    public FrameOutcome capture(byte[] image, EntryType eventType) {
        return capture(image, eventType, StageListener.NONE);
    }

    /**
     * Runs one frame through the pipeline.
     *
     * @throws AttendanceException on decode or provider failure, and on a
     *                             persistence failure when the frame had a single face
     */
    public FrameOutcome capture(byte[] image, EntryType eventType, StageListener listener) {
        listener.beforeStage(PipelineStage.DECODING);
        ImagePayloads.requireImage(image);
        return recognize(image, eventType, listener);
    }

    /**
     * As {@link #capture(byte[], EntryType, StageListener)} for bytes that
     * {@link ImagePayloads#fromDataUrl} has already verified.
     */
    public FrameOutcome captureVerified(byte[] image, EntryType eventType, StageListener listener) {
        listener.beforeStage(PipelineStage.DECODING);
        return recognize(image, eventType, listener);
    }

    private FrameOutcome recognize(byte[] image, EntryType eventType, StageListener listener) {
        List<DetectedFace> faces = embeddingProvider.extract(image);
        if (faces.isEmpty()) {
            log.debug("No face detected in frame");
            return FrameOutcome.noFace();
        }

        listener.beforeStage(PipelineStage.MATCHING);
        GallerySnapshot snapshot = gallery.snapshot();
        List<float[]> queries = faces.stream().map(DetectedFace::getEmbedding).collect(Collectors.toList());
        List<MatchResult> results = frameProcessor.process(queries, snapshot, threshold);

        Instant now = clock.instant();
        Punctuality punctuality = officeTimings.evaluate(eventType, now);
        List<UserOutcome> users = new ArrayList<>(results.size());
        List<AttendanceUpdate> updates = new ArrayList<>();
        for (MatchResult result : results) {
            if (!result.isAccepted()) {
                users.add(unmatched(result));
                continue;
            }
            DedupDecision decision;
            try {
                decision = deduplicator.decide(result.getUserId(), eventType, result.getSimilarity(), now,
                        punctuality::applyTo);
            } catch (AttendanceException e) {
                // One face failing must not hide the events already stored for the others
                if (results.size() == 1 || e.getErrorCode() != ErrorCode.PERSISTENCE_FAILURE) {
                    throw e;
                }
                users.add(new UserOutcome(UserOutcome.Status.FAILED,
                        "Failed to record " + eventType.wireName(),
                        result.getUserId(), result.getName(), null, result.getSimilarity()));
                continue;
            }
            if (decision.isAccepted()) {
                Attendance event = decision.getEvent();
                users.add(marked(result, eventType, event, punctuality));
                updates.add(update(result, eventType, event));
            } else {
                users.add(new UserOutcome(UserOutcome.Status.ALREADY_MARKED,
                        eventType.label() + " already marked",
                        result.getUserId(), result.getName(), decision.getLastEventAt(), result.getSimilarity()));
            }
        }

        if (!updates.isEmpty()) {
            eventPublisher.publishEvent(new AttendanceRecordedEvent(updates));
        }
        return FrameOutcome.of(users, updates, threshold);
    }

    /**
     * Ranks the first detected face against every registered user. Nothing is
     * recorded.
     *
     * @param threshold threshold to flag rows with, in [0, 1]
     * @throws AttendanceException {@code NO_FACE_DETECTED} when the image has no face
     */
    public DiagnosticResponse diagnose(byte[] image, double threshold) {
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("Threshold must be within [0, 1]: " + threshold);
        }
        ImagePayloads.requireImage(image);
        List<DetectedFace> faces = embeddingProvider.extract(image);
        if (faces.isEmpty()) {
            throw AttendanceException.noFaceDetected();
        }

        List<SimilarityRow> rows = matcher.rank(faces.get(0).getEmbedding(), gallery.snapshot(), threshold);
        List<DiagnosticResponse.Candidate> all = rows.stream()
                .map(DiagnosticResponse.Candidate::of)
                .collect(Collectors.toList());
        DiagnosticResponse.Candidate best = all.isEmpty()
                ? new DiagnosticResponse.Candidate(null, null, 0.0)
                : all.get(0);
        boolean matchFound = !rows.isEmpty() && rows.get(0).isMatch();
        return new DiagnosticResponse(matchFound, best, threshold, all);
    }

    private static UserOutcome marked(MatchResult result, EntryType eventType, Attendance event,
                                      Punctuality punctuality) {
        String message = eventType.label() + " marked successfully";
        if (punctuality.getNote() != null) {
            message += " - " + punctuality.getNote();
        }
        boolean entry = eventType == EntryType.ENTRY;
        return new UserOutcome(UserOutcome.Status.MARKED, message,
                result.getUserId(), result.getName(), event.getOccurredAt(), result.getSimilarity(),
                event.getId(),
                entry ? event.isLate() : null,
                entry ? event.getMinutesLate() : null,
                entry ? null : event.isEarlyExit());
    }

    private static AttendanceUpdate update(MatchResult result, EntryType eventType, Attendance event) {
        boolean entry = eventType == EntryType.ENTRY;
        return AttendanceUpdate.builder()
                .action(eventType.wireName())
                .userId(result.getUserId())
                .name(result.getName())
                .timestamp(event.getOccurredAt())
                .similarity(result.getSimilarity())
                .attendanceId(event.getId())
                .late(entry ? event.isLate() : null)
                .minutesLate(entry ? event.getMinutesLate() : null)
                .earlyExit(entry ? null : event.isEarlyExit())
                .build();
    }

    private static UserOutcome unmatched(MatchResult result) {
        String message = result.getReason() == MatchReason.AMBIGUOUS_MATCH ? AMBIGUOUS_MESSAGE : NO_MATCH_MESSAGE;
        return new UserOutcome(UserOutcome.Status.UNMATCHED, message, null, null, null, result.getSimilarity());
    }
}
