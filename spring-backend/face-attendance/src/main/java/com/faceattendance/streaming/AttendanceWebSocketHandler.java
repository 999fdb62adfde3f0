package com.faceattendance.streaming;

import com.faceattendance.config.AttendanceProperties;
import com.faceattendance.dto.FrameOutcome;
import com.faceattendance.exception.AttendanceException;
import com.faceattendance.model.EntryType;
import com.faceattendance.service.AttendancePipeline;
import com.faceattendance.service.AttendanceRecordedEvent;
import com.faceattendance.service.ImagePayloads;
import com.faceattendance.service.PipelineStage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * {@code /ws/attendance}: clients stream camera frames as
 * {@code {"image": "data:image/jpeg;base64,...", "entry_type": "entry"}} and get
 * one response per frame. A bad frame is answered with {@code {"error": ...}}
 * and the connection stays open.
 */
@Component
public class AttendanceWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(AttendanceWebSocketHandler.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

    private final AttendancePipeline pipeline;
    private final ObjectMapper objectMapper;
    private final Executor workers;
    private final int maxPendingFrames;
    private final int maxMessageBytes;

    private final Map<String, StreamingSession> sessions = new ConcurrentHashMap<>();

    public AttendanceWebSocketHandler(AttendancePipeline pipeline,
                                      ObjectMapper objectMapper,
                                      @Qualifier("frameWorkers") Executor workers,
                                      AttendanceProperties properties) {
        this.pipeline = pipeline;
        this.objectMapper = objectMapper;
        this.workers = workers;
        this.maxPendingFrames = properties.getStreaming().getMaxPendingFrames();
        this.maxMessageBytes = properties.getStreaming().getMaxMessageBytes();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        session.setTextMessageSizeLimit(maxMessageBytes);
        WebSocketSession safe = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES);
        StreamingSession streaming = new StreamingSession(safe, objectMapper);
        sessions.put(session.getId(), streaming);
        streaming.open();
        log.info("New WebSocket connection {}. Total connections: {}", session.getId(), sessions.size());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        StreamingSession streaming = sessions.get(session.getId());
        if (streaming == null || streaming.isClosed()) {
            return;
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            streaming.send(error("Invalid JSON data received"));
            return;
        }
        if (json == null || !json.isObject()) {
            streaming.send(error("Invalid JSON data received"));
            return;
        }

        String type = json.path("type").asText("");
        if ("ping".equals(type)) {
            Map<String, Object> pong = new LinkedHashMap<>();
            pong.put("type", "pong");
            streaming.send(pong);
            return;
        }
        if ("pong".equals(type)) {
            return;
        }

        String image = json.hasNonNull("image") ? json.get("image").asText() : null;
        String entryType = json.hasNonNull("entry_type") ? json.get("entry_type").asText() : null;
        if (!streaming.submit(() -> processFrame(streaming, image, entryType), workers, maxPendingFrames)
                && !streaming.isClosed()) {
            Map<String, Object> busy = new LinkedHashMap<>();
            busy.put("status", "error");
            busy.put("message", "Server busy with other images");
            streaming.send(busy);
        }
    }

    void processFrame(StreamingSession streaming, String image, String entryType) {
        try {
            FrameOutcome outcome = runPipeline(streaming, image, entryType);
            streaming.beforeStage(PipelineStage.RESPONDING);
            streaming.send(outcome.toBody());
        } catch (CancellationException e) {
            log.debug("Dropped frame for closed session {}", streaming.getId());
        } finally {
            streaming.frameDone();
        }
    }

    private FrameOutcome runPipeline(StreamingSession streaming, String image, String entryType) {
        try {
            streaming.beforeStage(PipelineStage.DECODING);
            EntryType type = EntryType.fromWire(entryType);
            byte[] bytes = ImagePayloads.fromDataUrl(image);
            return pipeline.captureVerified(bytes, type, streaming);
        } catch (CancellationException e) {
            throw e;
        } catch (AttendanceException e) {
            log.debug("Frame rejected for session {}: {} {}", streaming.getId(), e.getErrorCode(), e.getMessage());
            return FrameOutcome.error(e.getMessage());
        } catch (IllegalArgumentException e) {
            return FrameOutcome.error(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error processing image for session {}", streaming.getId(), e);
            return FrameOutcome.error("Error processing image: " + e.getMessage());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket transport error for {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        StreamingSession streaming = sessions.remove(session.getId());
        if (streaming != null) {
            streaming.close();
        }
        log.info("WebSocket connection {} closed ({}). Remaining connections: {}",
                session.getId(), status.getCode(), sessions.size());
    }

    /** Sends newly recorded events to every connected client. */
    @EventListener
    public void onAttendanceRecorded(AttendanceRecordedEvent event) {
        if (sessions.isEmpty()) {
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", "attendance_update");
        body.put("data", event.getUpdates());
        log.debug("Broadcasting {} attendance update(s) to {} client(s)", event.getUpdates().size(), sessions.size());
        for (StreamingSession streaming : sessions.values()) {
            streaming.send(body);
        }
    }

    Collection<StreamingSession> activeSessions() {
        return sessions.values();
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        return body;
    }
}
