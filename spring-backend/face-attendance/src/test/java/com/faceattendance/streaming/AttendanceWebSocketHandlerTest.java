package com.faceattendance.streaming;

import com.faceattendance.TestImages;
import com.faceattendance.config.AttendanceProperties;
import com.faceattendance.dto.AttendanceUpdate;
import com.faceattendance.dto.FrameOutcome;
import com.faceattendance.dto.UserOutcome;
import com.faceattendance.model.EntryType;
import com.faceattendance.service.AttendancePipeline;
import com.faceattendance.service.AttendanceRecordedEvent;
import com.faceattendance.service.StageListener;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AttendanceWebSocketHandlerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T08:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private AttendancePipeline pipeline;
    private AttendanceProperties properties;
    private final List<Runnable> queued = new ArrayList<>();

    @BeforeEach
    void setUp() {
        pipeline = mock(AttendancePipeline.class);
        properties = new AttendanceProperties();
        properties.getStreaming().setMaxPendingFrames(2);
    }

    @Test
    void answersPingWithPong() throws Exception {
        AttendanceWebSocketHandler handler = handler(Runnable::run);
        WebSocketSession session = connect(handler, "s1");

        handler.handleMessage(session, new TextMessage("{\"type\": \"ping\"}"));

        assertEquals("pong", sent(session, 1).get(0).get("type").asText());
    }

    @Test
    void invalidJsonKeepsConnectionOpen() throws Exception {
        AttendanceWebSocketHandler handler = handler(Runnable::run);
        WebSocketSession session = connect(handler, "s1");

        handler.handleMessage(session, new TextMessage("{not json"));
        handler.handleMessage(session, new TextMessage("{\"type\": \"ping\"}"));

        List<JsonNode> replies = sent(session, 2);
        assertEquals("Invalid JSON data received", replies.get(0).get("error").asText());
        assertEquals("pong", replies.get(1).get("type").asText());
        assertEquals(SessionState.OPEN, onlySession(handler).getState());
    }

    @Test
    void undecodableImageIsAnsweredWithError() throws Exception {
        AttendanceWebSocketHandler handler = handler(Runnable::run);
        WebSocketSession session = connect(handler, "s1");

        handler.handleMessage(session, new TextMessage("{\"image\": \"data:image/png;base64,aGVsbG8=\"}"));

        assertEquals("Failed to decode image", sent(session, 1).get(0).get("error").asText());
        assertEquals(SessionState.OPEN, onlySession(handler).getState());
        verify(pipeline, never()).captureVerified(any(), any(), any());
    }

    @Test
    void invalidEntryTypeIsAnsweredWithError() throws Exception {
        AttendanceWebSocketHandler handler = handler(Runnable::run);
        WebSocketSession session = connect(handler, "s1");

        handler.handleMessage(session, new TextMessage(frame("lunch")));

        assertTrue(sent(session, 1).get(0).get("error").asText().contains("lunch"));
    }

    @Test
    void matchedFrameGetsSingleUserBody() throws Exception {
        when(pipeline.captureVerified(any(), eq(EntryType.EXIT), any(StageListener.class)))
                .thenReturn(FrameOutcome.of(List.of(new UserOutcome(UserOutcome.Status.MARKED,
                        "Exit marked successfully", "U1", "Alice", T0, 0.97)), List.of(), 0.6));
        AttendanceWebSocketHandler handler = handler(Runnable::run);
        WebSocketSession session = connect(handler, "s1");

        handler.handleMessage(session, new TextMessage(frame("exit")));

        JsonNode reply = sent(session, 1).get(0);
        assertEquals("Exit marked successfully", reply.get("message").asText());
        assertEquals("U1", reply.get("user_id").asText());
        assertEquals(0.97, reply.get("similarity").asDouble(), 1e-9);
        verify(pipeline).captureVerified(any(), eq(EntryType.EXIT), eq(onlySession(handler)));
        verify(pipeline, never()).capture(any(), any(), any());
        assertEquals(SessionState.OPEN, onlySession(handler).getState());
    }

    @Test
    void noFaceFrame() throws Exception {
        when(pipeline.captureVerified(any(), any(), any(StageListener.class))).thenReturn(FrameOutcome.noFace());
        AttendanceWebSocketHandler handler = handler(Runnable::run);
        WebSocketSession session = connect(handler, "s1");

        handler.handleMessage(session, new TextMessage(frame(null)));

        assertEquals("no_face_detected", sent(session, 1).get(0).get("status").asText());
        verify(pipeline).captureVerified(any(), eq(EntryType.ENTRY), any(StageListener.class));
    }

    @Test
    void recordedEventsAreBroadcastToEverySession() throws Exception {
        AttendanceWebSocketHandler handler = handler(Runnable::run);
        WebSocketSession first = connect(handler, "s1");
        WebSocketSession second = connect(handler, "s2");

        handler.onAttendanceRecorded(new AttendanceRecordedEvent(List.of(
                AttendanceUpdate.builder()
                        .action("entry")
                        .userId("U1")
                        .name("Alice")
                        .timestamp(T0)
                        .similarity(0.97)
                        .attendanceId(7L)
                        .late(false)
                        .build())));

        for (WebSocketSession session : List.of(first, second)) {
            JsonNode update = sent(session, 1).get(0);
            assertEquals("attendance_update", update.get("type").asText());
            assertEquals("U1", update.get("data").get(0).get("user_id").asText());
            assertEquals(7, update.get("data").get(0).get("attendance_id").asLong());
            assertFalse(update.get("data").get(0).get("is_late").asBoolean());
            assertFalse(update.get("data").get(0).has("reason"));
        }
    }

    @Test
    void framesOfClosedSessionAreDropped() throws Exception {
        AttendanceWebSocketHandler handler = handler(queued::add);
        WebSocketSession session = connect(handler, "s1");

        handler.handleMessage(session, new TextMessage(frame("entry")));
        StreamingSession streaming = onlySession(handler);
        handler.afterConnectionClosed(session, CloseStatus.GOING_AWAY);
        runQueued();

        assertEquals(SessionState.CLOSED, streaming.getState());
        assertEquals(0, streaming.pendingFrames());
        assertTrue(handler.activeSessions().isEmpty());
        verify(pipeline, never()).captureVerified(any(), any(), any());
        verify(session, never()).sendMessage(any());
    }

    @Test
    void tooManyPendingFramesAreRefused() throws Exception {
        when(pipeline.captureVerified(any(), any(), any(StageListener.class))).thenReturn(FrameOutcome.noFace());
        AttendanceWebSocketHandler handler = handler(queued::add);
        WebSocketSession session = connect(handler, "s1");

        handler.handleMessage(session, new TextMessage(frame("entry")));
        handler.handleMessage(session, new TextMessage(frame("entry")));
        handler.handleMessage(session, new TextMessage(frame("entry")));

        JsonNode busy = sent(session, 1).get(0);
        assertEquals("error", busy.get("status").asText());
        assertEquals("Server busy with other images", busy.get("message").asText());
        assertEquals(2, onlySession(handler).pendingFrames());

        runQueued();

        List<JsonNode> replies = sent(session, 3);
        assertEquals("no_face_detected", replies.get(1).get("status").asText());
        assertEquals("no_face_detected", replies.get(2).get("status").asText());
        assertEquals(0, onlySession(handler).pendingFrames());
    }

    private AttendanceWebSocketHandler handler(Executor executor) {
        return new AttendanceWebSocketHandler(pipeline, mapper, executor, properties);
    }

    private WebSocketSession connect(AttendanceWebSocketHandler handler, String id) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(true);
        handler.afterConnectionEstablished(session);
        return session;
    }

    private StreamingSession onlySession(AttendanceWebSocketHandler handler) {
        assertEquals(1, handler.activeSessions().size());
        return handler.activeSessions().iterator().next();
    }

    /** Frames run one at a time; running one may queue the next. */
    private void runQueued() {
        while (!queued.isEmpty()) {
            queued.remove(0).run();
        }
    }

    @SuppressWarnings("unchecked")
    private List<JsonNode> sent(WebSocketSession session, int expected) throws Exception {
        ArgumentCaptor<WebSocketMessage<?>> captor = ArgumentCaptor.forClass(WebSocketMessage.class);
        verify(session, atLeast(expected)).sendMessage(captor.capture());
        List<JsonNode> messages = new ArrayList<>();
        for (WebSocketMessage<?> message : captor.getAllValues()) {
            messages.add(mapper.readTree(((TextMessage) message).getPayload()));
        }
        assertEquals(expected, messages.size());
        return messages;
    }

    private static String frame(String entryType) {
        String type = entryType == null ? "" : ", \"entry_type\": \"" + entryType + "\"";
        return "{\"image\": \"" + TestImages.pngDataUrl() + "\"" + type + "}";
    }
}
