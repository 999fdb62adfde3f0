package com.faceattendance.streaming;

import com.faceattendance.service.PipelineStage;
import com.faceattendance.service.StageListener;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-connection state. Frames of one session are chained so that frame N+1
 * starts only after frame N has been answered, while the work itself runs on
 * a pool shared by all sessions.
 */
public class StreamingSession implements StageListener {
    private static final Logger log = LoggerFactory.getLogger(StreamingSession.class);

    private final WebSocketSession socket;
    private final ObjectMapper objectMapper;
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);
    private final AtomicInteger pending = new AtomicInteger();

    // guarded by this
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    public StreamingSession(WebSocketSession socket, ObjectMapper objectMapper) {
        this.socket = socket;
        this.objectMapper = objectMapper;
    }

    public String getId() {
        return socket.getId();
    }

    public SessionState getState() {
        return state.get();
    }

    public boolean isClosed() {
        return state.get() == SessionState.CLOSED;
    }

    public int pendingFrames() {
        return pending.get();
    }

    void open() {
        state.compareAndSet(SessionState.CONNECTING, SessionState.OPEN);
    }

    /** Terminal; frames not yet past their next stage boundary are dropped. */
    void close() {
        state.set(SessionState.CLOSED);
    }

    /**
     * Queues a frame behind the ones already accepted for this session.
     *
     * @return false if the session is closed or already has {@code maxPending}
     * frames queued or running
     */
    boolean submit(Runnable frameTask, Executor executor, int maxPending) {
        if (isClosed()) {
            return false;
        }
        if (pending.incrementAndGet() > maxPending) {
            pending.decrementAndGet();
            return false;
        }
        synchronized (this) {
            try {
                tail = tail.handleAsync((ignored, previousFailure) -> {
                    try {
                        if (!isClosed()) {
                            frameTask.run();
                        }
                    } finally {
                        pending.decrementAndGet();
                    }
                    return null;
                }, executor);
            } catch (RejectedExecutionException e) {
                pending.decrementAndGet();
                log.warn("Frame worker pool rejected a frame for session {}", getId(), e);
                return false;
            }
        }
        return true;
    }

    @Override
    public void beforeStage(PipelineStage stage) {
        SessionState next;
        switch (stage) {
            case DECODING:
                next = SessionState.DECODING;
                break;
            case MATCHING:
                next = SessionState.MATCHING;
                break;
            default:
                next = SessionState.RESPONDING;
                break;
        }
        advance(next);
    }

    /** Back to OPEN once a frame has been answered. */
    void frameDone() {
        SessionState current = state.get();
        while (current != SessionState.CLOSED && current != SessionState.OPEN) {
            if (state.compareAndSet(current, SessionState.OPEN)) {
                return;
            }
            current = state.get();
        }
    }

    /**
     * Serializes {@code body} and sends it as one text message. Failures are
     * logged; a failed send usually means the client is already gone.
     */
    void send(Object body) {
        if (isClosed() || !socket.isOpen()) {
            return;
        }
        try {
            socket.sendMessage(new TextMessage(objectMapper.writeValueAsString(body)));
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize response for session {}", getId(), e);
        } catch (IOException | IllegalStateException e) {
            log.warn("Failed to send to session {}: {}", getId(), e.getMessage());
        }
    }

    private void advance(SessionState next) {
        SessionState current = state.get();
        while (true) {
            if (current == SessionState.CLOSED) {
                throw new CancellationException("Session " + getId() + " closed");
            }
            if (state.compareAndSet(current, next)) {
                return;
            }
            current = state.get();
        }
    }
}
