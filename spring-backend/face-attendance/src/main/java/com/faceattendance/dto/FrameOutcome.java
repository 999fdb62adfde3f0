package com.faceattendance.dto;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Everything a single processed frame produced, resolved to one response
 * shape before it is serialized:
 *
 * <ul>
 *   <li>{@link Kind#SINGLE}: one face, matched. Body is the {@link UserOutcome} itself.</li>
 *   <li>{@link Kind#MULTIPLE}: several faces. {@code {multiple_users: true, users: [...]}}</li>
 *   <li>{@link Kind#NO_MATCH}: one face, not matched. {@code {error: "No matching user found ..."}}</li>
 *   <li>{@link Kind#NO_FACE}: {@code {status: "no_face_detected"}}</li>
 *   <li>{@link Kind#ERROR}: {@code {error: "..."}}</li>
 * </ul>
 */
@Getter
public final class FrameOutcome {

    public enum Kind {
        SINGLE,
        MULTIPLE,
        NO_MATCH,
        NO_FACE,
        ERROR
    }

    private final Kind kind;
    private final List<UserOutcome> users;
    private final List<AttendanceUpdate> updates;
    private final String error;

    private FrameOutcome(Kind kind, List<UserOutcome> users, List<AttendanceUpdate> updates, String error) {
        this.kind = kind;
        this.users = users;
        this.updates = updates;
        this.error = error;
    }

    /**
     * Chooses the shape for the faces of one frame.
     *
     * @param users     one outcome per detected face, never empty
     * @param updates   events accepted while processing the frame
     * @param threshold threshold used, quoted in the single no-match message
     */
    public static FrameOutcome of(List<UserOutcome> users, List<AttendanceUpdate> updates, double threshold) {
        if (users.isEmpty()) {
            return noFace();
        }
        if (users.size() > 1) {
            return new FrameOutcome(Kind.MULTIPLE, List.copyOf(users), List.copyOf(updates), null);
        }
        UserOutcome only = users.get(0);
        if (only.getStatus() == UserOutcome.Status.UNMATCHED) {
            String message = String.format(Locale.ROOT, "%s (similarity: %.4f, threshold: %s)",
                    only.getMessage(), only.getSimilarity(), threshold);
            return new FrameOutcome(Kind.NO_MATCH, List.of(only), Collections.emptyList(), message);
        }
        return new FrameOutcome(Kind.SINGLE, List.of(only), List.copyOf(updates), null);
    }

    public static FrameOutcome noFace() {
        return new FrameOutcome(Kind.NO_FACE, Collections.emptyList(), Collections.emptyList(), null);
    }

    public static FrameOutcome error(String message) {
        return new FrameOutcome(Kind.ERROR, Collections.emptyList(), Collections.emptyList(), message);
    }

    /** The JSON body to send for this outcome. */
    public Object toBody() {
        Map<String, Object> body = new LinkedHashMap<>();
        switch (kind) {
            case SINGLE:
                return users.get(0);
            case MULTIPLE:
                body.put("multiple_users", true);
                body.put("users", users);
                return body;
            case NO_FACE:
                body.put("status", "no_face_detected");
                return body;
            case NO_MATCH:
            case ERROR:
            default:
                body.put("error", error);
                return body;
        }
    }
}
