package com.calypso.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A progress event emitted while a build runs, streamed to clients over SSE.
 *
 * @param eventType one of {@code file_start}, {@code file_chunk}, {@code file_complete}, {@code verify},
 *                  {@code verify_failed}, {@code fixing}, {@code done}, {@code error}
 * @param buildId   the build this event belongs to
 * @param payload   event data, serialized as the SSE frame body
 * @param timestamp when the event occurred
 */
public record BuildEvent(
    String eventType,
    String buildId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String FILE_START = "file_start";
    public static final String FILE_CHUNK = "file_chunk";
    public static final String FILE_COMPLETE = "file_complete";
    public static final String VERIFY = "verify";
    public static final String VERIFY_FAILED = "verify_failed";
    public static final String FIXING = "fixing";
    public static final String DONE = "done";
    public static final String ERROR = "error";

    public static BuildEvent of(String eventType, String buildId, Map<String, Object> payload) {
        return new BuildEvent(eventType, buildId, payload, Instant.now());
    }

    /** Terminal events end the stream for a build. */
    public boolean isTerminal() {
        return DONE.equals(eventType) || ERROR.equals(eventType);
    }
}
