package com.calypso.core.extract;

import com.calypso.core.model.GeneratedFile;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Incrementally reconstructs files from a model's text stream.
 * <p>
 * Files are framed as
 * <pre>
 * ===FILE: path/to/file===
 * content
 * ===END FILE===
 * </pre>
 * The extractor is a two-state machine ({@link State#SCANNING} for a start marker,
 * {@link State#IN_FILE} for the end marker) driven by {@link #feed(String)}. While inside a
 * file it withholds a tail at least as long as the end marker, so a marker split across two
 * deltas is never emitted as content. The resulting file list is the same however the
 * input text is split into deltas.
 * <p>
 * Not thread-safe: one instance serves one generation stream on one thread.
 */
public class StreamingFileExtractor {

    public static final String END_MARKER = "===END FILE===";

    static final Pattern START_MARKER = Pattern.compile("===FILE:\\s*(.+?)===\\n");

    private static final String MARKER_FENCE = "===";

    enum State { SCANNING, IN_FILE, FINISHED }

    private final StringBuilder buffer = new StringBuilder();
    private final StringBuilder content = new StringBuilder();
    private final List<GeneratedFile> files = new ArrayList<>();

    private State state = State.SCANNING;
    private String currentPath;

    /**
     * Appends a delta and returns the events it makes certain, in order.
     *
     * @throws IllegalStateException if called after {@link #finish()}
     */
    public List<ExtractionEvent> feed(String delta) {
        if (state == State.FINISHED) {
            throw new IllegalStateException("Extractor already finished");
        }
        List<ExtractionEvent> events = new ArrayList<>();
        if (delta == null || delta.isEmpty()) {
            return events;
        }
        buffer.append(delta);

        boolean progressed = true;
        while (progressed) {
            progressed = state == State.SCANNING ? scanForStart(events) : scanForEnd(events);
        }
        return events;
    }

    /**
     * Ends the stream. A file still open (truncated output, deadline abort) is flushed as a
     * best-effort {@link ExtractionEvent.FileCompleted} when it has non-blank content.
     */
    public List<ExtractionEvent> finish() {
        List<ExtractionEvent> events = new ArrayList<>();
        if (state == State.IN_FILE) {
            content.append(buffer);
            String partial = content.toString().stripTrailing();
            if (!partial.isBlank()) {
                complete(partial, events);
            }
        }
        buffer.setLength(0);
        content.setLength(0);
        currentPath = null;
        state = State.FINISHED;
        return events;
    }

    /** Files completed so far, in file-start order, one entry per path. */
    public List<GeneratedFile> files() {
        return List.copyOf(files);
    }

    public boolean isInFile() {
        return state == State.IN_FILE;
    }

    public String currentPath() {
        return currentPath;
    }

    /**
     * Parses a complete response keeping only files closed by {@link #END_MARKER} with
     * non-blank content. A truncated trailing file is dropped.
     */
    public static List<GeneratedFile> parseClosed(String text) {
        var extractor = new StreamingFileExtractor();
        extractor.feed(text);
        return extractor.files().stream()
                .filter(file -> !file.content().isBlank())
                .toList();
    }

    private boolean scanForStart(List<ExtractionEvent> events) {
        Matcher matcher = START_MARKER.matcher(buffer);
        while (matcher.find()) {
            String path = matcher.group(1).trim();
            if (path.isEmpty()) {
                continue;
            }
            buffer.delete(0, matcher.end());
            currentPath = path;
            content.setLength(0);
            state = State.IN_FILE;
            events.add(new ExtractionEvent.FileStarted(path));
            return true;
        }
        // Text outside markers is dropped, except from the first fence on: it may be a marker in progress.
        int fence = buffer.indexOf(MARKER_FENCE);
        if (fence < 0) {
            int keep = Math.min(buffer.length(), MARKER_FENCE.length() - 1);
            buffer.delete(0, buffer.length() - keep);
        } else if (fence > 0) {
            buffer.delete(0, fence);
        }
        return false;
    }

    private boolean scanForEnd(List<ExtractionEvent> events) {
        int end = buffer.indexOf(END_MARKER);
        if (end >= 0) {
            content.append(buffer, 0, end);
            buffer.delete(0, end + END_MARKER.length());
            complete(content.toString().stripTrailing(), events);
            state = State.SCANNING;
            return true;
        }
        int safeEnd = buffer.length() - END_MARKER.length();
        if (safeEnd > 0) {
            String chunk = buffer.substring(0, safeEnd);
            content.append(chunk);
            buffer.delete(0, safeEnd);
            events.add(new ExtractionEvent.FileChunk(currentPath, chunk));
        }
        return false;
    }

    private void complete(String fileContent, List<ExtractionEvent> events) {
        var file = new GeneratedFile(currentPath, fileContent);
        int existing = indexOf(currentPath);
        if (existing >= 0) {
            files.set(existing, file);
        } else {
            files.add(file);
        }
        events.add(new ExtractionEvent.FileCompleted(currentPath, fileContent));
        content.setLength(0);
        currentPath = null;
    }

    private int indexOf(String path) {
        for (int i = 0; i < files.size(); i++) {
            if (files.get(i).path().equals(path)) {
                return i;
            }
        }
        return -1;
    }
}
