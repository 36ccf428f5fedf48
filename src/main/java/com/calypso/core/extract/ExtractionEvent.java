package com.calypso.core.extract;

/**
 * Events emitted by {@link StreamingFileExtractor} as deltas are fed in.
 * {@link FileCompleted} is authoritative: clients discard buffered chunks for its path.
 */
public interface ExtractionEvent {

    String path();

    record FileStarted(String path) implements ExtractionEvent {}

    /** A slice of file content that cannot be part of an end marker. */
    record FileChunk(String path, String text) implements ExtractionEvent {}

    record FileCompleted(String path, String content) implements ExtractionEvent {}
}
