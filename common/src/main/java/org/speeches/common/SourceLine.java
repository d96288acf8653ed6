package org.speeches.common;

public record SourceLine(
        String text,
        String source
) implements IngestEvent {}
