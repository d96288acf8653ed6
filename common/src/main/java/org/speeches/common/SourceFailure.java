package org.speeches.common;

public record SourceFailure(
        String source,
        Stage stage,
        String cause
) implements IngestEvent {

    public enum Stage {
        OPEN,
        READ
    }
}
