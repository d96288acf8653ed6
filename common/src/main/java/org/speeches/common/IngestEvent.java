package org.speeches.common;

public interface IngestEvent {

    String source();
}
