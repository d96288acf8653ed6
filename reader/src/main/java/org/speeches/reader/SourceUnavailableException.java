package org.speeches.reader;

import java.io.IOException;

public class SourceUnavailableException extends IOException {

    public SourceUnavailableException(String message) {
        super(message);
    }
}
