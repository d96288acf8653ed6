package org.speeches.reader;

import java.io.IOException;
import java.io.Reader;

@FunctionalInterface
public interface SourceOpener {

    Reader open(String source) throws IOException;
}
