package org.speeches.reader;

import lombok.extern.slf4j.Slf4j;
import org.speeches.common.MergeChannel;
import org.speeches.common.SourceFailure;
import org.speeches.common.SourceLine;

import java.io.BufferedReader;
import java.io.IOException;

@Slf4j
public class SourceReader {

    private final SourceOpener sourceOpener;

    public SourceReader(SourceOpener sourceOpener) {
        this.sourceOpener = sourceOpener;
    }

    public void read(String source, MergeChannel channel) {
        BufferedReader reader;
        try {
            reader = new BufferedReader(sourceOpener.open(source));
        } catch (IOException | RuntimeException e) {
            log.warn("Could not open source {}: {}", source, describe(e));
            channel.publish(new SourceFailure(source, SourceFailure.Stage.OPEN, describe(e)));
            return;
        }

        int published = 0;
        try (reader) {
            if (reader.readLine() == null) {
                log.debug("Source {} is empty", source);
                return;
            }
            String line;
            while ((line = reader.readLine()) != null) {
                channel.publish(new SourceLine(line, source));
                published++;
            }
            log.debug("Read {} lines from {}", published, source);
        } catch (IOException e) {
            log.warn("Reading {} failed after {} lines: {}", source, published, describe(e));
            channel.publish(new SourceFailure(source, SourceFailure.Stage.READ, describe(e)));
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
