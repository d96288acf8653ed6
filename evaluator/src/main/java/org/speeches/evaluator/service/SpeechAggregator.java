package org.speeches.evaluator.service;

import lombok.extern.slf4j.Slf4j;
import org.speeches.common.IngestEvent;
import org.speeches.common.MergeChannel;
import org.speeches.common.SourceFailure;
import org.speeches.common.SourceLine;
import org.speeches.common.SpeechRecord;
import org.speeches.evaluator.model.SpeechTally;
import org.speeches.parser.ParseOutcome;
import org.speeches.parser.SpeechLineParser;

@Slf4j
public class SpeechAggregator {

    private final SpeechLineParser lineParser;
    private final String targetYear;
    private final String targetTopic;
    private final SpeechTally tally = new SpeechTally();

    public SpeechAggregator(SpeechLineParser lineParser, String targetYear, String targetTopic) {
        this.lineParser = lineParser;
        this.targetYear = targetYear;
        this.targetTopic = targetTopic;
    }

    public SpeechTally drain(MergeChannel channel) throws InterruptedException {
        int events = 0;
        IngestEvent event;
        while ((event = channel.take()) != null) {
            accept(event);
            events++;
        }
        log.debug("Aggregated {} events, {} errors", events, tally.getErrors().size());
        return tally;
    }

    void accept(IngestEvent event) {
        if (event instanceof SourceFailure failure) {
            tally.addError(describe(failure));
        } else if (event instanceof SourceLine line) {
            ParseOutcome outcome = lineParser.parse(line);
            if (!outcome.isParsed()) {
                tally.addError(outcome.error());
                return;
            }
            SpeechRecord speech = outcome.record();
            tally.addSpeech(
                    speech,
                    speech.date().contains(targetYear),
                    speech.topic().trim().equals(targetTopic)
            );
        } else {
            throw new IllegalArgumentException("Unsupported event type " + event.getClass().getName());
        }
    }

    private static String describe(SourceFailure failure) {
        String prefix = failure.stage() == SourceFailure.Stage.OPEN
                ? "Source unavailable"
                : "Source read failed";
        return String.format("%s. URL: '%s' Cause: '%s'", prefix, failure.source(), failure.cause());
    }
}
