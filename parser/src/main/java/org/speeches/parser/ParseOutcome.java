package org.speeches.parser;

import org.speeches.common.SpeechRecord;

public record ParseOutcome(
        SpeechRecord record,
        String error
) {

    public static ParseOutcome parsed(SpeechRecord record) {
        return new ParseOutcome(record, null);
    }

    public static ParseOutcome rejected(String error) {
        return new ParseOutcome(null, error);
    }

    public boolean isParsed() {
        return record != null;
    }
}
