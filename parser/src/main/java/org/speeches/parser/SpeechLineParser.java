package org.speeches.parser;

import org.speeches.common.SourceLine;
import org.speeches.common.SpeechRecord;

import java.util.regex.Pattern;

public class SpeechLineParser {

    public static final String DEFAULT_DELIMITER = ",";

    private static final int FIELD_COUNT = 4;
    private static final int POS_SPEAKER = 0;
    private static final int POS_TOPIC = 1;
    private static final int POS_DATE = 2;
    private static final int POS_WORD_COUNT = 3;

    private final Pattern delimiterPattern;

    public SpeechLineParser() {
        this(DEFAULT_DELIMITER);
    }

    public SpeechLineParser(String delimiter) {
        if (delimiter == null || delimiter.isEmpty()) {
            throw new IllegalArgumentException("delimiter must not be empty");
        }
        this.delimiterPattern = Pattern.compile(Pattern.quote(delimiter));
    }

    public ParseOutcome parse(SourceLine line) {
        // limit -1 keeps trailing empty fields, "a,b,c," has four fields
        String[] fields = delimiterPattern.split(line.text(), -1);
        if (fields.length != FIELD_COUNT) {
            return ParseOutcome.rejected(String.format(
                    "Not enough elements. URL: '%s' Line: '%s'", line.source(), line.text()));
        }

        long wordCount;
        try {
            wordCount = Long.parseLong(fields[POS_WORD_COUNT].trim());
        } catch (NumberFormatException e) {
            return ParseOutcome.rejected(String.format(
                    "Word count invalid format. URL: '%s' Line: '%s'", line.source(), line.text()));
        }

        return ParseOutcome.parsed(new SpeechRecord(
                fields[POS_SPEAKER],
                fields[POS_TOPIC],
                fields[POS_DATE],
                wordCount
        ));
    }
}
