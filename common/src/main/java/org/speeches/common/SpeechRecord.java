package org.speeches.common;

public record SpeechRecord(
        String speaker,
        String topic,
        String date,
        long wordCount
) {}
