package org.speeches.evaluator.model;

import org.speeches.common.SpeechRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class SpeechTally {

    private final Map<String, Long> speechesInTargetYear = new HashMap<>();
    private final Map<String, Long> speechesOnTargetTopic = new HashMap<>();
    private final Map<String, Long> totalWordCount = new HashMap<>();
    private final List<String> errors = new ArrayList<>();

    public void addSpeech(SpeechRecord speech, boolean inTargetYear, boolean onTargetTopic) {
        String speaker = speech.speaker();
        totalWordCount.merge(speaker, speech.wordCount(), Long::sum);
        if (inTargetYear) {
            speechesInTargetYear.merge(speaker, 1L, Long::sum);
        }
        if (onTargetTopic) {
            speechesOnTargetTopic.merge(speaker, 1L, Long::sum);
        }
    }

    public void addError(String error) {
        errors.add(error);
    }

    public Map<String, Long> getSpeechesInTargetYear() {
        return Collections.unmodifiableMap(speechesInTargetYear);
    }

    public Map<String, Long> getSpeechesOnTargetTopic() {
        return Collections.unmodifiableMap(speechesOnTargetTopic);
    }

    public Map<String, Long> getTotalWordCount() {
        return Collections.unmodifiableMap(totalWordCount);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public EvaluationResult toResult() {
        return new EvaluationResult(
                RankSelector.select(speechesInTargetYear, RankSelector.Direction.MAX),
                RankSelector.select(speechesOnTargetTopic, RankSelector.Direction.MAX),
                RankSelector.select(totalWordCount, RankSelector.Direction.MIN),
                List.copyOf(errors)
        );
    }
}
