package org.speeches.evaluator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record EvaluationResult(
        String mostSpeeches,
        @JsonProperty("mostSecurity") String mostOnTopic,
        String leastWordy,
        List<String> errors
) {}
