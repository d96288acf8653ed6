package org.speeches.evaluator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "evaluation")
@Data
public class EvaluationProperties {

    private String targetYear = "2013";

    private String targetTopic = "Innere Sicherheit";

    private String delimiter = ",";
}
