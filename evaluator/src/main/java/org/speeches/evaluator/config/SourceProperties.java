package org.speeches.evaluator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "source")
@Data
public class SourceProperties {

    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(30);
    // zero disables the limit
    private Duration callTimeout = Duration.ZERO;
}
