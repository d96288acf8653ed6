package org.speeches.evaluator.config;

import okhttp3.OkHttpClient;
import org.speeches.parser.SpeechLineParser;
import org.speeches.reader.HttpSourceOpener;
import org.speeches.reader.SourceOpener;
import org.speeches.reader.SourceReader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties({EvaluationProperties.class, SourceProperties.class})
public class EvaluationConfig {

    @Bean
    public OkHttpClient sourceHttpClient(SourceProperties sourceProperties) {
        return new OkHttpClient.Builder()
                .connectTimeout(sourceProperties.getConnectTimeout())
                .readTimeout(sourceProperties.getReadTimeout())
                .callTimeout(sourceProperties.getCallTimeout())
                .build();
    }

    @Bean
    public SourceOpener sourceOpener(OkHttpClient sourceHttpClient) {
        return new HttpSourceOpener(sourceHttpClient);
    }

    @Bean
    public SourceReader sourceReader(SourceOpener sourceOpener) {
        return new SourceReader(sourceOpener);
    }

    @Bean
    public SpeechLineParser speechLineParser(EvaluationProperties evaluationProperties) {
        return new SpeechLineParser(evaluationProperties.getDelimiter());
    }

    @Bean
    public ThreadPoolTaskExecutor evaluationTaskExecutor(
            @Value("${executor.core-pool-size:4}") int corePoolSize,
            @Value("${executor.keep-alive-seconds:60}") int keepAliveSeconds,
            @Value("${executor.thread-name-prefix:Evaluation-}") String threadNamePrefix
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(keepAliveSeconds);
        executor.setThreadNamePrefix(threadNamePrefix);
        return executor;
    }
}
