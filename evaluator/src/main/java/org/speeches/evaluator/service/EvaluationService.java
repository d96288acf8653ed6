package org.speeches.evaluator.service;

import lombok.extern.slf4j.Slf4j;
import org.speeches.common.MergeChannel;
import org.speeches.common.SourceFailure;
import org.speeches.evaluator.config.EvaluationProperties;
import org.speeches.evaluator.model.EvaluationResult;
import org.speeches.evaluator.model.SpeechTally;
import org.speeches.parser.SpeechLineParser;
import org.speeches.reader.SourceReader;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

@Service
@Slf4j
public class EvaluationService {

    private final SourceReader sourceReader;
    private final SpeechLineParser lineParser;
    private final EvaluationProperties properties;
    private final Executor executor;

    public EvaluationService(SourceReader sourceReader,
                             SpeechLineParser lineParser,
                             EvaluationProperties properties,
                             @Qualifier("evaluationTaskExecutor") Executor executor) {
        this.sourceReader = sourceReader;
        this.lineParser = lineParser;
        this.properties = properties;
        this.executor = executor;
    }

    public CompletableFuture<EvaluationResult> evaluate(List<String> sources) {
        List<String> requested = sources == null
                ? List.of()
                : sources.stream()
                        .filter(source -> source != null && !source.isBlank())
                        .map(String::trim)
                        .toList();
        if (requested.isEmpty()) {
            throw new NoSourcesException("Url Param 'url' is missing");
        }

        long startTime = System.currentTimeMillis();
        log.info("Evaluating {} source(s): {}", requested.size(), requested);

        MergeChannel channel = new MergeChannel();
        SpeechAggregator aggregator = new SpeechAggregator(
                lineParser, properties.getTargetYear(), properties.getTargetTopic());

        CompletableFuture<SpeechTally> aggregation =
                CompletableFuture.supplyAsync(() -> drain(aggregator, channel), executor);

        CompletableFuture<?>[] readers;
        try {
            readers = requested.stream()
                    .map(source -> startReader(source, channel))
                    .toArray(CompletableFuture[]::new);
        } catch (RuntimeException e) {
            channel.close();
            throw e;
        }

        CompletableFuture.allOf(readers).whenComplete((ignored, ex) -> channel.close());

        return aggregation.thenApply(tally -> {
            EvaluationResult result = tally.toResult();
            log.info("Evaluation result: {}", result);
            if (!result.errors().isEmpty()) {
                log.info("Evaluation reported {} error(s): {}", result.errors().size(), result.errors());
            }
            log.info("Evaluation of {} source(s) took {} ms",
                    requested.size(), System.currentTimeMillis() - startTime);
            return result;
        });
    }

    private CompletableFuture<Void> startReader(String source, MergeChannel channel) {
        return CompletableFuture.runAsync(() -> sourceReader.read(source, channel), executor)
                .exceptionally(ex -> {
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    log.error("Reader for {} failed unexpectedly", source, cause);
                    channel.publish(new SourceFailure(source, SourceFailure.Stage.READ, describe(cause)));
                    return null;
                });
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    private static SpeechTally drain(SpeechAggregator aggregator, MergeChannel channel) {
        try {
            return aggregator.drain(channel);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while aggregating speeches", e);
        }
    }
}
