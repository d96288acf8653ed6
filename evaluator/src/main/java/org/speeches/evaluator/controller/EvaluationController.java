package org.speeches.evaluator.controller;

import org.speeches.evaluator.model.EvaluationResult;
import org.speeches.evaluator.service.EvaluationService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@RestController
public class EvaluationController {

    private final EvaluationService evaluationService;

    public EvaluationController(EvaluationService evaluationService) {
        this.evaluationService = evaluationService;
    }

    @GetMapping(value = "/evaluation", produces = MediaType.APPLICATION_JSON_VALUE)
    public CompletableFuture<ResponseEntity<EvaluationResult>> evaluate(@RequestParam("url") List<String> urls) {
        return evaluationService.evaluate(urls)
                .thenApply(ResponseEntity::ok);
    }
}
