package org.speeches.evaluator.controller;

import lombok.extern.slf4j.Slf4j;
import org.speeches.evaluator.service.NoSourcesException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class EvaluationExceptionHandler {

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Url Param '{}' is missing", e.getParameterName());
        return error(HttpStatus.BAD_REQUEST, "Url Param '" + e.getParameterName() + "' is missing");
    }

    @ExceptionHandler(NoSourcesException.class)
    public ResponseEntity<ErrorResponse> handleNoSources(NoSourcesException e) {
        log.warn("Rejected evaluation request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotWritableException.class)
    public ResponseEntity<ErrorResponse> handleNotWritable(HttpMessageNotWritableException e) {
        log.error("Failed to encode evaluation result", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to encode evaluation result");
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handlePipelineFailure(IllegalStateException e) {
        log.error("Evaluation failed", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Evaluation failed: " + e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse(message));
    }

    public record ErrorResponse(String error) {}
}
