package org.speeches.evaluator.service;

public class NoSourcesException extends RuntimeException {

    public NoSourcesException(String message) {
        super(message);
    }
}
