package com.gbskill.engine.dsl;

import java.util.List;

/**
 * Thrown when a DSL payload cannot be parsed or fails structural validation.
 *
 * At load time the offending skill is skipped; on create or update the
 * request is rejected.
 */
public class DslValidationException extends RuntimeException {

    private final List<String> problems;

    public DslValidationException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    public DslValidationException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public DslValidationException(List<String> problems) {
        super("Invalid skill DSL: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() { return problems; }
}
