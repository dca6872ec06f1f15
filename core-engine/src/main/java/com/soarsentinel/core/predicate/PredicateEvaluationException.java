package com.soarsentinel.core.predicate;

/**
 * Thrown when a well-formed predicate cannot be evaluated against a given
 * input, e.g. a referenced field is absent and no {@code ??} default is
 * given. Callers matching events treat it as a non-match.
 */
public class PredicateEvaluationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PredicateEvaluationException(String message) {
        super(message);
    }
}
