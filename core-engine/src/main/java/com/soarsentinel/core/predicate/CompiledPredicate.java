package com.soarsentinel.core.predicate;

import java.util.Map;

/**
 * A parsed predicate ready to be evaluated any number of times.
 * Instances are immutable and thread-safe.
 */
public final class CompiledPredicate {

    private final String source;
    private final Expression expression;

    CompiledPredicate(String source, Expression expression) {
        this.source = source;
        this.expression = expression;
    }

    /**
     * Strict evaluation.
     *
     * @param root namespace to resolve field paths against
     * @return the boolean result
     * @throws PredicateEvaluationException if a field is absent without a
     *                                      default or the result is not boolean
     */
    public boolean test(Map<String, ?> root) {
        return Expression.asBoolean(expression, expression.evaluate(root));
    }

    /**
     * Lenient evaluation: evaluation errors count as a non-match.
     */
    public boolean matches(Map<String, ?> root) {
        try {
            return test(root);
        } catch (PredicateEvaluationException e) {
            return false;
        }
    }

    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return expression.toString();
    }
}
