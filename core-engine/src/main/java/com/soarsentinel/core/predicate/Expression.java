package com.soarsentinel.core.predicate;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Node of a parsed predicate.
 *
 * <p>
 * Evaluation is a single walk over a finite tree: there are no loops, no
 * function calls other than {@code contains}, and no access to anything but
 * the supplied namespace map.
 * </p>
 */
interface Expression {

    /**
     * @param root namespace the field paths resolve against
     * @return the value of this node
     * @throws PredicateEvaluationException if the node cannot be evaluated
     */
    Object evaluate(Map<String, ?> root);

    // ---------------------------------------------------------------
    // Leaves
    // ---------------------------------------------------------------

    final class Literal implements Expression {
        private final Object value;

        Literal(Object value) {
            this.value = value;
        }

        @Override
        public Object evaluate(Map<String, ?> root) {
            return value;
        }

        @Override
        public String toString() {
            return value instanceof String s ? "'" + s + "'" : String.valueOf(value);
        }
    }

    final class FieldRef implements Expression {
        private final List<String> segments;

        FieldRef(List<String> segments) {
            this.segments = List.copyOf(segments);
        }

        @Override
        public Object evaluate(Map<String, ?> root) {
            Object value = FieldPaths.lookup(root, segments);
            if (value == FieldPaths.MISSING) {
                throw new PredicateEvaluationException("Field '" + this + "' is not present");
            }
            return value;
        }

        @Override
        public String toString() {
            return String.join(".", segments);
        }
    }

    // ---------------------------------------------------------------
    // Operators
    // ---------------------------------------------------------------

    final class Coalesce implements Expression {
        private final Expression value;
        private final Expression fallback;

        Coalesce(Expression value, Expression fallback) {
            this.value = value;
            this.fallback = fallback;
        }

        @Override
        public Object evaluate(Map<String, ?> root) {
            Object result;
            try {
                result = value.evaluate(root);
            } catch (PredicateEvaluationException e) {
                return fallback.evaluate(root);
            }
            return result != null ? result : fallback.evaluate(root);
        }

        @Override
        public String toString() {
            return value + " ?? " + fallback;
        }
    }

    final class Contains implements Expression {
        private final Expression container;
        private final Expression element;

        Contains(Expression container, Expression element) {
            this.container = container;
            this.element = element;
        }

        @Override
        public Object evaluate(Map<String, ?> root) {
            Object haystack = container.evaluate(root);
            Object needle = element.evaluate(root);
            if (haystack instanceof Collection<?> collection) {
                for (Object candidate : collection) {
                    if (valuesEqual(candidate, needle)) {
                        return Boolean.TRUE;
                    }
                }
                return Boolean.FALSE;
            }
            if (haystack instanceof String s) {
                return needle != null && s.contains(needle.toString());
            }
            if (haystack instanceof Map<?, ?> map) {
                return needle != null && map.containsKey(needle.toString());
            }
            throw new PredicateEvaluationException(
                    "'" + container + "' is not a collection, string or map");
        }

        @Override
        public String toString() {
            return container + ".contains(" + element + ")";
        }
    }

    final class Comparison implements Expression {
        private final Expression left;
        private final Expression right;
        private final boolean negated;

        Comparison(Expression left, Expression right, boolean negated) {
            this.left = left;
            this.right = right;
            this.negated = negated;
        }

        @Override
        public Object evaluate(Map<String, ?> root) {
            boolean equal = valuesEqual(left.evaluate(root), right.evaluate(root));
            return negated != equal;
        }

        @Override
        public String toString() {
            return left + (negated ? " != " : " == ") + right;
        }
    }

    final class Not implements Expression {
        private final Expression operand;

        Not(Expression operand) {
            this.operand = operand;
        }

        @Override
        public Object evaluate(Map<String, ?> root) {
            return !asBoolean(operand, operand.evaluate(root));
        }

        @Override
        public String toString() {
            return "!" + operand;
        }
    }

    final class And implements Expression {
        private final Expression left;
        private final Expression right;

        And(Expression left, Expression right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public Object evaluate(Map<String, ?> root) {
            return asBoolean(left, left.evaluate(root)) && asBoolean(right, right.evaluate(root));
        }

        @Override
        public String toString() {
            return "(" + left + " && " + right + ")";
        }
    }

    final class Or implements Expression {
        private final Expression left;
        private final Expression right;

        Or(Expression left, Expression right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public Object evaluate(Map<String, ?> root) {
            return asBoolean(left, left.evaluate(root)) || asBoolean(right, right.evaluate(root));
        }

        @Override
        public String toString() {
            return "(" + left + " || " + right + ")";
        }
    }

    // ---------------------------------------------------------------
    // Value semantics
    // ---------------------------------------------------------------

    /**
     * Numbers compare by numeric value regardless of their Java type;
     * everything else uses {@link Objects#equals(Object, Object)}.
     */
    static boolean valuesEqual(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return toDecimal(x).compareTo(toDecimal(y)) == 0;
        }
        return Objects.equals(a, b);
    }

    static boolean asBoolean(Expression source, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new PredicateEvaluationException(
                "'" + source + "' evaluated to " + value + ", expected a boolean");
    }

    private static BigDecimal toDecimal(Number n) {
        if (n instanceof BigDecimal d) {
            return d;
        }
        if (n instanceof Double || n instanceof Float) {
            return BigDecimal.valueOf(n.doubleValue());
        }
        return new BigDecimal(n.toString());
    }
}
