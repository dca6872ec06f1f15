package com.soarsentinel.core.predicate;

/**
 * Thrown when a predicate does not conform to the grammar.
 *
 * <p>
 * Raised at binding authoring time so that an invalid predicate is never
 * stored; it is never thrown while matching events.
 * </p>
 */
public class PredicateSyntaxException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String predicate;
    private final int position;

    public PredicateSyntaxException(String message, String predicate, int position) {
        super(message + " at position " + position + " in predicate: " + predicate);
        this.predicate = predicate;
        this.position = position;
    }

    public String getPredicate() {
        return predicate;
    }

    /**
     * @return zero-based character offset of the offending token
     */
    public int getPosition() {
        return position;
    }
}
