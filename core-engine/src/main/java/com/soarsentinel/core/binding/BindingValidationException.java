package com.soarsentinel.core.binding;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Structured validation failure for binding create and update requests.
 *
 * <p>
 * Carries one {@link FieldError} per rejected field so that an API layer can
 * render a 400 response without parsing the message.
 * </p>
 */
public class BindingValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final transient List<FieldError> errors;

    public BindingValidationException(List<FieldError> errors) {
        super(describe(errors));
        this.errors = List.copyOf(errors);
    }

    public List<FieldError> getErrors() {
        return errors;
    }

    private static String describe(List<FieldError> errors) {
        return "Invalid playbook binding: " + errors.stream()
                .map(FieldError::toString)
                .collect(Collectors.joining("; "));
    }

    /**
     * One rejected field.
     */
    public static final class FieldError {

        private final String field;
        private final String message;

        public FieldError(String field, String message) {
            this.field = Objects.requireNonNull(field, "field must not be null");
            this.message = Objects.requireNonNull(message, "message must not be null");
        }

        public String getField() {
            return field;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return field + ": " + message;
        }
    }
}
