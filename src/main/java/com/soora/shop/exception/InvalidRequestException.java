package com.soora.shop.exception;

import java.util.Collections;
import java.util.List;

/**
 * Exception thrown when request parameters fail validation outside of Bean Validation
 * (query strings parsed by hand, unknown enum values, bad date ranges).
 *
 * @author Soora Platform Team
 */
public class InvalidRequestException extends RuntimeException {

    private final List<FieldViolation> violations;

    public InvalidRequestException(String field, String message) {
        this(List.of(new FieldViolation(field, message)));
    }

    public InvalidRequestException(List<FieldViolation> violations) {
        super(violations.isEmpty() ? "Invalid request" : violations.get(0).getMessage());
        this.violations = Collections.unmodifiableList(violations);
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }

    /**
     * One rejected field.
     */
    public static class FieldViolation {
        private final String field;
        private final String message;

        public FieldViolation(String field, String message) {
            this.field = field;
            this.message = message;
        }

        public String getField() {
            return field;
        }

        public String getMessage() {
            return message;
        }
    }
}
