package com.vantage.error;

/**
 * Thrown when input to a loader, walker or service operation is malformed.
 *
 * Validation always happens before any downstream I/O, so a caller receiving
 * this exception knows that no store was touched. The message is meant to be
 * shown to the client as-is.
 */
public class ValidationException extends IllegalArgumentException {

    private final String field;

    public ValidationException(String message) {
        this(null, message);
    }

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * @return the offending argument name, or null when the error is not tied to one field
     */
    public String getField() {
        return field;
    }
}
