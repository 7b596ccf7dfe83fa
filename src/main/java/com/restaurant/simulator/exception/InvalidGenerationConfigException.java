package com.restaurant.simulator.exception;

/**
 * A generator setting or request value is out of range. Carries the name of
 * the offending field so the REST layer can report it.
 */
public class InvalidGenerationConfigException extends IllegalArgumentException {

    private final String field;

    public InvalidGenerationConfigException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
