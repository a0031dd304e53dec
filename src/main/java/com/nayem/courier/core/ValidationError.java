package com.nayem.courier.core;

import java.util.Objects;

/**
 * One failed validation rule, optionally tied to the field it concerns.
 *
 * @param identifier   the field or property name, empty when the error is not tied to one
 * @param errorMessage human readable message
 * @param errorCode    machine readable code, empty when none
 * @param severity     how serious the error is
 */
public record ValidationError(String identifier, String errorMessage, String errorCode, Severity severity) {

    public enum Severity {
        ERROR,
        WARNING,
        INFO
    }

    public ValidationError {
        identifier = identifier == null ? "" : identifier;
        errorMessage = errorMessage == null ? "" : errorMessage;
        errorCode = errorCode == null ? "" : errorCode;
        severity = Objects.requireNonNullElse(severity, Severity.ERROR);
    }

    public static ValidationError of(String errorMessage) {
        return new ValidationError("", errorMessage, "", Severity.ERROR);
    }

    public static ValidationError of(String identifier, String errorMessage) {
        return new ValidationError(identifier, errorMessage, "", Severity.ERROR);
    }

    @Override
    public String toString() {
        return identifier.isEmpty() ? errorMessage : identifier + ": " + errorMessage;
    }
}
