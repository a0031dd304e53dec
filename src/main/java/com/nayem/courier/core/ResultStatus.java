package com.nayem.courier.core;

/**
 * Outcome category of a {@link Result}. Only {@link #OK}, {@link #CREATED} and
 * {@link #NO_CONTENT} count as success.
 */
public enum ResultStatus {
    OK,
    CREATED,
    NO_CONTENT,
    BAD_REQUEST,
    ERROR,
    INVALID,
    NOT_FOUND,
    UNAUTHORIZED,
    FORBIDDEN,
    CONFLICT,
    CRITICAL_ERROR,
    UNAVAILABLE;

    public boolean isSuccess() {
        return this == OK || this == CREATED || this == NO_CONTENT;
    }
}
