package com.nayem.courier.core;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Status-carrying return value for handlers that report expected failures without throwing.
 * <p>
 * Handlers with nothing to return use {@code Result<Void>}. A failed result can be re-typed
 * with {@link #cast()} so that middleware can short-circuit a handler whose response type is
 * {@code Result<Order>} with a {@code Result.invalid(...)} built without knowing {@code Order}:
 * </p>
 *
 * <pre>{@code
 * if (!errors.isEmpty()) {
 *     return HandlerResult.shortCircuit(Result.invalid(errors));
 * }
 * }</pre>
 *
 * @param <T> the value type
 */
public final class Result<T> {

    private final ResultStatus status;
    private final T value;
    private final String message;
    private final String location;
    private final List<ValidationError> validationErrors;

    private Result(ResultStatus status, T value, String message, String location,
            List<ValidationError> validationErrors) {
        this.status = Objects.requireNonNull(status, "status");
        this.value = value;
        this.message = message == null ? "" : message;
        this.location = location == null ? "" : location;
        this.validationErrors = List.copyOf(validationErrors);
    }

    private static <T> Result<T> of(ResultStatus status, String message) {
        return new Result<>(status, null, message, "", List.of());
    }

    public static <T> Result<T> success() {
        return of(ResultStatus.OK, "");
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(ResultStatus.OK, value, "", "", List.of());
    }

    public static <T> Result<T> success(T value, String message) {
        return new Result<>(ResultStatus.OK, value, message, "", List.of());
    }

    public static <T> Result<T> created(T value) {
        return new Result<>(ResultStatus.CREATED, value, "", "", List.of());
    }

    public static <T> Result<T> created(T value, String location) {
        return new Result<>(ResultStatus.CREATED, value, "", location, List.of());
    }

    public static <T> Result<T> noContent() {
        return of(ResultStatus.NO_CONTENT, "");
    }

    public static <T> Result<T> error(String message) {
        return of(ResultStatus.ERROR, message);
    }

    public static <T> Result<T> error(Throwable failure) {
        return of(ResultStatus.ERROR, failure.getMessage());
    }

    public static <T> Result<T> invalid(ValidationError... errors) {
        return invalid(Arrays.asList(errors));
    }

    public static <T> Result<T> invalid(List<ValidationError> errors) {
        return new Result<>(ResultStatus.INVALID, null, "", "", errors);
    }

    public static <T> Result<T> badRequest(String message) {
        return of(ResultStatus.BAD_REQUEST, message);
    }

    public static <T> Result<T> notFound() {
        return of(ResultStatus.NOT_FOUND, "");
    }

    public static <T> Result<T> notFound(String message) {
        return of(ResultStatus.NOT_FOUND, message);
    }

    public static <T> Result<T> unauthorized() {
        return of(ResultStatus.UNAUTHORIZED, "");
    }

    public static <T> Result<T> unauthorized(String message) {
        return of(ResultStatus.UNAUTHORIZED, message);
    }

    public static <T> Result<T> forbidden() {
        return of(ResultStatus.FORBIDDEN, "");
    }

    public static <T> Result<T> forbidden(String message) {
        return of(ResultStatus.FORBIDDEN, message);
    }

    public static <T> Result<T> conflict() {
        return of(ResultStatus.CONFLICT, "");
    }

    public static <T> Result<T> conflict(String message) {
        return of(ResultStatus.CONFLICT, message);
    }

    public static <T> Result<T> criticalError(String message) {
        return of(ResultStatus.CRITICAL_ERROR, message);
    }

    public static <T> Result<T> unavailable(String message) {
        return of(ResultStatus.UNAVAILABLE, message);
    }

    /**
     * The same status, message, location and validation errors under another value type.
     * The value is dropped.
     */
    public <U> Result<U> cast() {
        return new Result<>(status, null, message, location, validationErrors);
    }

    public ResultStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status.isSuccess();
    }

    public T getValue() {
        return value;
    }

    public String getMessage() {
        return message;
    }

    public String getLocation() {
        return location;
    }

    public List<ValidationError> getValidationErrors() {
        return validationErrors;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Result<?> other
                && status == other.status
                && Objects.equals(value, other.value)
                && message.equals(other.message)
                && location.equals(other.location)
                && validationErrors.equals(other.validationErrors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, value, message, location, validationErrors);
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder("Result[").append(status);
        if (value != null) {
            text.append(", value=").append(value);
        }
        if (!message.isEmpty()) {
            text.append(", message=").append(message);
        }
        if (!validationErrors.isEmpty()) {
            text.append(", errors=").append(validationErrors);
        }
        return text.append(']').toString();
    }
}
