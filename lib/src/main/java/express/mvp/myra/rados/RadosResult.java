package express.mvp.myra.rados;

import express.mvp.myra.rados.error.ErrorCategory;
import express.mvp.myra.rados.error.ErrorClassifier;
import express.mvp.myra.rados.error.ErrorKind;
import express.mvp.myra.rados.error.Errno;
import express.mvp.myra.rados.error.RadosException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of an operation that can fail at the backend: a value, or an error message with the
 * negative backend status.
 *
 * <p>This is the Java form of the {@code (value-or-nil, error-message, error-code)} protocol.
 * Expected failures (object not found, pool missing, allocation failure, completion not finished)
 * never raise; they come back as a failed result.
 *
 * <pre>{@code
 * RadosResult<ObjectStat> stat = ioctx.stat("obj");
 * if (stat.isSuccess()) {
 *     long size = stat.value().size();
 * } else if (Errno.isNotFound(stat.errorCode())) {
 *     // absent
 * } else {
 *     LOGGER.warning(stat.errorMessage());
 * }
 * }</pre>
 *
 * @param <T> the value type
 */
public final class RadosResult<T> {

    private final T value;

    private final String errorMessage;

    private final int errorCode;

    private final ErrorKind errorKind;

    private RadosResult(T value, String errorMessage, int errorCode, ErrorKind errorKind) {
        this.value = value;
        this.errorMessage = errorMessage;
        this.errorCode = errorCode;
        this.errorKind = errorKind;
    }

    /**
     * Creates a successful result.
     *
     * @param value the value, null for operations without one
     * @param <T> the value type
     * @return the result
     */
    public static <T> RadosResult<T> success(T value) {
        return new RadosResult<>(value, null, 0, null);
    }

    /**
     * Creates a failed result from a negative backend status.
     *
     * @param status the negative status
     * @param <T> the value type
     * @return the result
     * @throws IllegalArgumentException if status is not negative
     */
    public static <T> RadosResult<T> failure(int status) {
        if (status >= 0) {
            throw new IllegalArgumentException("failure status must be negative: " + status);
        }
        return new RadosResult<>(null, Errno.describe(status), status, ErrorKind.BACKEND_ERROR);
    }

    /**
     * Creates the failed result of a buffer allocation failure ({@code -ENOMEM}).
     *
     * @param <T> the value type
     * @return the result
     */
    public static <T> RadosResult<T> allocationFailure() {
        return new RadosResult<>(
                null, Errno.describe(Errno.ENOMEM), -Errno.ENOMEM, ErrorKind.ALLOCATION_FAILURE);
    }

    /**
     * Checks if the operation succeeded.
     *
     * @return true on success
     */
    public boolean isSuccess() {
        return errorKind == null;
    }

    /**
     * Returns the value of a successful result.
     *
     * @return the value, or null for a failed result
     */
    public T value() {
        return value;
    }

    /**
     * Returns the strerror-style message of a failed result.
     *
     * @return the message, or null on success
     */
    public String errorMessage() {
        return errorMessage;
    }

    /**
     * Returns the negative backend status of a failed result.
     *
     * @return the status, or 0 on success
     */
    public int errorCode() {
        return errorCode;
    }

    /**
     * Returns the kind of failure.
     *
     * @return {@link ErrorKind#BACKEND_ERROR} or {@link ErrorKind#ALLOCATION_FAILURE}, or null on
     *     success
     */
    public ErrorKind errorKind() {
        return errorKind;
    }

    /**
     * Classifies the failure for retry decisions.
     *
     * @return the category, or null on success
     */
    public ErrorCategory category() {
        return isSuccess() ? null : ErrorClassifier.classify(errorCode);
    }

    /**
     * Returns the value, raising the failure instead.
     *
     * @param operation name of the operation for the exception message
     * @return the value
     * @throws RadosException if the result is a failure
     */
    public T orElseThrow(String operation) {
        if (!isSuccess()) {
            throw Errno.fromStatus(errorCode, operation);
        }
        return value;
    }

    /**
     * Returns the value, raising the failure instead.
     *
     * @return the value
     * @throws RadosException if the result is a failure
     */
    public T orElseThrow() {
        return orElseThrow("rados operation");
    }

    /**
     * Returns the value as an optional.
     *
     * @return the value, or empty for a failure or a null value
     */
    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    /**
     * Transforms the value of a successful result.
     *
     * @param mapper the transformation
     * @param <U> the new value type
     * @return the transformed result, or this failure re-typed
     */
    public <U> RadosResult<U> map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (!isSuccess()) {
            return new RadosResult<>(null, errorMessage, errorCode, errorKind);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "RadosResult[ok]"
                : "RadosResult[" + errorMessage + ", " + errorCode + "]";
    }
}
