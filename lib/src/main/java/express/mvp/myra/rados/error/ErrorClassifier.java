package express.mvp.myra.rados.error;

import static express.mvp.myra.rados.error.Errno.*;

/**
 * Classifies backend statuses and exceptions into error categories.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RadosResult<ObjectStat> result = ioctx.stat("obj");
 * if (!result.isSuccess()) {
 *     switch (ErrorClassifier.classify(result.errorCode())) {
 *         case NOT_FOUND -> handleMissing();
 *         case TRANSIENT -> scheduleRetry();
 *         default -> fail(result.errorMessage());
 *     }
 * }
 * }</pre>
 *
 * @see ErrorCategory
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
        // Utility class
    }

    /**
     * Classifies a backend status.
     *
     * @param status the backend status (negative on failure)
     * @return the error category, {@link ErrorCategory#UNKNOWN} for non-negative statuses
     */
    public static ErrorCategory classify(int status) {
        if (status >= 0) {
            return ErrorCategory.UNKNOWN;
        }

        return switch (-status) {
            case EAGAIN, EBUSY, EINPROGRESS, EALREADY, ECANCELED -> ErrorCategory.TRANSIENT;
            case ETIMEDOUT, ENOTCONN, ESHUTDOWN, ECONNREFUSED, EIO -> ErrorCategory.NETWORK;
            case ENOENT, ENODEV -> ErrorCategory.NOT_FOUND;
            case EACCES, EPERM, EROFS -> ErrorCategory.PERMISSION;
            case ENOMEM, ENOSPC, EDQUOT -> ErrorCategory.RESOURCE;
            case EINVAL, ERANGE, ENAMETOOLONG, EOPNOTSUPP, ENOSYS, EBADF, EEXIST ->
                    ErrorCategory.INVALID_REQUEST;
            default -> ErrorCategory.UNKNOWN;
        };
    }

    /**
     * Classifies an exception.
     *
     * <p>{@link RadosException}s carrying a status are classified by that status; argument and
     * state errors are {@link ErrorCategory#INVALID_REQUEST}. JVM errors are {@link
     * ErrorCategory#RESOURCE} when they are {@link OutOfMemoryError}, otherwise unknown.
     *
     * @param throwable the exception to classify
     * @return the error category
     */
    public static ErrorCategory classify(Throwable throwable) {
        if (throwable == null) {
            return ErrorCategory.UNKNOWN;
        }

        if (throwable instanceof RadosException) {
            RadosException rados = (RadosException) throwable;
            if (rados.status() < 0) {
                return classify(rados.status());
            }
            return rados.kind().isOperational()
                    ? ErrorCategory.UNKNOWN
                    : ErrorCategory.INVALID_REQUEST;
        }

        if (throwable instanceof OutOfMemoryError) {
            return ErrorCategory.RESOURCE;
        }

        if (throwable instanceof InterruptedException) {
            return ErrorCategory.TRANSIENT;
        }

        Throwable cause = throwable.getCause();
        if (cause != null && cause != throwable) {
            return classify(cause);
        }

        return ErrorCategory.UNKNOWN;
    }
}
