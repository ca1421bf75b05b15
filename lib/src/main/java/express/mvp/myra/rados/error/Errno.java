package express.mvp.myra.rados.error;

/**
 * Linux errno values as returned (negated) by librados, with descriptions and recovery hints.
 *
 * <p>Every librados call reports failure as a negative errno. This class turns those statuses into
 * the human-readable message of the nil/message/code result protocol and into {@link
 * RadosException}s with hints for the common cases.
 *
 * <h2>Common Statuses</h2>
 *
 * <table border="1">
 *   <caption>Backend statuses and their meanings</caption>
 *   <tr><th>Errno</th><th>Name</th><th>Typical cause</th></tr>
 *   <tr><td>2</td><td>ENOENT</td><td>Object or pool does not exist</td></tr>
 *   <tr><td>12</td><td>ENOMEM</td><td>Read buffer allocation failed</td></tr>
 *   <tr><td>13</td><td>EACCES</td><td>Missing capabilities for the pool</td></tr>
 *   <tr><td>108</td><td>ESHUTDOWN</td><td>Client was blocklisted by the cluster</td></tr>
 *   <tr><td>110</td><td>ETIMEDOUT</td><td>Monitors unreachable</td></tr>
 *   <tr><td>115</td><td>EINPROGRESS</td><td>Completion harvested before it finished</td></tr>
 * </table>
 *
 * @see ErrorClassifier
 */
public final class Errno {

    public static final int EPERM = 1;
    public static final int ENOENT = 2;
    public static final int EIO = 5;
    public static final int EBADF = 9;
    public static final int EAGAIN = 11;
    public static final int ENOMEM = 12;
    public static final int EACCES = 13;
    public static final int EBUSY = 16;
    public static final int EEXIST = 17;
    public static final int ENODEV = 19;
    public static final int EINVAL = 22;
    public static final int ENOSPC = 28;
    public static final int EROFS = 30;
    public static final int ERANGE = 34;
    public static final int ENAMETOOLONG = 36;
    public static final int ENOSYS = 38;
    public static final int EOPNOTSUPP = 95;
    public static final int ENOTCONN = 107;
    public static final int ESHUTDOWN = 108;
    public static final int ETIMEDOUT = 110;
    public static final int ECONNREFUSED = 111;
    public static final int EALREADY = 114;
    public static final int EINPROGRESS = 115;
    public static final int EDQUOT = 122;
    public static final int ECANCELED = 125;

    private Errno() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the strerror-style description of a status.
     *
     * @param status the errno value (may be negative, will be converted to absolute)
     * @return the description, never null
     */
    public static String describe(int status) {
        int errno = Math.abs(status);

        return switch (errno) {
            case EPERM -> "Operation not permitted";
            case ENOENT -> "No such file or directory";
            case EIO -> "Input/output error";
            case EBADF -> "Bad file descriptor";
            case EAGAIN -> "Resource temporarily unavailable";
            case ENOMEM -> "Cannot allocate memory";
            case EACCES -> "Permission denied";
            case EBUSY -> "Device or resource busy";
            case EEXIST -> "File exists";
            case ENODEV -> "No such device";
            case EINVAL -> "Invalid argument";
            case ENOSPC -> "No space left on device";
            case EROFS -> "Read-only file system";
            case ERANGE -> "Numerical result out of range";
            case ENAMETOOLONG -> "File name too long";
            case ENOSYS -> "Function not implemented";
            case EOPNOTSUPP -> "Operation not supported";
            case ENOTCONN -> "Transport endpoint is not connected";
            case ESHUTDOWN -> "Cannot send after transport endpoint shutdown";
            case ETIMEDOUT -> "Connection timed out";
            case ECONNREFUSED -> "Connection refused";
            case EALREADY -> "Operation already in progress";
            case EINPROGRESS -> "Operation now in progress";
            case EDQUOT -> "Disk quota exceeded";
            case ECANCELED -> "Operation canceled";
            default -> "Unknown error " + errno;
        };
    }

    /**
     * Creates a {@link RadosException} from a backend status with context.
     *
     * <p>The message includes the operation name, the description and a recovery hint for the
     * statuses that have an obvious one.
     *
     * @param status the negative backend status
     * @param operation description of the failed operation (e.g., "stat", "connect")
     * @return the exception, with kind {@link ErrorKind#ALLOCATION_FAILURE} for ENOMEM and {@link
     *     ErrorKind#BACKEND_ERROR} otherwise
     */
    public static RadosException fromStatus(int status, String operation) {
        int errno = Math.abs(status);
        String base = operation + " failed: " + describe(errno) + " (errno=" + errno + ").";

        return switch (errno) {
            case ENOENT ->
                    new RadosException(
                            ErrorKind.BACKEND_ERROR,
                            base + " Hint: the object or pool does not exist.",
                            -errno);
            case EACCES, EPERM ->
                    new RadosException(
                            ErrorKind.BACKEND_ERROR,
                            base + " Hint: check the client keyring and its capabilities.",
                            -errno);
            case ETIMEDOUT ->
                    new RadosException(
                            ErrorKind.BACKEND_ERROR,
                            base + " Hint: monitors unreachable. Check mon_host and connectivity.",
                            -errno);
            case ESHUTDOWN ->
                    new RadosException(
                            ErrorKind.BACKEND_ERROR,
                            base + " Hint: the client may have been blocklisted. Reconnect.",
                            -errno);
            case EINPROGRESS ->
                    new RadosException(
                            ErrorKind.BACKEND_ERROR,
                            base + " Hint: wait for the completion before harvesting it.",
                            -errno);
            case ENOMEM ->
                    new RadosException(
                            ErrorKind.ALLOCATION_FAILURE,
                            base + " Hint: reduce the read length.",
                            -errno);
            default -> new RadosException(ErrorKind.BACKEND_ERROR, base, -errno);
        };
    }

    /**
     * Checks if the status indicates a transient condition worth retrying.
     *
     * @param status the errno value (may be negative)
     * @return true for EAGAIN, EBUSY, ETIMEDOUT and EINPROGRESS
     */
    public static boolean isRetryable(int status) {
        int errno = Math.abs(status);
        return errno == EAGAIN || errno == EBUSY || errno == ETIMEDOUT || errno == EINPROGRESS;
    }

    /**
     * Checks if the status means the object or pool does not exist.
     *
     * @param status the errno value (may be negative)
     * @return true for ENOENT
     */
    public static boolean isNotFound(int status) {
        return Math.abs(status) == ENOENT;
    }
}
