package express.mvp.myra.rados;

import express.mvp.myra.rados.error.RadosException;

/**
 * Validated length and offset of a read.
 *
 * @param length maximum number of bytes to read, may be 0
 * @param offset offset in the object
 */
public record ReadRange(int length, long offset) {

    /**
     * Validates the range.
     *
     * @throws RadosException with kind INVALID_ARGUMENT if length or offset is negative
     */
    public ReadRange {
        if (length < 0) {
            throw RadosException.invalidArgument("read length must not be negative: " + length);
        }
        if (offset < 0) {
            throw RadosException.invalidArgument("read offset must not be negative: " + offset);
        }
    }

    /**
     * Creates a range.
     *
     * @param length maximum number of bytes to read
     * @param offset offset in the object
     * @return the range
     */
    public static ReadRange of(int length, long offset) {
        return new ReadRange(length, offset);
    }
}
