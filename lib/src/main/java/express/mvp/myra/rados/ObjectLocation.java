package express.mvp.myra.rados;

import express.mvp.myra.rados.error.RadosException;

/**
 * Validated object id with its optional locator key.
 *
 * <p>Both strings cross into a C API, so embedded NUL characters are rejected along with a null
 * object id.
 *
 * @param oid the object id
 * @param locatorKey the locator key, or null
 */
public record ObjectLocation(String oid, String locatorKey) {

    /**
     * Validates the object id and locator key.
     *
     * @throws RadosException with kind INVALID_ARGUMENT if either is malformed
     */
    public ObjectLocation {
        if (oid == null) {
            throw RadosException.invalidArgument("object id must not be null");
        }
        if (oid.indexOf('\0') >= 0) {
            throw RadosException.invalidArgument("object id must not contain NUL characters");
        }
        if (locatorKey != null && locatorKey.indexOf('\0') >= 0) {
            throw RadosException.invalidArgument("locator key must not contain NUL characters");
        }
    }

    /**
     * Creates a location without a locator key.
     *
     * @param oid the object id
     * @return the location
     */
    public static ObjectLocation of(String oid) {
        return new ObjectLocation(oid, null);
    }

    /**
     * Creates a location with an optional locator key.
     *
     * @param oid the object id
     * @param locatorKey the locator key, or null
     * @return the location
     */
    public static ObjectLocation of(String oid, String locatorKey) {
        return new ObjectLocation(oid, locatorKey);
    }

    /**
     * Checks if a locator key was supplied.
     *
     * @return true if the locator key is non-null
     */
    public boolean hasLocatorKey() {
        return locatorKey != null;
    }
}
