package express.mvp.myra.rados.backend;

/**
 * Version of the storage client library.
 *
 * @param major major version
 * @param minor minor version
 * @param extra extra (patch) version
 */
public record RadosVersion(int major, int minor, int extra) {

    /**
     * Checks if any version part is non-zero.
     *
     * @return true unless the version is 0.0.0
     */
    public boolean isKnown() {
        return major > 0 || minor > 0 || extra > 0;
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + extra;
    }
}
