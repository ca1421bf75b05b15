package express.mvp.myra.rados.librados;

import com.sun.jna.Library;
import com.sun.jna.Native;
import com.sun.jna.NativeLibrary;
import com.sun.jna.NativeLong;
import com.sun.jna.Pointer;
import com.sun.jna.ptr.IntByReference;
import com.sun.jna.ptr.PointerByReference;
import java.io.File;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JNA binding of the librados C API subset used by {@link LibRadosBackend}.
 *
 * <p>The library is loaded once, on first use of this class. {@link #isAvailable()} reports whether
 * loading succeeded; {@link #library()} fails with the load error otherwise.
 *
 * <h2>Type Mapping</h2>
 *
 * <table border="1">
 *   <caption>C to Java types</caption>
 *   <tr><th>C</th><th>Java</th></tr>
 *   <tr><td>rados_t, rados_ioctx_t, rados_completion_t</td><td>{@link Pointer}</td></tr>
 *   <tr><td>size_t</td><td>{@link NativeLong} (LP64)</td></tr>
 *   <tr><td>uint64_t</td><td>long</td></tr>
 *   <tr><td>uint64_t*, time_t*</td><td>{@link Pointer} into a stat slot</td></tr>
 *   <tr><td>const char*</td><td>String</td></tr>
 * </table>
 */
public final class LibRados {

    private static final Logger LOGGER = Logger.getLogger(LibRados.class.getName());

    /** Symbol used to verify a loaded library is librados. */
    private static final String PROBE_SYMBOL = "rados_create";

    private static final String[] VERSIONED_NAMES = {"rados", "librados.so.2", "librados.so"};

    private static final Api API;

    private static final Throwable LOAD_ERROR;

    static {
        Api api = null;
        Throwable error = null;
        try {
            api = loadLibrary();
        } catch (UnsatisfiedLinkError e) {
            error = e;
            LOGGER.log(Level.FINE, "librados not available: {0}", e.getMessage());
        }
        API = api;
        LOAD_ERROR = error;
    }

    private LibRados() {
        // Utility class
    }

    /**
     * Checks if librados was loaded.
     *
     * @return true if the native library is usable
     */
    public static boolean isAvailable() {
        return API != null;
    }

    /**
     * Returns the bound library.
     *
     * @return the binding
     * @throws UnsatisfiedLinkError if librados could not be loaded
     */
    public static Api library() {
        if (API == null) {
            UnsatisfiedLinkError error = new UnsatisfiedLinkError("librados is not available");
            error.initCause(LOAD_ERROR);
            throw error;
        }
        return API;
    }

    /** Converts a native handle to its opaque token. */
    static long token(Pointer handle) {
        return Pointer.nativeValue(handle);
    }

    /** Converts an opaque token back to a native handle. */
    static Pointer pointer(long token) {
        return token == 0 ? null : new Pointer(token);
    }

    private static Api loadLibrary() {
        UnsatisfiedLinkError last = null;

        // 1. Names resolved by the system loader
        for (String name : VERSIONED_NAMES) {
            try {
                return bind(name);
            } catch (UnsatisfiedLinkError e) {
                last = e;
            }
        }

        // 2. Common system paths
        for (String path : searchPaths(System.getProperty("os.arch"))) {
            File file = new File(path, "librados.so.2");
            if (file.exists()) {
                try {
                    return bind(file.getAbsolutePath());
                } catch (UnsatisfiedLinkError e) {
                    last = e;
                }
            }
        }

        throw last != null ? last : new UnsatisfiedLinkError("librados not found");
    }

    private static Api bind(String name) {
        // JNA resolves functions lazily, so probe one before binding
        NativeLibrary.getInstance(name).getFunction(PROBE_SYMBOL);
        return Native.load(name, Api.class);
    }

    private static String[] searchPaths(String arch) {
        String gnuArch =
                switch (arch) {
                    case "aarch64" -> "aarch64-linux-gnu";
                    case "amd64", "x86_64" -> "x86_64-linux-gnu";
                    default -> null;
                };

        if (gnuArch != null) {
            return new String[] {
                "/usr/lib/" + gnuArch, "/lib/" + gnuArch, "/usr/local/lib", "/usr/lib", "/lib"
            };
        }
        return new String[] {"/usr/local/lib", "/usr/lib", "/lib"};
    }

    /** librados functions, named as in {@code rados/librados.h}. */
    public interface Api extends Library {

        void rados_version(IntByReference major, IntByReference minor, IntByReference extra);

        int rados_create(PointerByReference cluster, String id);

        int rados_conf_read_file(Pointer cluster, String path);

        int rados_connect(Pointer cluster);

        void rados_shutdown(Pointer cluster);

        int rados_ioctx_create(Pointer cluster, String poolName, PointerByReference ioctx);

        void rados_ioctx_destroy(Pointer ioctx);

        void rados_ioctx_locator_set_key(Pointer ioctx, String key);

        int rados_stat(Pointer ioctx, String oid, Pointer psize, Pointer pmtime);

        int rados_read(Pointer ioctx, String oid, Pointer buf, NativeLong len, long off);

        int rados_aio_create_completion(
                Pointer cbArg, Pointer cbComplete, Pointer cbSafe, PointerByReference pc);

        int rados_aio_stat(
                Pointer ioctx, String oid, Pointer completion, Pointer psize, Pointer pmtime);

        int rados_aio_read(
                Pointer ioctx,
                String oid,
                Pointer completion,
                Pointer buf,
                NativeLong len,
                long off);

        int rados_aio_is_complete(Pointer completion);

        int rados_aio_wait_for_complete(Pointer completion);

        int rados_aio_get_return_value(Pointer completion);

        void rados_aio_release(Pointer completion);
    }
}
