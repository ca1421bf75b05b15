package express.mvp.myra.rados.librados;

import com.sun.jna.Native;
import com.sun.jna.NativeLong;
import com.sun.jna.Pointer;
import com.sun.jna.ptr.IntByReference;
import com.sun.jna.ptr.PointerByReference;
import express.mvp.myra.rados.backend.BackendCounters;
import express.mvp.myra.rados.backend.BackendStats;
import express.mvp.myra.rados.backend.HandleRef;
import express.mvp.myra.rados.backend.RadosBackend;
import express.mvp.myra.rados.backend.RadosVersion;
import express.mvp.myra.rados.memory.ReadBuffer;
import express.mvp.myra.rados.memory.StatSlot;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Backend that calls the system librados.
 *
 * <p>Tokens are the native handle addresses. Buffers and stat slots are direct buffers whose
 * addresses are passed to librados as is, so asynchronous operations write straight into memory
 * owned by the completion.
 *
 * <p>librados frees a cluster handle only through {@code rados_shutdown}, which also accepts a
 * handle that never connected; {@link #releaseCluster(long)} therefore calls it too.
 */
public final class LibRadosBackend implements RadosBackend {

    private static final Logger LOGGER = Logger.getLogger(LibRadosBackend.class.getName());

    private final LibRados.Api lib;

    private final BackendCounters counters = new BackendCounters();

    /**
     * Binds the system librados.
     *
     * @throws UnsatisfiedLinkError if librados is not available
     */
    public LibRadosBackend() {
        this.lib = LibRados.library();
        LOGGER.log(Level.FINE, "librados {0} loaded", version());
    }

    @Override
    public RadosVersion version() {
        IntByReference major = new IntByReference();
        IntByReference minor = new IntByReference();
        IntByReference extra = new IntByReference();
        lib.rados_version(major, minor, extra);
        return new RadosVersion(major.getValue(), minor.getValue(), extra.getValue());
    }

    @Override
    public int createCluster(String userId, HandleRef cluster) {
        PointerByReference out = new PointerByReference();
        int status = lib.rados_create(out, userId);
        if (status < 0) {
            return counters.record(status);
        }
        cluster.set(LibRados.token(out.getValue()));
        counters.clustersCreated.incrementAndGet();
        return status;
    }

    @Override
    public int confReadFile(long cluster, String path) {
        return counters.record(lib.rados_conf_read_file(LibRados.pointer(cluster), path));
    }

    @Override
    public int connect(long cluster) {
        return counters.record(lib.rados_connect(LibRados.pointer(cluster)));
    }

    @Override
    public void shutdown(long cluster) {
        lib.rados_shutdown(LibRados.pointer(cluster));
        counters.clusterShutdowns.incrementAndGet();
    }

    @Override
    public void releaseCluster(long cluster) {
        // rados_shutdown is the only destructor for rados_t; unconnected clients skip the teardown
        lib.rados_shutdown(LibRados.pointer(cluster));
        counters.clustersReleasedUnconnected.incrementAndGet();
    }

    @Override
    public int createIoContext(long cluster, String poolName, HandleRef ioctx) {
        PointerByReference out = new PointerByReference();
        int status = lib.rados_ioctx_create(LibRados.pointer(cluster), poolName, out);
        if (status < 0) {
            return counters.record(status);
        }
        ioctx.set(LibRados.token(out.getValue()));
        counters.ioContextsCreated.incrementAndGet();
        return status;
    }

    @Override
    public void destroyIoContext(long ioctx) {
        lib.rados_ioctx_destroy(LibRados.pointer(ioctx));
        counters.ioContextsDestroyed.incrementAndGet();
    }

    @Override
    public void setLocatorKey(long ioctx, String locatorKey) {
        lib.rados_ioctx_locator_set_key(LibRados.pointer(ioctx), locatorKey);
    }

    @Override
    public int stat(long ioctx, String oid, StatSlot slot) {
        counters.syncStats.incrementAndGet();
        Pointer base = Native.getDirectBufferPointer(slot.buffer());
        return counters.record(
                lib.rados_stat(
                        LibRados.pointer(ioctx),
                        oid,
                        base.share(StatSlot.SIZE_OFFSET),
                        base.share(StatSlot.MTIME_OFFSET)));
    }

    @Override
    public int read(long ioctx, String oid, ReadBuffer buffer, long offset) {
        counters.syncReads.incrementAndGet();
        int status =
                lib.rados_read(
                        LibRados.pointer(ioctx),
                        oid,
                        Native.getDirectBufferPointer(buffer.buffer()),
                        new NativeLong(buffer.length()),
                        offset);
        if (status > 0) {
            counters.bytesRead.addAndGet(status);
        }
        return counters.record(status);
    }

    @Override
    public int aioCreateCompletion(HandleRef completion) {
        PointerByReference out = new PointerByReference();
        int status = lib.rados_aio_create_completion(null, null, null, out);
        if (status < 0) {
            return counters.record(status);
        }
        completion.set(LibRados.token(out.getValue()));
        counters.completionsCreated.incrementAndGet();
        return status;
    }

    @Override
    public int aioStat(long ioctx, String oid, long completion, StatSlot slot) {
        counters.aioStats.incrementAndGet();
        Pointer base = Native.getDirectBufferPointer(slot.buffer());
        return counters.record(
                lib.rados_aio_stat(
                        LibRados.pointer(ioctx),
                        oid,
                        LibRados.pointer(completion),
                        base.share(StatSlot.SIZE_OFFSET),
                        base.share(StatSlot.MTIME_OFFSET)));
    }

    @Override
    public int aioRead(long ioctx, String oid, long completion, ReadBuffer buffer, long offset) {
        counters.aioReads.incrementAndGet();
        return counters.record(
                lib.rados_aio_read(
                        LibRados.pointer(ioctx),
                        oid,
                        LibRados.pointer(completion),
                        Native.getDirectBufferPointer(buffer.buffer()),
                        new NativeLong(buffer.length()),
                        offset));
    }

    @Override
    public boolean aioIsComplete(long completion) {
        return lib.rados_aio_is_complete(LibRados.pointer(completion)) != 0;
    }

    @Override
    public int aioWaitForComplete(long completion) {
        return lib.rados_aio_wait_for_complete(LibRados.pointer(completion));
    }

    @Override
    public int aioGetReturnValue(long completion) {
        return lib.rados_aio_get_return_value(LibRados.pointer(completion));
    }

    @Override
    public void aioRelease(long completion) {
        lib.rados_aio_release(LibRados.pointer(completion));
        counters.completionsReleased.incrementAndGet();
    }

    @Override
    public String getBackendType() {
        return "librados";
    }

    @Override
    public BackendStats getStats() {
        return counters.snapshot();
    }

    @Override
    public void close() {
        // Handles own their native resources; nothing process-wide to free
        LOGGER.log(Level.FINE, "librados backend closed: {0}", counters.snapshot());
    }
}
