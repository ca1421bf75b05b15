package express.mvp.myra.rados.simulated;

import express.mvp.myra.rados.backend.BackendCounters;
import express.mvp.myra.rados.backend.BackendStats;
import express.mvp.myra.rados.backend.HandleRef;
import express.mvp.myra.rados.backend.RadosBackend;
import express.mvp.myra.rados.backend.RadosVersion;
import express.mvp.myra.rados.error.Errno;
import express.mvp.myra.rados.memory.ReadBuffer;
import express.mvp.myra.rados.memory.StatSlot;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process storage backend.
 *
 * <p>Holds pools of objects in memory and executes asynchronous operations on an {@link
 * AioWorkerPool}. It follows the librados contracts the access layer depends on and is strict
 * where librados would corrupt memory or crash:
 *
 * <ul>
 *   <li>releasing a token twice, or using an unknown token, throws {@link IllegalStateException}
 *   <li>tearing down a cluster through {@code shutdown} that never connected, tearing it down
 *       while contexts are open, releasing a completion whose operation is still running, or
 *       releasing a read buffer before its completion token are recorded as violations
 * </ul>
 *
 * <p>Objects are identified by pool, locator key and object id; an object written without a
 * locator key is not visible to a lookup that supplies one.
 *
 * <h2>Test Controls</h2>
 *
 * <ul>
 *   <li>{@link #holdCompletions()} / {@link #releaseCompletions()} keep asynchronous operations
 *       pending until released
 *   <li>{@link #failNext(SimulatedOperation, int)} makes the next call of an operation return a
 *       status
 *   <li>{@link #createPool(String)} and {@link #putObject(String, String, byte[])} seed data
 * </ul>
 */
public final class SimulatedRadosBackend implements RadosBackend {

    private static final Logger LOGGER = Logger.getLogger(SimulatedRadosBackend.class.getName());

    /** Version reported by the simulated client library. */
    public static final RadosVersion VERSION = new RadosVersion(3, 0, 0);

    private static final String NO_LOCATOR = "";

    private static final Duration TERMINATION_TIMEOUT = Duration.ofSeconds(1);

    private final AioWorkerPool workers;

    private final BackendCounters counters = new BackendCounters();

    private final AtomicLong nextToken = new AtomicLong(0x1000);

    private final Map<String, Map<ObjectKey, StoredObject>> pools = new ConcurrentHashMap<>();

    private final Map<Long, SimCluster> clusters = new ConcurrentHashMap<>();

    private final Map<Long, SimIoContext> ioContexts = new ConcurrentHashMap<>();

    private final Map<Long, SimCompletion> completions = new ConcurrentHashMap<>();

    private final Set<Long> releasedTokens = ConcurrentHashMap.newKeySet();

    private final Map<SimulatedOperation, Integer> faults = new EnumMap<>(SimulatedOperation.class);

    private final List<String> violations = new ArrayList<>();

    private final Object gateLock = new Object();

    private boolean gateClosed;

    /** Creates a backend with four asynchronous workers. */
    public SimulatedRadosBackend() {
        this(4);
    }

    /**
     * Creates a backend.
     *
     * @param aioThreads number of asynchronous workers
     */
    public SimulatedRadosBackend(int aioThreads) {
        this.workers = AioWorkerPool.builder().namePrefix("rados-aio").threads(aioThreads).build();
    }

    // ========== Fixtures ==========

    /**
     * Creates an empty pool. Existing pools are kept.
     *
     * @param name the pool name
     */
    public void createPool(String name) {
        pools.computeIfAbsent(Objects.requireNonNull(name), k -> new ConcurrentHashMap<>());
    }

    /**
     * Stores an object without a locator key, stamped with the current time.
     *
     * @param pool the pool, which must exist
     * @param oid the object id
     * @param data the contents
     */
    public void putObject(String pool, String oid, byte[] data) {
        putObject(pool, oid, null, data);
    }

    /**
     * Stores an object, stamped with the current time.
     *
     * @param pool the pool, which must exist
     * @param oid the object id
     * @param locatorKey the locator key, or null
     * @param data the contents
     */
    public void putObject(String pool, String oid, String locatorKey, byte[] data) {
        putObject(pool, oid, locatorKey, data, System.currentTimeMillis() / 1000L);
    }

    /**
     * Stores an object.
     *
     * @param pool the pool, which must exist
     * @param oid the object id
     * @param locatorKey the locator key, or null
     * @param data the contents
     * @param mtimeSeconds the modification time in epoch seconds
     * @throws IllegalArgumentException if the pool does not exist
     */
    public void putObject(
            String pool, String oid, String locatorKey, byte[] data, long mtimeSeconds) {
        Map<ObjectKey, StoredObject> objects = pools.get(pool);
        if (objects == null) {
            throw new IllegalArgumentException("no such pool: " + pool);
        }
        objects.put(
                new ObjectKey(locatorKey == null ? NO_LOCATOR : locatorKey, oid),
                new StoredObject(data.clone(), mtimeSeconds));
    }

    // ========== Test controls ==========

    /**
     * Makes the next call of an operation return {@code status} without acting.
     *
     * @param operation the operation
     * @param status the negative status to return
     * @throws IllegalArgumentException if status is not negative
     */
    public void failNext(SimulatedOperation operation, int status) {
        if (status >= 0) {
            throw new IllegalArgumentException("injected status must be negative: " + status);
        }
        synchronized (faults) {
            faults.put(operation, status);
        }
    }

    /** Keeps asynchronous operations submitted from now on pending until released. */
    public void holdCompletions() {
        synchronized (gateLock) {
            gateClosed = true;
        }
    }

    /** Lets held asynchronous operations run. */
    public void releaseCompletions() {
        synchronized (gateLock) {
            gateClosed = false;
            gateLock.notifyAll();
        }
    }

    /**
     * Returns the contract violations observed so far.
     *
     * @return a copy of the violation messages
     */
    public List<String> violations() {
        synchronized (violations) {
            return new ArrayList<>(violations);
        }
    }

    /**
     * Returns the locator key currently set on a context.
     *
     * @param ioctx the context token
     * @return the key, or null
     */
    public String currentLocatorKey(long ioctx) {
        return ioContext(ioctx).locatorKey;
    }

    /**
     * Returns the number of contexts open on a cluster.
     *
     * @param cluster the cluster token
     * @return the count
     */
    public int openIoContexts(long cluster) {
        return cluster(cluster).openContexts.get();
    }

    /**
     * Returns the user a cluster handle was created for.
     *
     * @param cluster the cluster token
     * @return the user id, or null for the default
     */
    public String userId(long cluster) {
        return cluster(cluster).userId;
    }

    /**
     * Checks if a cluster token is live.
     *
     * @param cluster the cluster token
     * @return true until the token is shut down or released
     */
    public boolean isClusterLive(long cluster) {
        return clusters.containsKey(cluster);
    }

    // ========== RadosBackend ==========

    @Override
    public RadosVersion version() {
        return VERSION;
    }

    @Override
    public int createCluster(String userId, HandleRef cluster) {
        int fault = takeFault(SimulatedOperation.CREATE);
        if (fault < 0) {
            return counters.record(fault);
        }
        long token = nextToken.incrementAndGet();
        clusters.put(token, new SimCluster(userId));
        cluster.set(token);
        counters.clustersCreated.incrementAndGet();
        return 0;
    }

    @Override
    public int confReadFile(long cluster, String path) {
        SimCluster sim = cluster(cluster);
        int fault = takeFault(SimulatedOperation.CONF_READ_FILE);
        if (fault < 0) {
            return counters.record(fault);
        }
        if (path != null && !Files.isReadable(Path.of(path))) {
            return counters.record(-Errno.ENOENT);
        }
        sim.configured = true;
        return 0;
    }

    @Override
    public int connect(long cluster) {
        SimCluster sim = cluster(cluster);
        int fault = takeFault(SimulatedOperation.CONNECT);
        if (fault < 0) {
            return counters.record(fault);
        }
        if (sim.connected) {
            return counters.record(-Errno.EALREADY);
        }
        if (!sim.configured) {
            // No monitor addresses without a configuration
            return counters.record(-Errno.ENOENT);
        }
        sim.connected = true;
        return 0;
    }

    @Override
    public void shutdown(long cluster) {
        SimCluster sim = release(clusters, cluster, "cluster");
        if (!sim.connected) {
            violation("shutdown of never-connected cluster 0x" + Long.toHexString(cluster));
        }
        checkNoOpenContexts(cluster, sim);
        counters.clusterShutdowns.incrementAndGet();
    }

    @Override
    public void releaseCluster(long cluster) {
        SimCluster sim = release(clusters, cluster, "cluster");
        if (sim.connected) {
            violation(
                    "connected cluster 0x" + Long.toHexString(cluster) + " freed without shutdown");
        }
        checkNoOpenContexts(cluster, sim);
        counters.clustersReleasedUnconnected.incrementAndGet();
    }

    @Override
    public int createIoContext(long cluster, String poolName, HandleRef ioctx) {
        SimCluster sim = cluster(cluster);
        int fault = takeFault(SimulatedOperation.IOCTX_CREATE);
        if (fault < 0) {
            return counters.record(fault);
        }
        if (!sim.connected) {
            return counters.record(-Errno.ENOTCONN);
        }
        if (!pools.containsKey(poolName)) {
            return counters.record(-Errno.ENOENT);
        }
        long token = nextToken.incrementAndGet();
        ioContexts.put(token, new SimIoContext(cluster, poolName));
        sim.openContexts.incrementAndGet();
        ioctx.set(token);
        counters.ioContextsCreated.incrementAndGet();
        return 0;
    }

    @Override
    public void destroyIoContext(long ioctx) {
        SimIoContext ctx = release(ioContexts, ioctx, "ioctx");
        SimCluster sim = clusters.get(ctx.cluster);
        if (sim == null) {
            violation("ioctx 0x" + Long.toHexString(ioctx) + " destroyed after its cluster");
        } else {
            sim.openContexts.decrementAndGet();
        }
        counters.ioContextsDestroyed.incrementAndGet();
    }

    @Override
    public void setLocatorKey(long ioctx, String locatorKey) {
        ioContext(ioctx).locatorKey = locatorKey;
    }

    @Override
    public int stat(long ioctx, String oid, StatSlot slot) {
        SimIoContext ctx = ioContext(ioctx);
        counters.syncStats.incrementAndGet();
        int fault = takeFault(SimulatedOperation.STAT);
        if (fault < 0) {
            return counters.record(fault);
        }
        return counters.record(doStat(ctx.pool, ctx.locatorKey, oid, slot));
    }

    @Override
    public int read(long ioctx, String oid, ReadBuffer buffer, long offset) {
        SimIoContext ctx = ioContext(ioctx);
        counters.syncReads.incrementAndGet();
        int fault = takeFault(SimulatedOperation.READ);
        if (fault < 0) {
            return counters.record(fault);
        }
        return counters.record(doRead(ctx.pool, ctx.locatorKey, oid, buffer, offset));
    }

    @Override
    public int aioCreateCompletion(HandleRef completion) {
        int fault = takeFault(SimulatedOperation.AIO_CREATE_COMPLETION);
        if (fault < 0) {
            return counters.record(fault);
        }
        long token = nextToken.incrementAndGet();
        completions.put(token, new SimCompletion());
        completion.set(token);
        counters.completionsCreated.incrementAndGet();
        return 0;
    }

    @Override
    public int aioStat(long ioctx, String oid, long completion, StatSlot slot) {
        SimIoContext ctx = ioContext(ioctx);
        SimCompletion comp = completion(completion);
        counters.aioStats.incrementAndGet();
        int fault = takeFault(SimulatedOperation.AIO_STAT);
        if (fault < 0) {
            return counters.record(fault);
        }
        String pool = ctx.pool;
        String locatorKey = ctx.locatorKey;
        return submit(comp, () -> doStat(pool, locatorKey, oid, slot));
    }

    @Override
    public int aioRead(long ioctx, String oid, long completion, ReadBuffer buffer, long offset) {
        SimIoContext ctx = ioContext(ioctx);
        SimCompletion comp = completion(completion);
        counters.aioReads.incrementAndGet();
        int fault = takeFault(SimulatedOperation.AIO_READ);
        if (fault < 0) {
            return counters.record(fault);
        }
        comp.buffer = buffer;
        String pool = ctx.pool;
        String locatorKey = ctx.locatorKey;
        return submit(comp, () -> doRead(pool, locatorKey, oid, buffer, offset));
    }

    @Override
    public boolean aioIsComplete(long completion) {
        return completion(completion).done.getCount() == 0;
    }

    @Override
    public int aioWaitForComplete(long completion) {
        SimCompletion comp = completion(completion);
        try {
            comp.done.await();
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return -Errno.ECANCELED;
        }
    }

    @Override
    public int aioGetReturnValue(long completion) {
        SimCompletion comp = completion(completion);
        return comp.done.getCount() == 0 ? comp.returnValue : -Errno.EINPROGRESS;
    }

    @Override
    public void aioRelease(long completion) {
        SimCompletion comp = release(completions, completion, "completion");
        if (comp.submitted && comp.done.getCount() != 0) {
            violation("completion 0x" + Long.toHexString(completion) + " released while pending");
        }
        ReadBuffer buffer = comp.buffer;
        if (buffer != null && buffer.isReleased()) {
            violation(
                    "read buffer of 0x"
                            + Long.toHexString(completion)
                            + " released before token");
        }
        counters.completionsReleased.incrementAndGet();
    }

    @Override
    public String getBackendType() {
        return "simulated";
    }

    @Override
    public BackendStats getStats() {
        return counters.snapshot();
    }

    /**
     * Stops the workers and completes every unfinished operation with {@code -ECANCELED}, so
     * waiting on or releasing its completion afterwards returns at once.
     */
    @Override
    public void close() {
        workers.shutdownNow();
        releaseCompletions();
        try {
            if (!workers.awaitTermination(TERMINATION_TIMEOUT)) {
                LOGGER.log(Level.WARNING, "simulated aio workers still running after close");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.log(Level.WARNING, "interrupted while waiting for simulated aio workers", e);
        }

        int cancelled = 0;
        for (SimCompletion comp : completions.values()) {
            if (comp.submitted && comp.complete(-Errno.ECANCELED)) {
                cancelled++;
            }
        }
        LOGGER.log(
                Level.FINE,
                "simulated backend closed: {0}, {1} pending operation(s) cancelled",
                new Object[] {workers, cancelled});
    }

    // ========== Internals ==========

    private int submit(SimCompletion comp, IntSupplier operation) {
        comp.submitted = true;
        if (workers.submit(() -> comp.complete(runGated(operation))) == null) {
            comp.submitted = false;
            return counters.record(-Errno.ESHUTDOWN);
        }
        return 0;
    }

    private int runGated(IntSupplier operation) {
        synchronized (gateLock) {
            while (gateClosed) {
                try {
                    gateLock.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return -Errno.ECANCELED;
                }
            }
        }
        if (Thread.currentThread().isInterrupted()) {
            // Worker pool shut down
            return -Errno.ECANCELED;
        }
        return counters.record(operation.getAsInt());
    }

    private int doStat(String pool, String locatorKey, String oid, StatSlot slot) {
        StoredObject object = lookup(pool, locatorKey, oid);
        if (object == null) {
            return -Errno.ENOENT;
        }
        slot.store(object.data.length, object.mtimeSeconds);
        return 0;
    }

    private int doRead(String pool, String locatorKey, String oid, ReadBuffer buffer, long offset) {
        StoredObject object = lookup(pool, locatorKey, oid);
        if (object == null) {
            return -Errno.ENOENT;
        }
        int available = offset >= object.data.length ? 0 : (int) (object.data.length - offset);
        int count = Math.min(buffer.length(), available);
        if (buffer.isReleased()) {
            violation("read into released buffer of " + oid);
            return -Errno.EIO;
        }
        if (count > 0) {
            ByteBuffer target = buffer.buffer().duplicate();
            target.clear();
            target.put(object.data, (int) offset, count);
        }
        counters.bytesRead.addAndGet(count);
        return count;
    }

    private StoredObject lookup(String pool, String locatorKey, String oid) {
        Map<ObjectKey, StoredObject> objects = pools.get(pool);
        if (objects == null) {
            return null;
        }
        return objects.get(new ObjectKey(locatorKey == null ? NO_LOCATOR : locatorKey, oid));
    }

    private int takeFault(SimulatedOperation operation) {
        synchronized (faults) {
            Integer status = faults.remove(operation);
            return status == null ? 0 : status;
        }
    }

    private <T> T release(Map<Long, T> live, long token, String what) {
        T handle = live.remove(token);
        if (handle == null) {
            throw new IllegalStateException(
                    (releasedTokens.contains(token) ? "double release of " : "release of unknown ")
                            + what
                            + " token 0x"
                            + Long.toHexString(token));
        }
        releasedTokens.add(token);
        return handle;
    }

    private void checkNoOpenContexts(long token, SimCluster sim) {
        int open = sim.openContexts.get();
        if (open > 0) {
            violation(
                    "cluster 0x" + Long.toHexString(token) + " torn down with " + open
                            + " open ioctx(s)");
        }
    }

    private void violation(String message) {
        LOGGER.log(Level.WARNING, "librados contract violation: {0}", message);
        synchronized (violations) {
            violations.add(message);
        }
    }

    private SimCluster cluster(long token) {
        SimCluster sim = clusters.get(token);
        if (sim == null) {
            throw new IllegalStateException(unknownToken("cluster", token));
        }
        return sim;
    }

    private SimIoContext ioContext(long token) {
        SimIoContext ctx = ioContexts.get(token);
        if (ctx == null) {
            throw new IllegalStateException(unknownToken("ioctx", token));
        }
        return ctx;
    }

    private SimCompletion completion(long token) {
        SimCompletion comp = completions.get(token);
        if (comp == null) {
            throw new IllegalStateException(unknownToken("completion", token));
        }
        return comp;
    }

    private String unknownToken(String what, long token) {
        return (releasedTokens.contains(token) ? "released " : "unknown ")
                + what
                + " token 0x"
                + Long.toHexString(token);
    }

    @Override
    public String toString() {
        return "SimulatedRadosBackend[pools="
                + pools.size()
                + ", clusters="
                + clusters.size()
                + ", ioctxs="
                + ioContexts.size()
                + ", completions="
                + completions.size()
                + "]";
    }

    private record ObjectKey(String locatorKey, String oid) {}

    private record StoredObject(byte[] data, long mtimeSeconds) {}

    private static final class SimCluster {
        final String userId;
        final AtomicInteger openContexts = new AtomicInteger();
        volatile boolean configured;
        volatile boolean connected;

        SimCluster(String userId) {
            this.userId = userId;
        }
    }

    private static final class SimIoContext {
        final long cluster;
        final String pool;
        volatile String locatorKey;

        SimIoContext(long cluster, String pool) {
            this.cluster = cluster;
            this.pool = pool;
        }
    }

    private static final class SimCompletion {
        final CountDownLatch done = new CountDownLatch(1);
        volatile boolean submitted;
        volatile int returnValue;
        volatile ReadBuffer buffer;

        /** Sets the return value once. Later calls have no effect and return false. */
        synchronized boolean complete(int status) {
            if (done.getCount() == 0) {
                return false;
            }
            returnValue = status;
            done.countDown();
            return true;
        }
    }
}
