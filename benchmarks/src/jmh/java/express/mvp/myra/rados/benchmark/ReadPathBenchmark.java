package express.mvp.myra.rados.benchmark;

import express.mvp.myra.rados.Cluster;
import express.mvp.myra.rados.Completion;
import express.mvp.myra.rados.InFlightCompletions;
import express.mvp.myra.rados.IoContext;
import express.mvp.myra.rados.ObjectStat;
import express.mvp.myra.rados.Rados;
import express.mvp.myra.rados.RadosConfig;
import express.mvp.myra.rados.RadosFactory;
import express.mvp.myra.rados.simulated.SimulatedRadosBackend;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;

/**
 * Cost of the binding layer around a read: argument checks, buffer allocation, completion
 * bookkeeping and handle release.
 *
 * <p>Runs against the simulated backend so the numbers exclude network and OSD latency.
 */
@BenchmarkMode(Mode.SampleTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Thread)
@Warmup(iterations = 3, time = 5, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 5, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class ReadPathBenchmark {

    private static final String POOL = "bench";

    private static final String OID = "payload";

    @Param({"64", "4096", "65536"})
    private int payloadSize;

    private Rados rados;
    private Cluster cluster;
    private IoContext ioctx;

    @Setup(Level.Trial)
    public void setup() {
        byte[] payload = new byte[payloadSize];
        new Random(7).nextBytes(payload);

        SimulatedRadosBackend backend = new SimulatedRadosBackend(2);
        backend.createPool(POOL);
        backend.putObject(POOL, OID, payload);

        RadosConfig config =
                RadosConfig.builder().backendType(RadosConfig.BackendType.SIMULATED).build();
        rados = RadosFactory.create(backend, config, new InFlightCompletions());
        cluster = rados.create("admin").orElseThrow();
        cluster.configure(null).orElseThrow();
        cluster.connect().orElseThrow();
        ioctx = cluster.openContext(POOL).orElseThrow();
    }

    @TearDown(Level.Trial)
    public void teardown() {
        ioctx.close();
        cluster.close();
        rados.close();
    }

    @Benchmark
    public ObjectStat syncStat() {
        return ioctx.stat(OID).value();
    }

    @Benchmark
    public byte[] syncRead() {
        return ioctx.read(OID, payloadSize, 0).value();
    }

    @Benchmark
    public byte[] aioRead() {
        try (Completion<byte[]> completion = ioctx.aioRead(OID, payloadSize, 0).orElseThrow()) {
            completion.waitForComplete();
            return completion.result().value();
        }
    }
}
