/**
 * In-process storage backend for tests and for hosts without a cluster.
 *
 * <p>{@link express.mvp.myra.rados.simulated.SimulatedRadosBackend} keeps pools and objects in
 * memory, runs asynchronous operations on an {@link
 * express.mvp.myra.rados.simulated.AioWorkerPool}, and records misuse of native tokens that a real
 * librados would turn into memory corruption.
 */
package express.mvp.myra.rados.simulated;
