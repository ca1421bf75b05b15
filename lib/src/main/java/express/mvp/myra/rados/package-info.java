/**
 * Client access layer for RADOS object storage.
 *
 * <p>Handles form a tree rooted at a {@link express.mvp.myra.rados.Rados} instance:
 *
 * <pre>
 * Rados ──create()──► Cluster ──openContext(pool)──► IoContext ──aioRead()/aioStat()──► Completion
 * </pre>
 *
 * <p>Operations that can fail at the backend return {@link express.mvp.myra.rados.RadosResult};
 * malformed arguments and lifecycle violations raise {@link
 * express.mvp.myra.rados.error.RadosException}. Every handle releases its native resource exactly
 * once, on explicit close or when collected, and a cluster's native handle outlives every context
 * opened from it.
 */
package express.mvp.myra.rados;
