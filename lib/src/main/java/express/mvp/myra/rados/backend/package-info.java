/**
 * Storage backend contract.
 *
 * <p>{@link express.mvp.myra.rados.backend.RadosBackend} is the only way the access layer talks to
 * a storage client library. Handles cross this boundary as opaque tokens, failures as negative
 * statuses.
 *
 * @see express.mvp.myra.rados.librados
 * @see express.mvp.myra.rados.simulated
 */
package express.mvp.myra.rados.backend;
