/**
 * Storage backend bound to the system librados through JNA.
 *
 * <p>{@link express.mvp.myra.rados.librados.LibRados#isAvailable()} tells whether {@code
 * librados.so.2} could be loaded on this host.
 */
package express.mvp.myra.rados.librados;
