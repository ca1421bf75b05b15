/**
 * Memory and handle-release utilities for the RADOS access layer.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.myra.rados.memory.ReadBuffer} - Scratch region filled by a read
 *   <li>{@link express.mvp.myra.rados.memory.StatSlot} - Size/mtime storage filled by a stat
 *   <li>{@link express.mvp.myra.rados.memory.HandleCleaner} - Cleaner-driven release of handles
 *   <li>{@link express.mvp.myra.rados.memory.ResourceTracker} - Leak detection for handles and
 *       buffers
 * </ul>
 *
 * <h2>Release Rules</h2>
 *
 * <ol>
 *   <li>Every native token and every buffer is released at most once
 *   <li>A read buffer owned by a completion is released only after the completion token
 *   <li>Explicit release is preferred; the cleaner covers handles the host simply drops
 * </ol>
 *
 * @see java.lang.ref.Cleaner
 */
package express.mvp.myra.rados.memory;
