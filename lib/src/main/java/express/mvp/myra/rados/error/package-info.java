/**
 * Error taxonomy for the RADOS access layer.
 *
 * <p>Failures take one of the shapes in {@link express.mvp.myra.rados.error.ErrorKind}. Argument
 * and lifecycle violations are raised immediately as {@link
 * express.mvp.myra.rados.error.RadosException}; backend statuses travel as result values and can
 * be described with {@link express.mvp.myra.rados.error.Errno} and classified with {@link
 * express.mvp.myra.rados.error.ErrorClassifier}.
 *
 * <h2>Error Categories</h2>
 *
 * <table border="1">
 *   <caption>Error category handling</caption>
 *   <tr><th>Category</th><th>Retryable</th><th>Example</th></tr>
 *   <tr><td>TRANSIENT</td><td>Yes</td><td>EAGAIN, EINPROGRESS</td></tr>
 *   <tr><td>NETWORK</td><td>Yes</td><td>ETIMEDOUT, ESHUTDOWN</td></tr>
 *   <tr><td>NOT_FOUND</td><td>No</td><td>ENOENT</td></tr>
 *   <tr><td>PERMISSION</td><td>No</td><td>EACCES</td></tr>
 *   <tr><td>RESOURCE</td><td>Yes</td><td>ENOMEM</td></tr>
 *   <tr><td>INVALID_REQUEST</td><td>No</td><td>EINVAL</td></tr>
 * </table>
 */
package express.mvp.myra.rados.error;
