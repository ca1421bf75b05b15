/**
 * Handle lifecycle management.
 *
 * <p>This package provides the cluster state machine and the registry that orders cluster
 * finalization after the finalization of its derived I/O contexts.
 *
 * <h2>Cluster States</h2>
 *
 * <pre>
 * CONFIGURING → CONNECTED → SHUTDOWN
 *      └────────────────────────┘
 * </pre>
 *
 * <h2>I/O Context States</h2>
 *
 * <pre>
 * OPEN → CLOSED
 * </pre>
 *
 * @see express.mvp.myra.rados.lifecycle.ClusterStateMachine
 * @see express.mvp.myra.rados.lifecycle.ClusterReferenceRegistry
 */
package express.mvp.myra.rados.lifecycle;
