/**
 * Ports separating the consume loop from broker client libraries and from metrics backends.
 * <p><strong>Role:</strong> Application boundary; adapters live in {@code ca.gc.cra.courier.adapter}.</p>
 * <p><strong>Concurrency:</strong> Each port documents which methods may be called from which thread.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.courier.application.port;
