/**
 * Broker-neutral message model.
 * <p><strong>Role:</strong> Domain values shared by the consume loop, handlers, and broker adapters.</p>
 * <p><strong>Concurrency:</strong> All types are immutable.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.courier.domain.msg;
