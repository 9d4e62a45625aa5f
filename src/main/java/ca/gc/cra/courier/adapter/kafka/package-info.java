/**
 * Kafka adapters for the broker client and writer ports.
 * <p><strong>Role:</strong> Only package that depends on {@code kafka-clients}.</p>
 * <p><strong>Concurrency:</strong> Consumers are single-threaded behind a lock; producers are shared-safe.</p>
 * <p><strong>Wire format:</strong> Keys and values are raw bytes; the retry counter travels in the
 * {@code retryCount} record header.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.courier.adapter.kafka;
