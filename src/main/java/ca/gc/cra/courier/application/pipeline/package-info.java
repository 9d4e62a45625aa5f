/**
 * Consume loop with commit-after-success, bounded retry by republication, and dead-letter diversion.
 * <p><strong>Concurrency:</strong> One worker thread per reader; messages within a reader are processed sequentially.</p>
 * <p><strong>Metrics:</strong> Emits {@code consume.*} counters and the {@code consume.handler.latencyNanos} histogram.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.courier.application.pipeline;
