/**
 * Executor factories for reader worker threads.
 * <p><strong>Concurrency:</strong> Each reader owns one executor with one named, non-daemon thread.</p>
 */
package ca.gc.cra.courier.infrastructure.exec;
