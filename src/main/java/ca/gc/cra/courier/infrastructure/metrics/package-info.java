/**
 * OpenTelemetry metrics export for the consume loop.
 *
 * @since 0.1.0
 */
package ca.gc.cra.courier.infrastructure.metrics;
