/**
 * Configuration loading (YAML and CLI), reader settings, and wiring onto the Kafka adapters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.courier.config;
