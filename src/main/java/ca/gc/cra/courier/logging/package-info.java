/**
 * Logging helpers: verbosity control and bounded payload previews.
 * <p><strong>Observability:</strong> Works with SLF4J/Logback; no metrics.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.courier.logging;
