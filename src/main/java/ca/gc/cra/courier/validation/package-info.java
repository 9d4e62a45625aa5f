/**
 * Input validation shared by configuration loading and the command line.
 * <p><strong>Concurrency:</strong> Stateless utilities.</p>
 * <p><strong>Observability:</strong> Violations surface as {@link java.lang.IllegalArgumentException}s.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.courier.validation;
