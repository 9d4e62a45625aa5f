/**
 * Command-line entry points: {@code consume}, {@code produce}, and {@code redrive}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.courier.api;
