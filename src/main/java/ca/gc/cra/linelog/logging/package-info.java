/**
 * <strong>Purpose:</strong> Control of the library's own SLF4J diagnostics, separate from the line logger it
 * provides.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.linelog.logging;
