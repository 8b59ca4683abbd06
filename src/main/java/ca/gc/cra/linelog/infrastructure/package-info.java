/**
 * Infrastructure adapters: pooled line buffers and terminal styling.
 * <p><strong>Role:</strong> Driven side of the logger; implements ports declared in
 * {@code ca.gc.cra.linelog.application.port}.</p>
 * <p><strong>Concurrency:</strong> Adapters are thread-safe unless a class documents otherwise.</p>
 */
package ca.gc.cra.linelog.infrastructure;
