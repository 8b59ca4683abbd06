/**
 * Ports the logger depends on but does not implement: the time source and text styling.
 * <p><strong>Role:</strong> Seams for tests and terminal adapters.</p>
 * <p><strong>Concurrency:</strong> Implementations are invoked concurrently and must be thread-safe.</p>
 */
package ca.gc.cra.linelog.application.port;
