/**
 * The logger core: construction options, the emit path, derivation and scope binding.
 * <p><strong>Role:</strong> Application layer; depends on the domain value types, the ports in
 * {@code application.port}, and the shared buffer pool.</p>
 * <p><strong>Concurrency:</strong> Loggers are immutable and share one lock per sink lineage.</p>
 * <p><strong>Performance:</strong> Disabled calls return after a single comparison; enabled calls reuse pooled
 * buffers.</p>
 */
package ca.gc.cra.linelog.application;
