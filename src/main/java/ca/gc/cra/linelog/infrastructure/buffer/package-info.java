/**
 * Buffer pooling utilities backing the logger emit path.
 * <p><strong>Role:</strong> Infrastructure providing reusable byte buffers so each enabled log call encodes its
 * line without fresh heap allocation.</p>
 * <p><strong>Concurrency:</strong> Pools are internally synchronized; a borrowed buffer belongs to one thread
 * until it is closed.</p>
 * <p><strong>Performance:</strong> Oversized buffers are dropped on release to bound retained memory.</p>
 */
package ca.gc.cra.linelog.infrastructure.buffer;
