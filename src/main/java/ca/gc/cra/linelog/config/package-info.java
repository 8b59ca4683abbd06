/**
 * Logger configuration records and the YAML/CLI layering that produces them.
 * <p><strong>Role:</strong> Bootstrap layer translating operator input into {@code LoggerOption}s.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Prefixes are validated through {@code ca.gc.cra.linelog.validation} before they
 * reach a terminal.</p>
 */
package ca.gc.cra.linelog.config;
