/**
 * CLI entry point that runs the bundled logging scenarios.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, resolves configuration, configures
 * diagnostics, and drives a {@link ca.gc.cra.linelog.application.Logger}.</p>
 * <p><strong>Concurrency:</strong> Single-threaded.</p>
 * <p><strong>Security:</strong> Rejects control characters in argument values and prefixes.</p>
 */
package ca.gc.cra.linelog.api;
