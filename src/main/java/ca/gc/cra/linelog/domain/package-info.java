/**
 * <strong>Purpose:</strong> Value types shared by every logger: severities, the level gate and typed attributes.
 * <p><strong>Concurrency:</strong> Immutable records and stateless helpers; safe for concurrent use.
 * <p><strong>Performance:</strong> Level checks are integer compares; attribute rendering allocates only the
 * rendered text.
 *
 * @since 0.1.0
 */
package ca.gc.cra.linelog.domain;
