/**
 * Terminal styling adapters implementing the {@link ca.gc.cra.linelog.application.port.Styler} port.
 */
package ca.gc.cra.linelog.infrastructure.style;
