/**
 * Injectable {@code java.util.logging} registry with level control and optional JSON output.
 *
 * @see io.pulse.logging.LoggerRegistry
 */
package io.pulse.logging;
