/**
 * Cancellation signals for blocking waits.
 */
package io.pulse.concurrent;
