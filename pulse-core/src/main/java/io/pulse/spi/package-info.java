/**
 * Service provider interfaces for plugging in metrics backends.
 */
package io.pulse.spi;
