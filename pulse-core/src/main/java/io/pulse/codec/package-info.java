/**
 * Byte encoding of {@link io.pulse.Message}s.
 */
package io.pulse.codec;
