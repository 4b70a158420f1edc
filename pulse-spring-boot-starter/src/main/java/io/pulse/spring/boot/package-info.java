/**
 * Spring Boot auto-configuration for pulse.
 *
 * <p>{@link io.pulse.spring.boot.PulseAutoConfiguration} wires retry parameters, a logger
 * registry, the default message codec and a retrier from {@code pulse.*} application
 * properties. {@link io.pulse.spring.boot.PulseMicrometerAutoConfiguration} adds retry
 * metrics when Micrometer is present.
 *
 * @see io.pulse.spring.boot.PulseProperties
 */
package io.pulse.spring.boot;
