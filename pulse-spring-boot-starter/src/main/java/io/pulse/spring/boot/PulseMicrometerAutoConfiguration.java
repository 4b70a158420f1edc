package io.pulse.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.pulse.micrometer.MicrometerRetryMetrics;
import io.pulse.spi.RetryMetrics;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerRetryMetrics} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists, and {@code pulse.metrics.enabled} is true (default).
 *
 * <p>Runs after the actuator's meter registry auto-configuration, so the registry it
 * defines satisfies the {@link MeterRegistry} condition, and before
 * {@link PulseAutoConfiguration} so the {@link RetryMetrics} bean is available for
 * injection into the {@link io.pulse.retry.Retrier}.
 */
@AutoConfiguration(
        before = PulseAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerRetryMetrics.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "pulse.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(PulseProperties.class)
public class PulseMicrometerAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(RetryMetrics.class)
    public MicrometerRetryMetrics micrometerRetryMetrics(MeterRegistry meterRegistry, PulseProperties props) {
        return new MicrometerRetryMetrics(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
