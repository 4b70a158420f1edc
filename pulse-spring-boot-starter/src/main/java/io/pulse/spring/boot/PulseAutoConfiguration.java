package io.pulse.spring.boot;

import io.pulse.codec.MessageCodec;
import io.pulse.logging.LogLevel;
import io.pulse.logging.LoggerRegistry;
import io.pulse.retry.Retrier;
import io.pulse.retry.RetryParams;
import io.pulse.spi.RetryMetrics;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for pulse.
 *
 * <p>Publishes {@link RetryParams}, {@link LoggerRegistry}, {@link MessageCodec} and
 * {@link Retrier} beans from {@link PulseProperties}. Each backs off when the
 * application defines its own bean of the same type.
 *
 * @see PulseProperties
 * @see PulseMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Retrier.class)
@EnableConfigurationProperties(PulseProperties.class)
public class PulseAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RetryParams pulseRetryParams(PulseProperties props) {
        return props.getRetry().toParams();
    }

    @Bean
    @ConditionalOnMissingBean
    public LoggerRegistry pulseLoggerRegistry(PulseProperties props) {
        LoggerRegistry registry = new LoggerRegistry();
        PulseProperties.Logging logging = props.getLogging();
        registry.setAppId(logging.getAppId());
        registry.setOutputLevel(LogLevel.of(logging.getLevel()));
        registry.enableJsonOutput(logging.isJsonOutput());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageCodec pulseMessageCodec() {
        return MessageCodec.getDefault();
    }

    @Bean
    @ConditionalOnMissingBean
    public Retrier pulseRetrier(RetryParams params,
                                LoggerRegistry loggerRegistry,
                                ObjectProvider<RetryMetrics> metricsProvider) {
        return Retrier.builder()
                .params(params)
                .logger(loggerRegistry.get("retry"))
                .metrics(metricsProvider.getIfAvailable(() -> RetryMetrics.NOOP))
                .build();
    }
}
