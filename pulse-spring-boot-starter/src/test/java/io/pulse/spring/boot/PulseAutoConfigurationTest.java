package io.pulse.spring.boot;

import io.pulse.codec.MessageCodec;
import io.pulse.concurrent.CancellationToken;
import io.pulse.logging.LogLevel;
import io.pulse.logging.LoggerRegistry;
import io.pulse.retry.BackoffStrategy;
import io.pulse.retry.Retrier;
import io.pulse.retry.RetryParams;
import io.pulse.spi.RetryMetrics;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PulseAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PulseAutoConfiguration.class));

    @Test
    void createsDefaultBeans() {
        runner.run(ctx -> {
            assertNotNull(ctx.getBean(PulseProperties.class));
            assertEquals(RetryParams.DEFAULT, ctx.getBean(RetryParams.class));
            assertSame(MessageCodec.getDefault(), ctx.getBean(MessageCodec.class));
            assertNotNull(ctx.getBean(LoggerRegistry.class));
            assertEquals(RetryParams.DEFAULT, ctx.getBean(Retrier.class).params());
        });
    }

    @Test
    void retrierUsesConfiguredParams() {
        runner.withPropertyValues(
                "pulse.retry.strategy=constant",
                "pulse.retry.max-tries=3",
                "pulse.retry.period=1ms"
        ).run(ctx -> {
            RetryParams expected = new RetryParams(BackoffStrategy.CONSTANT, 3, Duration.ofMillis(1));
            assertEquals(expected, ctx.getBean(RetryParams.class));
            assertEquals(expected, ctx.getBean(Retrier.class).params());
        });
    }

    @Test
    void loggerRegistryReflectsLoggingProperties() {
        runner.withPropertyValues(
                "pulse.logging.app-id=orders",
                "pulse.logging.level=error"
        ).run(ctx -> {
            LoggerRegistry registry = ctx.getBean(LoggerRegistry.class);
            assertEquals("orders", registry.appId());
            assertEquals(LogLevel.ERROR, registry.outputLevel());
            assertTrue(registry.loggers().containsKey("retry"));
        });
    }

    @Test
    void retrierReportsToRetryMetricsBean() {
        runner.withUserConfiguration(CountingMetricsConfig.class)
                .withPropertyValues("pulse.retry.period=0ms")
                .run(ctx -> {
                    CountingMetrics metrics = ctx.getBean(CountingMetrics.class);
                    AtomicInteger calls = new AtomicInteger();

                    String result = ctx.getBean(Retrier.class).execute(
                            CancellationToken.NONE, () -> {
                                if (calls.incrementAndGet() < 2) {
                                    throw new IllegalStateException("first try fails");
                                }
                                return "ok";
                            });

                    assertEquals("ok", result);
                    assertEquals(1, metrics.retries.get());
                    assertEquals(1, metrics.successes.get());
                });
    }

    @Test
    void backsOffWhenUserBeansPresent() {
        runner.withUserConfiguration(CustomBeansConfig.class).run(ctx -> {
            assertSame(CustomBeansConfig.PARAMS, ctx.getBean(RetryParams.class));
            assertSame(CustomBeansConfig.CODEC, ctx.getBean(MessageCodec.class));
            assertSame(CustomBeansConfig.RETRIER, ctx.getBean(Retrier.class));
        });
    }

    static class CountingMetrics implements RetryMetrics {
        final AtomicInteger successes = new AtomicInteger();
        final AtomicInteger retries = new AtomicInteger();

        @Override
        public void incrementSuccess() {
            successes.incrementAndGet();
        }

        @Override
        public void incrementRetry() {
            retries.incrementAndGet();
        }

        @Override
        public void incrementExhausted() {
        }

        @Override
        public void incrementCancelled() {
        }
    }

    @Configuration
    static class CountingMetricsConfig {
        @Bean
        CountingMetrics countingMetrics() {
            return new CountingMetrics();
        }
    }

    @Configuration
    static class CustomBeansConfig {
        static final RetryParams PARAMS = new RetryParams(BackoffStrategy.NONE, 1, Duration.ZERO);
        static final MessageCodec CODEC = MessageCodec.getDefault();
        static final Retrier RETRIER = Retrier.builder().params(PARAMS).build();

        @Bean
        RetryParams customParams() {
            return PARAMS;
        }

        @Bean
        MessageCodec customCodec() {
            return CODEC;
        }

        @Bean
        Retrier customRetrier() {
            return RETRIER;
        }
    }
}
