package io.pulse.spring.boot;

import io.pulse.retry.BackoffStrategy;
import io.pulse.retry.RetryParams;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for pulse.
 *
 * @see PulseAutoConfiguration
 */
@ConfigurationProperties(prefix = "pulse")
public class PulseProperties {

    private final Retry retry = new Retry();
    private final Logging logging = new Logging();
    private final Metrics metrics = new Metrics();

    public Retry getRetry() {
        return retry;
    }

    public Logging getLogging() {
        return logging;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Retry {
        /**
         * Backoff strategy: none, constant, linear, or exponential.
         */
        private BackoffStrategy strategy = RetryParams.DEFAULT.strategy();
        private int maxTries = RetryParams.DEFAULT.maxTries();
        private Duration period = RetryParams.DEFAULT.period();

        public BackoffStrategy getStrategy() {
            return strategy;
        }

        public void setStrategy(BackoffStrategy strategy) {
            this.strategy = strategy;
        }

        public int getMaxTries() {
            return maxTries;
        }

        public void setMaxTries(int maxTries) {
            this.maxTries = maxTries;
        }

        public Duration getPeriod() {
            return period;
        }

        public void setPeriod(Duration period) {
            this.period = period;
        }

        RetryParams toParams() {
            return new RetryParams(strategy, maxTries, period);
        }
    }

    public static class Logging {
        private String appId = "";
        /**
         * Output level: debug, info, warn, error, or fatal.
         */
        private String level = "info";
        private boolean jsonOutput = false;

        public String getAppId() {
            return appId;
        }

        public void setAppId(String appId) {
            this.appId = appId;
        }

        public String getLevel() {
            return level;
        }

        public void setLevel(String level) {
            this.level = level;
        }

        public boolean isJsonOutput() {
            return jsonOutput;
        }

        public void setJsonOutput(boolean jsonOutput) {
            this.jsonOutput = jsonOutput;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "pulse";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
