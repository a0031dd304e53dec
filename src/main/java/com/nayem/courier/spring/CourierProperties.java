package com.nayem.courier.spring;

import com.nayem.courier.core.PublishStrategy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for Courier message dispatch.
 * <p>
 * These properties can be configured in {@code application.yml} under the
 * {@code courier} prefix.
 * </p>
 */
@ConfigurationProperties(prefix = "courier")
@Validated
public class CourierProperties {

    /**
     * Whether Courier is auto-configured at all.
     */
    private boolean enabled = true;

    /**
     * Packages scanned for {@code @MessageHandler} and {@code @MessageMiddleware} classes.
     * When empty, the packages of the {@code @SpringBootApplication} class are used.
     */
    private List<String> basePackages = new ArrayList<>();

    /**
     * Strategy for {@code publishAsync} calls that do not name one, and for cascaded messages.
     */
    @NotNull
    private PublishStrategy publishStrategy = PublishStrategy.PARALLEL;

    /**
     * Whether every handler registration is logged at startup.
     */
    private boolean logRegistrations = true;

    /**
     * Micrometer metrics configuration.
     */
    @Valid
    private Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getBasePackages() {
        return basePackages;
    }

    public void setBasePackages(List<String> basePackages) {
        this.basePackages = basePackages;
    }

    public PublishStrategy getPublishStrategy() {
        return publishStrategy;
    }

    public void setPublishStrategy(PublishStrategy publishStrategy) {
        this.publishStrategy = publishStrategy;
    }

    public boolean isLogRegistrations() {
        return logRegistrations;
    }

    public void setLogRegistrations(boolean logRegistrations) {
        this.logRegistrations = logRegistrations;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public void setMetrics(Metrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Metrics are recorded only when a {@code MeterRegistry} bean is present.
     */
    public static class Metrics {
        /**
         * Whether dispatch metrics are recorded.
         */
        private boolean enabled = true;

        /** @return whether dispatch metrics are recorded */
        public boolean isEnabled() {
            return enabled;
        }

        /** @param enabled whether dispatch metrics are recorded */
        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
