package com.phillippitts.draftsmith.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the provider hub and its backend channels.
 *
 * <pre>
 * provider.default-temperature=0.7
 * provider.default-max-tokens=2000
 * provider.timeout-ms=60000
 * provider.fallback.enabled=true
 * provider.fallback.order=gemini-api,lmtapi
 * provider.fallback.max-retries=1
 * provider.fallback.retry-delay-ms=500
 * provider.channels.openai.api-key=${OPENAI_API_KEY:}
 * provider.channels.openai.model-name=gpt-4o-mini
 * </pre>
 */
@ConfigurationProperties(prefix = "provider")
@Validated
public class ProviderProperties {

    /** Sampling temperature when a request does not set one. */
    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double defaultTemperature = 0.7;

    /** Output token cap when a request does not set one. */
    @Positive(message = "Default max tokens must be positive")
    private int defaultMaxTokens = 2000;

    /** Upper bound for a single backend call, in milliseconds. */
    @Positive(message = "Provider timeout must be positive")
    private long timeoutMs = 60_000;

    @Valid
    @NotNull
    private Fallback fallback = new Fallback();

    /** Backend channels keyed by backend key (openai, gemini-api, gemini-cli, lmtapi). */
    @Valid
    private Map<String, Channel> channels = new LinkedHashMap<>();

    public double getDefaultTemperature() {
        return defaultTemperature;
    }

    public void setDefaultTemperature(double defaultTemperature) {
        this.defaultTemperature = defaultTemperature;
    }

    public int getDefaultMaxTokens() {
        return defaultMaxTokens;
    }

    public void setDefaultMaxTokens(int defaultMaxTokens) {
        this.defaultMaxTokens = defaultMaxTokens;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public Fallback getFallback() {
        return fallback;
    }

    public void setFallback(Fallback fallback) {
        this.fallback = fallback;
    }

    public Map<String, Channel> getChannels() {
        return channels;
    }

    public void setChannels(Map<String, Channel> channels) {
        this.channels = channels;
    }

    /**
     * Retry and failover settings.
     */
    public static class Fallback {
        private boolean enabled = false;
        private List<String> order = new ArrayList<>();

        @Min(0)
        private int maxRetries = 0;

        @Min(0)
        private long retryDelayMs = 0;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getOrder() {
            return order;
        }

        public void setOrder(List<String> order) {
            this.order = order;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryDelayMs() {
            return retryDelayMs;
        }

        public void setRetryDelayMs(long retryDelayMs) {
            this.retryDelayMs = retryDelayMs;
        }
    }

    /**
     * One OpenAI-compatible endpoint. A channel without an API key is registered but reported
     * as not configured.
     */
    public static class Channel {
        private boolean enabled = true;
        private String apiKey;
        private String baseUrl;
        private String modelName = "gpt-4o-mini";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModelName() {
            return modelName;
        }

        public void setModelName(String modelName) {
            this.modelName = modelName;
        }
    }
}
