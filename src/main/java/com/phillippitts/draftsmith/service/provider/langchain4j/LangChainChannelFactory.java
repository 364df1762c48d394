package com.phillippitts.draftsmith.service.provider.langchain4j;

import com.phillippitts.draftsmith.config.properties.ProviderProperties;
import com.phillippitts.draftsmith.service.provider.BackendKind;
import com.phillippitts.draftsmith.service.provider.ProviderChannel;
import com.phillippitts.draftsmith.service.provider.ProviderResponse;
import com.phillippitts.draftsmith.service.provider.TextGenerationModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Iterator;
import java.util.Objects;

/**
 * Builds provider channels for OpenAI-compatible endpoints.
 *
 * <p>Every backend key is reached through the OpenAI chat-completions protocol; Gemini and local
 * gateways are addressed by setting {@code base-url} to their OpenAI-compatible endpoint.
 *
 * <pre>
 * provider.channels.gemini-api.api-key=${GEMINI_API_KEY:}
 * provider.channels.gemini-api.base-url=https://generativelanguage.googleapis.com/v1beta/openai/
 * provider.channels.gemini-api.model-name=gemini-2.0-flash
 * </pre>
 *
 * A channel without an API key is still registered so that statistics and health reporting list
 * it; the hub answers {@code provider_not_configured} for it.
 */
public final class LangChainChannelFactory {

    private static final Logger LOG = LogManager.getLogger(LangChainChannelFactory.class);

    private final Duration timeout;

    /**
     * @param timeout HTTP timeout handed to the LangChain4j clients and used as the stream idle timeout
     */
    public LangChainChannelFactory(Duration timeout) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public ProviderChannel create(BackendKind key, ProviderProperties.Channel settings) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(settings, "settings");
        if (!hasText(settings.getApiKey())) {
            LOG.info("Provider {} has no API key; registering as not configured", key.key());
            return ProviderChannel.of(key, new UnconfiguredModel(settings.getModelName()), false);
        }

        OpenAiChatModel.OpenAiChatModelBuilder chat = OpenAiChatModel.builder()
                .apiKey(settings.getApiKey())
                .modelName(settings.getModelName())
                .timeout(timeout)
                .maxRetries(0);
        OpenAiStreamingChatModel.OpenAiStreamingChatModelBuilder streaming = OpenAiStreamingChatModel.builder()
                .apiKey(settings.getApiKey())
                .modelName(settings.getModelName())
                .timeout(timeout);
        if (hasText(settings.getBaseUrl())) {
            chat.baseUrl(settings.getBaseUrl());
            streaming.baseUrl(settings.getBaseUrl());
        }

        TextGenerationModel model = new LangChainTextGenerationModel(key.key(), settings.getModelName(),
                chat.build(), streaming.build(), timeout);
        LOG.info("Provider {} configured (model={}, endpoint={})", key.key(), settings.getModelName(),
                hasText(settings.getBaseUrl()) ? settings.getBaseUrl() : "default");
        return ProviderChannel.of(key, model, true);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }

    /** Placeholder model for channels that are registered but lack credentials; never invoked by the hub. */
    private static final class UnconfiguredModel implements TextGenerationModel {
        private final String modelName;

        UnconfiguredModel(String modelName) {
            this.modelName = modelName;
        }

        @Override
        public ProviderResponse generate(String prompt, double temperature, int maxTokens) {
            throw new IllegalStateException("Provider is not configured");
        }

        @Override
        public Iterator<String> stream(String prompt, double temperature, int maxTokens) {
            throw new IllegalStateException("Provider is not configured");
        }

        @Override
        public String modelName() {
            return modelName;
        }
    }
}
