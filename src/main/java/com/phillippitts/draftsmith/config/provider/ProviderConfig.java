package com.phillippitts.draftsmith.config.provider;

import com.phillippitts.draftsmith.config.properties.ProviderProperties;
import com.phillippitts.draftsmith.exception.UnknownBackendException;
import com.phillippitts.draftsmith.service.provider.BackendKind;
import com.phillippitts.draftsmith.service.provider.BackendStatisticsStore;
import com.phillippitts.draftsmith.service.provider.DefaultProviderHub;
import com.phillippitts.draftsmith.service.provider.ProviderHub;
import com.phillippitts.draftsmith.service.provider.ProviderMetricsPublisher;
import com.phillippitts.draftsmith.service.provider.langchain4j.LangChainChannelFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Builds the provider hub and registers one channel per {@code provider.channels.<key>} entry.
 *
 * <p>Unknown channel keys fail startup with {@link UnknownBackendException}. Disabled channels are
 * skipped; channels without an API key are registered as not configured.
 */
@Configuration
public class ProviderConfig {

    private static final Logger LOG = LogManager.getLogger(ProviderConfig.class);

    @Bean
    public BackendStatisticsStore backendStatisticsStore() {
        return new BackendStatisticsStore();
    }

    @Bean
    public LangChainChannelFactory langChainChannelFactory(ProviderProperties props) {
        return new LangChainChannelFactory(Duration.ofMillis(props.getTimeoutMs()));
    }

    @Bean
    public ProviderHub providerHub(ProviderProperties props,
                                   BackendStatisticsStore statistics,
                                   @Qualifier("providerExecutor") Executor providerExecutor,
                                   ProviderMetricsPublisher metricsPublisher,
                                   ApplicationEventPublisher publisher,
                                   LangChainChannelFactory channelFactory) {
        DefaultProviderHub hub = new DefaultProviderHub(props, statistics, providerExecutor, metricsPublisher,
                publisher);
        for (Map.Entry<String, ProviderProperties.Channel> entry : props.getChannels().entrySet()) {
            BackendKind key = BackendKind.fromKey(entry.getKey())
                    .orElseThrow(() -> new UnknownBackendException(entry.getKey()));
            if (!entry.getValue().isEnabled()) {
                LOG.info("Provider {} disabled by configuration", key.key());
                continue;
            }
            hub.registerProvider(channelFactory.create(key, entry.getValue()));
        }
        LOG.info("Provider hub ready: providers={}, fallback={}", hub.registeredProviders(),
                props.getFallback().isEnabled());
        return hub;
    }
}
