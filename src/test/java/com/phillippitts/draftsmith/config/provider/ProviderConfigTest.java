package com.phillippitts.draftsmith.config.provider;

import com.phillippitts.draftsmith.config.properties.ProviderProperties;
import com.phillippitts.draftsmith.exception.UnknownBackendException;
import com.phillippitts.draftsmith.service.provider.BackendKind;
import com.phillippitts.draftsmith.service.provider.ProviderHub;
import com.phillippitts.draftsmith.service.provider.ProviderMetricsPublisher;
import com.phillippitts.draftsmith.testutil.EventCapturingPublisher;
import com.phillippitts.draftsmith.testutil.SyncExecutor;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderConfigTest {

    private final ProviderConfig config = new ProviderConfig();

    private static ProviderProperties.Channel channel(String apiKey, boolean enabled) {
        ProviderProperties.Channel c = new ProviderProperties.Channel();
        c.setApiKey(apiKey);
        c.setEnabled(enabled);
        return c;
    }

    private ProviderHub hub(ProviderProperties props) {
        return config.providerHub(props, config.backendStatisticsStore(), new SyncExecutor(),
                ProviderMetricsPublisher.NOOP, new EventCapturingPublisher(), config.langChainChannelFactory(props));
    }

    @Test
    void registersEnabledChannelsInDeclarationOrder() {
        ProviderProperties props = new ProviderProperties();
        props.getChannels().put("lmtapi", channel(null, true));
        props.getChannels().put("openai", channel("sk-test", true));
        props.getChannels().put("gemini-api", channel("g-test", false));

        ProviderHub hub = hub(props);

        assertThat(hub.registeredProviders()).containsExactly(BackendKind.LMTAPI, BackendKind.OPENAI);
        assertThat(hub.isConfigured(BackendKind.OPENAI)).isTrue();
        assertThat(hub.isConfigured(BackendKind.LMTAPI)).isFalse();
        assertThat(hub.isConfigured(BackendKind.GEMINI_API)).isFalse();
    }

    @Test
    void unknownChannelKeyFailsStartup() {
        ProviderProperties props = new ProviderProperties();
        props.getChannels().put("anthropic", channel("x", true));

        assertThatThrownBy(() -> hub(props))
                .isInstanceOf(UnknownBackendException.class)
                .hasMessageContaining("anthropic");
    }
}
