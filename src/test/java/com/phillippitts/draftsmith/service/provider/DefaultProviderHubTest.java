package com.phillippitts.draftsmith.service.provider;

import com.phillippitts.draftsmith.config.properties.ProviderProperties;
import com.phillippitts.draftsmith.domain.Result;
import com.phillippitts.draftsmith.exception.GenerationException;
import com.phillippitts.draftsmith.exception.UnknownBackendException;
import com.phillippitts.draftsmith.service.provider.event.ProviderFallbackEvent;
import com.phillippitts.draftsmith.service.provider.event.ProviderFallbackExhaustedEvent;
import com.phillippitts.draftsmith.testutil.EventCapturingPublisher;
import com.phillippitts.draftsmith.testutil.FakeTextGenerationModel;
import com.phillippitts.draftsmith.testutil.SyncExecutor;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class DefaultProviderHubTest {

    private ProviderProperties props;
    private EventCapturingPublisher publisher;
    private BackendStatisticsStore statistics;
    private ExecutorService realExecutor;

    @BeforeEach
    void setUp() {
        props = new ProviderProperties();
        publisher = new EventCapturingPublisher();
        statistics = new BackendStatisticsStore();
    }

    @AfterEach
    void tearDown() {
        if (realExecutor != null) {
            realExecutor.shutdownNow();
        }
    }

    private DefaultProviderHub hub() {
        return new DefaultProviderHub(props, statistics, new SyncExecutor(), ProviderMetricsPublisher.NOOP, publisher);
    }

    private void enableFallback(int maxRetries, String... order) {
        props.getFallback().setEnabled(true);
        props.getFallback().setOrder(List.of(order));
        props.getFallback().setMaxRetries(maxRetries);
        props.getFallback().setRetryDelayMs(0);
    }

    /** Records each retry pause with the number of backend calls made before it. */
    private static final class PauseRecordingHub extends DefaultProviderHub {
        private final List<String> pauses = new ArrayList<>();
        private final Map<BackendKind, FakeTextGenerationModel> models = new LinkedHashMap<>();

        PauseRecordingHub(ProviderProperties props, BackendStatisticsStore statistics,
                          EventCapturingPublisher publisher) {
            super(props, statistics, new SyncExecutor(), ProviderMetricsPublisher.NOOP, publisher);
        }

        void register(BackendKind key, FakeTextGenerationModel model) {
            models.put(key, model);
            registerProvider(ProviderChannel.of(key, model, true));
        }

        @Override
        boolean pause(Duration delay) {
            StringBuilder calls = new StringBuilder();
            models.forEach((key, model) -> calls.append(key.key()).append('=').append(model.callCount()).append(' '));
            pauses.add(delay.toMillis() + "ms after " + calls.toString().trim());
            return true;
        }
    }

    private static ProviderRequest draftRequest(BackendKind key) {
        return ProviderRequest.of(key, ProviderPayload.of("Write the intro", ProviderMode.DRAFT));
    }

    @Test
    void executeReturnsBackendResponseAndRecordsStatistics() {
        DefaultProviderHub hub = hub();
        FakeTextGenerationModel model = new FakeTextGenerationModel("Intro text");
        hub.registerProvider(ProviderChannel.of(BackendKind.OPENAI, model, true));

        Result<ProviderResponse, ProviderFault> result = hub.execute(draftRequest(BackendKind.OPENAI));

        assertThat(result.isOk()).isTrue();
        assertThat(result.getValue().content()).isEqualTo("Intro text");
        BackendStatistics stats = hub.getStatistics(BackendKind.OPENAI).get(0);
        assertThat(stats.requestCount()).isEqualTo(1);
        assertThat(stats.successCount()).isEqualTo(1);
        assertThat(stats.failureCount()).isZero();
        assertThat(stats.totalTokensUsed()).isEqualTo(30);
    }

    @Test
    void composesPromptWithModeTemplatePersonaAndPoints() {
        DefaultProviderHub hub = hub();
        FakeTextGenerationModel model = new FakeTextGenerationModel("ok");
        hub.registerProvider(ProviderChannel.of(BackendKind.OPENAI, model, true));
        TemplateContext context = new TemplateContext("tpl-1", "p-1",
                List.of(new PointContext("intro", "Open with the problem", 1)));
        ProviderRequest request = new ProviderRequest(BackendKind.OPENAI,
                ProviderPayload.of("Write the intro", ProviderMode.CRITIQUE), context);

        hub.execute(request);

        assertThat(model.prompts()).containsExactly(
                "[Mode: critique]\n[Template: tpl-1]\n[Persona: p-1]\nWrite the intro"
                        + "\n\n[Template Points]\n- intro (priority 1): Open with the problem");
    }

    @Test
    void appliesDefaultsUnlessRequestOverrides() {
        props.setDefaultTemperature(0.3);
        props.setDefaultMaxTokens(512);
        DefaultProviderHub hub = hub();
        FakeTextGenerationModel model = new FakeTextGenerationModel("ok");
        hub.registerProvider(ProviderChannel.of(BackendKind.OPENAI, model, true));

        hub.execute(draftRequest(BackendKind.OPENAI));
        assertThat(model.lastTemperature()).isEqualTo(0.3);
        assertThat(model.lastMaxTokens()).isEqualTo(512);

        hub.execute(ProviderRequest.of(BackendKind.OPENAI,
                new ProviderPayload("p", ProviderMode.DRAFT, 64, 1.1)));
        assertThat(model.lastTemperature()).isEqualTo(1.1);
        assertThat(model.lastMaxTokens()).isEqualTo(64);
    }

    @Test
    void unknownProviderIsNotFoundAndLeavesNoStatistics() {
        DefaultProviderHub hub = hub();

        Result<ProviderResponse, ProviderFault> result = hub.execute(draftRequest(BackendKind.LMTAPI));

        assertThat(result.isErr()).isTrue();
        assertThat(result.getError().code()).isEqualTo(ProviderFaultCode.PROVIDER_NOT_FOUND);
        assertThat(result.getError().recoverable()).isFalse();
        assertThat(result.getError().message()).isEqualTo("Provider \"lmtapi\" not found");
        assertThat(hub.getStatistics(BackendKind.LMTAPI)).isEmpty();
    }

    @Test
    void unconfiguredProviderIsRejectedWithoutCountingARequest() {
        DefaultProviderHub hub = hub();
        FakeTextGenerationModel model = new FakeTextGenerationModel("never");
        hub.registerProvider(ProviderChannel.of(BackendKind.GEMINI_API, model, false));

        Result<ProviderResponse, ProviderFault> result = hub.execute(draftRequest(BackendKind.GEMINI_API));

        assertThat(result.getError().code()).isEqualTo(ProviderFaultCode.PROVIDER_NOT_CONFIGURED);
        assertThat(result.getError().recoverable()).isTrue();
        assertThat(model.callCount()).isZero();
        assertThat(hub.getStatistics(BackendKind.GEMINI_API).get(0).requestCount()).isZero();
        assertThat(hub.isConfigured(BackendKind.GEMINI_API)).isFalse();
    }

    @Test
    void backendErrorIsClassifiedAndCountedAsFailure() {
        DefaultProviderHub hub = hub();
        FakeTextGenerationModel model = new FakeTextGenerationModel("x").failNext("upstream rate limit reached");
        hub.registerProvider(ProviderChannel.of(BackendKind.OPENAI, model, true));

        Result<ProviderResponse, ProviderFault> result = hub.execute(draftRequest(BackendKind.OPENAI));

        ProviderFault fault = result.getError();
        assertThat(fault.code()).isEqualTo(ProviderFaultCode.RATE_LIMIT_EXCEEDED);
        assertThat(fault.recoverable()).isTrue();
        assertThat(fault.provider()).isEqualTo(BackendKind.OPENAI);
        assertThat(fault.details()).containsEntry(ProviderFault.DETAIL_ORIGINAL_ERROR, "upstream rate limit reached");
        BackendStatistics stats = hub.getStatistics(BackendKind.OPENAI).get(0);
        assertThat(stats.requestCount()).isEqualTo(1);
        assertThat(stats.failureCount()).isEqualTo(1);
        assertThat(stats.successCount()).isZero();
    }

    @Test
    void slowBackendTimesOut() {
        props.setTimeoutMs(100);
        realExecutor = Executors.newCachedThreadPool();
        DefaultProviderHub hub = new DefaultProviderHub(props, statistics, realExecutor,
                ProviderMetricsPublisher.NOOP, publisher);
        FakeTextGenerationModel model = new FakeTextGenerationModel("late");
        model.delayMs = 2_000;
        hub.registerProvider(ProviderChannel.of(BackendKind.OPENAI, model, true));

        Result<ProviderResponse, ProviderFault> result = hub.execute(draftRequest(BackendKind.OPENAI));

        assertThat(result.getError().code()).isEqualTo(ProviderFaultCode.TIMEOUT);
        assertThat(result.getError().message()).isEqualTo("Request timeout");
        assertThat(hub.getStatistics(BackendKind.OPENAI).get(0).failureCount()).isEqualTo(1);
    }

    @Test
    void rejectedCallFailsRecoverablyWithoutRunningOnCaller() {
        Executor rejecting = command -> {
            throw new RejectedExecutionException("pool full");
        };
        DefaultProviderHub hub = new DefaultProviderHub(props, statistics, rejecting,
                ProviderMetricsPublisher.NOOP, publisher);
        FakeTextGenerationModel model = new FakeTextGenerationModel("unused");
        hub.registerProvider(ProviderChannel.of(BackendKind.OPENAI, model, true));

        Result<ProviderResponse, ProviderFault> direct = hub.execute(draftRequest(BackendKind.OPENAI));

        assertThat(direct.getError().code()).isEqualTo(ProviderFaultCode.PROVIDER_ERROR);
        assertThat(direct.getError().message()).isEqualTo("Provider executor saturated");
        assertThat(direct.getError().recoverable()).isTrue();
        assertThat(model.callCount()).isZero();
        assertThat(hub.getStatistics(BackendKind.OPENAI).get(0).failureCount()).isEqualTo(1);
    }

    @Test
    void disabledFallbackExecutesRequestedBackendOnly() {
        props.getFallback().setEnabled(false);
        props.getFallback().setOrder(List.of("gemini-api"));
        props.getFallback().setMaxRetries(3);
        DefaultProviderHub hub = hub();
        FakeTextGenerationModel primary = new FakeTextGenerationModel("x").alwaysFail("boom");
        FakeTextGenerationModel secondary = new FakeTextGenerationModel("from gemini");
        hub.registerProvider(ProviderChannel.of(BackendKind.OPENAI, primary, true));
        hub.registerProvider(ProviderChannel.of(BackendKind.GEMINI_API, secondary, true));

        Result<ProviderResponse, ProviderFault> result = hub.executeWithFallback(draftRequest(BackendKind.OPENAI));

        assertThat(result.getError().code()).isEqualTo(ProviderFaultCode.PROVIDER_ERROR);
        assertThat(result.getError().details()).doesNotContainKey(ProviderFault.DETAIL_ALL_ERRORS);
        assertThat(primary.callCount()).isEqualTo(1);
        assertThat(secondary.callCount()).isZero();
        assertThat(publisher.all()).isEmpty();
    }

    @Test
    void enabledFallbackWithEmptyOrderExecutesOnce() {
        props.getFallback().setEnabled(true);
        props.getFallback().setMaxRetries(2);
        DefaultProviderHub hub = hub();
        FakeTextGenerationModel primary = new FakeTextGenerationModel("x").alwaysFail("boom");
        hub.registerProvider(ProviderChannel.of(BackendKind.OPENAI, primary, true));

        Result<ProviderResponse, ProviderFault> result = hub.executeWithFallback(draftRequest(BackendKind.OPENAI));

        assertThat(result.isErr()).isTrue();
        assertThat(primary.callCount()).isEqualTo(1);
    }

    @Test
    void retriesSameBackendBeforeSucceeding() {
        enableFallback(2, "gemini-api");
        DefaultProviderHub hub = hub();
        FakeTextGenerationModel primary = new FakeTextGenerationModel("third time lucky")
                .failNext("network unreachable", "network unreachable");
        FakeTextGenerationModel secondary = new FakeTextGenerationModel("from gemini");
        hub.registerProvider(ProviderChannel.of(BackendKind.OPENAI, primary, true));
        hub.registerProvider(ProviderChannel.of(BackendKind.GEMINI_API, secondary, true));

        Result<ProviderResponse, ProviderFault> result = hub.executeWithFallback(draftRequest(BackendKind.OPENAI));

        assertThat(result.getValue().content()).isEqualTo("third time lucky");
        BackendStatistics stats = hub.getStatistics(BackendKind.OPENAI).get(0);
        assertThat(stats.requestCount()).isEqualTo(3);
        assertThat(stats.successCount()).isEqualTo(1);
        assertThat(stats.failureCount()).isEqualTo(2);
        assertThat(secondary.callCount()).isZero();
        assertThat(publisher.all()).isEmpty();
    }

    @Test
    void retryDelayAppliesOnlyBetweenAttemptsOnTheSameBackend() {
        enableFallback(2, "openai");
        props.getFallback().setRetryDelayMs(250);
        PauseRecordingHub hub = new PauseRecordingHub(props, statistics, publisher);
        hub.register(BackendKind.OPENAI, new FakeTextGenerationModel("second try").failNext("network unreachable"));

        Result<ProviderResponse, ProviderFault> result = hub.executeWithFallback(draftRequest(BackendKind.LMTAPI));

        assertThat(result.getValue().content()).isEqualTo("second try");
        assertThat(hub.pauses).containsExactly("250ms after openai=1");
    }

    @Test
    void noRetryDelayWhenMovingToNextBackend() {
        enableFallback(1, "gemini-api");
        props.getFallback().setRetryDelayMs(100);
        PauseRecordingHub hub = new PauseRecordingHub(props, statistics, publisher);
        hub.register(BackendKind.OPENAI, new FakeTextGenerationModel("x").alwaysFail("network down"));
        hub.register(BackendKind.GEMINI_API, new FakeTextGenerationModel("x").alwaysFail("network down"));

        Result<ProviderResponse, ProviderFault> result = hub.executeWithFallback(draftRequest(BackendKind.OPENAI));

        assertThat(result.isErr()).isTrue();
        assertThat(hub.pauses).containsExactly(
                "100ms after openai=1 gemini-api=0",
                "100ms after openai=2 gemini-api=1");
    }

    @Test
    void nonRecoverablePrimaryMovesToNextBackendImmediately() {
        enableFallback(2, "openai");
        DefaultProviderHub hub = hub();
        FakeTextGenerationModel fallback = new FakeTextGenerationModel("served by openai");
        hub.registerProvider(ProviderChannel.of(BackendKind.OPENAI, fallback, true));

        Result<ProviderResponse, ProviderFault> result = hub.executeWithFallback(draftRequest(BackendKind.LMTAPI));

        assertThat(result.getValue().content()).isEqualTo("served by openai");
        assertThat(fallback.callCount()).isEqualTo(1);
        List<ProviderFallbackEvent> events = publisher.eventsOfType(ProviderFallbackEvent.class);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).requested()).isEqualTo("lmtapi");
        assertThat(events.get(0).servedBy()).isEqualTo("openai");
        assertThat(events.get(0).failedAttempts()).isEqualTo(1);
    }

    @Test
    void exhaustedFallbackReturnsLastFaultWithAllAttempts() {
        enableFallback(1, "gemini-api");
        DefaultProviderHub hub = hub();
        hub.registerProvider(ProviderChannel.of(BackendKind.OPENAI,
                new FakeTextGenerationModel("x").alwaysFail("boom"), true));
        hub.registerProvider(ProviderChannel.of(BackendKind.GEMINI_API,
                new FakeTextGenerationModel("x").alwaysFail("network down"), true));

        Result<ProviderResponse, ProviderFault> result = hub.executeWithFallback(draftRequest(BackendKind.OPENAI));

        ProviderFault fault = result.getError();
        assertThat(fault.code()).isEqualTo(ProviderFaultCode.NETWORK_ERROR);
        assertThat(fault.provider()).isEqualTo(BackendKind.GEMINI_API);
        assertThat(fault.details().get(ProviderFault.DETAIL_ALL_ERRORS))
                .asInstanceOf(InstanceOfAssertFactories.list(FallbackAttempt.class))
                .satisfies(attempts -> {
                    assertThat(attempts).extracting(FallbackAttempt::provider).containsExactly(
                            BackendKind.OPENAI, BackendKind.OPENAI, BackendKind.GEMINI_API, BackendKind.GEMINI_API);
                    assertThat(attempts.get(0).fault().code()).isEqualTo(ProviderFaultCode.PROVIDER_ERROR);
                });

        List<ProviderFallbackExhaustedEvent> events = publisher.eventsOfType(ProviderFallbackExhaustedEvent.class);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).attempts()).isEqualTo(4);
        assertThat(events.get(0).lastFaultCode()).isEqualTo("network_error");
    }

    @Test
    void interruptDuringRetryDelayStopsTraversalWithLastFault() {
        enableFallback(3, "gemini-api");
        props.getFallback().setRetryDelayMs(30_000);
        DefaultProviderHub hub = hub();
        FakeTextGenerationModel primary = new FakeTextGenerationModel("x").alwaysFail("network down");
        FakeTextGenerationModel secondary = new FakeTextGenerationModel("never reached");
        hub.registerProvider(ProviderChannel.of(BackendKind.OPENAI, primary, true));
        hub.registerProvider(ProviderChannel.of(BackendKind.GEMINI_API, secondary, true));

        AtomicReference<Result<ProviderResponse, ProviderFault>> outcome = new AtomicReference<>();
        Thread caller = new Thread(() -> outcome.set(hub.executeWithFallback(draftRequest(BackendKind.OPENAI))));
        caller.start();
        await().atMost(2, TimeUnit.SECONDS).until(() -> primary.callCount() == 1);
        caller.interrupt();
        await().atMost(2, TimeUnit.SECONDS).until(() -> outcome.get() != null);

        ProviderFault fault = outcome.get().getError();
        assertThat(fault.code()).isEqualTo(ProviderFaultCode.NETWORK_ERROR);
        assertThat(fault.details().get(ProviderFault.DETAIL_ALL_ERRORS))
                .asInstanceOf(InstanceOfAssertFactories.LIST)
                .hasSize(1);
        assertThat(secondary.callCount()).isZero();
    }

    @Test
    void requestedBackendIsNotTriedTwiceWhenAlsoInOrder() {
        enableFallback(0, "openai", "gemini-api");
        DefaultProviderHub hub = hub();
        FakeTextGenerationModel primary = new FakeTextGenerationModel("x").alwaysFail("boom");
        hub.registerProvider(ProviderChannel.of(BackendKind.OPENAI, primary, true));

        Result<ProviderResponse, ProviderFault> result = hub.executeWithFallback(draftRequest(BackendKind.OPENAI));

        assertThat(primary.callCount()).isEqualTo(1);
        assertThat(result.getError().code()).isEqualTo(ProviderFaultCode.PROVIDER_NOT_FOUND);
        assertThat(result.getError().provider()).isEqualTo(BackendKind.GEMINI_API);
    }

    @Test
    void unknownKeyInFallbackOrderFailsConstruction() {
        props.getFallback().setOrder(List.of("anthropic"));

        assertThatThrownBy(this::hub)
                .isInstanceOf(UnknownBackendException.class)
                .hasMessageContaining("anthropic");
    }

    @Test
    void streamYieldsDeltasThenEndAndRecordsSuccess() {
        DefaultProviderHub hub = hub();
        hub.registerProvider(ProviderChannel.of(BackendKind.OPENAI, new FakeTextGenerationModel("hello big world"), true));

        Result<ProviderStream, ProviderFault> result = hub.stream(draftRequest(BackendKind.OPENAI));

        ProviderStream stream = result.getValue();
        assertThat(stream.provider()).isEqualTo(BackendKind.OPENAI);
        assertThat(hub.getStatistics(BackendKind.OPENAI).get(0).successCount()).isZero();
        assertThat(stream.collectContent()).isEqualTo("hello big world");
        BackendStatistics stats = hub.getStatistics(BackendKind.OPENAI).get(0);
        assertThat(stats.requestCount()).isEqualTo(1);
        assertThat(stats.successCount()).isEqualTo(1);
    }

    @Test
    void streamEndsWithSingleDoneChunk() {
        DefaultProviderHub hub = hub();
        hub.registerProvider(ProviderChannel.of(BackendKind.OPENAI, new FakeTextGenerationModel("a b"), true));

        Iterator<ProviderStreamChunk> chunks = hub.stream(draftRequest(BackendKind.OPENAI)).getValue().chunks();

        assertThat(chunks.next()).isEqualTo(ProviderStreamChunk.delta("a"));
        assertThat(chunks.next()).isEqualTo(ProviderStreamChunk.delta(" b"));
        assertThat(chunks.next()).isEqualTo(ProviderStreamChunk.end());
        assertThat(chunks.hasNext()).isFalse();
    }

    @Test
    void midStreamFailureRecordsFailureAndThrows() {
        DefaultProviderHub hub = hub();
        FakeTextGenerationModel model = new FakeTextGenerationModel("one two three").failStreamAfter(1, "connection reset");
        hub.registerProvider(ProviderChannel.of(BackendKind.OPENAI, model, true));

        ProviderStream stream = hub.stream(draftRequest(BackendKind.OPENAI)).getValue();

        assertThatThrownBy(stream::collectContent)
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("connection reset");
        BackendStatistics stats = hub.getStatistics(BackendKind.OPENAI).get(0);
        assertThat(stats.failureCount()).isEqualTo(1);
        assertThat(stats.successCount()).isZero();
    }

    @Test
    void streamWithFallbackUsesNextBackendWhenPrimaryUnconfigured() {
        enableFallback(0, "gemini-api");
        DefaultProviderHub hub = hub();
        hub.registerProvider(ProviderChannel.of(BackendKind.OPENAI, new FakeTextGenerationModel("x"), false));
        hub.registerProvider(ProviderChannel.of(BackendKind.GEMINI_API, new FakeTextGenerationModel("from gemini"), true));

        Result<ProviderStream, ProviderFault> result = hub.streamWithFallback(draftRequest(BackendKind.OPENAI));

        assertThat(result.getValue().provider()).isEqualTo(BackendKind.GEMINI_API);
        assertThat(result.getValue().collectContent()).isEqualTo("from gemini");
        assertThat(publisher.eventsOfType(ProviderFallbackEvent.class)).hasSize(1);
    }

    @Test
    void statisticsCoverRegisteredProvidersInRegistrationOrder() {
        DefaultProviderHub hub = hub();
        hub.registerProvider(ProviderChannel.of(BackendKind.GEMINI_CLI, new FakeTextGenerationModel("a"), true));
        hub.registerProvider(ProviderChannel.of(BackendKind.OPENAI, new FakeTextGenerationModel("b"), true));

        assertThat(hub.registeredProviders()).containsExactly(BackendKind.GEMINI_CLI, BackendKind.OPENAI);
        assertThat(hub.getStatistics()).extracting(BackendStatistics::provider)
                .containsExactly(BackendKind.GEMINI_CLI, BackendKind.OPENAI);
        assertThat(hub.getStatistics(null)).hasSize(2);
    }
}
