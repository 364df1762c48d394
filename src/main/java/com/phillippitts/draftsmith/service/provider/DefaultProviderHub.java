package com.phillippitts.draftsmith.service.provider;

import com.phillippitts.draftsmith.config.properties.ProviderProperties;
import com.phillippitts.draftsmith.domain.Result;
import com.phillippitts.draftsmith.exception.GenerationExceptionBuilder;
import com.phillippitts.draftsmith.service.provider.event.ProviderFallbackEvent;
import com.phillippitts.draftsmith.service.provider.event.ProviderFallbackExhaustedEvent;
import com.phillippitts.draftsmith.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Default {@link ProviderHub}: runs backend calls on a bounded executor, races them against the
 * configured timeout, and applies the fallback policy.
 *
 * <p><b>Statistics:</b> a request is counted only after the backend was found and reported itself
 * configured. Success adds duration and tokens; failure adds duration. Streams settle their
 * statistics when the final chunk is produced or when iteration fails.
 *
 * <p><b>Thread Model:</b> backend calls run on {@code providerExecutor}, never on the calling
 * thread, so the timeout always applies. When the executor rejects a call the attempt fails with a
 * recoverable {@code provider_error} ("Provider executor saturated") and fallback moves on. A
 * timed-out call is cancelled best-effort; the retry delay blocks the calling thread and stops the
 * fallback loop when interrupted.
 *
 * @see FallbackPolicy
 * @see BackendStatisticsStore
 * @since 1.0
 */
public class DefaultProviderHub implements ProviderHub {

    private static final Logger LOG = LogManager.getLogger(DefaultProviderHub.class);

    static final String TIMEOUT_MESSAGE = "Request timeout";
    static final String SATURATED_MESSAGE = "Provider executor saturated";

    private final Map<BackendKind, ProviderChannel> channels = new LinkedHashMap<>();
    private final BackendStatisticsStore statistics;
    private final Executor executor;
    private final ProviderMetricsPublisher metrics;
    private final ApplicationEventPublisher publisher;
    private final double defaultTemperature;
    private final int defaultMaxTokens;
    private final long timeoutMs;
    private final FallbackPolicy fallbackPolicy;

    /**
     * @param props hub defaults, timeout and fallback policy
     * @param statistics counter store (may be shared with health reporting)
     * @param executor executor for backend calls (qualified as "providerExecutor" in Spring)
     * @param metrics metrics publisher, {@link ProviderMetricsPublisher#NOOP} when not needed
     * @param publisher event publisher for fallback events
     * @throws com.phillippitts.draftsmith.exception.UnknownBackendException if the fallback order
     *         names an unsupported backend
     */
    public DefaultProviderHub(ProviderProperties props,
                              BackendStatisticsStore statistics,
                              Executor executor,
                              ProviderMetricsPublisher metrics,
                              ApplicationEventPublisher publisher) {
        Objects.requireNonNull(props, "props");
        this.statistics = Objects.requireNonNull(statistics, "statistics");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = metrics != null ? metrics : ProviderMetricsPublisher.NOOP;
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.defaultTemperature = props.getDefaultTemperature();
        this.defaultMaxTokens = props.getDefaultMaxTokens();
        this.timeoutMs = props.getTimeoutMs() > 0 ? props.getTimeoutMs() : 60_000L;
        this.fallbackPolicy = FallbackPolicy.from(props.getFallback());
    }

    @Override
    public void registerProvider(ProviderChannel channel) {
        Objects.requireNonNull(channel, "channel");
        synchronized (channels) {
            ProviderChannel previous = channels.put(channel.key(), channel);
            if (previous != null) {
                LOG.info("Replaced provider channel {}", channel.key().key());
            }
        }
        statistics.track(channel.key());
        LOG.info("Registered provider {} (configured={}, model={})",
                channel.key().key(), channel.isConfigured(), channel.model().modelName());
    }

    @Override
    public Result<ProviderResponse, ProviderFault> execute(ProviderRequest request) {
        Objects.requireNonNull(request, "request");
        BackendKind key = request.key();
        ProviderChannel channel = lookup(key);
        Result<ProviderChannel, ProviderFault> usable = checkUsable(key, channel);
        if (usable.isErr()) {
            return Result.err(usable.getError());
        }

        statistics.recordRequest(key);
        long start = System.nanoTime();
        String prompt = ProviderPromptComposer.compose(request.payload(), request.templateContext());
        double temperature = temperatureOf(request);
        int maxTokens = maxTokensOf(request);
        LOG.debug("Executing provider={} mode={} promptChars={}",
                key.key(), request.payload().mode().wireName(), prompt.length());

        Result<ProviderResponse, ProviderFault> outcome =
                callWithTimeout(key, () -> channel.model().generate(prompt, temperature, maxTokens));
        if (outcome.isErr()) {
            return Result.err(recordFailure(key, start, outcome.getError()));
        }

        ProviderResponse response = outcome.getValue();
        long tokens = response.totalTokens();
        statistics.recordSuccess(key, TimeUtils.elapsedMillis(start), tokens);
        metrics.recordSuccess(key, System.nanoTime() - start, tokens);
        LOG.debug("Provider {} succeeded in {} ms (tokens={})", key.key(), TimeUtils.elapsedMillis(start), tokens);
        return Result.ok(response);
    }

    @Override
    public Result<ProviderResponse, ProviderFault> executeWithFallback(ProviderRequest request) {
        Objects.requireNonNull(request, "request");
        if (!fallbackPolicy.isActive()) {
            return execute(request);
        }
        return withFallback(request, this::execute);
    }

    @Override
    public Result<ProviderStream, ProviderFault> stream(ProviderRequest request) {
        Objects.requireNonNull(request, "request");
        BackendKind key = request.key();
        ProviderChannel channel = lookup(key);
        Result<ProviderChannel, ProviderFault> usable = checkUsable(key, channel);
        if (usable.isErr()) {
            return Result.err(usable.getError());
        }

        statistics.recordRequest(key);
        long start = System.nanoTime();
        String prompt = ProviderPromptComposer.compose(request.payload(), request.templateContext());
        double temperature = temperatureOf(request);
        int maxTokens = maxTokensOf(request);

        Result<Iterator<String>, ProviderFault> opened =
                callWithTimeout(key, () -> channel.model().stream(prompt, temperature, maxTokens));
        if (opened.isErr()) {
            return Result.err(recordFailure(key, start, opened.getError()));
        }
        return Result.ok(new ProviderStream(key, new SettlingChunkIterator(key, opened.getValue(), start)));
    }

    @Override
    public Result<ProviderStream, ProviderFault> streamWithFallback(ProviderRequest request) {
        Objects.requireNonNull(request, "request");
        if (!fallbackPolicy.isActive()) {
            return stream(request);
        }
        return withFallback(request, this::stream);
    }

    @Override
    public List<BackendStatistics> getStatistics() {
        List<BackendStatistics> result = new ArrayList<>();
        for (BackendKind key : registeredProviders()) {
            BackendStatistics snapshot = statistics.snapshot(key);
            if (snapshot != null) {
                result.add(snapshot);
            }
        }
        return result;
    }

    @Override
    public List<BackendStatistics> getStatistics(BackendKind key) {
        if (key == null) {
            return getStatistics();
        }
        BackendStatistics snapshot = statistics.snapshot(key);
        return snapshot == null ? List.of() : List.of(snapshot);
    }

    @Override
    public boolean isConfigured(BackendKind key) {
        ProviderChannel channel = lookup(key);
        return channel != null && channel.isConfigured();
    }

    @Override
    public List<BackendKind> registeredProviders() {
        synchronized (channels) {
            return List.copyOf(channels.keySet());
        }
    }

    private <T> Result<T, ProviderFault> withFallback(ProviderRequest request,
                                                      Function<ProviderRequest, Result<T, ProviderFault>> attempt) {
        BackendKind requested = request.key();
        Set<BackendKind> candidates = new LinkedHashSet<>();
        candidates.add(requested);
        candidates.addAll(fallbackPolicy.order());

        List<FallbackAttempt> attempts = new ArrayList<>();
        ProviderFault last = null;

        traversal:
        for (BackendKind key : candidates) {
            ProviderRequest routed = request.withKey(key);
            for (int retry = 0; retry <= fallbackPolicy.maxRetries(); retry++) {
                Result<T, ProviderFault> result = attempt.apply(routed);
                if (result.isOk()) {
                    if (key != requested) {
                        metrics.recordFallbackServed(requested, key);
                        publisher.publishEvent(new ProviderFallbackEvent(requested.key(), key.key(),
                                attempts.size(), Instant.now()));
                    }
                    return result;
                }

                last = result.getError();
                attempts.add(new FallbackAttempt(key, last));
                if (!last.recoverable()) {
                    LOG.debug("Provider {} returned non-recoverable {}; skipping retries",
                            key.key(), last.code().wireName());
                    break;
                }
                if (retry < fallbackPolicy.maxRetries() && !pause(fallbackPolicy.retryDelay())) {
                    LOG.warn("Fallback interrupted after {} attempts (requested={})", attempts.size(), requested.key());
                    break traversal;
                }
            }
        }

        metrics.recordFallbackExhausted(requested);
        publisher.publishEvent(new ProviderFallbackExhaustedEvent(requested.key(),
                last.code().wireName(), attempts.size(), Instant.now()));
        return Result.err(last.withDetail(ProviderFault.DETAIL_ALL_ERRORS, List.copyOf(attempts)));
    }

    private <T> Result<T, ProviderFault> callWithTimeout(BackendKind key, Supplier<T> call) {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(call, executor);
        } catch (RejectedExecutionException ree) {
            LOG.warn("Provider executor rejected call to {}: {}", key.key(), ree.getMessage());
            return Result.err(ProviderFault.fromError(key, SATURATED_MESSAGE));
        }
        try {
            return Result.ok(future.get(timeoutMs, TimeUnit.MILLISECONDS));
        } catch (TimeoutException te) {
            future.cancel(true);
            return Result.err(ProviderFault.fromError(key, TIMEOUT_MESSAGE));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return Result.err(ProviderFault.fromError(key, "Request interrupted"));
        } catch (ExecutionException ee) {
            return Result.err(ProviderFault.fromError(key, messageOf(ee.getCause())));
        }
    }

    private Result<ProviderChannel, ProviderFault> checkUsable(BackendKind key, ProviderChannel channel) {
        if (channel == null) {
            LOG.debug("Provider {} not registered", key.key());
            return Result.err(ProviderFault.notFound(key));
        }
        if (!channel.isConfigured()) {
            LOG.debug("Provider {} not configured", key.key());
            return Result.err(ProviderFault.notConfigured(key));
        }
        return Result.ok(channel);
    }

    private ProviderFault recordFailure(BackendKind key, long startNanos, ProviderFault fault) {
        statistics.recordFailure(key, TimeUtils.elapsedMillis(startNanos));
        metrics.recordFailure(key, System.nanoTime() - startNanos, fault.code());
        LOG.warn("Provider {} failed: code={}, message={}", key.key(), fault.code().wireName(), fault.message());
        return fault;
    }

    private ProviderChannel lookup(BackendKind key) {
        synchronized (channels) {
            return channels.get(key);
        }
    }

    private double temperatureOf(ProviderRequest request) {
        Double t = request.payload().temperature();
        return t != null ? t : defaultTemperature;
    }

    private int maxTokensOf(ProviderRequest request) {
        Integer m = request.payload().maxTokens();
        return m != null && m > 0 ? m : defaultMaxTokens;
    }

    /**
     * Blocks between two attempts on the same backend.
     *
     * @return false when interrupted
     */
    boolean pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String messageOf(Throwable t) {
        if (t == null) {
            return "Unknown provider error";
        }
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    /**
     * Wraps backend deltas into chunks, appends the terminal chunk and settles statistics once.
     */
    private final class SettlingChunkIterator implements Iterator<ProviderStreamChunk> {
        private final BackendKind key;
        private final Iterator<String> deltas;
        private final long startNanos;
        private boolean finished;

        SettlingChunkIterator(BackendKind key, Iterator<String> deltas, long startNanos) {
            this.key = key;
            this.deltas = deltas;
            this.startNanos = startNanos;
        }

        @Override
        public boolean hasNext() {
            return !finished;
        }

        @Override
        public ProviderStreamChunk next() {
            if (finished) {
                throw new NoSuchElementException("Stream already completed");
            }
            try {
                if (deltas.hasNext()) {
                    return ProviderStreamChunk.delta(deltas.next());
                }
            } catch (RuntimeException e) {
                finished = true;
                ProviderFault fault = ProviderFault.fromError(key, messageOf(e));
                recordFailure(key, startNanos, fault);
                throw GenerationExceptionBuilder.create("Stream failed")
                        .backend(key.key())
                        .cause(e)
                        .durationMs(TimeUtils.elapsedMillis(startNanos))
                        .build();
            }
            finished = true;
            statistics.recordSuccess(key, TimeUtils.elapsedMillis(startNanos), 0);
            metrics.recordSuccess(key, System.nanoTime() - startNanos, 0);
            return ProviderStreamChunk.end();
        }
    }
}
