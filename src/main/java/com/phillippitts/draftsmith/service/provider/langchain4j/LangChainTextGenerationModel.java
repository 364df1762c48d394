package com.phillippitts.draftsmith.service.provider.langchain4j;

import com.phillippitts.draftsmith.exception.GenerationException;
import com.phillippitts.draftsmith.exception.GenerationExceptionBuilder;
import com.phillippitts.draftsmith.service.provider.ProviderResponse;
import com.phillippitts.draftsmith.service.provider.TextGenerationModel;
import com.phillippitts.draftsmith.service.provider.TokenUsage;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link TextGenerationModel} backed by LangChain4j chat models.
 *
 * <p>Errors raised by the client are rethrown as {@link GenerationException} whose message names
 * the failure class ("timeout", "rate limit", "network") so the hub can classify it.
 */
public final class LangChainTextGenerationModel implements TextGenerationModel {

    private static final Logger LOG = LogManager.getLogger(LangChainTextGenerationModel.class);

    private final String backend;
    private final String modelName;
    private final ChatModel chatModel;
    private final StreamingChatModel streamingModel;
    private final Duration streamIdleTimeout;

    /**
     * @param backend backend key used in error messages
     * @param modelName model name reported in responses
     * @param chatModel blocking chat model
     * @param streamingModel streaming chat model, or null to stream the blocking response as one delta
     * @param streamIdleTimeout longest wait for the next streamed token
     */
    public LangChainTextGenerationModel(String backend,
                                        String modelName,
                                        ChatModel chatModel,
                                        StreamingChatModel streamingModel,
                                        Duration streamIdleTimeout) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.modelName = modelName;
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
        this.streamingModel = streamingModel;
        this.streamIdleTimeout = Objects.requireNonNull(streamIdleTimeout, "streamIdleTimeout");
    }

    @Override
    public ProviderResponse generate(String prompt, double temperature, int maxTokens) {
        long start = System.nanoTime();
        try {
            ChatResponse response = chatModel.chat(request(prompt, temperature, maxTokens));
            return toResponse(response);
        } catch (RuntimeException e) {
            throw failure("Chat completion failed", e, start);
        }
    }

    @Override
    public Iterator<String> stream(String prompt, double temperature, int maxTokens) {
        if (streamingModel == null) {
            return List.of(generate(prompt, temperature, maxTokens).content()).iterator();
        }
        QueueingHandler handler = new QueueingHandler();
        long start = System.nanoTime();
        try {
            streamingModel.chat(request(prompt, temperature, maxTokens), handler);
        } catch (RuntimeException e) {
            throw failure("Streaming chat failed to start", e, start);
        }
        return new DeltaIterator(handler.queue, start);
    }

    @Override
    public String modelName() {
        return modelName != null ? modelName : "unknown";
    }

    private static ChatRequest request(String prompt, double temperature, int maxTokens) {
        return ChatRequest.builder()
                .messages(UserMessage.from(prompt))
                .temperature(temperature)
                .maxOutputTokens(maxTokens)
                .build();
    }

    private ProviderResponse toResponse(ChatResponse response) {
        AiMessage message = response.aiMessage();
        String text = message == null || message.text() == null ? "" : message.text();
        dev.langchain4j.model.output.TokenUsage usage = response.tokenUsage();
        TokenUsage mapped = usage == null ? null : new TokenUsage(
                orZero(usage.inputTokenCount()),
                orZero(usage.outputTokenCount()),
                orZero(usage.totalTokenCount()));
        String finishReason = response.finishReason() == null
                ? null
                : response.finishReason().name().toLowerCase(Locale.ROOT);
        return new ProviderResponse(text, mapped, modelName(), finishReason);
    }

    private GenerationException failure(String message, Throwable cause, long startNanos) {
        String category = categorize(cause);
        LOG.debug("{} backend call failed ({}): {}", backend, category, cause.toString());
        GenerationExceptionBuilder builder = GenerationExceptionBuilder.create(message + " [" + category + "]")
                .backend(backend)
                .cause(cause)
                .durationMs((System.nanoTime() - startNanos) / 1_000_000L)
                .metadata("model", modelName);
        if (cause instanceof HttpException http) {
            builder.metadata("status", http.statusCode());
        }
        return builder.build();
    }

    /**
     * Failure category understood by the hub's message classification.
     */
    static String categorize(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException
                    || t instanceof TimeoutException) {
                return "timeout";
            }
            if (t instanceof HttpException http && http.statusCode() == 429) {
                return "rate limit";
            }
            if (t instanceof IOException) {
                return "network";
            }
        }
        return "error";
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }

    private static final Object END = new Object();

    /** Bridges the callback-based streaming API to a queue. */
    private static final class QueueingHandler implements StreamingChatResponseHandler {
        private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();

        @Override
        public void onPartialResponse(String partialResponse) {
            if (partialResponse != null && !partialResponse.isEmpty()) {
                queue.add(partialResponse);
            }
        }

        @Override
        public void onCompleteResponse(ChatResponse completeResponse) {
            queue.add(END);
        }

        @Override
        public void onError(Throwable error) {
            queue.add(error);
        }
    }

    private final class DeltaIterator implements Iterator<String> {
        private final BlockingQueue<Object> queue;
        private final long startNanos;
        private Object pending;
        private boolean done;

        DeltaIterator(BlockingQueue<Object> queue, long startNanos) {
            this.queue = queue;
            this.startNanos = startNanos;
        }

        @Override
        public boolean hasNext() {
            if (done) {
                return false;
            }
            if (pending == null) {
                pending = take();
            }
            if (pending == END) {
                done = true;
                return false;
            }
            if (pending instanceof Throwable error) {
                done = true;
                throw failure("Stream interrupted by backend", error, startNanos);
            }
            return true;
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            String delta = (String) pending;
            pending = null;
            return delta;
        }

        private Object take() {
            try {
                Object item = queue.poll(streamIdleTimeout.toMillis(), TimeUnit.MILLISECONDS);
                if (item == null) {
                    return new TimeoutException(
                            "No streamed token within " + streamIdleTimeout.toMillis() + " ms");
                }
                return item;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return new IllegalStateException("Streaming interrupted");
            }
        }
    }
}
