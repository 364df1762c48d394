package com.phillippitts.draftsmith.service.provider;

import java.util.Iterator;
import java.util.Objects;

/**
 * Lazily produced sequence of chunks. Single use: chunks are pulled from the backend as the
 * caller iterates, and statistics are recorded when the final chunk has been produced or when
 * iteration fails.
 */
public final class ProviderStream {

    private final BackendKind provider;
    private final Iterator<ProviderStreamChunk> chunks;

    public ProviderStream(BackendKind provider, Iterator<ProviderStreamChunk> chunks) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.chunks = Objects.requireNonNull(chunks, "chunks");
    }

    /** Backend that produced this stream. */
    public BackendKind provider() {
        return provider;
    }

    public Iterator<ProviderStreamChunk> chunks() {
        return chunks;
    }

    /**
     * Drains the stream and concatenates every delta.
     *
     * @throws com.phillippitts.draftsmith.exception.GenerationException if the backend fails mid-stream
     */
    public String collectContent() {
        StringBuilder sb = new StringBuilder();
        while (chunks.hasNext()) {
            ProviderStreamChunk chunk = chunks.next();
            if (!chunk.done()) {
                sb.append(chunk.content());
            }
        }
        return sb.toString();
    }
}
