package com.phillippitts.draftsmith.service.provider;

/** Streamed delta; the last chunk of a stream has {@code done=true} and empty content. */
public record ProviderStreamChunk(String content, boolean done) {

    public static ProviderStreamChunk delta(String content) {
        return new ProviderStreamChunk(content, false);
    }

    public static ProviderStreamChunk end() {
        return new ProviderStreamChunk("", true);
    }
}
