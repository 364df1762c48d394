package com.phillippitts.draftsmith.service.provider;

import java.util.Objects;

/**
 * A backend registered with the hub: its key, the model adapter and whether it is usable.
 */
public interface ProviderChannel {

    BackendKind key();

    TextGenerationModel model();

    /** False when credentials or endpoints are missing; the hub then refuses to call the model. */
    boolean isConfigured();

    static ProviderChannel of(BackendKind key, TextGenerationModel model, boolean configured) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(model, "model");
        return new ProviderChannel() {
            @Override
            public BackendKind key() {
                return key;
            }

            @Override
            public TextGenerationModel model() {
                return model;
            }

            @Override
            public boolean isConfigured() {
                return configured;
            }

            @Override
            public String toString() {
                return "ProviderChannel[" + key.key() + ", configured=" + configured + "]";
            }
        };
    }
}
