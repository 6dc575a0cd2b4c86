package net.deckforge.exception;

import jakarta.annotation.Nullable;

/**
 * Image generator call failed.
 * RETRYABLE: Yes for connection and I/O failures, No for rejected requests
 * (bad prompt, unsupported size or model, missing credentials).
 */
public class ImageGenerationException extends AssetProductionException {

    private ImageGenerationException(String message, String model, boolean transientFailure, @Nullable Throwable cause) {
        super(message, model, transientFailure, cause);
    }

    public static ImageGenerationException transientFailure(String model, String message, @Nullable Throwable cause) {
        return new ImageGenerationException(message, model, true, cause);
    }

    public static ImageGenerationException permanentFailure(String model, String message, @Nullable Throwable cause) {
        return new ImageGenerationException(message, model, false, cause);
    }

    public boolean isTransient() {
        return isRetryable();
    }
}
