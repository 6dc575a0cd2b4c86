package net.deckforge.exception;

import jakarta.annotation.Nullable;

/**
 * Base exception for failures while producing a single generated asset.
 * Subclasses indicate the failing step; the retryable flag drives retry logic.
 */
public abstract class AssetProductionException extends RuntimeException {
    private final String source;
    private final boolean retryable;

    protected AssetProductionException(String message, @Nullable String source,
                                       boolean retryable, @Nullable Throwable cause) {
        super(message, cause);
        this.source = source;
        this.retryable = retryable;
    }

    /**
     * Returns the prompt excerpt, URL or filename the failure relates to, if known.
     */
    @Nullable
    public String getSource() {
        return source;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
