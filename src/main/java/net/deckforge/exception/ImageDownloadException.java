package net.deckforge.exception;

/**
 * Download of a generated image from its URL failed (network error, timeout, HTTP error).
 * RETRYABLE: Yes for network issues and 5xx responses, No for other HTTP errors
 */
public class ImageDownloadException extends AssetProductionException {

    public ImageDownloadException(String imageUrl, String reason, boolean retryable, Throwable cause) {
        super("Failed to download generated image from " + imageUrl + ": " + reason, imageUrl, retryable, cause);
    }

    public ImageDownloadException(String imageUrl, String reason, boolean retryable) {
        this(imageUrl, reason, retryable, null);
    }
}
