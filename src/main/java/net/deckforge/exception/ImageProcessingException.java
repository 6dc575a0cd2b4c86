package net.deckforge.exception;

/**
 * Image decode, resize or PNG encode failed.
 * RETRYABLE: No (corrupt or unsupported image data)
 */
public class ImageProcessingException extends AssetProductionException {

    public ImageProcessingException(String reason, Throwable cause) {
        super("Image processing failed: " + reason, null, false, cause);
    }

    public ImageProcessingException(String reason) {
        this(reason, null);
    }
}
