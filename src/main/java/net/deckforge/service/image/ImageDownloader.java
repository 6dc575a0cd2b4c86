package net.deckforge.service.image;

import net.deckforge.exception.ImageDownloadException;

/**
 * Fetches the bytes behind a generated image URL.
 */
public interface ImageDownloader {

    /**
     * @throws ImageDownloadException if the request fails, times out or returns an error status
     */
    byte[] download(String url);
}
