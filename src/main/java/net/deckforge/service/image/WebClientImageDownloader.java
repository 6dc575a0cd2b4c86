package net.deckforge.service.image;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import net.deckforge.config.DeckForgeProperties;
import net.deckforge.exception.ImageDownloadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Downloads generated images with the shared WebClient.
 * <p>
 * Called from materializer worker threads, so the reactive pipeline is blocked on
 * directly. Connection failures, timeouts and 5xx responses map to retryable
 * {@link ImageDownloadException}s; other HTTP errors are not retryable.
 */
@Component
public class WebClientImageDownloader implements ImageDownloader {

    private static final Logger logger = LoggerFactory.getLogger(WebClientImageDownloader.class);

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientImageDownloader(WebClient.Builder webClientBuilder, DeckForgeProperties properties) {
        this.webClient = webClientBuilder.build();
        this.timeout = properties.getDownloadTimeout();
    }

    @Override
    public byte[] download(String url) {
        byte[] body = webClient.get().uri(url).retrieve().bodyToMono(byte[].class)
            .timeout(timeout)
            .onErrorMap(error -> !(error instanceof ImageDownloadException), error -> mapError(url, error))
            .block();
        if (body == null || body.length == 0) {
            throw new ImageDownloadException(url, "empty response body", true);
        }
        logger.debug("Downloaded {} bytes from {}", body.length, url);
        return body;
    }

    private ImageDownloadException mapError(String url, Throwable error) {
        if (error instanceof WebClientResponseException responseError) {
            int status = responseError.getStatusCode().value();
            return new ImageDownloadException(url, "HTTP " + status, status >= 500 || status == 429, error);
        }
        if (error instanceof WebClientRequestException) {
            return new ImageDownloadException(url, "request failed: " + error.getMessage(), true, error);
        }
        if (error instanceof TimeoutException) {
            return new ImageDownloadException(url, "timed out after " + timeout.toSeconds() + "s", true, error);
        }
        logger.error("Unexpected error downloading {}: {}", url, error.getMessage());
        return new ImageDownloadException(url, error.getMessage(), false, error);
    }
}
