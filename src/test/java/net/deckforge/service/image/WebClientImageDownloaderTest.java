package net.deckforge.service.image;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import net.deckforge.config.DeckForgeProperties;
import net.deckforge.exception.ImageDownloadException;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

class WebClientImageDownloaderTest {

    private static final String URL = "https://cdn.example/img.png";

    @Test
    void should_ReturnBody_When_ResponseIsOk() {
        byte[] payload = {7, 8, 9};
        WebClientImageDownloader downloader = downloader(request -> Mono.just(
            ClientResponse.create(HttpStatus.OK)
                .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(payload)))
                .build()));

        assertThat(downloader.download(URL)).containsExactly(payload);
    }

    @Test
    void should_MarkServerErrorsRetryable() {
        WebClientImageDownloader downloader = downloader(request ->
            Mono.just(ClientResponse.create(HttpStatus.BAD_GATEWAY).build()));

        assertThatThrownBy(() -> downloader.download(URL))
            .isInstanceOfSatisfying(ImageDownloadException.class, ex -> {
                assertThat(ex.isRetryable()).isTrue();
                assertThat(ex.getMessage()).contains("HTTP 502");
            });
    }

    @Test
    void should_NotRetryClientErrors() {
        WebClientImageDownloader downloader = downloader(request ->
            Mono.just(ClientResponse.create(HttpStatus.FORBIDDEN).build()));

        assertThatThrownBy(() -> downloader.download(URL))
            .isInstanceOfSatisfying(ImageDownloadException.class, ex -> assertThat(ex.isRetryable()).isFalse());
    }

    @Test
    void should_MarkConnectionFailuresRetryable() {
        WebClientImageDownloader downloader = downloader(request -> Mono.error(new WebClientRequestException(
            new ConnectException("refused"), HttpMethod.GET, URI.create(URL), new HttpHeaders())));

        assertThatThrownBy(() -> downloader.download(URL))
            .isInstanceOfSatisfying(ImageDownloadException.class, ex -> assertThat(ex.isRetryable()).isTrue());
    }

    @Test
    void should_TimeOut_When_ServerNeverAnswers() {
        WebClientImageDownloader downloader = downloader(request -> Mono.never());

        assertThatThrownBy(() -> downloader.download(URL))
            .isInstanceOfSatisfying(ImageDownloadException.class, ex -> {
                assertThat(ex.isRetryable()).isTrue();
                assertThat(ex.getMessage()).contains("timed out");
            });
    }

    @Test
    void should_RetryEmptyBody() {
        WebClientImageDownloader downloader = downloader(request ->
            Mono.just(ClientResponse.create(HttpStatus.OK).build()));

        assertThatThrownBy(() -> downloader.download(URL))
            .isInstanceOfSatisfying(ImageDownloadException.class, ex -> {
                assertThat(ex.isRetryable()).isTrue();
                assertThat(ex.getMessage()).contains("empty response body");
            });
    }

    private static WebClientImageDownloader downloader(ExchangeFunction exchange) {
        DeckForgeProperties properties = new DeckForgeProperties();
        properties.setDownloadTimeout(Duration.ofMillis(200));
        return new WebClientImageDownloader(WebClient.builder().exchangeFunction(exchange), properties);
    }
}
