/**
 * Configuration for WebClient
 * - Defines the builder used to download generated images
 * - Sets timeouts and a buffer large enough for full-size PNGs
 */
package net.deckforge.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Configures the WebClient used for image downloads
 */
@Configuration
public class WebClientConfig {

    private static final String USER_AGENT = "deckforge/0.1";

    /** Generated images are typically 1-4MB; leave generous headroom. */
    private static final int MAX_IN_MEMORY_BYTES = 20 * 1024 * 1024;

    /**
     * Creates a pre-configured WebClient Builder bean
     * - Connection timeout of 10 seconds
     * - Read/write and response timeouts from {@code deckforge.download-timeout}
     *
     * @param properties build configuration carrying the download timeout
     * @return A WebClient Builder instance
     */
    @Bean
    public WebClient.Builder webClientBuilder(DeckForgeProperties properties) {
        Duration timeout = properties.getDownloadTimeout();
        long timeoutSeconds = Math.max(1L, timeout.toSeconds());
        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
            )
            .responseTimeout(timeout);

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(MAX_IN_MEMORY_BYTES))
            .build();

        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
