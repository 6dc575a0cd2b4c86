package net.deckforge.service.image;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.images.Image;
import com.openai.models.images.ImageGenerateParams;
import com.openai.models.images.ImageModel;
import com.openai.models.images.ImagesResponse;
import jakarta.annotation.Nullable;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.deckforge.DeckForgeApplication;
import net.deckforge.exception.ImageGenerationException;
import net.deckforge.model.image.GeneratedImage;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Image generator backed by the OpenAI Images API.
 *
 * <p>Connection and I/O failures are reported as transient so the materializer
 * retries them; so are HTTP 429 and 5xx responses. Every other API error is
 * permanent. When no API key is configured the generator stays disabled and
 * every call fails permanently.
 */
@Slf4j
@Component
public class OpenAiImageGenerator implements ImageGenerator {

    private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    @Nullable
    private final OpenAIClient openAiClient;
    private final Duration requestTimeout;

    /**
     * Creates the configured OpenAI-backed generator.
     */
    @Autowired
    public OpenAiImageGenerator(
        @Value("${deckforge.openai.api-key:${OPENAI_API_KEY:}}") String apiKey,
        @Value("${deckforge.openai.base-url:${OPENAI_BASE_URL:" + DEFAULT_BASE_URL + "}}") String baseUrl,
        @Value("${deckforge.openai.timeout:120s}") Duration requestTimeout
    ) {
        this.requestTimeout = requestTimeout;
        if (StringUtils.hasText(apiKey) && !DeckForgeApplication.AI_KEY_NOT_CONFIGURED.equals(apiKey.trim())) {
            String resolvedBaseUrl = normalizeBaseUrl(baseUrl);
            this.openAiClient = OpenAIOkHttpClient.builder()
                .apiKey(apiKey.trim())
                .baseUrl(resolvedBaseUrl)
                .maxRetries(0)
                .build();
            log.info("OpenAI image generator configured (baseUrl={})", resolvedBaseUrl);
            return;
        }
        this.openAiClient = null;
        log.warn("OpenAI image generator is disabled: no API key configured");
    }

    OpenAiImageGenerator(@Nullable OpenAIClient openAiClient, Duration requestTimeout) {
        this.openAiClient = openAiClient;
        this.requestTimeout = requestTimeout;
    }

    public boolean isAvailable() {
        return openAiClient != null;
    }

    @Override
    public GeneratedImage generate(String prompt, String size, String model) {
        if (openAiClient == null) {
            throw ImageGenerationException.permanentFailure(model,
                "Image generation is not configured; set OPENAI_API_KEY", null);
        }
        ImageGenerateParams params = ImageGenerateParams.builder()
            .prompt(prompt)
            .model(ImageModel.of(model))
            .size(ImageGenerateParams.Size.of(size))
            .n(1L)
            .responseFormat(ImageGenerateParams.ResponseFormat.URL)
            .build();
        RequestOptions options = RequestOptions.builder()
            .timeout(Timeout.builder().request(requestTimeout).read(requestTimeout).build())
            .build();

        ImagesResponse response;
        try {
            response = openAiClient.images().generate(params, options);
        } catch (OpenAIException openAiException) {
            String detail = describeApiError(openAiException);
            String message = "Image generation failed (%s, %s): %s".formatted(model, size, detail);
            if (isTransient(openAiException)) {
                throw ImageGenerationException.transientFailure(model, message, openAiException);
            }
            log.error("Image API call rejected (model={}): {}", model, detail);
            throw ImageGenerationException.permanentFailure(model, message, openAiException);
        }
        return toGeneratedImage(response, model);
    }

    private static GeneratedImage toGeneratedImage(ImagesResponse response, String model) {
        List<Image> images = response.data().orElse(List.of());
        if (images.isEmpty()) {
            throw ImageGenerationException.permanentFailure(model, "Image response contained no images", null);
        }
        Image image = images.get(0);
        Optional<String> url = image.url().filter(StringUtils::hasText);
        if (url.isPresent()) {
            return GeneratedImage.ofUrl(url.get());
        }
        Optional<String> b64 = image.b64Json().filter(StringUtils::hasText);
        if (b64.isPresent()) {
            try {
                return GeneratedImage.ofBytes(Base64.getDecoder().decode(b64.get()));
            } catch (IllegalArgumentException badPayload) {
                throw ImageGenerationException.permanentFailure(model, "Image response carried invalid base64 data", badPayload);
            }
        }
        throw ImageGenerationException.permanentFailure(model, "Image response had neither a URL nor inline data", null);
    }

    static boolean isTransient(OpenAIException ex) {
        if (ex instanceof OpenAIIoException) {
            return true;
        }
        if (ex instanceof OpenAIServiceException serviceException) {
            int status = serviceException.statusCode();
            return status == 429 || status >= 500;
        }
        return false;
    }

    static String describeApiError(OpenAIException ex) {
        if (ex instanceof OpenAIServiceException serviceException) {
            int status = serviceException.statusCode();
            String explanation = switch (status) {
                case 400 -> "bad request (prompt rejected or unsupported size)";
                case 401 -> "unauthorized, check API key";
                case 403 -> "access denied";
                case 404 -> "not found, check base URL and model name";
                case 429 -> "rate limited";
                case 500, 502, 503 -> "server error";
                default -> "unexpected status";
            };
            return "HTTP %d %s".formatted(status, explanation);
        }
        if (ex instanceof OpenAIIoException) {
            return "network error: " + ex.getMessage();
        }
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }

    static String normalizeBaseUrl(@Nullable String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            return DEFAULT_BASE_URL;
        }
        String normalized = rawUrl.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized.endsWith("/v1") ? normalized : normalized + "/v1";
    }
}
