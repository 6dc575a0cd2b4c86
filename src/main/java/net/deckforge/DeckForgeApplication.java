/**
 * Main application class for DeckForge
 *
 * Features:
 * - Loads a local .env file before the context starts
 * - Normalizes OpenAI credentials from the environment
 * - Runs as a non-web command-line application (see application.yml)
 * - Exits with the code reported by the build runner
 */

package net.deckforge;

import java.io.IOException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.util.StringUtils;

@SpringBootApplication
public class DeckForgeApplication {

    private static final Logger log = LoggerFactory.getLogger(DeckForgeApplication.class);

    /**
     * Sentinel value set as the OpenAI API key when no real key is configured.
     * The image generator reports itself unavailable when it sees this value.
     */
    public static final String AI_KEY_NOT_CONFIGURED = "not-configured";

    /**
     * Starts the application and propagates the runner's exit code to the JVM.
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        loadDotEnvFile();
        normalizeOpenAiConfig();
        System.exit(SpringApplication.exit(SpringApplication.run(DeckForgeApplication.class, args)));
    }

    /**
     * Wall clock used for version metadata timestamps.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static void loadDotEnvFile() {
        try {
            java.nio.file.Path envFile = java.nio.file.Paths.get(".env");
            if (java.nio.file.Files.exists(envFile)) {
                java.util.Properties props = new java.util.Properties();
                try (java.io.InputStream is = java.nio.file.Files.newInputStream(envFile)) {
                    props.load(is);
                }
                // Real environment variables win over .env entries
                for (String key : props.stringPropertyNames()) {
                    if (System.getenv(key) == null) {
                        System.setProperty(key, props.getProperty(key));
                    }
                }
            }
        } catch (IOException | SecurityException e) {
            log.warn("Failed to load .env file; aborting startup", e);
            throw new IllegalStateException("Failed to load .env file", e);
        }
    }

    /**
     * Copies OPENAI_* environment variables into the deckforge.openai.* properties
     * read by the image generator. A sentinel key is set when none is provided so
     * validation-only runs work without credentials.
     */
    private static void normalizeOpenAiConfig() {
        try {
            String apiKey = firstText(
                System.getenv("OPENAI_API_KEY"),
                System.getProperty("OPENAI_API_KEY")
            );
            if (StringUtils.hasText(apiKey)
                && !StringUtils.hasText(System.getProperty("deckforge.openai.api-key"))) {
                System.setProperty("deckforge.openai.api-key", apiKey);
            }

            String baseUrl = firstText(
                System.getenv("OPENAI_BASE_URL"),
                System.getProperty("OPENAI_BASE_URL")
            );
            if (StringUtils.hasText(baseUrl)
                && !StringUtils.hasText(System.getProperty("deckforge.openai.base-url"))) {
                System.setProperty("deckforge.openai.base-url", baseUrl);
            }

            boolean hasApiKey = StringUtils.hasText(firstText(
                System.getProperty("deckforge.openai.api-key"),
                apiKey
            ));
            if (!hasApiKey) {
                System.setProperty("deckforge.openai.api-key", AI_KEY_NOT_CONFIGURED);
                log.warn("[AI] No OpenAI API key configured. "
                    + "Set OPENAI_API_KEY to enable image generation; schema validation still works.");
            }
        } catch (SecurityException e) {
            log.warn("[AI] Unable to set OpenAI system properties due to security restrictions", e);
            throw e;
        }
    }

    private static String firstText(String... values) {
        if (values == null) {
            return null;
        }
        for (String value : values) {
            if (StringUtils.hasText(value)) {
                return value;
            }
        }
        return null;
    }
}
