package net.deckforge.service.image;

import net.deckforge.exception.ImageGenerationException;
import net.deckforge.model.image.GeneratedImage;

/**
 * Text-to-image backend used to produce missing assets.
 */
public interface ImageGenerator {

    /**
     * Generates one image.
     *
     * @param prompt full prompt including the shared style prefix
     * @param size requested generation size in {@code WIDTHxHEIGHT} form
     * @param model generator model identifier
     * @return a URL to download or inline image bytes
     * @throws ImageGenerationException transient for connection and I/O failures, permanent otherwise
     */
    GeneratedImage generate(String prompt, String size, String model);
}
