package net.deckforge.application.asset;

import net.deckforge.model.image.ImageSize;

/**
 * Everything needed to produce one asset file. Derived per build, never persisted.
 *
 * @param filename output filename; also the asset's identity
 * @param prompt full generator prompt including the shared style prefix
 * @param assetClass background or icon
 * @param generationSize size requested from the generator, {@code WIDTHxHEIGHT}
 * @param finalSize exact size of the stored file
 * @param transparent whether the asset is meant to keep an alpha channel
 * @param generatorModel generator model identifier
 */
public record AssetSpec(
    String filename,
    String prompt,
    AssetClass assetClass,
    String generationSize,
    ImageSize finalSize,
    boolean transparent,
    String generatorModel
) {
}
