package net.deckforge.application.asset;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.deckforge.domain.schema.AssetDimension;
import net.deckforge.domain.schema.IconDefinition;
import net.deckforge.domain.schema.PresentationSchema;
import net.deckforge.domain.schema.SlideDefinition;
import net.deckforge.model.image.ImageSize;
import net.deckforge.util.DimensionParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the asset list of a validated schema: slide backgrounds in slide order, then icons.
 */
public final class AssetSpecFactory {

    private static final Logger log = LoggerFactory.getLogger(AssetSpecFactory.class);

    /** Joins the shared style prompt and an asset's own prompt. */
    static final String PROMPT_SEPARATOR = " — ";

    private AssetSpecFactory() {
    }

    /**
     * Builds one spec per distinct filename. When two entries share a filename the
     * first one wins so that no two workers ever write the same file.
     *
     * @param schema a schema that passed validation
     */
    public static List<AssetSpec> fromSchema(PresentationSchema schema) {
        String style = schema.visualIdentity().stylePrompt();
        String model = schema.assetConfig().generatorModel();
        AssetDimension backgroundDimension = schema.assetConfig().dimensions().background();
        AssetDimension iconDimension = schema.assetConfig().dimensions().icons();
        ImageSize backgroundSize = finalSize(backgroundDimension, "background");
        ImageSize iconSize = finalSize(iconDimension, "icons");

        Map<String, AssetSpec> byFilename = new LinkedHashMap<>();
        for (SlideDefinition slide : schema.slides()) {
            AssetSpec spec = new AssetSpec(
                slide.background().filename(),
                fullPrompt(style, slide.background().prompt()),
                AssetClass.BACKGROUND,
                backgroundDimension.generationSize(),
                backgroundSize,
                false,
                model);
            addFirstWins(byFilename, spec);
        }
        for (IconDefinition icon : schema.icons()) {
            AssetSpec spec = new AssetSpec(
                icon.filename(),
                fullPrompt(style, icon.prompt()),
                AssetClass.ICON,
                iconDimension.generationSize(),
                iconSize,
                icon.transparent(),
                model);
            addFirstWins(byFilename, spec);
        }
        return new ArrayList<>(byFilename.values());
    }

    static String fullPrompt(String stylePrompt, String assetPrompt) {
        return stylePrompt + PROMPT_SEPARATOR + assetPrompt;
    }

    private static void addFirstWins(Map<String, AssetSpec> byFilename, AssetSpec spec) {
        AssetSpec existing = byFilename.putIfAbsent(spec.filename(), spec);
        if (existing != null) {
            log.info("Asset {} is referenced more than once; keeping the first definition", spec.filename());
        }
    }

    private static ImageSize finalSize(AssetDimension dimension, String assetClassKey) {
        return DimensionParser.fromPair(dimension.finalSize())
            .orElseThrow(() -> new IllegalArgumentException(
                "asset_config.dimensions." + assetClassKey + ".final_size is not a valid size: " + dimension.finalSize()));
    }
}
