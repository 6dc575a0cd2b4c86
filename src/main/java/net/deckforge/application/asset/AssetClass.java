package net.deckforge.application.asset;

/** Kind of generated asset; selects the dimension block in {@code asset_config}. */
public enum AssetClass {
    BACKGROUND,
    ICON
}
