package net.deckforge.model.image;

/**
 * Pixel dimensions of an image.
 *
 * @param width width in pixels, positive
 * @param height height in pixels, positive
 */
public record ImageSize(int width, int height) {

    public ImageSize {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive but were " + width + "x" + height);
        }
    }

    /**
     * Renders the size in the {@code WIDTHxHEIGHT} form expected by image generators.
     */
    @Override
    public String toString() {
        return width + "x" + height;
    }
}
