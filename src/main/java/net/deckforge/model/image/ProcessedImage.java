/**
 * Record representing a PNG normalized to its final asset size
 *
 * Features:
 * - Immutable container for encoded bytes and the dimensions they decode to
 * - Implements defensive copy for mutable byte arrays
 *
 * @param pngBytes the encoded PNG data
 * @param width the width of the encoded image in pixels
 * @param height the height of the encoded image in pixels
 */
package net.deckforge.model.image;

import java.util.Arrays;

public record ProcessedImage(byte[] pngBytes, int width, int height) {

    // Defensive copy for mutable byte array
    public ProcessedImage {
        if (pngBytes == null || pngBytes.length == 0) {
            throw new IllegalArgumentException("ProcessedImage requires encoded bytes");
        }
        pngBytes = Arrays.copyOf(pngBytes, pngBytes.length);
    }

    @Override
    public byte[] pngBytes() {
        return Arrays.copyOf(pngBytes, pngBytes.length);
    }

    public ImageSize size() {
        return new ImageSize(width, height);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ProcessedImage that)) {
            return false;
        }
        return width == that.width && height == that.height && Arrays.equals(pngBytes, that.pngBytes);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(pngBytes) + width) + height;
    }

    @Override
    public String toString() {
        return "ProcessedImage[" + width + "x" + height + ", " + pngBytes.length + " bytes]";
    }
}
