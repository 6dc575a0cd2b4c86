/**
 * Result of one image generator call
 *
 * Features:
 * - Holds either a download URL or inline image bytes, never both
 * - Defensive copies of the inline byte array
 *
 * @param url location of the generated image, when the generator returned a link
 * @param inlineBytes decoded image payload, when the generator returned base64 data
 */
package net.deckforge.model.image;

import jakarta.annotation.Nullable;
import java.util.Arrays;

public record GeneratedImage(@Nullable String url, @Nullable byte[] inlineBytes) {

    public GeneratedImage {
        if ((url == null) == (inlineBytes == null)) {
            throw new IllegalArgumentException("GeneratedImage requires exactly one of url or inlineBytes");
        }
        if (inlineBytes != null) {
            inlineBytes = Arrays.copyOf(inlineBytes, inlineBytes.length);
        }
    }

    public static GeneratedImage ofUrl(String url) {
        return new GeneratedImage(url, null);
    }

    public static GeneratedImage ofBytes(byte[] bytes) {
        return new GeneratedImage(null, bytes);
    }

    public boolean isInline() {
        return inlineBytes != null;
    }

    @Override
    public byte[] inlineBytes() {
        return inlineBytes == null ? null : Arrays.copyOf(inlineBytes, inlineBytes.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof GeneratedImage that)) {
            return false;
        }
        return java.util.Objects.equals(url, that.url) && Arrays.equals(inlineBytes, that.inlineBytes);
    }

    @Override
    public int hashCode() {
        return 31 * java.util.Objects.hashCode(url) + Arrays.hashCode(inlineBytes);
    }

    @Override
    public String toString() {
        return isInline()
            ? "GeneratedImage[inline, " + inlineBytes.length + " bytes]"
            : "GeneratedImage[url=" + url + "]";
    }
}
