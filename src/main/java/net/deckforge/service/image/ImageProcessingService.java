package net.deckforge.service.image;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import javax.imageio.ImageIO;
import net.deckforge.exception.ImageProcessingException;
import net.deckforge.model.image.ImageSize;
import net.deckforge.model.image.ProcessedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Service for normalizing generated images into final slide assets
 *
 * Features:
 * - Decodes any ImageIO-readable format into an ARGB raster
 * - Resizes to the exact final size with bicubic interpolation and quality hints
 * - Encodes the result as PNG, keeping the alpha channel for transparent icons
 */
@Service
public class ImageProcessingService {

    private static final Logger logger = LoggerFactory.getLogger(ImageProcessingService.class);
    private static final String OUTPUT_FORMAT = "png";

    /**
     * Decodes raw bytes into an ARGB image.
     *
     * @throws ImageProcessingException if the bytes are empty or not a readable image
     */
    public BufferedImage decode(byte[] rawImageBytes) {
        if (rawImageBytes == null || rawImageBytes.length == 0) {
            throw new ImageProcessingException("image bytes are empty");
        }
        try (ByteArrayInputStream bais = new ByteArrayInputStream(rawImageBytes)) {
            BufferedImage raw = ImageIO.read(bais);
            if (raw == null) {
                throw new ImageProcessingException(
                    "unsupported or corrupt image data (%d bytes)".formatted(rawImageBytes.length));
            }
            if (raw.getType() == BufferedImage.TYPE_INT_ARGB) {
                return raw;
            }
            // Standardize the color model so resizing and PNG encoding behave identically for every source format
            BufferedImage argb = new BufferedImage(raw.getWidth(), raw.getHeight(), BufferedImage.TYPE_INT_ARGB);
            Graphics2D g = argb.createGraphics();
            g.drawImage(raw, 0, 0, null);
            g.dispose();
            return argb;
        } catch (IOException e) {
            throw new ImageProcessingException("IOException while decoding image: " + e.getMessage(), e);
        }
    }

    /**
     * Scales the image to exactly the target size. Aspect ratio is not preserved.
     */
    public BufferedImage resize(BufferedImage source, ImageSize target) {
        if (source.getWidth() == target.width() && source.getHeight() == target.height()) {
            return source;
        }
        logger.debug("Resizing image from {}x{} to {}", source.getWidth(), source.getHeight(), target);
        BufferedImage output = new BufferedImage(target.width(), target.height(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g2d = output.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2d.drawImage(source, 0, 0, target.width(), target.height(), null);
        } finally {
            g2d.dispose();
        }
        return output;
    }

    public byte[] encodePng(BufferedImage image) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image, OUTPUT_FORMAT, baos)) {
                throw new ImageProcessingException("no PNG writer available");
            }
            return baos.toByteArray();
        } catch (IOException e) {
            throw new ImageProcessingException("IOException while encoding PNG: " + e.getMessage(), e);
        }
    }

    /**
     * Decodes, resizes to {@code finalSize} and re-encodes as PNG.
     *
     * @param rawImageBytes generator or download payload
     * @param finalSize exact output dimensions
     * @param assetNameForLog asset filename used in log messages
     * @return the normalized PNG
     * @throws ImageProcessingException on any decode or encode failure
     */
    public ProcessedImage normalize(byte[] rawImageBytes, ImageSize finalSize, String assetNameForLog) {
        BufferedImage decoded = decode(rawImageBytes);
        BufferedImage resized = resize(decoded, finalSize);
        byte[] png = encodePng(resized);
        logger.debug("Asset {}: normalized {}x{} source to {} PNG ({} bytes)",
            assetNameForLog, decoded.getWidth(), decoded.getHeight(), finalSize, png.length);
        return new ProcessedImage(png, finalSize.width(), finalSize.height());
    }
}
