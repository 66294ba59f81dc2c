package com.williamcallahan.photo_print_preview.types;

import com.williamcallahan.photo_print_preview.exception.InvalidDimensionsException;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * A decoded photo whose EXIF orientation has already been applied to the pixels
 *
 * @author William Callahan
 *
 * Features:
 * - Exposes pixel dimensions for the layout engine
 * - Holds the orientation-normalized RGB raster for the compositor
 * - Immutable once created; replaced when another photo is loaded
 */
public final class ImageDescriptor {

    private final BufferedImage pixels;
    private final int pixelWidth;
    private final int pixelHeight;
    private final String sourceName;

    public ImageDescriptor(BufferedImage pixels, String sourceName) {
        this.pixels = Objects.requireNonNull(pixels, "pixels");
        this.pixelWidth = pixels.getWidth();
        this.pixelHeight = pixels.getHeight();
        if (pixelWidth <= 0 || pixelHeight <= 0) {
            throw new InvalidDimensionsException(
                "Image dimensions must be positive, got %dx%d".formatted(pixelWidth, pixelHeight));
        }
        this.sourceName = sourceName == null ? "image" : sourceName;
    }

    public BufferedImage getPixels() {
        return pixels;
    }

    public int getPixelWidth() {
        return pixelWidth;
    }

    public int getPixelHeight() {
        return pixelHeight;
    }

    public String getSourceName() {
        return sourceName;
    }

    public boolean isLandscape() {
        return pixelWidth > pixelHeight;
    }

    @Override
    public String toString() {
        return "ImageDescriptor{" + sourceName + " " + pixelWidth + "x" + pixelHeight + "}";
    }
}
