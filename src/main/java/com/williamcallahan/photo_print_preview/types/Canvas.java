package com.williamcallahan.photo_print_preview.types;

import com.williamcallahan.photo_print_preview.exception.InvalidDimensionsException;

/**
 * Target rectangle for composition, in screen pixels (preview) or device pixels (print)
 *
 * @param width canvas width
 * @param height canvas height
 */
public record Canvas(int width, int height) {

    /** Largest raster a single BufferedImage int buffer can hold. */
    public static final long MAX_PIXELS = Integer.MAX_VALUE;

    public Canvas {
        if (width <= 0 || height <= 0) {
            throw new InvalidDimensionsException("Canvas dimensions must be positive, got %dx%d".formatted(width, height));
        }
        if ((long) width * height > MAX_PIXELS) {
            throw new InvalidDimensionsException("Canvas %dx%d exceeds %d pixels".formatted(width, height, MAX_PIXELS));
        }
    }

    /**
     * Print raster for the given paper at the device resolution, always portrait.
     * 4x6 inches at 300 DPI yields 1200x1800.
     */
    public static Canvas forPrint(PaperSize paper, int dpi) {
        if (dpi <= 0) {
            throw new InvalidDimensionsException("DPI must be positive, got " + dpi);
        }
        long width = Math.round(paper.widthInches() * dpi);
        long height = Math.round(paper.heightInches() * dpi);
        if (width > Integer.MAX_VALUE || height > Integer.MAX_VALUE) {
            throw new InvalidDimensionsException("DPI %d is too large for a %s sheet".formatted(dpi, paper.label()));
        }
        return new Canvas((int) width, (int) height);
    }

    /**
     * Largest rectangle with the paper's aspect ratio inside the available area, less the margin
     *
     * @param availableWidth width of the display area
     * @param availableHeight height of the display area
     * @param paper paper whose aspect ratio constrains the preview
     * @param margin pixels reserved around the preview on each axis
     */
    public static Canvas forPreview(int availableWidth, int availableHeight, PaperSize paper, int margin) {
        int usableWidth = availableWidth - margin;
        int usableHeight = availableHeight - margin;
        if (usableWidth <= 0 || usableHeight <= 0) {
            throw new InvalidDimensionsException(
                "Preview area %dx%d leaves no room after a %d px margin".formatted(availableWidth, availableHeight, margin));
        }
        double paperAspect = paper.aspectRatio();
        if (usableWidth / paperAspect < usableHeight) {
            return new Canvas(usableWidth, (int) (usableWidth / paperAspect));
        }
        return new Canvas((int) (usableHeight * paperAspect), usableHeight);
    }

    public double aspectRatio() {
        return (double) width / height;
    }

    public boolean isLandscape() {
        return width > height;
    }

    public Canvas swapped() {
        return new Canvas(height, width);
    }
}
