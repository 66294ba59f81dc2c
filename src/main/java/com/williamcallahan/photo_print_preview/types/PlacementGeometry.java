package com.williamcallahan.photo_print_preview.types;

/**
 * Where and how large a photo is drawn on a canvas, in the canvas's own units
 *
 * <p>Offsets are relative to the working canvas: the caller's canvas when {@code rotateImage90}
 * is false, otherwise the caller's canvas with width and height swapped. Negative offsets mean
 * the photo is cropped equally on both sides of that axis.</p>
 *
 * @param rotateImage90 whether the photo is turned 90 degrees onto the canvas
 * @param scaledWidth drawn width of the photo
 * @param scaledHeight drawn height of the photo
 * @param xOffset left edge of the photo in the working frame
 * @param yOffset top edge of the photo in the working frame
 * @param workingWidth width of the working frame
 * @param workingHeight height of the working frame
 */
public record PlacementGeometry(
        boolean rotateImage90,
        double scaledWidth,
        double scaledHeight,
        double xOffset,
        double yOffset,
        double workingWidth,
        double workingHeight) {

    public double scaledAspectRatio() {
        return scaledWidth / scaledHeight;
    }

    /**
     * Same geometry on a canvas {@code factor} times larger
     */
    public PlacementGeometry scaledBy(double factor) {
        return new PlacementGeometry(
            rotateImage90,
            scaledWidth * factor,
            scaledHeight * factor,
            xOffset * factor,
            yOffset * factor,
            workingWidth * factor,
            workingHeight * factor);
    }

    /** True when some of the photo falls outside the working frame. */
    public boolean crops() {
        return xOffset < 0 || yOffset < 0;
    }

    /** True when part of the working frame is left uncovered. */
    public boolean leavesBorder() {
        return xOffset > 0 || yOffset > 0;
    }
}
