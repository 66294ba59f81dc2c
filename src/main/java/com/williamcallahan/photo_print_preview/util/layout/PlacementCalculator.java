package com.williamcallahan.photo_print_preview.util.layout;

import com.williamcallahan.photo_print_preview.exception.InvalidDimensionsException;
import com.williamcallahan.photo_print_preview.types.Canvas;
import com.williamcallahan.photo_print_preview.types.LayoutMode;
import com.williamcallahan.photo_print_preview.types.OrientationPolicy;
import com.williamcallahan.photo_print_preview.types.PlacementGeometry;

/**
 * Single Source of Truth for placing a photo on a paper canvas.
 *
 * Used by both the on-screen preview and the print raster, so the two only differ in the
 * canvas size passed in. The fill/fit branch depends on aspect ratios alone, which makes the
 * result scale linearly with the canvas.
 *
 * @author William Callahan
 */
public final class PlacementCalculator {

    private PlacementCalculator() {
        // Utility class - prevent instantiation
    }

    /**
     * Computes placement with the default {@link OrientationPolicy#ROTATE_TO_PORTRAIT} policy
     *
     * @see #computePlacement(double, double, double, double, LayoutMode, OrientationPolicy)
     */
    public static PlacementGeometry computePlacement(double imageWidth, double imageHeight,
                                                     double canvasWidth, double canvasHeight,
                                                     LayoutMode mode) {
        return computePlacement(imageWidth, imageHeight, canvasWidth, canvasHeight, mode, OrientationPolicy.ROTATE_TO_PORTRAIT);
    }

    /**
     * Computes rotation, scaled size and offsets for a photo on a canvas.
     *
     * @param imageWidth photo width in pixels
     * @param imageHeight photo height in pixels
     * @param canvasWidth canvas width in canvas units
     * @param canvasHeight canvas height in canvas units
     * @param mode fill (crop, no border) or fit (border, no crop)
     * @param policy whether landscape photos are turned onto the canvas
     * @return geometry in the working frame of the canvas
     * @throws InvalidDimensionsException if any dimension is zero, negative or not a number
     *
     * @example
     * <pre>{@code
     * PlacementGeometry g = PlacementCalculator.computePlacement(2000, 1000, 1200, 1800, LayoutMode.FILL);
     * // g.rotateImage90() == true, working frame 1800x1200
     * // g.scaledWidth() == 2400, g.scaledHeight() == 1200, g.xOffset() == -300
     * }</pre>
     */
    public static PlacementGeometry computePlacement(double imageWidth, double imageHeight,
                                                     double canvasWidth, double canvasHeight,
                                                     LayoutMode mode, OrientationPolicy policy) {
        requirePositive("image width", imageWidth);
        requirePositive("image height", imageHeight);
        requirePositive("canvas width", canvasWidth);
        requirePositive("canvas height", canvasHeight);
        if (mode == null) {
            throw new IllegalArgumentException("Layout mode is required");
        }

        boolean rotate = shouldRotate(imageWidth, imageHeight, policy);
        double workingWidth = rotate ? canvasHeight : canvasWidth;
        double workingHeight = rotate ? canvasWidth : canvasHeight;

        double imageAspect = imageWidth / imageHeight;
        double workingAspect = workingWidth / workingHeight;
        boolean imageRelativelyWider = imageAspect > workingAspect;

        // Fill matches the image's narrow side to the canvas, fit matches its wide side
        boolean matchHeight = mode == LayoutMode.FILL ? imageRelativelyWider : !imageRelativelyWider;

        double scaledWidth;
        double scaledHeight;
        double xOffset;
        double yOffset;
        if (matchHeight) {
            double scale = workingHeight / imageHeight;
            scaledWidth = imageWidth * scale;
            scaledHeight = workingHeight;
            xOffset = (workingWidth - scaledWidth) / 2.0;
            yOffset = 0.0;
        } else {
            double scale = workingWidth / imageWidth;
            scaledWidth = workingWidth;
            scaledHeight = imageHeight * scale;
            xOffset = 0.0;
            yOffset = (workingHeight - scaledHeight) / 2.0;
        }

        return new PlacementGeometry(rotate, scaledWidth, scaledHeight, xOffset, yOffset, workingWidth, workingHeight);
    }

    /**
     * Canvas variant used by the compositor
     */
    public static PlacementGeometry computePlacement(int imageWidth, int imageHeight, Canvas canvas,
                                                     LayoutMode mode, OrientationPolicy policy) {
        return computePlacement(imageWidth, imageHeight, canvas.width(), canvas.height(), mode, policy);
    }

    /**
     * Whether a photo of this shape is turned 90 degrees onto a portrait sheet
     */
    public static boolean shouldRotate(double imageWidth, double imageHeight, OrientationPolicy policy) {
        return policy != OrientationPolicy.FOLLOW_IMAGE && imageWidth > imageHeight;
    }

    /**
     * Returns the canvas the photo is actually drawn on.
     * Under {@link OrientationPolicy#FOLLOW_IMAGE} a landscape photo turns the sheet landscape;
     * otherwise the caller's canvas is used unchanged.
     */
    public static Canvas orientCanvas(Canvas canvas, int imageWidth, int imageHeight, OrientationPolicy policy) {
        if (policy == OrientationPolicy.FOLLOW_IMAGE && imageWidth > imageHeight && !canvas.isLandscape()) {
            return canvas.swapped();
        }
        return canvas;
    }

    private static void requirePositive(String name, double value) {
        // NaN fails this comparison too
        if (!(value > 0)) {
            throw new InvalidDimensionsException(name + " must be positive, got " + value);
        }
    }
}
