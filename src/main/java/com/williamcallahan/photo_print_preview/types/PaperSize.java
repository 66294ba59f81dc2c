package com.williamcallahan.photo_print_preview.types;

import com.williamcallahan.photo_print_preview.exception.InvalidDimensionsException;

/**
 * Physical paper stock in inches, portrait (width is the short edge)
 *
 * @param widthInches short edge
 * @param heightInches long edge
 */
public record PaperSize(double widthInches, double heightInches) {

    public static final double POINTS_PER_INCH = 72.0;

    /** 4x6 inch glossy photo paper. */
    public static final PaperSize FOUR_BY_SIX = new PaperSize(4.0, 6.0);

    public PaperSize {
        if (!(widthInches > 0) || !(heightInches > 0)) {
            throw new InvalidDimensionsException(
                "Paper size must be positive, got %sx%s in".formatted(widthInches, heightInches));
        }
    }

    public double aspectRatio() {
        return widthInches / heightInches;
    }

    public double widthPoints() {
        return widthInches * POINTS_PER_INCH;
    }

    public double heightPoints() {
        return heightInches * POINTS_PER_INCH;
    }

    /**
     * Label in the "4x6" form used by the preferences file
     */
    public String label() {
        return trim(widthInches) + "x" + trim(heightInches);
    }

    private static String trim(double value) {
        return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
    }
}
