package com.williamcallahan.photo_print_preview.types;

import java.util.Locale;

/**
 * How a landscape photo is reconciled with the physical paper orientation
 *
 * @author William Callahan
 *
 * Features:
 * - ROTATE_TO_PORTRAIT keeps the sheet portrait and turns landscape photos 90 degrees on it
 * - FOLLOW_IMAGE turns the sheet instead, so the canvas and the print page go landscape
 */
public enum OrientationPolicy {
    ROTATE_TO_PORTRAIT,
    FOLLOW_IMAGE;

    public static OrientationPolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return ROTATE_TO_PORTRAIT;
        }
        try {
            return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown orientation policy: '" + value + "'", e);
        }
    }
}
