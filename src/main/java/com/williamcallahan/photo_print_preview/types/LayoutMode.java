package com.williamcallahan.photo_print_preview.types;

import java.util.Locale;
import java.util.Optional;

/**
 * Placement policy used when laying a photo onto the paper canvas
 */
public enum LayoutMode {
    FILL("fill", "Fill (Crop to fit paper)"),
    FIT("fit", "Fit (Scale with borders)");

    private final String configKey;
    private final String displayName;

    LayoutMode(String configKey, String displayName) {
        this.configKey = configKey;
        this.displayName = displayName;
    }

    /**
     * Key stored in the preferences file ("fill" or "fit")
     */
    public String getConfigKey() {
        return configKey;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolves a mode from its config key or enum name, ignoring case
     *
     * @param value raw value, may be null
     * @return matching mode, or empty when the value is blank or unknown
     */
    public static Optional<LayoutMode> fromString(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (LayoutMode mode : values()) {
            if (mode.configKey.equals(normalized) || mode.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }

    /**
     * Strict variant of {@link #fromString(String)} for explicit caller input
     *
     * @throws IllegalArgumentException when the value is not a known mode
     */
    public static LayoutMode parse(String value) {
        return fromString(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown layout mode: '" + value + "' (expected 'fill' or 'fit')"));
    }
}
