/**
 * Service owning the persisted user preferences
 *
 * @author William Callahan
 *
 * Features:
 * - Loads settings.json once at startup, creating the config directory when missing
 * - Falls back to defaults when the file is absent or unreadable
 * - Saves immediately whenever a preference changes
 * - Resolves the stored scale mode against the configured default
 * - Hands out copies so callers never mutate the live settings
 */

package com.williamcallahan.photo_print_preview.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.williamcallahan.photo_print_preview.config.AppConfigurationProperties;
import com.williamcallahan.photo_print_preview.types.LayoutMode;
import com.williamcallahan.photo_print_preview.types.PrintPreferences;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Service
public class PreferencesService {

    private static final Logger logger = LoggerFactory.getLogger(PreferencesService.class);

    private final ObjectMapper objectMapper;
    private final Path settingsFile;
    private final LayoutMode defaultMode;

    private PrintPreferences preferences = new PrintPreferences();

    public PreferencesService(ObjectMapper objectMapper, AppConfigurationProperties properties) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.settingsFile = properties.getPreferences().getPath();
        this.defaultMode = properties.getLayout().getDefaultMode();
    }

    /**
     * Loads preferences from disk; never fails startup
     */
    @PostConstruct
    public synchronized void load() {
        Path parent = settingsFile.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            logger.warn("Could not create preferences directory {}: {}", parent, e.getMessage());
        }

        if (!Files.exists(settingsFile)) {
            logger.info("No preferences file at {}. Using defaults.", settingsFile);
            preferences = defaults();
            return;
        }

        try {
            PrintPreferences loaded = objectMapper.readValue(settingsFile.toFile(), PrintPreferences.class);
            preferences = loaded != null ? loaded : defaults();
            logger.info("Loaded preferences from {} (mode: {}, printer: '{}').",
                settingsFile, preferences.getLastScaleMode(), preferences.getPrinterName());
        } catch (IOException e) {
            logger.warn("Could not load preferences from {}: {}. Using defaults.", settingsFile, e.getMessage());
            preferences = defaults();
        }
    }

    /**
     * Writes the current preferences to disk
     *
     * @return true when the file was written
     */
    public synchronized boolean save() {
        try {
            Path parent = settingsFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(settingsFile.toFile(), preferences);
            logger.debug("Saved preferences to {}.", settingsFile);
            return true;
        } catch (IOException e) {
            logger.warn("Could not save preferences to {}: {}", settingsFile, e.getMessage());
            return false;
        }
    }

    public synchronized PrintPreferences getPreferences() {
        return new PrintPreferences(preferences);
    }

    /**
     * Stored scale mode, or the configured default when the stored value is unknown
     */
    public synchronized LayoutMode getLayoutMode() {
        return LayoutMode.fromString(preferences.getLastScaleMode()).orElse(defaultMode);
    }

    public synchronized void setLayoutMode(LayoutMode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("Layout mode is required");
        }
        preferences.setLastScaleMode(mode.getConfigKey());
        save();
    }

    public synchronized String getPrinterName() {
        return preferences.getPrinterName();
    }

    public synchronized void setPrinterName(String printerName) {
        preferences.setPrinterName(printerName);
        save();
    }

    public Path getSettingsFile() {
        return settingsFile;
    }

    private PrintPreferences defaults() {
        PrintPreferences defaults = new PrintPreferences();
        defaults.setLastScaleMode(defaultMode.getConfigKey());
        return defaults;
    }
}
