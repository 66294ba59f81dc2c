/**
 * Facade tying the layout engine, compositor and preferences together for the outer surfaces
 *
 * @author William Callahan
 *
 * Features:
 * - Sizes the preview canvas to the paper's aspect ratio inside the available area
 * - Renders previews and print rasters with the same placement geometry
 * - Resolves a missing mode from the saved preference
 * - Remembers the mode whenever a caller changes it explicitly
 * - Caps preview area and print DPI so one request cannot allocate an unbounded raster
 */

package com.williamcallahan.photo_print_preview.service;

import com.williamcallahan.photo_print_preview.config.AppConfigurationProperties;
import com.williamcallahan.photo_print_preview.exception.InvalidDimensionsException;
import com.williamcallahan.photo_print_preview.service.image.PhotoCompositorService;
import com.williamcallahan.photo_print_preview.types.Canvas;
import com.williamcallahan.photo_print_preview.types.ImageDescriptor;
import com.williamcallahan.photo_print_preview.types.LayoutMode;
import com.williamcallahan.photo_print_preview.types.OrientationPolicy;
import com.williamcallahan.photo_print_preview.types.PaperSize;
import com.williamcallahan.photo_print_preview.types.PlacementGeometry;
import com.williamcallahan.photo_print_preview.util.layout.PlacementCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;

@Service
public class PrintPreviewService {

    private static final Logger logger = LoggerFactory.getLogger(PrintPreviewService.class);

    private final PhotoCompositorService compositorService;
    private final PreferencesService preferencesService;
    private final AppConfigurationProperties properties;

    public PrintPreviewService(PhotoCompositorService compositorService,
                               PreferencesService preferencesService,
                               AppConfigurationProperties properties) {
        this.compositorService = compositorService;
        this.preferencesService = preferencesService;
        this.properties = properties;
    }

    /**
     * Mode to use for a request: the explicit one, else the saved preference
     */
    public LayoutMode resolveMode(LayoutMode requested) {
        return requested != null ? requested : preferencesService.getLayoutMode();
    }

    /**
     * Changes the active mode and persists it
     */
    public LayoutMode changeMode(LayoutMode mode) {
        preferencesService.setLayoutMode(mode);
        logger.info("Layout mode changed to {}.", mode);
        return mode;
    }

    public PlacementGeometry computePlacement(int imageWidth, int imageHeight, int canvasWidth, int canvasHeight,
                                              LayoutMode mode, OrientationPolicy policy) {
        OrientationPolicy effectivePolicy = policy != null ? policy : orientationPolicy();
        return PlacementCalculator.computePlacement(imageWidth, imageHeight, canvasWidth, canvasHeight,
            resolveMode(mode), effectivePolicy);
    }

    /**
     * Preview canvas for a display area of the given size
     */
    public Canvas previewCanvas(int availableWidth, int availableHeight) {
        int maxSize = properties.getPreview().getMaxSize();
        if (availableWidth > maxSize || availableHeight > maxSize) {
            throw new InvalidDimensionsException(
                "Preview area %dx%d exceeds the %d px limit".formatted(availableWidth, availableHeight, maxSize));
        }
        return Canvas.forPreview(availableWidth, availableHeight, paperSize(), properties.getPreview().getMargin());
    }

    /**
     * Renders the on-screen preview for a display area
     *
     * @param image photo to place
     * @param availableWidth width of the display area in screen pixels
     * @param availableHeight height of the display area in screen pixels
     * @param mode fill or fit; null uses the saved mode
     */
    public BufferedImage renderPreview(ImageDescriptor image, int availableWidth, int availableHeight, LayoutMode mode) {
        Canvas canvas = previewCanvas(availableWidth, availableHeight);
        return compositorService.composite(image, canvas, resolveMode(mode), orientationPolicy());
    }

    /**
     * Renders the full-resolution print raster
     *
     * @param dpi device resolution; non-positive values use the configured DPI
     * @throws InvalidDimensionsException if the DPI is above {@code app.paper.max-dpi}
     */
    public BufferedImage renderPrintRaster(ImageDescriptor image, LayoutMode mode, int dpi) {
        int effectiveDpi = dpi > 0 ? dpi : properties.getPaper().getDpi();
        if (effectiveDpi > properties.getPaper().getMaxDpi()) {
            throw new InvalidDimensionsException(
                "DPI %d exceeds the %d DPI limit".formatted(effectiveDpi, properties.getPaper().getMaxDpi()));
        }
        Canvas canvas = Canvas.forPrint(paperSize(), effectiveDpi);
        return compositorService.composite(image, canvas, resolveMode(mode), orientationPolicy());
    }

    public byte[] encode(BufferedImage raster, String format) throws IOException {
        return compositorService.encode(raster, format);
    }

    private PaperSize paperSize() {
        return properties.getPaper().toPaperSize();
    }

    private OrientationPolicy orientationPolicy() {
        return properties.getLayout().getOrientationPolicy();
    }
}
