/**
 * Command-line entry point for previewing and printing a single photo
 *
 * @author William Callahan
 *
 * Features:
 * - --image=PATH loads a photo (missing files abort startup)
 * - --mode=fill|fit overrides and remembers the scale mode
 * - --output=FILE writes the print raster as PNG or JPEG by extension
 * - --dpi=N renders the written raster at another resolution
 * - --print [--printer=NAME] sends the photo to a printer
 */

package com.williamcallahan.photo_print_preview.cli;

import com.williamcallahan.photo_print_preview.service.PrintPreviewService;
import com.williamcallahan.photo_print_preview.service.image.ImageLoadingService;
import com.williamcallahan.photo_print_preview.service.print.PhotoPrintService;
import com.williamcallahan.photo_print_preview.types.ImageDescriptor;
import com.williamcallahan.photo_print_preview.types.LayoutMode;
import com.williamcallahan.photo_print_preview.types.PrintJobResult;
import com.williamcallahan.photo_print_preview.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

@Component
public class PrintCommandRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(PrintCommandRunner.class);

    private final ImageLoadingService imageLoadingService;
    private final PrintPreviewService printPreviewService;
    private final PhotoPrintService photoPrintService;

    public PrintCommandRunner(ImageLoadingService imageLoadingService,
                              PrintPreviewService printPreviewService,
                              PhotoPrintService photoPrintService) {
        this.imageLoadingService = imageLoadingService;
        this.printPreviewService = printPreviewService;
        this.photoPrintService = photoPrintService;
    }

    @Override
    public void run(ApplicationArguments args) {
        String modeArg = firstOptionValue(args, "mode");
        LayoutMode mode = null;
        if (ValidationUtils.hasText(modeArg)) {
            mode = printPreviewService.changeMode(LayoutMode.parse(modeArg));
        }

        String imageArg = firstOptionValue(args, "image");
        if (!ValidationUtils.hasText(imageArg)) {
            if (args.containsOption("output") || args.containsOption("print")) {
                throw new IllegalArgumentException("--output and --print require --image=PATH");
            }
            return;
        }

        ImageDescriptor image = imageLoadingService.load(Paths.get(imageArg));

        String output = firstOptionValue(args, "output");
        if (ValidationUtils.hasText(output)) {
            writeRaster(image, mode, parseIntArg(args, "dpi", 0), Paths.get(output));
        }

        if (args.containsOption("print")) {
            PrintJobResult result = photoPrintService.print(image, mode, firstOptionValue(args, "printer"));
            log.info("Print job sent successfully to '{}' ({}x{}, {}).",
                result.printerName(), result.rasterWidth(), result.rasterHeight(), result.mode());
        }
    }

    private void writeRaster(ImageDescriptor image, LayoutMode mode, int dpi, Path target) {
        String format = formatFor(target);
        BufferedImage raster = printPreviewService.renderPrintRaster(image, mode, dpi);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(target, printPreviewService.encode(raster, format));
        } catch (IOException e) {
            log.error("Could not write print raster to {}: {}", target, e.getMessage(), e);
            throw new UncheckedIOException("Could not write print raster to " + target, e);
        }
        log.info("Wrote {}x{} print raster for {} to {}.", raster.getWidth(), raster.getHeight(), image.getSourceName(), target);
    }

    static String formatFor(Path target) {
        String name = target.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".jpg") || name.endsWith(".jpeg") ? "jpeg" : "png";
    }

    private String firstOptionValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return (values == null || values.isEmpty()) ? null : values.get(0);
    }

    private int parseIntArg(ApplicationArguments args, String name, int defaultValue) {
        String value = firstOptionValue(args, name);
        if (!ValidationUtils.hasText(value)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be a whole number, got '" + value + "'", e);
        }
    }
}
