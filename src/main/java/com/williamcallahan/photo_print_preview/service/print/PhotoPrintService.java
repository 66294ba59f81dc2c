package com.williamcallahan.photo_print_preview.service.print;

import com.williamcallahan.photo_print_preview.config.AppConfigurationProperties;
import com.williamcallahan.photo_print_preview.exception.PrintJobException;
import com.williamcallahan.photo_print_preview.service.PreferencesService;
import com.williamcallahan.photo_print_preview.service.PrintPreviewService;
import com.williamcallahan.photo_print_preview.types.ImageDescriptor;
import com.williamcallahan.photo_print_preview.types.LayoutMode;
import com.williamcallahan.photo_print_preview.types.OrientationPolicy;
import com.williamcallahan.photo_print_preview.types.PrintJobResult;
import com.williamcallahan.photo_print_preview.util.ValidationUtils;
import com.williamcallahan.photo_print_preview.util.layout.PlacementCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.print.PrintService;
import java.awt.image.BufferedImage;
import java.awt.print.PageFormat;
import java.awt.print.PrinterException;
import java.awt.print.PrinterJob;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Service for sending photos to a printer
 *
 * @author William Callahan
 *
 * Features:
 * - Lists the printers known to the print system
 * - Picks the saved printer, falling back to the system default
 * - Renders the print raster at paper size x DPI with the same layout as the preview
 * - Submits a borderless single-page job sized to the paper
 * - Remembers the chosen printer for the next session
 */
@Service
public class PhotoPrintService {

    private static final Logger logger = LoggerFactory.getLogger(PhotoPrintService.class);

    private final PrintPreviewService printPreviewService;
    private final PreferencesService preferencesService;
    private final PrinterLookup printerLookup;
    private final AppConfigurationProperties properties;
    private final Supplier<PrinterJob> printerJobFactory;

    @Autowired
    public PhotoPrintService(PrintPreviewService printPreviewService,
                             PreferencesService preferencesService,
                             PrinterLookup printerLookup,
                             AppConfigurationProperties properties) {
        this(printPreviewService, preferencesService, printerLookup, properties, PrinterJob::getPrinterJob);
    }

    PhotoPrintService(PrintPreviewService printPreviewService,
                      PreferencesService preferencesService,
                      PrinterLookup printerLookup,
                      AppConfigurationProperties properties,
                      Supplier<PrinterJob> printerJobFactory) {
        this.printPreviewService = printPreviewService;
        this.preferencesService = preferencesService;
        this.printerLookup = printerLookup;
        this.properties = properties;
        this.printerJobFactory = printerJobFactory;
    }

    /**
     * Names of all printers the print system reports
     */
    public List<String> listPrinters() {
        return Arrays.stream(printerLookup.availablePrinters())
            .map(PrintService::getName)
            .toList();
    }

    public Optional<String> defaultPrinterName() {
        return Optional.ofNullable(printerLookup.defaultPrinter()).map(PrintService::getName);
    }

    /**
     * Saved printer when it is still installed, otherwise the system default
     */
    public Optional<String> selectedPrinterName() {
        String saved = preferencesService.getPrinterName();
        if (ValidationUtils.hasText(saved) && listPrinters().contains(saved)) {
            return Optional.of(saved);
        }
        return defaultPrinterName();
    }

    /**
     * Prints a photo on one sheet
     *
     * @param image photo to print
     * @param mode fill or fit; null uses the saved mode
     * @param printerName printer to use; blank uses the saved or default printer
     * @return summary of the submitted job
     * @throws PrintJobException if no printer matches or the print system fails
     *
     * @implNote Printing workflow:
     * 1. Resolves the printer and remembers an explicitly chosen one
     * 2. Composites the raster at paper size x DPI
     * 3. Builds a page format matching the sheet, landscape only when the sheet follows the photo
     * 4. Submits a single-page job that stretches the raster over the imageable area
     */
    public PrintJobResult print(ImageDescriptor image, LayoutMode mode, String printerName) {
        LayoutMode effectiveMode = printPreviewService.resolveMode(mode);
        PrintService printer = resolvePrinter(printerName);
        if (ValidationUtils.hasText(printerName)) {
            preferencesService.setPrinterName(printerName.trim());
        }

        BufferedImage raster = printPreviewService.renderPrintRaster(image, effectiveMode, properties.getPaper().getDpi());
        boolean landscapePage = raster.getWidth() > raster.getHeight();
        boolean rotated = PlacementCalculator.shouldRotate(image.getPixelWidth(), image.getPixelHeight(), orientationPolicy());
        PageFormat pageFormat = PrintPageSettings.createPageFormat(
            properties.getPaper().toPaperSize(),
            properties.getPrint().isBorderless(),
            properties.getPrint().getMarginPoints(),
            landscapePage);

        PrinterJob job = printerJobFactory.get();
        try {
            job.setPrintService(printer);
            job.setJobName(properties.getPrint().getJobName());
            job.setPrintable(new PhotoPrintable(raster), pageFormat);
            logger.info("{}: Sending {}x{} raster ({}, rotated: {}) to printer '{}'.",
                image.getSourceName(), raster.getWidth(), raster.getHeight(), effectiveMode, rotated, printer.getName());
            job.print();
        } catch (PrinterException e) {
            logger.error("{}: Print job on '{}' failed: {}", image.getSourceName(), printer.getName(), e.getMessage(), e);
            throw new PrintJobException("Print job on '" + printer.getName() + "' failed: " + e.getMessage(), e);
        }

        return new PrintJobResult(printer.getName(), raster.getWidth(), raster.getHeight(), effectiveMode, rotated);
    }

    private PrintService resolvePrinter(String printerName) {
        PrintService[] available = printerLookup.availablePrinters();
        if (ValidationUtils.hasText(printerName)) {
            String wanted = printerName.trim();
            return Arrays.stream(available)
                .filter(service -> wanted.equals(service.getName()))
                .findFirst()
                .orElseThrow(() -> new PrintJobException("Printer not found: " + wanted));
        }

        String saved = preferencesService.getPrinterName();
        if (ValidationUtils.hasText(saved)) {
            Optional<PrintService> savedService = Arrays.stream(available)
                .filter(service -> saved.equals(service.getName()))
                .findFirst();
            if (savedService.isPresent()) {
                return savedService.get();
            }
            logger.warn("Saved printer '{}' is no longer available. Falling back to the default printer.", saved);
        }

        PrintService fallback = printerLookup.defaultPrinter();
        if (fallback == null && available.length > 0) {
            fallback = available[0];
        }
        if (fallback == null) {
            throw new PrintJobException("No printers available");
        }
        return fallback;
    }

    private OrientationPolicy orientationPolicy() {
        return properties.getLayout().getOrientationPolicy();
    }
}
