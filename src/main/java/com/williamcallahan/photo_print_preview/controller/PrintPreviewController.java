package com.williamcallahan.photo_print_preview.controller;

import com.williamcallahan.photo_print_preview.controller.support.ErrorResponseUtils;
import com.williamcallahan.photo_print_preview.exception.ImageLoadingException;
import com.williamcallahan.photo_print_preview.exception.InvalidDimensionsException;
import com.williamcallahan.photo_print_preview.exception.PrintJobException;
import com.williamcallahan.photo_print_preview.service.PreferencesService;
import com.williamcallahan.photo_print_preview.service.PrintPreviewService;
import com.williamcallahan.photo_print_preview.service.image.ImageLoadingService;
import com.williamcallahan.photo_print_preview.service.image.PhotoCompositorService;
import com.williamcallahan.photo_print_preview.service.print.PhotoPrintService;
import com.williamcallahan.photo_print_preview.types.ImageDescriptor;
import com.williamcallahan.photo_print_preview.types.LayoutMode;
import com.williamcallahan.photo_print_preview.types.OrientationPolicy;
import com.williamcallahan.photo_print_preview.types.PlacementGeometry;
import com.williamcallahan.photo_print_preview.types.PrintJobResult;
import com.williamcallahan.photo_print_preview.types.PrintPreferences;
import com.williamcallahan.photo_print_preview.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Controller for photo placement, preview rendering and printing
 *
 * @author William Callahan
 *
 * Features:
 * - Exposes the layout engine as a JSON endpoint
 * - Renders preview and print rasters for uploaded photos
 * - Lists printers and submits print jobs
 * - Reads and updates the persisted scale mode
 * - Maps dimension, decoding and printer failures to error payloads
 */
@RestController
@RequestMapping("/api/print-preview")
@Slf4j
public class PrintPreviewController {

    private final PrintPreviewService printPreviewService;
    private final ImageLoadingService imageLoadingService;
    private final PhotoPrintService photoPrintService;
    private final PreferencesService preferencesService;

    public PrintPreviewController(PrintPreviewService printPreviewService,
                                  ImageLoadingService imageLoadingService,
                                  PhotoPrintService photoPrintService,
                                  PreferencesService preferencesService) {
        this.printPreviewService = printPreviewService;
        this.imageLoadingService = imageLoadingService;
        this.photoPrintService = photoPrintService;
        this.preferencesService = preferencesService;
    }

    /**
     * Computes placement geometry without rendering anything
     *
     * @param mode "fill" or "fit"; omitted uses the saved mode
     * @param orientationPolicy "rotate-to-portrait" or "follow-image"; omitted uses the configured policy
     */
    @PostMapping("/placement")
    public ResponseEntity<PlacementGeometry> computePlacement(
            @RequestParam int imageWidth,
            @RequestParam int imageHeight,
            @RequestParam int canvasWidth,
            @RequestParam int canvasHeight,
            @RequestParam(required = false) String mode,
            @RequestParam(required = false) String orientationPolicy) {
        OrientationPolicy policy = ValidationUtils.hasText(orientationPolicy) ? OrientationPolicy.parse(orientationPolicy) : null;
        PlacementGeometry geometry = printPreviewService.computePlacement(
            imageWidth, imageHeight, canvasWidth, canvasHeight, parseMode(mode), policy);
        return ResponseEntity.ok(geometry);
    }

    /**
     * Renders the preview for a display area of {@code width x height}
     */
    @PostMapping(value = "/preview", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.IMAGE_PNG_VALUE)
    public ResponseEntity<byte[]> renderPreview(
            @RequestPart("image") MultipartFile image,
            @RequestParam int width,
            @RequestParam int height,
            @RequestParam(required = false) String mode) throws IOException {
        ImageDescriptor descriptor = load(image);
        BufferedImage preview = printPreviewService.renderPreview(descriptor, width, height, parseMode(mode));
        log.debug("Rendered {}x{} preview for {}.", preview.getWidth(), preview.getHeight(), descriptor.getSourceName());
        return ResponseEntity.ok()
            .contentType(MediaType.IMAGE_PNG)
            .body(printPreviewService.encode(preview, "png"));
    }

    /**
     * Renders the full-resolution print raster
     *
     * @param dpi device resolution; omitted uses the configured DPI
     * @param format "png" (default) or "jpeg"
     */
    @PostMapping(value = "/raster", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> renderRaster(
            @RequestPart("image") MultipartFile image,
            @RequestParam(required = false) String mode,
            @RequestParam(required = false, defaultValue = "0") int dpi,
            @RequestParam(required = false, defaultValue = "png") String format) throws IOException {
        ImageDescriptor descriptor = load(image);
        BufferedImage raster = printPreviewService.renderPrintRaster(descriptor, parseMode(mode), dpi);
        byte[] body = printPreviewService.encode(raster, format);
        log.info("Rendered {}x{} print raster for {} ({} bytes).",
            raster.getWidth(), raster.getHeight(), descriptor.getSourceName(), body.length);
        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType(PhotoCompositorService.mediaTypeFor(format)))
            .body(body);
    }

    @PostMapping(value = "/print", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<PrintJobResult> print(
            @RequestPart("image") MultipartFile image,
            @RequestParam(required = false) String mode,
            @RequestParam(required = false) String printer) {
        ImageDescriptor descriptor = load(image);
        PrintJobResult result = photoPrintService.print(descriptor, parseMode(mode), printer);
        return ResponseEntity.ok(result);
    }

    @GetMapping("/printers")
    public ResponseEntity<Map<String, Object>> listPrinters() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("printers", photoPrintService.listPrinters());
        response.put("selected", photoPrintService.selectedPrinterName().orElse(null));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/preferences")
    public ResponseEntity<PrintPreferences> getPreferences() {
        return ResponseEntity.ok(preferencesService.getPreferences());
    }

    @PutMapping("/preferences/mode")
    public ResponseEntity<PrintPreferences> updateMode(@RequestParam String mode) {
        printPreviewService.changeMode(LayoutMode.parse(mode));
        return ResponseEntity.ok(preferencesService.getPreferences());
    }

    @ExceptionHandler(InvalidDimensionsException.class)
    public ResponseEntity<Map<String, String>> handleInvalidDimensions(InvalidDimensionsException ex) {
        log.warn("Rejected request with invalid dimensions: {}", ex.getMessage());
        return ErrorResponseUtils.badRequest("Invalid dimensions", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleValidationExceptions(IllegalArgumentException ex) {
        return ErrorResponseUtils.badRequest("Invalid request", ex.getMessage());
    }

    @ExceptionHandler(ImageLoadingException.class)
    public ResponseEntity<Map<String, String>> handleImageLoading(ImageLoadingException ex) {
        log.warn("Could not load uploaded photo: {}", ex.getMessage());
        return ErrorResponseUtils.error(HttpStatus.UNPROCESSABLE_ENTITY, "Unreadable image", ex.getMessage());
    }

    @ExceptionHandler(PrintJobException.class)
    public ResponseEntity<Map<String, String>> handlePrintJob(PrintJobException ex) {
        log.error("Print request failed: {}", ex.getMessage());
        return ErrorResponseUtils.error(HttpStatus.SERVICE_UNAVAILABLE, "Print failed", ex.getMessage());
    }

    private ImageDescriptor load(MultipartFile image) {
        if (image == null || image.isEmpty()) {
            throw new ImageLoadingException("No image uploaded");
        }
        String name = ValidationUtils.firstNonBlank(image.getOriginalFilename(), image.getName());
        try {
            return imageLoadingService.load(image.getBytes(), name);
        } catch (IOException e) {
            throw new ImageLoadingException("Could not read upload " + name + ": " + e.getMessage(), e);
        }
    }

    private LayoutMode parseMode(String mode) {
        return ValidationUtils.hasText(mode) ? LayoutMode.parse(mode) : null;
    }
}
