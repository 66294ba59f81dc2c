package com.williamcallahan.photo_print_preview.types;

/**
 * Summary of a submitted print job
 *
 * @param printerName printer the job was sent to
 * @param rasterWidth width of the printed raster in device pixels
 * @param rasterHeight height of the printed raster in device pixels
 * @param mode placement mode used
 * @param rotated whether the photo was turned onto the sheet
 */
public record PrintJobResult(String printerName, int rasterWidth, int rasterHeight, LayoutMode mode, boolean rotated) {
}
