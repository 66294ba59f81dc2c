package com.williamcallahan.photo_print_preview.service.image;

import com.williamcallahan.photo_print_preview.types.Canvas;
import com.williamcallahan.photo_print_preview.types.ImageDescriptor;
import com.williamcallahan.photo_print_preview.types.LayoutMode;
import com.williamcallahan.photo_print_preview.types.OrientationPolicy;
import com.williamcallahan.photo_print_preview.types.PlacementGeometry;
import com.williamcallahan.photo_print_preview.util.layout.PlacementCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;

/**
 * Service for rendering a photo onto a paper canvas
 *
 * @author William Callahan
 *
 * Features:
 * - Draws the photo at the geometry computed by {@link PlacementCalculator}
 * - Turns landscape photos onto portrait sheets through the drawing transform
 * - Always returns an opaque raster with the requested canvas dimensions
 * - Serves both the preview canvas and the fixed-DPI print raster
 * - Encodes finished rasters as PNG or high-quality JPEG
 */
@Service
public class PhotoCompositorService {

    private static final Logger logger = LoggerFactory.getLogger(PhotoCompositorService.class);
    private static final float JPEG_QUALITY = 0.95f; // Print rasters keep more detail than web thumbnails
    private static final Color BACKGROUND = Color.WHITE;

    /**
     * Composites with the default portrait-sheet policy
     *
     * @see #composite(ImageDescriptor, Canvas, LayoutMode, OrientationPolicy)
     */
    public BufferedImage composite(ImageDescriptor image, Canvas canvas, LayoutMode mode) {
        return composite(image, canvas, mode, OrientationPolicy.ROTATE_TO_PORTRAIT);
    }

    /**
     * Renders the photo onto a white canvas
     *
     * @param image orientation-normalized photo
     * @param canvas target size; preview pixels or device pixels
     * @param mode fill or fit
     * @param policy how landscape photos meet the sheet
     * @return opaque RGB raster; {@code canvas.width() x canvas.height()} unless
     *         {@link OrientationPolicy#FOLLOW_IMAGE} turned the sheet for a landscape photo
     *
     * @implNote Rendering workflow:
     * 1. Orients the canvas for the policy and computes placement geometry
     * 2. Fills the raster white and enables quality interpolation
     * 3. For rotated photos, maps the swapped working frame onto the raster:
     *    translate to the centre, rotate 90 degrees, translate back by half the working size
     * 4. Draws the photo at the rounded offsets and size
     * 5. Restores the original transform so the raster keeps the sheet's own frame
     */
    public BufferedImage composite(ImageDescriptor image, Canvas canvas, LayoutMode mode, OrientationPolicy policy) {
        Canvas target = PlacementCalculator.orientCanvas(canvas, image.getPixelWidth(), image.getPixelHeight(), policy);
        PlacementGeometry geometry = PlacementCalculator.computePlacement(
            image.getPixelWidth(), image.getPixelHeight(), target, mode, policy);

        BufferedImage output = new BufferedImage(target.width(), target.height(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = output.createGraphics();
        try {
            g2d.setColor(BACKGROUND);
            g2d.fillRect(0, 0, target.width(), target.height());
            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);

            AffineTransform original = g2d.getTransform();
            if (geometry.rotateImage90()) {
                g2d.translate(target.width() / 2.0, target.height() / 2.0);
                g2d.rotate(Math.PI / 2);
                g2d.translate(-target.height() / 2.0, -target.width() / 2.0);
            }

            int x = (int) Math.round(geometry.xOffset());
            int y = (int) Math.round(geometry.yOffset());
            int w = (int) Math.round(geometry.scaledWidth());
            int h = (int) Math.round(geometry.scaledHeight());
            g2d.drawImage(image.getPixels(), x, y, w, h, null);

            g2d.setTransform(original);
        } finally {
            g2d.dispose();
        }

        logger.debug("{}: composited {} onto {}x{} canvas (rotated: {}, drawn {}x{} at {},{}).",
            image.getSourceName(), mode, target.width(), target.height(), geometry.rotateImage90(),
            Math.round(geometry.scaledWidth()), Math.round(geometry.scaledHeight()),
            Math.round(geometry.xOffset()), Math.round(geometry.yOffset()));
        return output;
    }

    /**
     * Encodes a composited raster
     *
     * @param raster image to encode
     * @param format "png", "jpg" or "jpeg" (case-insensitive)
     * @return encoded bytes
     * @throws IOException if the writer fails
     * @throws IllegalArgumentException for unsupported formats
     */
    public byte[] encode(BufferedImage raster, String format) throws IOException {
        String normalized = format == null ? "png" : format.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "png" -> encodePng(raster);
            case "jpg", "jpeg" -> encodeJpeg(raster);
            default -> throw new IllegalArgumentException("Unsupported output format: " + format);
        };
    }

    /**
     * Media type for a format accepted by {@link #encode(BufferedImage, String)}
     */
    public static String mediaTypeFor(String format) {
        String normalized = format == null ? "png" : format.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "jpg", "jpeg" -> "image/jpeg";
            default -> "image/png";
        };
    }

    private byte[] encodePng(BufferedImage raster) throws IOException {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            if (!ImageIO.write(raster, "png", baos)) {
                throw new IOException("No PNG ImageWriter available");
            }
            return baos.toByteArray();
        }
    }

    private byte[] encodeJpeg(BufferedImage raster) throws IOException {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
            if (!writers.hasNext()) {
                throw new IOException("No JPEG ImageWriter available");
            }
            ImageWriter writer = writers.next();
            ImageWriteParam jpegParams = writer.getDefaultWriteParam();
            jpegParams.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            jpegParams.setCompressionQuality(JPEG_QUALITY);

            try (ImageOutputStream ios = ImageIO.createImageOutputStream(baos)) {
                writer.setOutput(ios);
                writer.write(null, new IIOImage(raster, null, null), jpegParams);
            } finally {
                writer.dispose();
            }

            byte[] bytes = baos.toByteArray();
            logger.debug("Encoded {}x{} raster as JPEG ({} bytes).", raster.getWidth(), raster.getHeight(), bytes.length);
            return bytes;
        }
    }
}
