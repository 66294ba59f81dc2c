package com.williamcallahan.photo_print_preview.service.image;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Metadata;
import com.drew.metadata.MetadataException;
import com.drew.metadata.exif.ExifDirectoryBase;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.williamcallahan.photo_print_preview.exception.ImageLoadingException;
import com.williamcallahan.photo_print_preview.types.ImageDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Service for turning photo files into orientation-normalized {@link ImageDescriptor}s
 *
 * @author William Callahan
 *
 * Features:
 * - Decodes any format ImageIO can read
 * - Applies the EXIF orientation tag so pixels are upright before layout
 * - Flattens transparency onto white and converts to RGB
 * - Rejects empty or undecodable input with {@link ImageLoadingException}
 */
@Service
public class ImageLoadingService {

    private static final Logger logger = LoggerFactory.getLogger(ImageLoadingService.class);
    static final int ORIENTATION_NORMAL = 1;

    /**
     * Loads a photo from disk
     *
     * @param path photo file
     * @return decoded, upright photo
     * @throws ImageLoadingException if the file is missing, unreadable or not an image
     */
    public ImageDescriptor load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ImageLoadingException("File not found: " + path);
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            logger.error("Could not read photo {}: {}", path, e.getMessage(), e);
            throw new ImageLoadingException("Could not read photo " + path + ": " + e.getMessage(), e);
        }
        return load(bytes, path.getFileName().toString());
    }

    /**
     * Decodes photo bytes
     *
     * @param rawImageBytes encoded photo
     * @param sourceName name used in log lines and the descriptor
     * @return decoded, upright photo
     * @throws ImageLoadingException if the bytes are empty or cannot be decoded
     *
     * @implNote Loading workflow:
     * 1. Validates input bytes are present
     * 2. Decodes with ImageIO
     * 3. Reads the EXIF orientation (defaults to 1 when absent)
     * 4. Applies the matching flip/rotation while converting to RGB over white
     */
    public ImageDescriptor load(byte[] rawImageBytes, String sourceName) {
        if (rawImageBytes == null || rawImageBytes.length == 0) {
            logger.warn("{}: Raw image bytes are null or empty. Cannot load.", sourceName);
            throw new ImageLoadingException("Image data is empty");
        }

        BufferedImage decoded;
        try (ByteArrayInputStream bais = new ByteArrayInputStream(rawImageBytes)) {
            decoded = ImageIO.read(bais);
        } catch (IOException e) {
            logger.error("{}: IOException while decoding image: {}", sourceName, e.getMessage(), e);
            throw new ImageLoadingException("Could not decode image " + sourceName + ": " + e.getMessage(), e);
        }
        if (decoded == null) {
            logger.warn("{}: Could not read raw bytes into a BufferedImage. Image format might be unsupported or corrupt.", sourceName);
            throw new ImageLoadingException("Unsupported or corrupt image format: " + sourceName);
        }

        int orientation = readExifOrientation(rawImageBytes, sourceName);
        BufferedImage upright = normalize(decoded, orientation);
        ImageDescriptor descriptor = new ImageDescriptor(upright, sourceName);
        logger.info("{}: Loaded {}x{} photo (EXIF orientation {}, {}).",
            sourceName, descriptor.getPixelWidth(), descriptor.getPixelHeight(), orientation,
            descriptor.isLandscape() ? "landscape" : "portrait");
        return descriptor;
    }

    /**
     * Reads the EXIF IFD0 orientation tag
     *
     * @return orientation 1-8; 1 when the tag is missing, invalid or the metadata is unreadable
     */
    int readExifOrientation(byte[] rawImageBytes, String sourceName) {
        try (ByteArrayInputStream bais = new ByteArrayInputStream(rawImageBytes)) {
            Metadata metadata = ImageMetadataReader.readMetadata(bais);
            ExifIFD0Directory directory = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
            if (directory == null || !directory.containsTag(ExifDirectoryBase.TAG_ORIENTATION)) {
                return ORIENTATION_NORMAL;
            }
            int orientation = directory.getInt(ExifDirectoryBase.TAG_ORIENTATION);
            if (orientation < 1 || orientation > 8) {
                logger.warn("{}: Ignoring out-of-range EXIF orientation {}.", sourceName, orientation);
                return ORIENTATION_NORMAL;
            }
            return orientation;
        } catch (ImageProcessingException | MetadataException | IOException e) {
            logger.debug("{}: No usable EXIF orientation ({}). Assuming upright.", sourceName, e.getMessage());
            return ORIENTATION_NORMAL;
        }
    }

    /**
     * Applies an EXIF orientation and converts to an opaque RGB raster
     *
     * @param source decoded pixels as stored in the file
     * @param orientation EXIF orientation 1-8
     * @return upright RGB image; width and height are swapped for orientations 5-8
     */
    static BufferedImage normalize(BufferedImage source, int orientation) {
        int w = source.getWidth();
        int h = source.getHeight();
        boolean swapsAxes = orientation >= 5 && orientation <= 8;
        int outWidth = swapsAxes ? h : w;
        int outHeight = swapsAxes ? w : h;

        BufferedImage output = new BufferedImage(outWidth, outHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = output.createGraphics();
        try {
            g2d.setColor(Color.WHITE);
            g2d.fillRect(0, 0, outWidth, outHeight);
            g2d.drawImage(source, orientationTransform(orientation, w, h), null);
        } finally {
            g2d.dispose();
        }
        return output;
    }

    /**
     * Maps stored pixel coordinates to upright coordinates for each EXIF orientation
     */
    static AffineTransform orientationTransform(int orientation, int width, int height) {
        // AffineTransform(m00, m10, m01, m11, m02, m12): x' = m00*x + m01*y + m02, y' = m10*x + m11*y + m12
        return switch (orientation) {
            case 2 -> new AffineTransform(-1, 0, 0, 1, width, 0);      // mirror horizontal
            case 3 -> new AffineTransform(-1, 0, 0, -1, width, height); // rotate 180
            case 4 -> new AffineTransform(1, 0, 0, -1, 0, height);     // mirror vertical
            case 5 -> new AffineTransform(0, 1, 1, 0, 0, 0);           // transpose
            case 6 -> new AffineTransform(0, 1, -1, 0, height, 0);     // rotate 90 clockwise
            case 7 -> new AffineTransform(0, -1, -1, 0, height, width); // transverse
            case 8 -> new AffineTransform(0, -1, 1, 0, 0, width);      // rotate 90 counter-clockwise
            default -> new AffineTransform();
        };
    }
}
