/**
 * Main application class for Photo Print Preview
 *
 * @author William Callahan
 *
 * Features:
 * - Serves the preview, raster and print API
 * - Runs one-shot print commands from the command line
 * - Entry point for Spring Boot application
 */

package com.williamcallahan.photo_print_preview;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PhotoPrintPreviewApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(PhotoPrintPreviewApplication.class, args);
    }
}
