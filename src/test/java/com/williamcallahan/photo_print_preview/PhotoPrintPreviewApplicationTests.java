/**
 * Basic application context load test for Photo Print Preview
 *
 * @author William Callahan
 *
 * Features:
 * - Verifies that the Spring application context loads correctly
 * - Checks that app.* properties bind from the test profile
 * - Serves as a smoke test for the whole render pipeline
 *
 * The "test" profile points the preferences file at the temp directory so the
 * user's real settings are never touched.
 */

package com.williamcallahan.photo_print_preview;

import com.williamcallahan.photo_print_preview.config.AppConfigurationProperties;
import com.williamcallahan.photo_print_preview.service.PreferencesService;
import com.williamcallahan.photo_print_preview.service.PrintPreviewService;
import com.williamcallahan.photo_print_preview.testutil.ImageTestData;
import com.williamcallahan.photo_print_preview.types.LayoutMode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.awt.Color;
import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
class PhotoPrintPreviewApplicationTests {

    @Autowired
    private PrintPreviewService printPreviewService;

    @Autowired
    private PreferencesService preferencesService;

    @Autowired
    private AppConfigurationProperties properties;

    /**
     * Verifies that the Spring application context loads successfully
     */
    @Test
    void contextLoads() {
        assertNotNull(printPreviewService);
        assertEquals(300, properties.getPaper().getDpi());
        assertTrue(preferencesService.getSettingsFile().toString().contains("photo-print-preview-test"));
    }

    @Test
    void rendersFourBySixPrintRaster() {
        BufferedImage raster = printPreviewService.renderPrintRaster(
            ImageTestData.solidPhoto(400, 300, Color.RED), LayoutMode.FIT, 0);

        assertEquals(1200, raster.getWidth());
        assertEquals(1800, raster.getHeight());
    }
}
