package com.williamcallahan.photo_print_preview.controller;

import com.williamcallahan.photo_print_preview.config.AppConfigurationProperties;
import com.williamcallahan.photo_print_preview.service.PreferencesService;
import com.williamcallahan.photo_print_preview.service.PrintPreviewService;
import com.williamcallahan.photo_print_preview.service.image.ImageLoadingService;
import com.williamcallahan.photo_print_preview.service.image.PhotoCompositorService;
import com.williamcallahan.photo_print_preview.service.print.PhotoPrintService;
import com.williamcallahan.photo_print_preview.testutil.ImageTestData;
import com.williamcallahan.photo_print_preview.types.LayoutMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.awt.Color;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Test class for PrintPreviewController size limits
 *
 * @author William Callahan
 *
 * Runs the real preview service and compositor so oversized rasters are refused before allocation
 */
@WebMvcTest(PrintPreviewController.class)
@Import({PrintPreviewService.class, PhotoCompositorService.class, AppConfigurationProperties.class})
class PrintPreviewControllerLimitsTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ImageLoadingService imageLoadingService;
    @MockBean
    private PhotoPrintService photoPrintService;
    @MockBean
    private PreferencesService preferencesService;

    private final MockMultipartFile upload =
        new MockMultipartFile("image", "photo.png", MediaType.IMAGE_PNG_VALUE, ImageTestData.solidPng(8, 12, Color.RED));

    @BeforeEach
    void setUp() {
        when(imageLoadingService.load(any(byte[].class), eq("photo.png")))
            .thenReturn(ImageTestData.solidPhoto(8, 12, Color.RED));
        when(preferencesService.getLayoutMode()).thenReturn(LayoutMode.FILL);
    }

    @Test
    void hugeDpiIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/api/print-preview/raster").file(upload).param("dpi", "100000"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid dimensions"));
    }

    @Test
    void hugePreviewAreaIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/api/print-preview/preview").file(upload)
                .param("width", "100000").param("height", "100000"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid dimensions"));
    }

    @Test
    void rasterWithinLimitRenders() throws Exception {
        mockMvc.perform(multipart("/api/print-preview/raster").file(upload).param("dpi", "30"))
            .andExpect(status().isOk());
    }
}
