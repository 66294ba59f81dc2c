package com.williamcallahan.photo_print_preview.service.print;

import com.williamcallahan.photo_print_preview.config.AppConfigurationProperties;
import com.williamcallahan.photo_print_preview.exception.PrintJobException;
import com.williamcallahan.photo_print_preview.service.PreferencesService;
import com.williamcallahan.photo_print_preview.service.PrintPreviewService;
import com.williamcallahan.photo_print_preview.testutil.ImageTestData;
import com.williamcallahan.photo_print_preview.types.ImageDescriptor;
import com.williamcallahan.photo_print_preview.types.LayoutMode;
import com.williamcallahan.photo_print_preview.types.PrintJobResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import javax.print.PrintService;
import java.awt.Color;
import java.awt.print.PageFormat;
import java.awt.print.Printable;
import java.awt.print.PrinterException;
import java.awt.print.PrinterJob;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for PhotoPrintService
 *
 * @author William Callahan
 *
 * Uses mocked printers and print jobs so no real print system is touched
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PhotoPrintServiceTest {

    @Mock
    private PrintPreviewService printPreviewService;
    @Mock
    private PreferencesService preferencesService;
    @Mock
    private PrinterLookup printerLookup;
    @Mock
    private PrinterJob printerJob;
    @Mock
    private PrintService selphy;
    @Mock
    private PrintService office;

    private AppConfigurationProperties properties;
    private PhotoPrintService photoPrintService;
    private ImageDescriptor photo;

    @BeforeEach
    void setUp() {
        properties = new AppConfigurationProperties();
        photoPrintService = new PhotoPrintService(printPreviewService, preferencesService, printerLookup, properties, () -> printerJob);
        photo = ImageTestData.solidPhoto(2000, 1000, Color.RED);

        when(selphy.getName()).thenReturn("Canon SELPHY CP1500");
        when(office.getName()).thenReturn("Office Laser");
        when(printerLookup.availablePrinters()).thenReturn(new PrintService[] {selphy, office});
        when(printerLookup.defaultPrinter()).thenReturn(office);
        when(preferencesService.getPrinterName()).thenReturn("");
        when(printPreviewService.resolveMode(any())).thenAnswer(inv -> {
            LayoutMode requested = inv.getArgument(0);
            return requested != null ? requested : LayoutMode.FILL;
        });
        when(printPreviewService.renderPrintRaster(any(), any(), eq(300)))
            .thenReturn(ImageTestData.solid(1200, 1800, Color.RED));
    }

    @Test
    void listsPrinterNames() {
        assertThat(photoPrintService.listPrinters()).containsExactly("Canon SELPHY CP1500", "Office Laser");
    }

    @Test
    void selectedPrinterPrefersSavedOne() {
        when(preferencesService.getPrinterName()).thenReturn("Canon SELPHY CP1500");

        assertThat(photoPrintService.selectedPrinterName()).contains("Canon SELPHY CP1500");
    }

    @Test
    void selectedPrinterFallsBackToDefaultWhenSavedOneIsGone() {
        when(preferencesService.getPrinterName()).thenReturn("Retired Printer");

        assertThat(photoPrintService.selectedPrinterName()).contains("Office Laser");
    }

    @Test
    void printsOnExplicitPrinterAndRemembersIt() throws Exception {
        PrintJobResult result = photoPrintService.print(photo, LayoutMode.FIT, "Canon SELPHY CP1500");

        verify(printerJob).setPrintService(selphy);
        verify(printerJob).setJobName("Photo Print");
        ArgumentCaptor<Printable> printable = ArgumentCaptor.forClass(Printable.class);
        ArgumentCaptor<PageFormat> pageFormat = ArgumentCaptor.forClass(PageFormat.class);
        verify(printerJob).setPrintable(printable.capture(), pageFormat.capture());
        verify(printerJob).print();
        verify(preferencesService).setPrinterName("Canon SELPHY CP1500");
        verify(printPreviewService).renderPrintRaster(photo, LayoutMode.FIT, 300);

        assertThat(((PhotoPrintable) printable.getValue()).getRaster().getWidth()).isEqualTo(1200);
        assertThat(pageFormat.getValue().getOrientation()).isEqualTo(PageFormat.PORTRAIT);
        assertThat(pageFormat.getValue().getImageableWidth()).isEqualTo(288.0);
        assertThat(result.printerName()).isEqualTo("Canon SELPHY CP1500");
        assertThat(result.rasterWidth()).isEqualTo(1200);
        assertThat(result.rasterHeight()).isEqualTo(1800);
        assertThat(result.mode()).isEqualTo(LayoutMode.FIT);
        assertThat(result.rotated()).isTrue();
    }

    @Test
    void usesSavedPrinterWhenNoneRequested() throws Exception {
        when(preferencesService.getPrinterName()).thenReturn("Canon SELPHY CP1500");

        PrintJobResult result = photoPrintService.print(photo, null, null);

        verify(printerJob).setPrintService(selphy);
        verify(preferencesService, never()).setPrinterName(anyString());
        assertThat(result.mode()).isEqualTo(LayoutMode.FILL);
    }

    @Test
    void fallsBackToDefaultPrinter() throws Exception {
        photoPrintService.print(photo, null, " ");

        verify(printerJob).setPrintService(office);
    }

    @Test
    void fallsBackToFirstPrinterWithoutDefault() throws Exception {
        when(printerLookup.defaultPrinter()).thenReturn(null);

        photoPrintService.print(photo, null, null);

        verify(printerJob).setPrintService(selphy);
    }

    @Test
    void unknownPrinterIsRejectedBeforeRendering() throws Exception {
        assertThatThrownBy(() -> photoPrintService.print(photo, null, "Nonexistent"))
            .isInstanceOf(PrintJobException.class)
            .hasMessage("Printer not found: Nonexistent");

        verify(printerJob, never()).print();
        verify(printPreviewService, never()).renderPrintRaster(any(), any(), eq(300));
        verify(preferencesService, never()).setPrinterName(anyString());
    }

    @Test
    void noPrintersIsReported() {
        when(printerLookup.availablePrinters()).thenReturn(new PrintService[0]);
        when(printerLookup.defaultPrinter()).thenReturn(null);

        assertThatThrownBy(() -> photoPrintService.print(photo, null, null))
            .isInstanceOf(PrintJobException.class)
            .hasMessage("No printers available");
    }

    @Test
    void printerFailureIsWrapped() throws Exception {
        doThrow(new PrinterException("Paper jam")).when(printerJob).print();

        assertThatThrownBy(() -> photoPrintService.print(photo, null, "Office Laser"))
            .isInstanceOf(PrintJobException.class)
            .hasMessageContaining("Paper jam")
            .hasCauseInstanceOf(PrinterException.class);
    }

    @Test
    void landscapeRasterGetsLandscapePage() throws Exception {
        when(printPreviewService.renderPrintRaster(any(), any(), eq(300)))
            .thenReturn(ImageTestData.solid(1800, 1200, Color.RED));

        photoPrintService.print(photo, null, null);

        ArgumentCaptor<PageFormat> pageFormat = ArgumentCaptor.forClass(PageFormat.class);
        verify(printerJob).setPrintable(any(Printable.class), pageFormat.capture());
        assertThat(pageFormat.getValue().getOrientation()).isEqualTo(PageFormat.LANDSCAPE);
    }
}
