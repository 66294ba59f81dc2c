package com.williamcallahan.photo_print_preview.types;

import com.williamcallahan.photo_print_preview.exception.InvalidDimensionsException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CanvasTest {

    @Test
    void printCanvasForFourBySixAtThreeHundredDpi() {
        Canvas canvas = Canvas.forPrint(PaperSize.FOUR_BY_SIX, 300);

        assertThat(canvas).isEqualTo(new Canvas(1200, 1800));
        assertThat(canvas.isLandscape()).isFalse();
    }

    @Test
    void printCanvasRoundsFractionalPixels() {
        assertThat(Canvas.forPrint(new PaperSize(3.5, 5.0), 301)).isEqualTo(new Canvas(1054, 1505));
    }

    @ParameterizedTest
    @CsvSource({
        // available area, margin -> expected canvas
        "800,600,20,386,580",
        "420,2000,20,400,600",
        "1000,1000,0,666,1000"
    })
    void previewCanvasKeepsPaperAspectInsideArea(int availableW, int availableH, int margin, int expectedW, int expectedH) {
        Canvas canvas = Canvas.forPreview(availableW, availableH, PaperSize.FOUR_BY_SIX, margin);

        assertThat(canvas).isEqualTo(new Canvas(expectedW, expectedH));
        assertThat(canvas.width()).isLessThanOrEqualTo(availableW - margin);
        assertThat(canvas.height()).isLessThanOrEqualTo(availableH - margin);
        assertThat(canvas.aspectRatio()).isCloseTo(PaperSize.FOUR_BY_SIX.aspectRatio(), within(0.01));
    }

    @Test
    void previewAreaSmallerThanMarginIsRejected() {
        assertThatThrownBy(() -> Canvas.forPreview(20, 600, PaperSize.FOUR_BY_SIX, 20))
            .isInstanceOf(InvalidDimensionsException.class);
    }

    @ParameterizedTest
    @CsvSource({"0,1800", "1200,0", "-5,10"})
    void nonPositiveSizeIsRejected(int width, int height) {
        assertThatThrownBy(() -> new Canvas(width, height))
            .isInstanceOf(InvalidDimensionsException.class)
            .hasMessageContaining("must be positive");
    }

    @Test
    void zeroDpiIsRejected() {
        assertThatThrownBy(() -> Canvas.forPrint(PaperSize.FOUR_BY_SIX, 0))
            .isInstanceOf(InvalidDimensionsException.class);
    }

    @Test
    void canvasBeyondIntPixelCountIsRejected() {
        assertThatThrownBy(() -> new Canvas(100_000, 100_000))
            .isInstanceOf(InvalidDimensionsException.class)
            .hasMessageContaining("exceeds");
        assertThatThrownBy(() -> Canvas.forPrint(PaperSize.FOUR_BY_SIX, 100_000))
            .isInstanceOf(InvalidDimensionsException.class);
    }

    @Test
    void swappedExchangesAxes() {
        assertThat(new Canvas(1200, 1800).swapped()).isEqualTo(new Canvas(1800, 1200));
    }

    @Test
    void paperSizeReportsPointsAndLabel() {
        assertThat(PaperSize.FOUR_BY_SIX.widthPoints()).isEqualTo(288.0);
        assertThat(PaperSize.FOUR_BY_SIX.heightPoints()).isEqualTo(432.0);
        assertThat(PaperSize.FOUR_BY_SIX.label()).isEqualTo("4x6");
        assertThat(new PaperSize(3.5, 5).label()).isEqualTo("3.5x5");
    }

    @Test
    void paperSizeRejectsNonPositiveEdges() {
        assertThatThrownBy(() -> new PaperSize(0, 6)).isInstanceOf(InvalidDimensionsException.class);
    }
}
