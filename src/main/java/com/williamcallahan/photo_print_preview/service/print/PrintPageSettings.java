package com.williamcallahan.photo_print_preview.service.print;

import com.williamcallahan.photo_print_preview.exception.InvalidDimensionsException;
import com.williamcallahan.photo_print_preview.types.PaperSize;

import java.awt.print.PageFormat;
import java.awt.print.Paper;

/**
 * Builds the page format for a single photo sheet.
 */
public final class PrintPageSettings {

    private PrintPageSettings() {
    }

    /**
     * @param paperSize physical sheet, portrait
     * @param borderless when true the imageable area covers the whole sheet
     * @param marginPoints inset on every edge when not borderless
     * @param landscape turn the page for a landscape raster
     */
    public static PageFormat createPageFormat(PaperSize paperSize, boolean borderless, double marginPoints, boolean landscape) {
        double widthPoints = paperSize.widthPoints();
        double heightPoints = paperSize.heightPoints();
        double inset = borderless ? 0.0 : Math.max(0.0, marginPoints);
        if (inset * 2 >= widthPoints || inset * 2 >= heightPoints) {
            throw new InvalidDimensionsException(
                "Print margin of %.1f pt leaves no printable area on a %s sheet".formatted(inset, paperSize.label()));
        }

        Paper paper = new Paper();
        paper.setSize(widthPoints, heightPoints);
        paper.setImageableArea(inset, inset, widthPoints - 2 * inset, heightPoints - 2 * inset);

        PageFormat pageFormat = new PageFormat();
        pageFormat.setPaper(paper);
        pageFormat.setOrientation(landscape ? PageFormat.LANDSCAPE : PageFormat.PORTRAIT);
        return pageFormat;
    }
}
