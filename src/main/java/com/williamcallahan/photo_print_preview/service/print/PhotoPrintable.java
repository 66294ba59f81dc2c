package com.williamcallahan.photo_print_preview.service.print;

import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.print.PageFormat;
import java.awt.print.Printable;
import java.util.Objects;

/**
 * Single-page printable that draws a finished print raster as large as the imageable area allows.
 * The raster keeps its own aspect ratio; a margin-inset area that is not 2:3 leaves the slack
 * centred as blank paper.
 */
final class PhotoPrintable implements Printable {

    private final BufferedImage raster;

    PhotoPrintable(BufferedImage raster) {
        this.raster = Objects.requireNonNull(raster, "raster");
    }

    @Override
    public int print(Graphics g, PageFormat pf, int pageIndex) {
        if (pageIndex != 0) {
            return NO_SUCH_PAGE;
        }

        Graphics2D g2d = (Graphics2D) g;
        Rectangle bounds = drawnBounds(pf);
        g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
        g2d.drawImage(raster, bounds.x, bounds.y, bounds.width, bounds.height, null);
        return PAGE_EXISTS;
    }

    /**
     * Page rectangle the raster is drawn into: uniformly scaled to the imageable area and centred in it
     */
    Rectangle drawnBounds(PageFormat pf) {
        double areaWidth = pf.getImageableWidth();
        double areaHeight = pf.getImageableHeight();
        double scale = Math.min(areaWidth / raster.getWidth(), areaHeight / raster.getHeight());
        int width = (int) Math.round(raster.getWidth() * scale);
        int height = (int) Math.round(raster.getHeight() * scale);
        int x = (int) Math.round(pf.getImageableX() + (areaWidth - width) / 2.0);
        int y = (int) Math.round(pf.getImageableY() + (areaHeight - height) / 2.0);
        return new Rectangle(x, y, width, height);
    }

    BufferedImage getRaster() {
        return raster;
    }
}
