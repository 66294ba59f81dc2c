package com.williamcallahan.photo_print_preview.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * User settings persisted between sessions as JSON
 *
 * @author William Callahan
 *
 * Features:
 * - Remembers the last printer and the last placement mode
 * - Ignores unknown keys so older or newer files still load
 *
 * paper_size, borderless and quality are carried through load and save so existing settings files
 * keep their layout; printing reads paper and borderless from app.paper and app.print instead.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PrintPreferences {

    @JsonProperty("printer_name")
    private String printerName = "";

    @JsonProperty("last_scale_mode")
    private String lastScaleMode = LayoutMode.FILL.getConfigKey();

    @JsonProperty("paper_size")
    private String paperSize = PaperSize.FOUR_BY_SIX.label();

    @JsonProperty("borderless")
    private boolean borderless = true;

    @JsonProperty("quality")
    private String quality = "high";

    public PrintPreferences() {
    }

    public PrintPreferences(PrintPreferences other) {
        this.printerName = other.printerName;
        this.lastScaleMode = other.lastScaleMode;
        this.paperSize = other.paperSize;
        this.borderless = other.borderless;
        this.quality = other.quality;
    }

    public String getPrinterName() { return printerName; }
    public void setPrinterName(String printerName) { this.printerName = printerName == null ? "" : printerName; }

    public String getLastScaleMode() { return lastScaleMode; }
    public void setLastScaleMode(String lastScaleMode) { this.lastScaleMode = lastScaleMode; }

    public String getPaperSize() { return paperSize; }
    public void setPaperSize(String paperSize) { this.paperSize = paperSize; }

    public boolean isBorderless() { return borderless; }
    public void setBorderless(boolean borderless) { this.borderless = borderless; }

    public String getQuality() { return quality; }
    public void setQuality(String quality) { this.quality = quality; }
}
