/**
 * Main application configuration properties
 * Centralizes all app.* configuration properties for better type safety and IDE support
 *
 * @author William Callahan
 */

package com.williamcallahan.photo_print_preview.config;

import com.williamcallahan.photo_print_preview.types.LayoutMode;
import com.williamcallahan.photo_print_preview.types.OrientationPolicy;
import com.williamcallahan.photo_print_preview.types.PaperSize;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

@Component
@ConfigurationProperties(prefix = "app")
public class AppConfigurationProperties {

    @NestedConfigurationProperty
    private Paper paper = new Paper();

    @NestedConfigurationProperty
    private Preview preview = new Preview();

    @NestedConfigurationProperty
    private Layout layout = new Layout();

    @NestedConfigurationProperty
    private Print print = new Print();

    @NestedConfigurationProperty
    private Preferences preferences = new Preferences();

    // Getters and setters
    public Paper getPaper() { return paper; }
    public void setPaper(Paper paper) { this.paper = paper; }

    public Preview getPreview() { return preview; }
    public void setPreview(Preview preview) { this.preview = preview; }

    public Layout getLayout() { return layout; }
    public void setLayout(Layout layout) { this.layout = layout; }

    public Print getPrint() { return print; }
    public void setPrint(Print print) { this.print = print; }

    public Preferences getPreferences() { return preferences; }
    public void setPreferences(Preferences preferences) { this.preferences = preferences; }

    // Nested configuration classes
    public static class Paper {
        private double widthInches = 4.0;
        private double heightInches = 6.0;
        private int dpi = 300;
        private int maxDpi = 600;

        public double getWidthInches() { return widthInches; }
        public void setWidthInches(double widthInches) { this.widthInches = widthInches; }

        public double getHeightInches() { return heightInches; }
        public void setHeightInches(double heightInches) { this.heightInches = heightInches; }

        public int getDpi() { return dpi; }
        public void setDpi(int dpi) { this.dpi = dpi; }

        public int getMaxDpi() { return maxDpi; }
        public void setMaxDpi(int maxDpi) { this.maxDpi = maxDpi; }

        public PaperSize toPaperSize() {
            return new PaperSize(widthInches, heightInches);
        }
    }

    public static class Preview {
        private int margin = 20;
        private int maxSize = 4096;

        public int getMargin() { return margin; }
        public void setMargin(int margin) { this.margin = margin; }

        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }
    }

    public static class Layout {
        private LayoutMode defaultMode = LayoutMode.FILL;
        private OrientationPolicy orientationPolicy = OrientationPolicy.ROTATE_TO_PORTRAIT;

        public LayoutMode getDefaultMode() { return defaultMode; }
        public void setDefaultMode(LayoutMode defaultMode) { this.defaultMode = defaultMode; }

        public OrientationPolicy getOrientationPolicy() { return orientationPolicy; }
        public void setOrientationPolicy(OrientationPolicy orientationPolicy) { this.orientationPolicy = orientationPolicy; }
    }

    public static class Print {
        private boolean borderless = true;
        private double marginPoints = 0.0;
        private String jobName = "Photo Print";

        public boolean isBorderless() { return borderless; }
        public void setBorderless(boolean borderless) { this.borderless = borderless; }

        public double getMarginPoints() { return marginPoints; }
        public void setMarginPoints(double marginPoints) { this.marginPoints = marginPoints; }

        public String getJobName() { return jobName; }
        public void setJobName(String jobName) { this.jobName = jobName; }
    }

    public static class Preferences {
        private String file = Paths.get(System.getProperty("user.home"), ".config", "photo-print-preview", "settings.json").toString();

        public String getFile() { return file; }
        public void setFile(String file) { this.file = file; }

        public Path getPath() {
            return Paths.get(file);
        }
    }
}
