package com.project.image.editor.DTOs;

import com.project.image.editor.service.ColorSpace;

/**
 * Tolerance model for one reference colour.
 * A pixel is background when its hue lies within {@code hueTolerance} degrees of
 * {@code referenceHue} (circular distance) and its saturation and lightness are inside the bounds.
 */
public record ChromaKeyConfig(
        double referenceHue,
        double hueTolerance,
        double minSaturation,
        double minLightness,
        double maxLightness
) {

    /** #FF00FF, the colour the background removal edit asks the model to paint. */
    public static final ChromaKeyConfig MAGENTA = new ChromaKeyConfig(300, 25, 0.25, 0.15, 0.95);

    public ChromaKeyConfig {
        if (!(referenceHue >= 0 && referenceHue < 360)) {
            throw new IllegalArgumentException("Reference hue must be in [0, 360): " + referenceHue);
        }
        if (!(hueTolerance >= 0 && hueTolerance <= 180)) {
            throw new IllegalArgumentException("Hue tolerance must be in [0, 180]: " + hueTolerance);
        }
        requireUnit(minSaturation, "minSaturation");
        requireUnit(minLightness, "minLightness");
        requireUnit(maxLightness, "maxLightness");
        if (minLightness > maxLightness) {
            throw new IllegalArgumentException(
                    "minLightness " + minLightness + " exceeds maxLightness " + maxLightness);
        }
    }

    /**
     * Builds a config whose reference hue is taken from a {@code #RRGGBB} colour.
     */
    public static ChromaKeyConfig forReferenceColor(String hex, double hueTolerance,
                                                    double minSaturation, double minLightness,
                                                    double maxLightness) {
        String digits = hex.startsWith("#") ? hex.substring(1) : hex;
        if (!digits.matches("[0-9a-fA-F]{6}")) {
            throw new IllegalArgumentException("Expected a #RRGGBB colour, got: " + hex);
        }
        int rgb = Integer.parseInt(digits, 16);
        ColorHSL hsl = ColorSpace.toHsl((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
        return new ChromaKeyConfig(hsl.hue(), hueTolerance, minSaturation, minLightness, maxLightness);
    }

    private static void requireUnit(double v, String name) {
        if (!(v >= 0 && v <= 1)) {
            throw new IllegalArgumentException(name + " must be in [0, 1]: " + v);
        }
    }
}
