package com.project.image.editor.service;

import com.project.image.editor.DTOs.ChromaKeyConfig;
import com.project.image.editor.DTOs.ColorHSL;
import com.project.image.editor.DTOs.Pixel;

/**
 * Background / subject classification against one reference hue.
 * <p>
 * Saturation and lightness bounds keep near-grey, near-black and near-white pixels on the subject
 * side even when their hue happens to be close to the reference; those are edge and shading detail.
 * The input alpha channel is ignored.
 */
public final class ChromaKeyMatcher {

    private ChromaKeyMatcher() {}

    public static boolean isBackground(Pixel pixel, ChromaKeyConfig config) {
        return isBackground(pixel.r(), pixel.g(), pixel.b(), config);
    }

    public static boolean isBackground(int argb, ChromaKeyConfig config) {
        return isBackground((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF, config);
    }

    public static boolean isBackground(int r, int g, int b, ChromaKeyConfig config) {
        ColorHSL hsl = ColorSpace.toHsl(r, g, b);
        return hueDistance(hsl.hue(), config.referenceHue()) <= config.hueTolerance()
                && hsl.saturation() >= config.minSaturation()
                && hsl.lightness() >= config.minLightness()
                && hsl.lightness() <= config.maxLightness();
    }

    /** Shortest distance between two hues on the colour wheel, in [0, 180]. */
    public static double hueDistance(double h1, double h2) {
        double d = Math.abs(h1 - h2) % 360;
        return Math.min(d, 360 - d);
    }
}
