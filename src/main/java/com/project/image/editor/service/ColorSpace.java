package com.project.image.editor.service;

import com.project.image.editor.DTOs.ColorHSL;

/**
 * sRGB to HSL conversion. Hue is easier to key on than raw RGB because a flattened
 * background keeps its hue through compression noise while RGB values drift.
 */
public final class ColorSpace {

    private ColorSpace() {}

    public static ColorHSL toHsl(int r8, int g8, int b8) {
        double r = r8 / 255.0, g = g8 / 255.0, b = b8 / 255.0;
        double max = Math.max(r, Math.max(g, b));
        double min = Math.min(r, Math.min(g, b));
        double l = (max + min) / 2;

        if (max == min) {
            return new ColorHSL(0, 0, l);
        }

        double d = max - min;
        double s = l > 0.5 ? d / (2 - max - min) : d / (max + min);

        double sector;
        if (max == r) {
            sector = (g - b) / d + (g < b ? 6 : 0);
        } else if (max == g) {
            sector = (b - r) / d + 2;
        } else {
            sector = (r - g) / d + 4;
        }

        double h = sector * 60;
        if (h >= 360) h -= 360;
        return new ColorHSL(h, s, l);
    }
}
