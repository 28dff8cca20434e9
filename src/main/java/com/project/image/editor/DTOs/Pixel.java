package com.project.image.editor.DTOs;

/** RGBA pixel, 0-255 per channel. */
public record Pixel(int r, int g, int b, int a) {

    public Pixel {
        checkChannel(r, "r");
        checkChannel(g, "g");
        checkChannel(b, "b");
        checkChannel(a, "a");
    }

    public static Pixel ofArgb(int argb) {
        return new Pixel((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF, (argb >>> 24) & 0xFF);
    }

    public static Pixel opaque(int r, int g, int b) {
        return new Pixel(r, g, b, 255);
    }

    private static void checkChannel(int v, String name) {
        if (v < 0 || v > 255) {
            throw new IllegalArgumentException("Channel " + name + " out of range: " + v);
        }
    }
}
