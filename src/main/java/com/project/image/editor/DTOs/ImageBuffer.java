package com.project.image.editor.DTOs;

import java.util.Objects;

/**
 * Decoded raster: row-major packed ARGB pixels.
 * Immutable; the pixel array is copied on the way in and on the way out.
 */
public final class ImageBuffer {
    private final int width;
    private final int height;
    private final int[] argb;

    public ImageBuffer(int width, int height, int[] argb) {
        Objects.requireNonNull(argb, "argb");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid dimensions " + width + "x" + height);
        }
        if ((long) width * height != argb.length) {
            throw new IllegalArgumentException(
                    "Pixel count " + argb.length + " does not match " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.argb = argb.clone();
    }

    public int width() { return width; }
    public int height() { return height; }
    public int pixelCount() { return argb.length; }

    public int argbAt(int x, int y) {
        return argb[y * width + x];
    }

    public Pixel pixelAt(int x, int y) {
        return Pixel.ofArgb(argbAt(x, y));
    }

    public int[] toArgbArray() {
        return argb.clone();
    }

    @Override
    public String toString() {
        return "ImageBuffer[" + width + "x" + height + "]";
    }
}
