package com.project.image.editor.DTOs;

/**
 * Hue in degrees [0, 360), saturation and lightness in [0, 1].
 */
public record ColorHSL(double hue, double saturation, double lightness) {}
