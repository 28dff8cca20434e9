package com.project.image.editor.service;

import com.project.image.editor.DTOs.ImageBuffer;
import com.project.image.editor.DTOs.Snapshot;
import com.project.image.editor.exceptions.DecodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import javax.imageio.ImageIO;

/**
 * Moves between encoded snapshots and pixel buffers. The reader is picked from the bytes
 * themselves; the declared MIME type is not trusted.
 */
@Service
public class ImageCodec {
    private static final Logger log = LoggerFactory.getLogger(ImageCodec.class);

    public ImageBuffer decode(Snapshot snapshot) {
        BufferedImage img;
        try (var in = new ByteArrayInputStream(snapshot.data())) {
            img = ImageIO.read(in);
        } catch (IOException | RuntimeException e) {
            throw new DecodeException("Cannot decode " + snapshot.mimeType() + " image: " + e.getMessage(), e);
        }
        if (img == null) {
            throw new DecodeException("No image reader understands the " + snapshot.mimeType() + " data");
        }

        int w = img.getWidth(), h = img.getHeight();
        int[] argb = new int[w * h];
        if (img.getColorModel().getColorSpace().getType() == java.awt.color.ColorSpace.TYPE_GRAY) {
            readGray(img, argb);
        } else {
            img.getRGB(0, 0, w, h, argb, 0, w);
        }
        log.debug("Decoded {} into {}x{} pixels", snapshot, w, h);
        return new ImageBuffer(w, h, argb);
    }

    /**
     * Gray samples are copied as stored. {@code getRGB} would push them through the linear gray
     * colour space and lighten every mid tone.
     */
    private static void readGray(BufferedImage img, int[] argb) {
        Raster raster = img.getRaster();
        int w = img.getWidth(), h = img.getHeight();
        boolean hasAlpha = raster.getNumBands() > 1;
        int grayBits = raster.getSampleModel().getSampleSize(0);
        int alphaBits = hasAlpha ? raster.getSampleModel().getSampleSize(1) : 8;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int v = to8Bit(raster.getSample(x, y, 0), grayBits);
                int a = hasAlpha ? to8Bit(raster.getSample(x, y, 1), alphaBits) : 255;
                argb[y * w + x] = (a << 24) | (v << 16) | (v << 8) | v;
            }
        }
    }

    private static int to8Bit(int sample, int bits) {
        if (bits == 8) {
            return sample;
        }
        int max = (1 << bits) - 1;
        return Math.round(sample * 255f / max);
    }

    /** Always PNG, so transparency survives. */
    public Snapshot encodePng(ImageBuffer buffer) {
        BufferedImage img = new BufferedImage(buffer.width(), buffer.height(), BufferedImage.TYPE_INT_ARGB);
        img.setRGB(0, 0, buffer.width(), buffer.height(), buffer.toArgbArray(), 0, buffer.width());
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(img, "png", baos);
            return new Snapshot(baos.toByteArray(), Snapshot.PNG);
        } catch (IOException e) {
            throw new DecodeException("Failed to encode image", e);
        }
    }
}
