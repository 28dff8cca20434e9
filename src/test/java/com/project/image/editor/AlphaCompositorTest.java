package com.project.image.editor;

import com.project.image.editor.DTOs.ChromaKeyConfig;
import com.project.image.editor.DTOs.ImageBuffer;
import com.project.image.editor.DTOs.Pixel;
import com.project.image.editor.DTOs.Snapshot;
import com.project.image.editor.exceptions.DecodeException;
import com.project.image.editor.service.AlphaCompositor;
import com.project.image.editor.service.ChromaKeyMatcher;
import com.project.image.editor.service.ImageCodec;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.util.Random;
import javax.imageio.ImageIO;

import static org.assertj.core.api.Assertions.*;

class AlphaCompositorTest {
    private final ImageCodec codec = new ImageCodec();
    private final AlphaCompositor compositor = new AlphaCompositor(codec, 262_144);
    private final ChromaKeyConfig magenta = ChromaKeyConfig.MAGENTA;

    @Test
    void matchingPixels_becomeTransparent_andKeepRgb() {
        int[] argb = {0xFFFF00FF, 0xFFC87828, 0x80FF00FF, 0xFF000000};
        ImageBuffer out = compositor.applyChromaKey(new ImageBuffer(2, 2, argb), magenta);

        assertThat(out.argbAt(0, 0)).isEqualTo(0x00FF00FF);
        assertThat(out.argbAt(1, 0)).isEqualTo(0xFFC87828);
        assertThat(out.argbAt(0, 1)).isEqualTo(0x00FF00FF);
        assertThat(out.argbAt(1, 1)).isEqualTo(0xFF000000);
        assertThat(out.pixelAt(0, 1)).isEqualTo(new Pixel(255, 0, 255, 0));
    }

    @Test
    void everyPixel_isEitherUntouchedOrOnlyLosesAlpha() {
        Random rnd = new Random(42);
        int w = 64, h = 48;
        int[] argb = new int[w * h];
        for (int i = 0; i < argb.length; i++) {
            argb[i] = rnd.nextInt();
        }
        // sprinkle in background so both branches are hit
        for (int i = 0; i < argb.length; i += 3) {
            argb[i] = 0xFF000000 | (240 + rnd.nextInt(16)) << 16 | rnd.nextInt(20) << 8 | (230 + rnd.nextInt(26));
        }
        ImageBuffer in = new ImageBuffer(w, h, argb);
        ImageBuffer out = compositor.applyChromaKey(in, magenta);

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int before = in.argbAt(x, y);
                int after = out.argbAt(x, y);
                if (ChromaKeyMatcher.isBackground(before, magenta)) {
                    assertThat(after >>> 24).isZero();
                    assertThat(after & 0xFFFFFF).isEqualTo(before & 0xFFFFFF);
                } else {
                    assertThat(after).isEqualTo(before);
                }
            }
        }
    }

    @Test
    void input_isNotMutated() {
        int[] argb = {0xFFFF00FF, 0xFFFF00FF};
        ImageBuffer in = new ImageBuffer(2, 1, argb);
        compositor.applyChromaKey(in, magenta);

        assertThat(in.toArgbArray()).containsExactly(0xFFFF00FF, 0xFFFF00FF);
        assertThat(argb).containsExactly(0xFFFF00FF, 0xFFFF00FF);
    }

    @Test
    void parallelRows_giveTheSameResult() {
        Random rnd = new Random(7);
        int[] argb = new int[100 * 80];
        for (int i = 0; i < argb.length; i++) argb[i] = rnd.nextInt();
        ImageBuffer in = new ImageBuffer(100, 80, argb);

        AlphaCompositor parallel = new AlphaCompositor(codec, 1);
        assertThat(parallel.applyChromaKey(in, magenta).toArgbArray())
                .isEqualTo(compositor.applyChromaKey(in, magenta).toArgbArray());
    }

    @Test
    void snapshot_isKeyedAndReencodedAsPng() throws Exception {
        Snapshot out = compositor.applyChromaKey(TestImages.png(TestImages.subjectOnMagenta()), magenta);

        assertThat(out.mimeType()).isEqualTo("image/png");
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(out.data()));
        assertThat(decoded.getColorModel().hasAlpha()).isTrue();
        assertThat(decoded.getRGB(0, 0) >>> 24).isZero();
        assertThat(decoded.getRGB(39, 29) >>> 24).isZero();
        assertThat(decoded.getRGB(15, 15)).isEqualTo(TestImages.SUBJECT.getRGB());
    }

    @Test
    void jpegInput_comesOutAsPngWithTransparency() throws Exception {
        Snapshot out = compositor.applyChromaKey(TestImages.jpeg(TestImages.subjectOnMagenta()), magenta);

        assertThat(out.mimeType()).isEqualTo("image/png");
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(out.data()));
        assertThat(decoded.getRGB(2, 2) >>> 24).isZero();
        assertThat(decoded.getRGB(15, 15) >>> 24).isEqualTo(0xFF);
    }

    @Test
    void corruptBytes_failWithDecodeError() {
        Snapshot garbage = new Snapshot(new byte[]{(byte) 0x89, 'P', 'N', 'G', 1, 2, 3}, "image/png");
        assertThatThrownBy(() -> compositor.applyChromaKey(garbage, magenta))
                .isInstanceOf(DecodeException.class);
    }

    @Test
    void imageBuffer_rejectsMismatchedDimensions() {
        assertThatThrownBy(() -> new ImageBuffer(3, 3, new int[8]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ImageBuffer(0, 0, new int[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
