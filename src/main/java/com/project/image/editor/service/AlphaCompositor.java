package com.project.image.editor.service;

import com.project.image.editor.DTOs.ChromaKeyConfig;
import com.project.image.editor.DTOs.ImageBuffer;
import com.project.image.editor.DTOs.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

/**
 * Turns chroma-keyed background pixels transparent.
 * <p>
 * Hard cut only: a matching pixel gets alpha 0, every other byte is copied as is. No blur or
 * feathering, the background edit already asks the model for a sharp boundary.
 */
@Service
public class AlphaCompositor {
    private static final Logger log = LoggerFactory.getLogger(AlphaCompositor.class);

    private final ImageCodec codec;
    private final int parallelThreshold;

    public AlphaCompositor(ImageCodec codec,
                           @Value("${app.chroma-key.parallel-threshold:262144}") int parallelThreshold) {
        this.codec = codec;
        this.parallelThreshold = parallelThreshold;
    }

    public ImageBuffer applyChromaKey(ImageBuffer image, ChromaKeyConfig config) {
        final int w = image.width(), h = image.height();
        int[] argb = image.toArgbArray();
        AtomicInteger keyed = new AtomicInteger();

        // every pixel is independent, so rows can go in parallel on big images
        IntStream rows = IntStream.range(0, h);
        if (image.pixelCount() >= parallelThreshold) {
            rows = rows.parallel();
        }
        rows.forEach(y -> {
            int count = 0;
            for (int i = y * w, end = i + w; i < end; i++) {
                if (ChromaKeyMatcher.isBackground(argb[i], config)) {
                    argb[i] &= 0x00FFFFFF;
                    count++;
                }
            }
            keyed.addAndGet(count);
        });

        log.debug("Chroma key cleared {} of {} pixels ({}x{})", keyed.get(), image.pixelCount(), w, h);
        return new ImageBuffer(w, h, argb);
    }

    /**
     * Decodes the snapshot, keys it and re-encodes it as PNG whatever the input type was.
     *
     * @throws com.project.image.editor.exceptions.DecodeException if the bytes are not a readable image
     */
    public Snapshot applyChromaKey(Snapshot image, ChromaKeyConfig config) {
        ImageBuffer decoded = codec.decode(image);
        return codec.encodePng(applyChromaKey(decoded, config));
    }
}
