package com.project.image.editor.DTOs;

import org.springframework.util.MimeType;
import org.springframework.util.MimeTypeUtils;

import java.util.Arrays;
import java.util.Objects;

/**
 * One immutable point in the editing history: encoded image bytes plus their MIME type.
 * The bytes are opaque here; they are only decoded when a chroma key has to be applied.
 */
public record Snapshot(byte[] data, String mimeType) {

    public static final String PNG = "image/png";

    public Snapshot {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(mimeType, "mimeType");
        if (data.length == 0) {
            throw new IllegalArgumentException("Snapshot data is empty");
        }
        MimeType parsed = MimeTypeUtils.parseMimeType(mimeType);
        if (!"image".equals(parsed.getType()) || parsed.isWildcardSubtype()) {
            throw new IllegalArgumentException("Not a concrete image MIME type: " + mimeType);
        }
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    public int size() {
        return data.length;
    }

    /** File extension for downloads, derived from the MIME subtype. */
    public String extension() {
        String subtype = MimeTypeUtils.parseMimeType(mimeType).getSubtype();
        return switch (subtype) {
            case "jpeg", "pjpeg" -> "jpg";
            case "svg+xml" -> "svg";
            default -> subtype;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Snapshot other)) return false;
        return mimeType.equals(other.mimeType) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * mimeType.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Snapshot[" + mimeType + ", " + data.length + " bytes]";
    }
}
