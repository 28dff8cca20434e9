package com.project.image.editor.DTOs;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Body of a {@code generateContent} call: one user turn carrying the image and the instruction.
 */
public record GeminiRequest(List<Content> contents, GenerationConfig generationConfig) {

    public record Content(List<Part> parts) {}

    /** Either {@code inlineData} or {@code text} is set. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Part(InlineData inlineData, String text) {
        public static Part image(String mimeType, String base64) {
            return new Part(new InlineData(mimeType, base64), null);
        }

        public static Part text(String text) {
            return new Part(null, text);
        }
    }

    public record InlineData(String mimeType, String data) {}

    public record GenerationConfig(List<String> responseModalities) {}

    public static GeminiRequest imageEdit(String mimeType, String base64Image, String instruction) {
        return new GeminiRequest(
                List.of(new Content(List.of(Part.image(mimeType, base64Image), Part.text(instruction)))),
                new GenerationConfig(List.of("IMAGE"))
        );
    }
}
