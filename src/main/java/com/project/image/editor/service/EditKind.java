package com.project.image.editor.service;

/**
 * The edits offered to the user. The kind, not the prompt text, decides whether the
 * result has to go through the chroma key.
 */
public enum EditKind {

    REMOVE_BACKGROUND("Remove background", true, """
            ROLE: You are an expert image editing AI.

            PRIMARY DIRECTIVE: Isolate the main subject(s) from the background. The subject must stay exactly as it is.

            OUTPUT SPECIFICATIONS:
            1. Subject preservation: keep the main subject(s) pixel-accurate. Do not change shape, colour, texture or detail.
            2. Background replacement: replace the whole background with one solid, pure magenta, hex #FF00FF.
            3. Edge quality: the border between subject and magenta must be sharp and clean. \
            No blurred, feathered or anti-aliased edges.
            4. Nothing else in the background: the background may only contain #FF00FF.

            TASK: Identify the primary subject(s), preserve them, and replace the entire background with solid magenta (#FF00FF).
            """),

    REMOVE_BLEMISHES("Remove dust", false, """
            ROLE: You are a precision image restoration AI. Your only job is to remove small defects while \
            keeping every other property of the original.

            TASK: Remove fine scratches, dust and small spots from the surface of the subject.

            RULES:
            1. Remove defects only. Do not modify any other part of the image.
            2. Keep the subject's outline, shape and structure. Keep its surface texture; do not blur or smooth it.
            3. Keep the original colours exactly, including hue, saturation and brightness, \
            and keep every reflection, shadow and highlight.
            4. Retouched areas must be indistinguishable from their surroundings, with no visible editing seams.

            RESULT: The original image with only the dust and scratches gone; shape, texture, colour and lighting identical.
            """);

    private final String label;
    private final boolean requiresChromaKey;
    private final String instruction;

    EditKind(String label, boolean requiresChromaKey, String instruction) {
        this.label = label;
        this.requiresChromaKey = requiresChromaKey;
        this.instruction = instruction;
    }

    public String label() { return label; }

    public boolean requiresChromaKey() { return requiresChromaKey; }

    public String instruction() { return instruction; }
}
