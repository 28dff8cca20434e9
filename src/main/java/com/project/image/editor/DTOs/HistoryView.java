package com.project.image.editor.DTOs;

/**
 * Read-only view of an editing session for the page template.
 *
 * @param currentIndex cursor into the history, -1 when nothing is loaded
 * @param downloadable true once the cursor has moved past the original upload
 */
public record HistoryView(
        boolean loaded,
        int currentIndex,
        int size,
        boolean undoable,
        boolean redoable,
        boolean downloadable,
        boolean editPending,
        String mimeType
) {

    public static final HistoryView EMPTY = new HistoryView(false, -1, 0, false, false, false, false, null);

    /** 1-based position for display, e.g. "2 / 3". */
    public String position() {
        return loaded ? (currentIndex + 1) + " / " + size : "";
    }
}
