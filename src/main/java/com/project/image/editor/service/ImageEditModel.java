package com.project.image.editor.service;

import com.project.image.editor.DTOs.Snapshot;

/**
 * Generative model that edits an image according to a natural-language instruction.
 */
public interface ImageEditModel {

    /**
     * @throws com.project.image.editor.exceptions.ExternalEditException if the call fails,
     *         times out or the answer carries no image
     */
    Snapshot edit(Snapshot image, String instruction);
}
