package com.project.image.editor.service;

import com.project.image.editor.DTOs.ChromaKeyConfig;
import com.project.image.editor.DTOs.Snapshot;
import com.project.image.editor.exceptions.EditorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/**
 * Runs an edit end to end: current snapshot, external model, optional chroma key, history.
 * A failure anywhere leaves the history exactly as it was.
 */
@Service
public class ImageEditingService {
    private static final Logger log = LoggerFactory.getLogger(ImageEditingService.class);

    private final ImageEditModel model;
    private final AlphaCompositor compositor;
    private final UploadService uploadService;
    private final ChromaKeyConfig chromaKeyConfig;

    public ImageEditingService(ImageEditModel model, AlphaCompositor compositor,
                               UploadService uploadService, ChromaKeyConfig chromaKeyConfig) {
        this.model = model;
        this.compositor = compositor;
        this.uploadService = uploadService;
        this.chromaKeyConfig = chromaKeyConfig;
    }

    public Snapshot load(EditSession session, MultipartFile file) {
        Snapshot original = uploadService.toSnapshot(file);
        session.load(original);
        return original;
    }

    public Snapshot applyEdit(EditSession session, EditKind kind) {
        Snapshot base = session.beginEdit();
        log.info("Starting edit {} on {}", kind, base);
        boolean completed = false;
        try {
            Snapshot raw = model.edit(base, kind.instruction());
            Snapshot result = kind.requiresChromaKey()
                    ? compositor.applyChromaKey(raw, chromaKeyConfig)
                    : raw;
            session.completeEdit(result);
            completed = true;
            log.info("Edit {} completed: {}", kind, result);
            return result;
        } catch (EditorException e) {
            log.warn("Edit {} failed: {}", kind, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Edit {} failed unexpectedly", kind, e);
            throw e;
        } finally {
            // released on every exit, errors included
            if (!completed) {
                session.abortEdit();
            }
        }
    }
}
