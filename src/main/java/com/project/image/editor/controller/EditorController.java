package com.project.image.editor.controller;

import com.project.image.editor.DTOs.Snapshot;
import com.project.image.editor.exceptions.InvalidStateException;
import com.project.image.editor.service.EditKind;
import com.project.image.editor.service.EditSession;
import com.project.image.editor.service.ImageEditingService;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

@Controller
@Validated
public class EditorController {
    private static final Logger log = LoggerFactory.getLogger(EditorController.class);

    private static final String DOWNLOAD_NAME = "edited-image";

    private final ImageEditingService editingService;
    private final EditSession editSession;

    public EditorController(ImageEditingService editingService, EditSession editSession) {
        this.editingService = editingService;
        this.editSession = editSession;
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String upload(@RequestParam("file") @NotNull MultipartFile file, RedirectAttributes redirect) {
        log.info("Upload received: {} ({}KB)", file.getOriginalFilename(), file.getSize() / 1024);
        editingService.load(editSession, file);
        redirect.addFlashAttribute("message", "Image loaded");
        return "redirect:/";
    }

    @PostMapping("/edit")
    public String edit(@RequestParam("kind") @NotNull EditKind kind, RedirectAttributes redirect) {
        editingService.applyEdit(editSession, kind);
        redirect.addFlashAttribute("message", kind.label() + " finished");
        return "redirect:/";
    }

    @PostMapping("/undo")
    public String undo(RedirectAttributes redirect) {
        if (!editSession.undo()) {
            redirect.addFlashAttribute("message", "Nothing to undo");
        }
        return "redirect:/";
    }

    @PostMapping("/redo")
    public String redo(RedirectAttributes redirect) {
        if (!editSession.redo()) {
            redirect.addFlashAttribute("message", "Nothing to redo");
        }
        return "redirect:/";
    }

    @PostMapping("/reset")
    public String reset() {
        editSession.reset();
        log.info("Editing session reset");
        return "redirect:/";
    }

    /** The snapshot under the cursor, for display. */
    @GetMapping("/image")
    public ResponseEntity<byte[]> image() {
        return editSession.current()
                .map(s -> ResponseEntity.ok()
                        .contentType(MediaType.parseMediaType(s.mimeType()))
                        .header(HttpHeaders.CACHE_CONTROL, "no-store")
                        .body(s.data()))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /** Only edited versions can be downloaded; the original is what the user already has. */
    @GetMapping("/download")
    public ResponseEntity<byte[]> download() {
        if (!editSession.view().downloadable()) {
            throw new InvalidStateException("Apply an edit before downloading");
        }
        Snapshot current = editSession.current()
                .orElseThrow(() -> new InvalidStateException("Please upload an image first"));
        String filename = DOWNLOAD_NAME + "." + current.extension();
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(current.mimeType()))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(filename).build().toString())
                .body(current.data());
    }
}
