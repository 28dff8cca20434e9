package com.project.image.editor.service;

import com.project.image.editor.DTOs.Snapshot;
import com.project.image.editor.exceptions.UploadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

/**
 * Checks an upload and keeps it in memory as the first snapshot of a history.
 * Nothing is written to disk.
 */
@Service
public class UploadService {
    private static final Logger log = LoggerFactory.getLogger(UploadService.class);

    public static final List<String> SUPPORTED_FORMATS = List.of(
            "image/jpeg", "image/jpg", "image/png", "image/gif", "image/bmp", "image/webp"
    );
    static final long MAX_SIZE = 10 * 1024 * 1024; // 10MB

    public Snapshot toSnapshot(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new UploadException("Please choose an image to upload");
        }
        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase())) {
            throw new UploadException("Unsupported file type: " + contentType
                    + ". Supported types: " + String.join(", ", SUPPORTED_FORMATS));
        }
        if (file.getSize() > MAX_SIZE) {
            throw new UploadException("The file is too large. Maximum size: 10MB");
        }

        String original = StringUtils.cleanPath(file.getOriginalFilename() == null ? "upload" : file.getOriginalFilename());
        try {
            Snapshot snapshot = new Snapshot(file.getBytes(), normalize(contentType));
            log.info("Accepted upload {} ({}KB)", original, file.getSize() / 1024);
            return snapshot;
        } catch (IOException e) {
            throw new UploadException("Could not read the uploaded file", e);
        }
    }

    private static String normalize(String contentType) {
        String lower = contentType.toLowerCase();
        return lower.equals("image/jpg") ? "image/jpeg" : lower;
    }
}
