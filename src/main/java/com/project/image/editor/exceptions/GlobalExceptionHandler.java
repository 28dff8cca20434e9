package com.project.image.editor.exceptions;

import com.project.image.editor.controller.HomeController;
import com.project.image.editor.service.EditSession;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ui.Model;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Renders the editor page again with an error message. The session state shown is whatever it
 * was before the failed request, since failed operations never change it.
 */
@ControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final EditSession editSession;

    public GlobalExceptionHandler(EditSession editSession) {
        this.editSession = editSession;
    }

    @ExceptionHandler(ExternalEditException.class)
    public String handleExternalEdit(ExternalEditException ex, Model model) {
        log.warn("External edit failed: {}", ex.getMessage());
        return page(model, "The edit failed: " + ex.getMessage());
    }

    @ExceptionHandler(DecodeException.class)
    public String handleDecode(DecodeException ex, Model model) {
        log.warn("Decode error: {}", ex.getMessage());
        return page(model, "The edited image could not be processed: " + ex.getMessage());
    }

    @ExceptionHandler({InvalidStateException.class, UploadException.class})
    public String handleDomainExceptions(EditorException ex, Model model) {
        log.warn("Domain error: {}", ex.getMessage());
        return page(model, ex.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public String handleMaxUploadSizeExceeded(MaxUploadSizeExceededException ex, Model model) {
        log.warn("File upload size exceeded: {}", ex.getMessage());
        return page(model, "The file is too large. Maximum size: 10MB");
    }

    @ExceptionHandler({ConstraintViolationException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public String handleValidationErrors(Exception ex, Model model) {
        log.warn("Validation error: {}", ex.getMessage());
        return page(model, "Invalid request parameters.");
    }

    @ExceptionHandler(Exception.class)
    public String handleUnknownException(Exception ex, Model model) {
        log.error("Unhandled error occurred", ex);
        return page(model, "An unexpected error occurred. Please try again.");
    }

    private String page(Model model, String error) {
        HomeController.populate(model, editSession);
        model.addAttribute("error", error);
        return "index";
    }
}
