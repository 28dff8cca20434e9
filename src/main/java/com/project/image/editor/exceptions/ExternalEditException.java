package com.project.image.editor.exceptions;

/** The external image model failed or returned no usable image. */
public class ExternalEditException extends EditorException {
    public ExternalEditException(String message) { super(message); }
    public ExternalEditException(String message, Throwable cause) { super(message, cause); }
}
