package com.project.image.editor.exceptions;

public class UploadException extends EditorException {
    public UploadException(String message) { super(message); }
    public UploadException(String message, Throwable cause) { super(message, cause); }
}
