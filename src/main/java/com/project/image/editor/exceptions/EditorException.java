package com.project.image.editor.exceptions;

/** Base of the editor's domain exceptions. */
public class EditorException extends RuntimeException {
    public EditorException(String message) { super(message); }
    public EditorException(String message, Throwable cause) { super(message, cause); }
}
