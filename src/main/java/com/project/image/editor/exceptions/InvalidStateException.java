package com.project.image.editor.exceptions;

/** An edit history operation was called in a state that does not allow it. State is left unchanged. */
public class InvalidStateException extends EditorException {
    public InvalidStateException(String message) { super(message); }
}
