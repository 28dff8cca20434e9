package com.project.image.editor.exceptions;

/** Encoded bytes could not be turned into a pixel grid, or a pixel grid could not be encoded. */
public class DecodeException extends EditorException {
    public DecodeException(String message) { super(message); }
    public DecodeException(String message, Throwable cause) { super(message, cause); }
}
