package com.libragraph.pack.formats.api;

/**
 * Thrown when a {@link Codec} cannot decode its input.
 */
public class CodecException extends RuntimeException {

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }

    public CodecException(String message) {
        super(message);
    }
}
