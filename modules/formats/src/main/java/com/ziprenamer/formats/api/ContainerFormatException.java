package com.ziprenamer.formats.api;

/**
 * Raised when a container cannot be detected or read.
 */
public class ContainerFormatException extends RuntimeException {

    public ContainerFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    public ContainerFormatException(String message) {
        super(message);
    }
}
