package com.harmoniq.app.exception;

/**
 * The media library could not be read or written.
 */
public class LibraryAccessException extends RuntimeException {

    public LibraryAccessException(String message) {
        super(message);
    }

    public LibraryAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
