package com.williamcallahan.photo_print_preview.exception;

/**
 * Thrown when photo bytes are empty, undecodable or cannot be read from disk
 */
public class ImageLoadingException extends RuntimeException {

    public ImageLoadingException(String message) {
        super(message);
    }

    public ImageLoadingException(String message, Throwable cause) {
        super(message, cause);
    }
}
