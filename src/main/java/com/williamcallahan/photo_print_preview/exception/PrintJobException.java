package com.williamcallahan.photo_print_preview.exception;

/**
 * Thrown when no usable printer is found or the print system rejects the job
 */
public class PrintJobException extends RuntimeException {

    public PrintJobException(String message) {
        super(message);
    }

    public PrintJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
