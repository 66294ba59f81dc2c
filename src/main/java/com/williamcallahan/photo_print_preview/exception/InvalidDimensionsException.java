/**
 * Thrown when an image, canvas or paper dimension is zero or negative
 *
 * @author William Callahan
 *
 * Features:
 * - Signals a programming error upstream (a failed decode or a collapsed display area)
 * - Raised synchronously and never retried
 * - Maps to HTTP 400 at the API boundary
 */

package com.williamcallahan.photo_print_preview.exception;

public class InvalidDimensionsException extends IllegalArgumentException {

    public InvalidDimensionsException(String message) {
        super(message);
    }
}
