package dev.receiptly.processor.api;

/**
 * Thrown when an uploaded file is not an acceptable receipt image.
 */
public class InvalidUploadException extends RuntimeException {

    public InvalidUploadException(String message) {
        super(message);
    }
}
