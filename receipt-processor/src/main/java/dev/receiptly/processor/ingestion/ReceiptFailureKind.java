package dev.receiptly.processor.ingestion;

import dev.receiptly.processor.extraction.MissingRequiredFieldsException;
import dev.receiptly.processor.ocr.OcrProcessingException;
import dev.receiptly.processor.validation.InvalidReceiptException;
import dev.receiptly.processor.validation.PoorImageQualityException;

/**
 * Terminal failure categories of an ingestion. Each category carries the prefix used for the
 * quarantine reason and the message shown to the uploader.
 */
public enum ReceiptFailureKind {

    OCR_PROCESSING("OCR failed: "),
    INVALID_RECEIPT("Invalid receipt: "),
    POOR_IMAGE_QUALITY("Poor quality: "),
    MISSING_REQUIRED_FIELDS("Missing fields: "),
    UNEXPECTED("Unexpected error: ");

    private final String reasonPrefix;

    ReceiptFailureKind(String reasonPrefix) {
        this.reasonPrefix = reasonPrefix;
    }

    public static ReceiptFailureKind classify(Throwable failure) {
        if (failure instanceof OcrProcessingException) {
            return OCR_PROCESSING;
        }
        if (failure instanceof InvalidReceiptException) {
            return INVALID_RECEIPT;
        }
        if (failure instanceof PoorImageQualityException) {
            return POOR_IMAGE_QUALITY;
        }
        if (failure instanceof MissingRequiredFieldsException) {
            return MISSING_REQUIRED_FIELDS;
        }
        return UNEXPECTED;
    }

    public String reason(Throwable failure) {
        if (failure instanceof MissingRequiredFieldsException missing) {
            return reasonPrefix + String.join(", ", missing.getMissingFields());
        }
        String message = failure.getMessage();
        return reasonPrefix + (message != null ? message : failure.getClass().getSimpleName());
    }

    /**
     * Message safe to return to the uploader. Never includes OCR payloads or stack details.
     */
    public String userMessage(Throwable failure) {
        return switch (this) {
            case INVALID_RECEIPT -> "The uploaded image is not a valid receipt. " + failure.getMessage();
            case POOR_IMAGE_QUALITY ->
                "Image quality is too poor to read the receipt. Please take a clearer photo with good lighting.";
            case OCR_PROCESSING ->
                "Failed to process receipt. The image may not contain a valid receipt or is too unclear to read.";
            case MISSING_REQUIRED_FIELDS -> "Receipt is missing required information: "
                + String.join(", ", ((MissingRequiredFieldsException) failure).getMissingFields())
                + ". Please upload a complete receipt.";
            case UNEXPECTED -> "An unexpected error occurred while processing your receipt. "
                + "Please try again or contact support if the problem persists.";
        };
    }
}
