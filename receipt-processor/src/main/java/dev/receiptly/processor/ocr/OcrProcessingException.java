package dev.receiptly.processor.ocr;

/**
 * Signals that the OCR service could not analyse an image, either after exhausting retries or
 * because it rejected the request.
 */
public class OcrProcessingException extends RuntimeException {

    private final Integer httpStatus;
    private final String rawResponse;

    public OcrProcessingException(String message, Integer httpStatus, String rawResponse) {
        super(message);
        this.httpStatus = httpStatus;
        this.rawResponse = rawResponse;
    }

    public OcrProcessingException(String message, Integer httpStatus, String rawResponse, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
        this.rawResponse = rawResponse;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }

    public String getRawResponse() {
        return rawResponse;
    }
}
