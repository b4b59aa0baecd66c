package dev.receiptly.receipts;

/**
 * Records which OCR pipeline produced the data and how confident it was.
 */
public record OcrProvenance(String ocrProvider, Double ocrConfidence, String extractionStrategy) {

    public static final String DEFAULT_PROVIDER = "Azure Document Intelligence + Tesseract";
}
