package dev.receiptly.processor.validation;

import dev.receiptly.processor.ocr.OcrAnalysis;
import dev.receiptly.processor.ocr.OcrValidation;
import java.util.Objects;

/**
 * Receipt-or-not decision reported by the OCR service.
 */
public record ValidationVerdict(boolean validReceipt, double confidence, String message, String docType) {

    /**
     * Uses the validation block of the analysis, or the document confidence when the service did
     * not send one.
     */
    public static ValidationVerdict from(OcrAnalysis analysis) {
        Objects.requireNonNull(analysis, "analysis");
        OcrValidation validation = analysis.validation();
        if (validation == null) {
            return new ValidationVerdict(true, analysis.confidence(), null, analysis.docType());
        }
        return new ValidationVerdict(validation.validReceipt(), validation.confidence(), validation.message(),
            validation.docType() != null ? validation.docType() : analysis.docType());
    }
}
