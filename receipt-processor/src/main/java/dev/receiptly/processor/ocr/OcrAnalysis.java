package dev.receiptly.processor.ocr;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.Objects;

/**
 * Successful OCR analysis of a receipt image.
 *
 * @param validation validation block of the response, {@code null} when the service omitted it
 * @param metadata secondary extraction details such as location overrides
 * @param response response document as received, kept for snapshots and failure records
 */
public record OcrAnalysis(
    String docType,
    Map<String, FieldNode> fields,
    double confidence,
    Map<String, JsonNode> metadata,
    OcrValidation validation,
    JsonNode response
) {

    public OcrAnalysis {
        fields = fields != null ? fields : Map.of();
        metadata = metadata != null ? metadata : Map.of();
        Objects.requireNonNull(response, "response");
    }
}
