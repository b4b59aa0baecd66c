package dev.receiptly.processor.ocr;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Leaf field. {@code value} keeps the raw JSON so that values typed as {@code array} or
 * {@code dictionary} can be read as nested fields later.
 *
 * @param source which OCR engine produced the value, when reported
 * @param requiresManualReview set by the OCR service when it fell back to a placeholder value
 */
public record ScalarField(
    JsonNode value,
    String valueType,
    Double confidence,
    String source,
    boolean requiresManualReview
) implements FieldNode {

    public boolean hasValue() {
        return value != null && !value.isNull() && !value.isMissingNode();
    }
}
