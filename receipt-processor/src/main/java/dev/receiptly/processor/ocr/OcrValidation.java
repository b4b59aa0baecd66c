package dev.receiptly.processor.ocr;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OcrValidation(
    @JsonProperty("is_valid_receipt") boolean validReceipt,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("message") String message,
    @JsonProperty("doc_type") String docType
) {
}
