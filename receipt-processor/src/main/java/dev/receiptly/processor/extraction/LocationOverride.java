package dev.receiptly.processor.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * Store and location details from the secondary OCR pass, read from the document metadata.
 * Present values take precedence over the primary fields for store identity.
 */
public record LocationOverride(
    String storeName,
    String address,
    String phoneNumber,
    String postalCode,
    String country,
    Double locationConfidence,
    String extractionStrategy
) {

    static final String STORE_NAME = "store_name";
    static final String ADDRESS = "address";
    static final String PHONE = "phone";
    static final String POSTAL_CODE = "postal_code";
    static final String COUNTRY = "country";
    static final String TESSERACT_CONFIDENCE = "tesseract_confidence";
    static final String LOCATION_CONFIDENCE = "location_confidence";
    static final String EXTRACTION_STRATEGY = "extraction_strategy";

    public static LocationOverride fromMetadata(Map<String, JsonNode> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return empty();
        }
        Double confidence = FieldValues.number(metadata.get(TESSERACT_CONFIDENCE));
        if (confidence == null) {
            confidence = FieldValues.number(metadata.get(LOCATION_CONFIDENCE));
        }
        return new LocationOverride(
            text(metadata.get(STORE_NAME)),
            text(metadata.get(ADDRESS)),
            text(metadata.get(PHONE)),
            text(metadata.get(POSTAL_CODE)),
            text(metadata.get(COUNTRY)),
            confidence,
            text(metadata.get(EXTRACTION_STRATEGY)));
    }

    public static LocationOverride empty() {
        return new LocationOverride(null, null, null, null, null, null, null);
    }

    private static String text(JsonNode value) {
        if (value == null || !value.isValueNode() || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
