package dev.receiptly.processor.extraction;

import java.util.Locale;

/**
 * Receipt attributes that can be configured as mandatory via {@code receipt.ingest.required-fields}.
 */
public enum RequiredField {

    STORE_NAME("storeName"),
    TOTAL("total"),
    PURCHASE_DATE("purchaseDate"),
    ITEMS("items");

    private final String propertyName;

    RequiredField(String propertyName) {
        this.propertyName = propertyName;
    }

    public String propertyName() {
        return propertyName;
    }

    public static RequiredField fromPropertyName(String value) {
        String normalized = value == null ? "" : value.trim().replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
        for (RequiredField field : values()) {
            if (field.propertyName.toLowerCase(Locale.ROOT).equals(normalized)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown required receipt field '%s'".formatted(value));
    }
}
