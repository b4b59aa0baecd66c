package dev.receiptly.receipts;

/**
 * Merchant identity and location as resolved from the OCR response.
 */
public record StoreDetails(
    String name,
    String address,
    String phoneNumber,
    String postalCode,
    String country,
    Double locationConfidence
) {

    public static final String UNKNOWN_STORE_NAME = "Unknown Store";

    public static StoreDetails empty() {
        return new StoreDetails(null, null, null, null, null, null);
    }
}
