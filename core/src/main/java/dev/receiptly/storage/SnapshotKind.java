package dev.receiptly.storage;

/**
 * JSON documents stored beside an uploaded receipt image.
 */
public enum SnapshotKind {

    RAW_RESPONSE("raw_response.json"),
    EXTRACTED_DATA("extracted_data.json");

    private final String fileName;

    SnapshotKind(String fileName) {
        this.fileName = fileName;
    }

    public String fileName() {
        return fileName;
    }
}
