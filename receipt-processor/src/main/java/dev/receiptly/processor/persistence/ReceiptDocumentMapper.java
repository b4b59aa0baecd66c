package dev.receiptly.processor.persistence;

import com.google.cloud.Timestamp;
import dev.receiptly.receipts.OcrProvenance;
import dev.receiptly.receipts.Receipt;
import dev.receiptly.receipts.ReceiptItem;
import dev.receiptly.receipts.ReceiptStatus;
import dev.receiptly.receipts.ReceiptTotals;
import dev.receiptly.receipts.StoreDetails;
import dev.receiptly.receipts.ValidationSummary;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Converts receipts to and from Firestore document maps. Amounts are stored as plain decimal
 * strings so no precision is lost, dates as ISO-8601 strings and instants as Firestore timestamps.
 */
final class ReceiptDocumentMapper {

    static final String FIELD_RECEIPT_ID = "receiptId";
    static final String FIELD_USER_ID = "userId";
    static final String FIELD_CONTENT_HASH = "contentHash";
    static final String FIELD_CREATED_AT = "createdAt";
    static final String FIELD_INDEX = "index";

    private ReceiptDocumentMapper() {
    }

    static Map<String, Object> toDocument(Receipt receipt) {
        Map<String, Object> document = new HashMap<>();
        document.put(FIELD_RECEIPT_ID, receipt.id().toString());
        document.put(FIELD_USER_ID, receipt.userId());
        document.put(FIELD_CONTENT_HASH, receipt.contentHash());
        document.put("originalFileName", receipt.originalFileName());
        document.put("objectKey", receipt.objectKey());
        document.put("purchaseDate", receipt.purchaseDate() != null ? receipt.purchaseDate().toString() : null);
        document.put("receiptType", receipt.receiptType());
        document.put("transactionId", receipt.transactionId());
        document.put("status", receipt.status().name());
        document.put("requiresManualReview", receipt.requiresManualReview());
        document.put("itemCount", receipt.items().size());
        document.put(FIELD_CREATED_AT, timestamp(receipt.createdAt()));
        document.put("processedAt", timestamp(receipt.processedAt()));
        document.put("updatedAt", timestamp(receipt.updatedAt()));

        StoreDetails store = receipt.store();
        Map<String, Object> storeMap = new HashMap<>();
        storeMap.put("name", store.name());
        storeMap.put("address", store.address());
        storeMap.put("phoneNumber", store.phoneNumber());
        storeMap.put("postalCode", store.postalCode());
        storeMap.put("country", store.country());
        storeMap.put("locationConfidence", store.locationConfidence());
        document.put("store", storeMap);

        ReceiptTotals totals = receipt.totals();
        Map<String, Object> totalsMap = new HashMap<>();
        totalsMap.put("total", amountText(totals.total()));
        totalsMap.put("subtotal", amountText(totals.subtotal()));
        totalsMap.put("tax", amountText(totals.tax()));
        totalsMap.put("tip", amountText(totals.tip()));
        document.put("totals", totalsMap);

        if (receipt.provenance() != null) {
            Map<String, Object> provenance = new HashMap<>();
            provenance.put("ocrProvider", receipt.provenance().ocrProvider());
            provenance.put("ocrConfidence", receipt.provenance().ocrConfidence());
            provenance.put("extractionStrategy", receipt.provenance().extractionStrategy());
            document.put("provenance", provenance);
        }
        if (receipt.validation() != null) {
            Map<String, Object> validation = new HashMap<>();
            validation.put("validReceipt", receipt.validation().validReceipt());
            validation.put("confidence", receipt.validation().confidence());
            validation.put("message", receipt.validation().message());
            document.put("validation", validation);
        }
        return document;
    }

    static Map<String, Object> toItemDocument(Receipt receipt, int index, ReceiptItem item) {
        Map<String, Object> document = new HashMap<>();
        document.put(FIELD_RECEIPT_ID, receipt.id().toString());
        document.put(FIELD_USER_ID, receipt.userId());
        document.put(FIELD_INDEX, index);
        document.put("name", item.name());
        document.put("quantity", item.quantity());
        document.put("price", amountText(item.price()));
        return document;
    }

    static Receipt fromDocument(Map<String, Object> document, List<Map<String, Object>> itemDocuments) {
        Map<String, Object> store = map(document.get("store"));
        Map<String, Object> totals = map(document.get("totals"));
        Map<String, Object> provenance = map(document.get("provenance"));
        Map<String, Object> validation = map(document.get("validation"));

        return Receipt.builder()
            .id(UUID.fromString(string(document.get(FIELD_RECEIPT_ID))))
            .userId(string(document.get(FIELD_USER_ID)))
            .contentHash(string(document.get(FIELD_CONTENT_HASH)))
            .originalFileName(string(document.get("originalFileName")))
            .objectKey(string(document.get("objectKey")))
            .purchaseDate(localDate(document.get("purchaseDate")))
            .receiptType(string(document.get("receiptType")))
            .transactionId(string(document.get("transactionId")))
            .status(ReceiptStatus.valueOf(string(document.get("status"))))
            .requiresManualReview(Boolean.TRUE.equals(document.get("requiresManualReview")))
            .createdAt(instant(document.get(FIELD_CREATED_AT)))
            .processedAt(instant(document.get("processedAt")))
            .updatedAt(instant(document.get("updatedAt")))
            .store(new StoreDetails(
                string(store.get("name")),
                string(store.get("address")),
                string(store.get("phoneNumber")),
                string(store.get("postalCode")),
                string(store.get("country")),
                decimalNumber(store.get("locationConfidence"))))
            .totals(new ReceiptTotals(
                amountValue(totals.get("total")),
                amountValue(totals.get("subtotal")),
                amountValue(totals.get("tax")),
                amountValue(totals.get("tip"))))
            .provenance(provenance.isEmpty() ? null : new OcrProvenance(
                string(provenance.get("ocrProvider")),
                decimalNumber(provenance.get("ocrConfidence")),
                string(provenance.get("extractionStrategy"))))
            .validation(validation.isEmpty() ? null : new ValidationSummary(
                Boolean.TRUE.equals(validation.get("validReceipt")),
                validation.get("confidence") instanceof Number number ? number.doubleValue() : 0.0,
                string(validation.get("message"))))
            .items(items(itemDocuments))
            .build();
    }

    private static List<ReceiptItem> items(List<Map<String, Object>> itemDocuments) {
        if (itemDocuments == null || itemDocuments.isEmpty()) {
            return List.of();
        }
        List<Map<String, Object>> sorted = new ArrayList<>(itemDocuments);
        sorted.sort(Comparator.comparingLong(item -> item.get(FIELD_INDEX) instanceof Number number
            ? number.longValue() : Long.MAX_VALUE));
        List<ReceiptItem> items = new ArrayList<>(sorted.size());
        for (Map<String, Object> item : sorted) {
            Object quantity = item.get("quantity");
            BigDecimal price = amountValue(item.get("price"));
            items.add(new ReceiptItem(
                string(item.get("name")),
                quantity instanceof Number number ? number.intValue() : ReceiptItem.DEFAULT_QUANTITY,
                price != null ? price : BigDecimal.ZERO));
        }
        return items;
    }

    private static Timestamp timestamp(Instant instant) {
        if (instant == null) {
            return null;
        }
        return Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano());
    }

    private static Instant instant(Object value) {
        if (value instanceof Timestamp timestamp) {
            return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
        }
        if (value instanceof String text && !text.isBlank()) {
            return Instant.parse(text);
        }
        return null;
    }

    private static String amountText(BigDecimal value) {
        return value != null ? value.toPlainString() : null;
    }

    private static BigDecimal amountValue(Object value) {
        if (value instanceof String text && !text.isBlank()) {
            return new BigDecimal(text);
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        return null;
    }

    private static Double decimalNumber(Object value) {
        return value instanceof Number number ? number.doubleValue() : null;
    }

    private static LocalDate localDate(Object value) {
        return value instanceof String text && !text.isBlank() ? LocalDate.parse(text) : null;
    }

    private static String string(Object value) {
        return value != null ? value.toString() : null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(Object value) {
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }
}
