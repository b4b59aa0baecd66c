package dev.receiptly.processor.extraction;

import dev.receiptly.processor.ocr.FieldNode;
import dev.receiptly.processor.ocr.OcrAnalysis;
import dev.receiptly.processor.ocr.ScalarField;
import dev.receiptly.receipts.ReceiptItem;
import dev.receiptly.receipts.ReceiptTotals;
import dev.receiptly.receipts.StoreDetails;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Maps the OCR field tree onto receipt attributes and line items.
 */
public class ReceiptFieldExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptFieldExtractor.class);

    public static final double DEFAULT_LOCATION_REVIEW_THRESHOLD = 0.5;

    static final String MERCHANT_NAME = "MerchantName";
    static final String MERCHANT_ADDRESS = "MerchantAddress";
    static final String MERCHANT_PHONE_NUMBER = "MerchantPhoneNumber";
    static final String TRANSACTION_DATE = "TransactionDate";
    static final String TOTAL = "Total";
    static final String SUBTOTAL = "Subtotal";
    static final String TOTAL_TAX = "TotalTax";
    static final String TIP = "Tip";
    static final String RECEIPT_TYPE = "ReceiptType";
    static final String TRANSACTION_ID = "TransactionId";
    static final String ITEMS = "Items";
    static final String ITEM_DESCRIPTION = "Description";
    static final String ITEM_QUANTITY = "Quantity";
    static final String ITEM_TOTAL_PRICE = "TotalPrice";
    static final String ITEM_PRICE = "Price";

    private final double locationReviewThreshold;
    private final Set<RequiredField> requiredFields;

    public ReceiptFieldExtractor() {
        this(DEFAULT_LOCATION_REVIEW_THRESHOLD, Set.of());
    }

    public ReceiptFieldExtractor(double locationReviewThreshold, Set<RequiredField> requiredFields) {
        this.locationReviewThreshold = locationReviewThreshold;
        this.requiredFields = requiredFields == null || requiredFields.isEmpty()
            ? Set.of() : Set.copyOf(EnumSet.copyOf(requiredFields));
    }

    /**
     * @throws MissingRequiredFieldsException when a configured required attribute could not be extracted
     */
    public ReceiptExtraction extract(OcrAnalysis analysis) {
        Objects.requireNonNull(analysis, "analysis");
        Map<String, FieldNode> fields = analysis.fields();
        LocationOverride override = LocationOverride.fromMetadata(analysis.metadata());
        LOGGER.debug("Extracting receipt from OCR fields {}", fields.keySet());

        FieldNode merchantName = fields.get(MERCHANT_NAME);
        StoreDetails store = new StoreDetails(
            firstText(override.storeName(), FieldValues.text(merchantName)),
            firstText(override.address(), FieldValues.text(fields.get(MERCHANT_ADDRESS))),
            firstText(override.phoneNumber(), FieldValues.text(fields.get(MERCHANT_PHONE_NUMBER))),
            override.postalCode(),
            override.country(),
            override.locationConfidence());

        ReceiptTotals totals = new ReceiptTotals(
            FieldValues.decimal(fields.get(TOTAL)),
            FieldValues.decimal(fields.get(SUBTOTAL)),
            FieldValues.decimal(fields.get(TOTAL_TAX)),
            FieldValues.decimal(fields.get(TIP)));

        List<ReceiptItem> items = new ArrayList<>();
        int skipped = readItems(fields.get(ITEMS), items);

        ReceiptExtraction extraction = new ReceiptExtraction(
            store,
            totals,
            FieldValues.date(fields.get(TRANSACTION_DATE)),
            FieldValues.text(fields.get(RECEIPT_TYPE)),
            FieldValues.text(fields.get(TRANSACTION_ID)),
            items,
            override.extractionStrategy(),
            manualReviewReasons(merchantName, store),
            skipped);

        checkRequiredFields(extraction);
        return extraction;
    }

    private int readItems(FieldNode itemsNode, List<ReceiptItem> items) {
        List<FieldNode> elements = FieldValues.elements(itemsNode);
        int skipped = 0;
        for (int index = 0; index < elements.size(); index++) {
            try {
                ReceiptItem item = readItem(elements.get(index));
                if (item == null) {
                    LOGGER.warn("Skipping item {} without description or price", index);
                    skipped++;
                } else {
                    items.add(item);
                }
            } catch (RuntimeException ex) {
                LOGGER.warn("Skipping unreadable item {}", index, ex);
                skipped++;
            }
        }
        return skipped;
    }

    private ReceiptItem readItem(FieldNode element) {
        Map<String, FieldNode> itemFields = FieldValues.children(element);
        if (itemFields.isEmpty()) {
            return null;
        }
        String name = FieldValues.text(itemFields.get(ITEM_DESCRIPTION));
        BigDecimal price = FieldValues.decimal(itemFields.get(ITEM_TOTAL_PRICE));
        if (price == null) {
            price = FieldValues.decimal(itemFields.get(ITEM_PRICE));
        }
        if (name == null && price == null) {
            return null;
        }
        Integer quantity = FieldValues.integer(itemFields.get(ITEM_QUANTITY));
        return new ReceiptItem(name, quantity != null ? quantity : ReceiptItem.DEFAULT_QUANTITY,
            price != null ? price : BigDecimal.ZERO);
    }

    private List<String> manualReviewReasons(FieldNode merchantName, StoreDetails store) {
        List<String> reasons = new ArrayList<>();
        if (merchantName instanceof ScalarField scalar && scalar.requiresManualReview()) {
            reasons.add("OCR flagged the store name for review (source: %s)"
                .formatted(scalar.source() != null ? scalar.source() : "unknown"));
        }
        if (!StringUtils.hasText(store.name()) || StoreDetails.UNKNOWN_STORE_NAME.equalsIgnoreCase(store.name())) {
            reasons.add("Store name could not be detected");
        }
        if (store.locationConfidence() != null && store.locationConfidence() < locationReviewThreshold) {
            reasons.add(String.format(Locale.ROOT, "Location confidence %.2f is below %.2f",
                store.locationConfidence(), locationReviewThreshold));
        }
        if (!reasons.isEmpty()) {
            LOGGER.warn("Receipt requires manual review: {}", reasons);
        }
        return reasons;
    }

    private void checkRequiredFields(ReceiptExtraction extraction) {
        if (requiredFields.isEmpty()) {
            return;
        }
        List<String> missing = new ArrayList<>();
        for (RequiredField field : RequiredField.values()) {
            if (requiredFields.contains(field) && isMissing(field, extraction)) {
                missing.add(field.propertyName());
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingRequiredFieldsException(missing);
        }
    }

    private static boolean isMissing(RequiredField field, ReceiptExtraction extraction) {
        return switch (field) {
            case STORE_NAME -> !StringUtils.hasText(extraction.store().name());
            case TOTAL -> extraction.totals().total() == null;
            case PURCHASE_DATE -> extraction.purchaseDate() == null;
            case ITEMS -> extraction.items().isEmpty();
        };
    }

    private static String firstText(String preferred, String fallback) {
        return StringUtils.hasText(preferred) ? preferred : fallback;
    }
}
