package dev.receiptly.receipts;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Line item owned by a {@link Receipt}. {@code price} holds the line total when the OCR
 * service reported one, otherwise the unit price.
 */
public record ReceiptItem(String name, int quantity, BigDecimal price) {

    public static final int DEFAULT_QUANTITY = 1;

    public ReceiptItem {
        Objects.requireNonNull(price, "price");
    }
}
