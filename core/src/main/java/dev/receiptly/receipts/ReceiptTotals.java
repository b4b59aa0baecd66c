package dev.receiptly.receipts;

import java.math.BigDecimal;

public record ReceiptTotals(BigDecimal total, BigDecimal subtotal, BigDecimal tax, BigDecimal tip) {

    public static ReceiptTotals empty() {
        return new ReceiptTotals(null, null, null, null);
    }
}
