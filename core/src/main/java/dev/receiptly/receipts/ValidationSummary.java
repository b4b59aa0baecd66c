package dev.receiptly.receipts;

public record ValidationSummary(boolean validReceipt, double confidence, String message) {
}
