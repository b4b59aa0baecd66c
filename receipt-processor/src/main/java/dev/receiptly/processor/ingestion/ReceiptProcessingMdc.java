package dev.receiptly.processor.ingestion;

import java.util.Map;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Utility for populating mapped diagnostic context (MDC) entries so log lines emitted during
 * an ingestion share the same identifiers (receipt id, user, content hash, stage).
 */
final class ReceiptProcessingMdc {

    static final String KEY_RECEIPT_ID = "receipt.id";
    static final String KEY_USER_ID = "receipt.userId";
    static final String KEY_CONTENT_HASH = "receipt.contentHash";
    static final String KEY_STAGE = "receipt.stage";

    private ReceiptProcessingMdc() {
        // Utility class
    }

    static Context open(UUID receiptId, String userId) {
        return new Context(receiptId, userId);
    }

    static void attachContentHash(String contentHash) {
        putIfHasText(KEY_CONTENT_HASH, contentHash);
    }

    static void setStage(String stage) {
        putIfHasText(KEY_STAGE, stage);
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(UUID receiptId, String userId) {
            this.previous = MDC.getCopyOfContextMap();
            putIfHasText(KEY_RECEIPT_ID, receiptId != null ? receiptId.toString() : null);
            putIfHasText(KEY_USER_ID, userId);
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
