package dev.receiptly.processor.ingestion;

import java.io.InputStream;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Receipt image submitted by a user.
 */
public record UploadRequest(String userId, String originalFileName, String contentType, InputStream content) {

    public UploadRequest {
        if (!StringUtils.hasText(userId)) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        Objects.requireNonNull(content, "content");
    }
}
