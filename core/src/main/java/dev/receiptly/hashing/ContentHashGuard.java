package dev.receiptly.hashing;

import dev.receiptly.receipts.Receipt;
import dev.receiptly.receipts.ReceiptRepository;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Computes content hashes of uploads and resolves them against receipts the user already owns.
 */
public class ContentHashGuard {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContentHashGuard.class);
    private static final int BUFFER_SIZE = 8192;
    private static final int SHA256_HEX_LENGTH = 64;

    private final ReceiptRepository receiptRepository;

    public ContentHashGuard(ReceiptRepository receiptRepository) {
        this.receiptRepository = Objects.requireNonNull(receiptRepository, "receiptRepository");
    }

    /**
     * Returns the lowercase hex SHA-256 digest of the remaining stream content. The stream is
     * reset to where it was before hashing so it can be read again.
     *
     * @throws IllegalArgumentException when the stream does not support mark/reset
     */
    public String computeHash(InputStream content) {
        Objects.requireNonNull(content, "content");
        if (!content.markSupported()) {
            throw new IllegalArgumentException("Content stream must support mark/reset to be hashed");
        }
        MessageDigest digest = newDigest();
        content.mark(Integer.MAX_VALUE);
        try {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = content.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read content for hashing", ex);
        } finally {
            reset(content);
        }
        return toHex(digest.digest());
    }

    public Optional<Receipt> lookup(String userId, String contentHash) {
        if (!StringUtils.hasText(userId) || !isValidSha256Hash(contentHash)) {
            LOGGER.warn("Skipping duplicate lookup for user {} with invalid hash {}", userId, contentHash);
            return Optional.empty();
        }
        Optional<Receipt> existing = receiptRepository.findByContentHash(userId, contentHash);
        existing.ifPresent(receipt -> LOGGER.info("Content hash {} already stored as receipt {} for user {}",
            contentHash, receipt.id(), userId));
        return existing;
    }

    public static boolean isValidSha256Hash(String hash) {
        if (hash == null || hash.length() != SHA256_HEX_LENGTH) {
            return false;
        }
        for (int i = 0; i < hash.length(); i++) {
            char c = hash.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
                return false;
            }
        }
        return true;
    }

    private static void reset(InputStream content) {
        try {
            content.reset();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to reset content stream after hashing", ex);
        }
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder hexString = new StringBuilder(2 * bytes.length);
        for (byte b : bytes) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
