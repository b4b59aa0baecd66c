package dev.receiptly.processor.api;

import java.util.Arrays;
import java.util.Optional;

/**
 * Image formats accepted for upload, recognised by their leading magic bytes.
 */
public enum ReceiptImageFormat {

    JPEG("image/jpeg", new byte[] {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF}),
    PNG("image/png", new byte[] {(byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A}),
    TIFF_LITTLE_ENDIAN("image/tiff", new byte[] {0x49, 0x49, 0x2A, 0x00}),
    TIFF_BIG_ENDIAN("image/tiff", new byte[] {0x4D, 0x4D, 0x00, 0x2A});

    private final String contentType;
    private final byte[] signature;

    ReceiptImageFormat(String contentType, byte[] signature) {
        this.contentType = contentType;
        this.signature = signature;
    }

    public String contentType() {
        return contentType;
    }

    static Optional<ReceiptImageFormat> detect(byte[] content) {
        return Arrays.stream(values()).filter(format -> format.matches(content)).findFirst();
    }

    private boolean matches(byte[] content) {
        if (content.length < signature.length) {
            return false;
        }
        for (int i = 0; i < signature.length; i++) {
            if (content[i] != signature[i]) {
                return false;
            }
        }
        return true;
    }
}
