package dev.receiptly.processor.api;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.springframework.util.unit.DataSize;

/**
 * Checks uploaded bytes before they enter the ingestion pipeline: size limits and a supported
 * image signature. The declared content type of the upload is ignored.
 */
public class ReceiptFileValidator {

    private static final byte[] PDF_SIGNATURE = "%PDF".getBytes(StandardCharsets.US_ASCII);

    private final DataSize minSize;
    private final DataSize maxSize;

    public ReceiptFileValidator(DataSize minSize, DataSize maxSize) {
        if (minSize.toBytes() < 0 || maxSize.toBytes() < minSize.toBytes()) {
            throw new IllegalArgumentException("Upload size limits must satisfy 0 <= min <= max");
        }
        this.minSize = minSize;
        this.maxSize = maxSize;
    }

    /**
     * @return the detected image format
     * @throws InvalidUploadException when the upload is empty, outside the size limits or not a supported image
     */
    public ReceiptImageFormat validate(byte[] content) {
        if (content == null || content.length == 0) {
            throw new InvalidUploadException("The uploaded file is empty");
        }
        if (content.length < minSize.toBytes()) {
            throw new InvalidUploadException("The uploaded file is too small to be a receipt image (minimum %d bytes)"
                .formatted(minSize.toBytes()));
        }
        if (content.length > maxSize.toBytes()) {
            throw new InvalidUploadException("The uploaded file exceeds the maximum size of %d MB"
                .formatted(maxSize.toMegabytes()));
        }
        if (startsWith(content, PDF_SIGNATURE)) {
            throw new InvalidUploadException("PDF receipts are not supported. Please upload a JPEG, PNG or TIFF image");
        }
        return ReceiptImageFormat.detect(content)
            .orElseThrow(() -> new InvalidUploadException("Unsupported file format. Please upload a JPEG, PNG or TIFF image"));
    }

    private static boolean startsWith(byte[] content, byte[] prefix) {
        return content.length >= prefix.length
            && Arrays.equals(content, 0, prefix.length, prefix, 0, prefix.length);
    }
}
