package dev.receiptly.processor.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;

class ReceiptFileValidatorTest {

    private final ReceiptFileValidator validator = new ReceiptFileValidator(DataSize.ofBytes(32), DataSize.ofKilobytes(1));

    @Test
    void detectsSupportedImageSignatures() {
        assertThat(validator.validate(image(0xFF, 0xD8, 0xFF, 0xE0))).isEqualTo(ReceiptImageFormat.JPEG);
        assertThat(validator.validate(image(0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A)))
            .isEqualTo(ReceiptImageFormat.PNG);
        assertThat(validator.validate(image(0x49, 0x49, 0x2A, 0x00))).isEqualTo(ReceiptImageFormat.TIFF_LITTLE_ENDIAN);
        assertThat(validator.validate(image(0x4D, 0x4D, 0x00, 0x2A))).isEqualTo(ReceiptImageFormat.TIFF_BIG_ENDIAN);
        assertThat(ReceiptImageFormat.TIFF_BIG_ENDIAN.contentType()).isEqualTo("image/tiff");
    }

    @Test
    void ignoresDeclaredTypeAndRejectsUnknownBytes() {
        assertThatThrownBy(() -> validator.validate(image('G', 'I', 'F', '8', '9', 'a')))
            .isInstanceOf(InvalidUploadException.class)
            .hasMessageStartingWith("Unsupported file format");
    }

    @Test
    void rejectsPdfWithDedicatedMessage() {
        assertThatThrownBy(() -> validator.validate(image('%', 'P', 'D', 'F', '-', '1', '.', '7')))
            .isInstanceOf(InvalidUploadException.class)
            .hasMessageStartingWith("PDF receipts are not supported");
    }

    @Test
    void enforcesSizeLimits() {
        assertThatThrownBy(() -> validator.validate(new byte[0]))
            .isInstanceOf(InvalidUploadException.class)
            .hasMessage("The uploaded file is empty");
        assertThatThrownBy(() -> validator.validate(new byte[] {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF}))
            .isInstanceOf(InvalidUploadException.class)
            .hasMessageContaining("too small");

        byte[] oversized = Arrays.copyOf(image(0xFF, 0xD8, 0xFF), 2048);
        assertThatThrownBy(() -> validator.validate(oversized))
            .isInstanceOf(InvalidUploadException.class)
            .hasMessageContaining("maximum size");
    }

    @Test
    void rejectsInconsistentLimits() {
        assertThatThrownBy(() -> new ReceiptFileValidator(DataSize.ofKilobytes(2), DataSize.ofKilobytes(1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static byte[] image(int... signature) {
        byte[] content = new byte[64];
        for (int i = 0; i < signature.length; i++) {
            content[i] = (byte) signature[i];
        }
        return content;
    }
}
