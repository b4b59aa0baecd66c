package dev.receiptly.processor.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.receiptly.processor.ocr.OcrAnalysis;
import dev.receiptly.processor.ocr.OcrValidation;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ValidationGateTest {

    private final ValidationGate gate = new ValidationGate();

    @ParameterizedTest
    @CsvSource({
        "true, 0.49, POOR_IMAGE_QUALITY",
        "true, 0.50, ACCEPTED",
        "true, 0.51, ACCEPTED",
        "true, 0.00, POOR_IMAGE_QUALITY",
        "true, 1.00, ACCEPTED",
        "false, 0.49, NOT_A_RECEIPT",
        "false, 0.50, NOT_A_RECEIPT",
        "false, 0.99, NOT_A_RECEIPT"
    })
    void decidesOnValidityAndConfidence(boolean valid, double confidence, ValidationOutcome expected) {
        assertThat(gate.evaluate(new ValidationVerdict(valid, confidence, null, "receipt"))).isEqualTo(expected);
    }

    @Test
    void sameVerdictAlwaysGivesSameOutcome() {
        ValidationVerdict verdict = new ValidationVerdict(true, 0.42, "blurry", "receipt");

        assertThat(gate.evaluate(verdict)).isEqualTo(gate.evaluate(verdict));
    }

    @Test
    void enforceRaisesInvalidReceiptWithServiceMessage() {
        assertThatThrownBy(() -> gate.enforce(new ValidationVerdict(false, 0.9, "Looks like a menu", "other")))
            .isInstanceOfSatisfying(InvalidReceiptException.class,
                ex -> assertThat(ex.getMessage()).isEqualTo("Looks like a menu"));
    }

    @Test
    void enforceRaisesPoorQualityBelowThreshold() {
        assertThatThrownBy(() -> gate.enforce(new ValidationVerdict(true, 0.2, null, "receipt")))
            .isInstanceOf(PoorImageQualityException.class);
    }

    @Test
    void enforceAcceptsConfidentReceipt() {
        assertThatCode(() -> gate.enforce(new ValidationVerdict(true, 0.8, null, "receipt")))
            .doesNotThrowAnyException();
    }

    @Test
    void thresholdIsConfigurable() {
        ValidationGate strict = new ValidationGate(0.9);

        assertThat(strict.evaluate(new ValidationVerdict(true, 0.8, null, null)))
            .isEqualTo(ValidationOutcome.POOR_IMAGE_QUALITY);
        assertThatThrownBy(() -> new ValidationGate(1.5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void verdictFallsBackToDocumentConfidenceWithoutValidationBlock() {
        OcrAnalysis analysis = new OcrAnalysis("receipt", Map.of(), 0.64, Map.of(), null,
            JsonNodeFactory.instance.objectNode());

        ValidationVerdict verdict = ValidationVerdict.from(analysis);

        assertThat(verdict.validReceipt()).isTrue();
        assertThat(verdict.confidence()).isEqualTo(0.64);
        assertThat(verdict.docType()).isEqualTo("receipt");
    }

    @Test
    void verdictUsesValidationBlockWhenPresent() {
        OcrAnalysis analysis = new OcrAnalysis("receipt", Map.of(), 0.64, Map.of(),
            new OcrValidation(false, 0.3, "Not a receipt", null), JsonNodeFactory.instance.objectNode());

        ValidationVerdict verdict = ValidationVerdict.from(analysis);

        assertThat(verdict.validReceipt()).isFalse();
        assertThat(verdict.confidence()).isEqualTo(0.3);
        assertThat(verdict.message()).isEqualTo("Not a receipt");
        assertThat(verdict.docType()).isEqualTo("receipt");
    }
}
