package dev.receiptly.processor.ocr;

/**
 * Recursively typed OCR field. The OCR service reports each field as a scalar, a keyed group of
 * fields or a list of fields; a scalar may still carry a nested list or dictionary in its raw value.
 */
public sealed interface FieldNode permits ScalarField, ObjectField, ArrayField {

    Double confidence();
}
