package dev.receiptly.processor.ocr;

import java.util.Map;

public record ObjectField(Map<String, FieldNode> fields, Double confidence) implements FieldNode {

    public ObjectField {
        fields = fields != null ? Map.copyOf(fields) : Map.of();
    }
}
