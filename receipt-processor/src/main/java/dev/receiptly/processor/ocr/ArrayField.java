package dev.receiptly.processor.ocr;

import java.util.List;

public record ArrayField(List<FieldNode> elements, Double confidence) implements FieldNode {

    public ArrayField {
        elements = elements != null ? List.copyOf(elements) : List.of();
    }
}
