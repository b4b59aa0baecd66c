package dev.receiptly.processor.extraction;

import java.util.List;

public class MissingRequiredFieldsException extends RuntimeException {

    private final List<String> missingFields;

    public MissingRequiredFieldsException(List<String> missingFields) {
        super("Receipt is missing required fields: " + String.join(", ", missingFields));
        this.missingFields = List.copyOf(missingFields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
