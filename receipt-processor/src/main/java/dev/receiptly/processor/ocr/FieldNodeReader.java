package dev.receiptly.processor.ocr;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts the OCR wire representation of fields into {@link FieldNode} trees.
 *
 * <p>Wire shape of a field: {@code {"value", "value_type", "confidence", "value_object",
 * "value_array", "source", "requires_manual_review"}}. A non-empty {@code value_array} wins over a
 * non-empty {@code value_object}; anything else is read as a scalar.
 */
public final class FieldNodeReader {

    static final String VALUE = "value";
    static final String VALUE_TYPE = "value_type";
    static final String CONFIDENCE = "confidence";
    static final String VALUE_OBJECT = "value_object";
    static final String VALUE_ARRAY = "value_array";
    static final String SOURCE = "source";
    static final String REQUIRES_MANUAL_REVIEW = "requires_manual_review";

    private FieldNodeReader() {
    }

    public static FieldNode read(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return new ScalarField(null, null, null, null, false);
        }
        if (!node.isObject()) {
            return new ScalarField(node, null, null, null, false);
        }

        Double confidence = readConfidence(node.get(CONFIDENCE));
        JsonNode valueArray = node.get(VALUE_ARRAY);
        if (valueArray != null && valueArray.isArray() && !valueArray.isEmpty()) {
            return new ArrayField(readElements(valueArray), confidence);
        }
        JsonNode valueObject = node.get(VALUE_OBJECT);
        if (valueObject != null && valueObject.isObject() && !valueObject.isEmpty()) {
            return new ObjectField(readFields(valueObject), confidence);
        }

        JsonNode valueType = node.get(VALUE_TYPE);
        JsonNode source = node.get(SOURCE);
        JsonNode manualReview = node.get(REQUIRES_MANUAL_REVIEW);
        return new ScalarField(
            node.get(VALUE),
            valueType != null && valueType.isTextual() ? valueType.asText() : null,
            confidence,
            source != null && source.isTextual() ? source.asText() : null,
            manualReview != null && manualReview.asBoolean(false));
    }

    /**
     * Reads every entry of a JSON object as a named field, keeping the reported order.
     */
    public static Map<String, FieldNode> readFields(JsonNode fields) {
        if (fields == null || !fields.isObject()) {
            return Map.of();
        }
        Map<String, FieldNode> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = fields.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            result.put(entry.getKey(), read(entry.getValue()));
        }
        return Collections.unmodifiableMap(result);
    }

    public static List<FieldNode> readElements(JsonNode array) {
        if (array == null || !array.isArray()) {
            return List.of();
        }
        List<FieldNode> elements = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            elements.add(read(element));
        }
        return elements;
    }

    private static Double readConfidence(JsonNode confidence) {
        if (confidence == null || !confidence.isNumber()) {
            return null;
        }
        return confidence.doubleValue();
    }
}
