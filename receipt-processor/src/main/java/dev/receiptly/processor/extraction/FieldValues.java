package dev.receiptly.processor.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import dev.receiptly.processor.ocr.ArrayField;
import dev.receiptly.processor.ocr.FieldNode;
import dev.receiptly.processor.ocr.FieldNodeReader;
import dev.receiptly.processor.ocr.ObjectField;
import dev.receiptly.processor.ocr.ScalarField;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Lenient coercion of OCR field values. Every reader returns {@code null} for absent or
 * unparsable input instead of throwing.
 */
final class FieldValues {

    private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9,.\\-]");
    private static final Pattern DECIMAL_COMMA = Pattern.compile("^-?\\d+,\\d{1,2}$");
    private static final List<Function<String, LocalDate>> DATE_PARSERS = List.of(
        LocalDate::parse,
        text -> LocalDateTime.parse(text).toLocalDate(),
        text -> OffsetDateTime.parse(text).toLocalDate());

    private FieldValues() {
    }

    static String text(FieldNode node) {
        if (!(node instanceof ScalarField scalar) || !scalar.hasValue()) {
            return null;
        }
        JsonNode value = scalar.value();
        if (!value.isValueNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    static BigDecimal decimal(FieldNode node) {
        if (!(node instanceof ScalarField scalar) || !scalar.hasValue()) {
            return null;
        }
        return decimal(scalar.value());
    }

    static BigDecimal decimal(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isObject() && value.has("amount")) {
            return decimal(value.get("amount"));
        }
        if (!value.isTextual()) {
            return null;
        }
        String cleaned = NON_NUMERIC.matcher(value.asText()).replaceAll("");
        if (cleaned.isEmpty()) {
            return null;
        }
        if (cleaned.contains(",") && cleaned.contains(".")) {
            cleaned = cleaned.replace(",", "");
        } else if (DECIMAL_COMMA.matcher(cleaned).matches()) {
            cleaned = cleaned.replace(',', '.');
        } else {
            cleaned = cleaned.replace(",", "");
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    static Integer integer(FieldNode node) {
        if (!(node instanceof ScalarField scalar) || !scalar.hasValue()) {
            return null;
        }
        JsonNode value = scalar.value();
        if (value.isNumber()) {
            return wholeNumber(value.doubleValue());
        }
        if (value.isTextual()) {
            try {
                return wholeNumber(Double.parseDouble(value.asText().trim()));
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    private static Integer wholeNumber(double value) {
        if (!Double.isFinite(value) || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            return null;
        }
        return (int) value;
    }

    static Double number(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    static LocalDate date(FieldNode node) {
        String text = text(node);
        if (text == null) {
            return null;
        }
        for (Function<String, LocalDate> parser : DATE_PARSERS) {
            LocalDate parsed = parseOrNull(parser, text);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    private static LocalDate parseOrNull(Function<String, LocalDate> parser, String text) {
        try {
            return parser.apply(text);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    /**
     * Elements of a list-valued field, whether the list arrived as an {@link ArrayField} or as a
     * JSON array inside a scalar value.
     */
    static List<FieldNode> elements(FieldNode node) {
        if (node instanceof ArrayField array) {
            return array.elements();
        }
        if (node instanceof ScalarField scalar && scalar.hasValue() && scalar.value().isArray()) {
            return FieldNodeReader.readElements(scalar.value());
        }
        return List.of();
    }

    /**
     * Named children of a dictionary-valued field, whether it arrived as an {@link ObjectField} or
     * as a JSON object inside a scalar value.
     */
    static Map<String, FieldNode> children(FieldNode node) {
        if (node instanceof ObjectField object) {
            return object.fields();
        }
        if (node instanceof ScalarField scalar && scalar.hasValue() && scalar.value().isObject()) {
            return FieldNodeReader.readFields(scalar.value());
        }
        return Map.of();
    }
}
