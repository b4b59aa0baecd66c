package dev.receiptly.processor.ocr;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FieldNodeReaderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void readsScalarWithAttributes() throws Exception {
        FieldNode node = FieldNodeReader.read(json("""
            {"value": "Corner Market", "value_type": "string", "confidence": 0.4,
             "source": "tesseract", "requires_manual_review": true}
            """));

        assertThat(node).isInstanceOfSatisfying(ScalarField.class, scalar -> {
            assertThat(scalar.value().asText()).isEqualTo("Corner Market");
            assertThat(scalar.valueType()).isEqualTo("string");
            assertThat(scalar.confidence()).isEqualTo(0.4);
            assertThat(scalar.source()).isEqualTo("tesseract");
            assertThat(scalar.requiresManualReview()).isTrue();
        });
    }

    @Test
    void nonEmptyArrayWinsOverObject() throws Exception {
        FieldNode node = FieldNodeReader.read(json("""
            {"value_type": "array", "confidence": 0.8,
             "value_array": [{"value": 1}, {"value": 2}],
             "value_object": {"ignored": {"value": true}}}
            """));

        assertThat(node).isInstanceOfSatisfying(ArrayField.class, array -> {
            assertThat(array.elements()).hasSize(2);
            assertThat(array.confidence()).isEqualTo(0.8);
        });
    }

    @Test
    void emptyArrayFallsBackToObject() throws Exception {
        FieldNode node = FieldNodeReader.read(json("""
            {"value_array": [], "value_object": {"Description": {"value": "Tea"}}}
            """));

        assertThat(node).isInstanceOfSatisfying(ObjectField.class,
            object -> assertThat(object.fields()).containsOnlyKeys("Description"));
    }

    @Test
    void emptyContainersAreReadAsScalar() throws Exception {
        FieldNode node = FieldNodeReader.read(json("""
            {"value": null, "value_array": [], "value_object": {}}
            """));

        assertThat(node).isInstanceOfSatisfying(ScalarField.class,
            scalar -> assertThat(scalar.hasValue()).isFalse());
    }

    @Test
    void scalarKeepsNestedValueForLaterParsing() throws Exception {
        FieldNode node = FieldNodeReader.read(json("""
            {"value": [{"Description": {"value": "Tea"}}], "value_type": "array"}
            """));

        assertThat(node).isInstanceOfSatisfying(ScalarField.class,
            scalar -> assertThat(scalar.value().isArray()).isTrue());
    }

    @Test
    void bareValuesBecomeScalars() throws Exception {
        assertThat(FieldNodeReader.read(json("42"))).isInstanceOfSatisfying(ScalarField.class,
            scalar -> assertThat(scalar.value().asInt()).isEqualTo(42));
        assertThat(FieldNodeReader.read(null)).isInstanceOfSatisfying(ScalarField.class,
            scalar -> assertThat(scalar.hasValue()).isFalse());
    }

    @Test
    void readFieldsKeepsReportedOrder() throws Exception {
        Map<String, FieldNode> fields = FieldNodeReader.readFields(json("""
            {"Total": {"value": 1}, "MerchantName": {"value": "A"}, "Items": {"value_array": [{"value": 1}]}}
            """));

        assertThat(fields).containsOnlyKeys("Total", "MerchantName", "Items");
        assertThat(fields.keySet()).containsExactly("Total", "MerchantName", "Items");
        assertThat(fields.get("Items")).isInstanceOf(ArrayField.class);
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }
}
