package com.barte.sdk.decode;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Strict reader over one JSON object.
 *
 * <p>Required accessors fail when the field is missing, null or of the wrong JSON
 * type. Optional accessors return a {@link Field} and still fail on a wrong type.
 * Nothing is coerced: numeric strings are not numbers and numbers are not text.
 */
public final class JsonFields {

    private final JsonNode node;
    private final String path;

    private JsonFields(JsonNode node, String path) {
        this.node = node;
        this.path = path;
    }

    /** Wraps a root response object. */
    public static JsonFields of(JsonNode node) throws DecodingException {
        return of(node, "");
    }

    public static JsonFields of(JsonNode node, String path) throws DecodingException {
        if (node == null || node.isMissingNode()) {
            throw new DecodingException(path, "expected an object but there was no content");
        }
        if (!node.isObject()) {
            throw new DecodingException(path, "expected an object but was " + kind(node));
        }
        return new JsonFields(node, path);
    }

    public String path() {
        return path;
    }

    public boolean has(String name) {
        return node.has(name);
    }

    /** Path of a child field, used in error messages. */
    public String pathOf(String name) {
        return path.isEmpty() ? name : path + "." + name;
    }

    // ---- text ----

    public String requireText(String name) throws DecodingException {
        JsonNode value = required(name);
        if (!value.isTextual()) {
            throw mismatch(name, "a string", value);
        }
        return value.textValue();
    }

    public Field<String> optionalText(String name) throws DecodingException {
        JsonNode value = node.get(name);
        if (value == null) return Field.absent();
        if (value.isNull()) return Field.ofNull();
        if (!value.isTextual()) {
            throw mismatch(name, "a string", value);
        }
        return Field.of(value.textValue());
    }

    // ---- numbers ----

    public BigDecimal requireDecimal(String name) throws DecodingException {
        JsonNode value = required(name);
        if (!value.isNumber()) {
            throw mismatch(name, "a number", value);
        }
        return value.decimalValue();
    }

    public Field<BigDecimal> optionalDecimal(String name) throws DecodingException {
        JsonNode value = node.get(name);
        if (value == null) return Field.absent();
        if (value.isNull()) return Field.ofNull();
        if (!value.isNumber()) {
            throw mismatch(name, "a number", value);
        }
        return Field.of(value.decimalValue());
    }

    public int requireInt(String name) throws DecodingException {
        JsonNode value = required(name);
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw mismatch(name, "an integer", value);
        }
        return value.intValue();
    }

    public Field<Integer> optionalInt(String name) throws DecodingException {
        JsonNode value = node.get(name);
        if (value == null) return Field.absent();
        if (value.isNull()) return Field.ofNull();
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw mismatch(name, "an integer", value);
        }
        return Field.of(value.intValue());
    }

    public long requireLong(String name) throws DecodingException {
        JsonNode value = required(name);
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw mismatch(name, "an integer", value);
        }
        return value.longValue();
    }

    // ---- booleans ----

    public boolean requireBoolean(String name) throws DecodingException {
        JsonNode value = required(name);
        if (!value.isBoolean()) {
            throw mismatch(name, "a boolean", value);
        }
        return value.booleanValue();
    }

    // ---- timestamps and enums ----

    public OffsetDateTime requireTimestamp(String name) throws DecodingException {
        return Timestamps.parse(requireText(name), pathOf(name));
    }

    public Field<OffsetDateTime> optionalTimestamp(String name) throws DecodingException {
        Field<String> text = optionalText(name);
        if (!text.isPresent()) {
            return text.isAbsent() ? Field.absent() : Field.ofNull();
        }
        return Field.of(Timestamps.parse(text.get(), pathOf(name)));
    }

    public <E extends Enum<E>> E requireEnum(String name, Class<E> type) throws DecodingException {
        String text = requireText(name);
        try {
            return Enum.valueOf(type, text);
        } catch (IllegalArgumentException e) {
            throw new DecodingException(pathOf(name), "unrecognised " + type.getSimpleName() + " '" + text + "'", e);
        }
    }

    // ---- nested structures ----

    public JsonFields requireObject(String name) throws DecodingException {
        return of(required(name), pathOf(name));
    }

    public Field<JsonFields> optionalObject(String name) throws DecodingException {
        JsonNode value = node.get(name);
        if (value == null) return Field.absent();
        if (value.isNull()) return Field.ofNull();
        return Field.of(of(value, pathOf(name)));
    }

    /** Decodes every element of a required array of objects; the result is unmodifiable. */
    public <T> List<T> requireList(String name, ElementDecoder<T> decoder) throws DecodingException {
        JsonNode value = required(name);
        if (!value.isArray()) {
            throw mismatch(name, "an array", value);
        }
        return elements(value, pathOf(name), decoder);
    }

    /** Decodes a response whose root is an array of objects; the result is unmodifiable. */
    public static <T> List<T> list(JsonNode node, ElementDecoder<T> decoder) throws DecodingException {
        if (node == null || node.isMissingNode()) {
            throw new DecodingException("", "expected an array but there was no content");
        }
        if (!node.isArray()) {
            throw new DecodingException("", "expected an array but was " + kind(node));
        }
        return elements(node, "", decoder);
    }

    private static <T> List<T> elements(JsonNode array, String base, ElementDecoder<T> decoder)
            throws DecodingException {
        List<T> items = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            items.add(decoder.decode(of(array.get(i), base + "[" + i + "]")));
        }
        return Collections.unmodifiableList(items);
    }

    private JsonNode required(String name) throws DecodingException {
        JsonNode value = node.get(name);
        if (value == null) {
            throw new DecodingException(pathOf(name), "required field is missing");
        }
        if (value.isNull()) {
            throw new DecodingException(pathOf(name), "required field is null");
        }
        return value;
    }

    private DecodingException mismatch(String name, String expected, JsonNode actual) {
        return new DecodingException(pathOf(name), "expected " + expected + " but was " + kind(actual));
    }

    private static String kind(JsonNode node) {
        return node.getNodeType().name().toLowerCase();
    }
}
