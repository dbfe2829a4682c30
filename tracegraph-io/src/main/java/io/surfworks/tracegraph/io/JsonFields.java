package io.surfworks.tracegraph.io;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

/**
 * Typed field access on Jackson trees that reports the offending location on failure.
 */
final class JsonFields {

    private JsonFields() {} // Utility class

    static JsonNode require(JsonNode node, String field, String location) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new TraceFormatException(location, "missing required field '" + field + "'");
        }
        return value;
    }

    static String requireText(JsonNode node, String field, String location) {
        JsonNode value = require(node, field, location);
        if (!value.isTextual()) {
            throw new TraceFormatException(location + "." + field, "expected a string");
        }
        return value.asText();
    }

    static int requireInt(JsonNode node, String field, String location) {
        return asInt(require(node, field, location), location + "." + field);
    }

    static int optionalInt(JsonNode node, String field, int defaultValue, String location) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return asInt(value, location + "." + field);
    }

    static Long optionalLong(JsonNode node, String field, String location) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.canConvertToLong() || !value.isIntegralNumber()) {
            throw new TraceFormatException(location + "." + field, "expected an integer");
        }
        return value.asLong();
    }

    static String optionalText(JsonNode node, String field, String defaultValue, String location) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isTextual()) {
            throw new TraceFormatException(location + "." + field, "expected a string");
        }
        return value.asText();
    }

    static boolean optionalBoolean(JsonNode node, String field, boolean defaultValue, String location) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isBoolean()) {
            throw new TraceFormatException(location + "." + field, "expected a boolean");
        }
        return value.asBoolean();
    }

    static List<Integer> requireIntList(JsonNode node, String field, String location) {
        return asIntList(require(node, field, location), location + "." + field);
    }

    static List<Integer> optionalIntList(JsonNode node, String field, String location) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        return asIntList(value, location + "." + field);
    }

    static List<String> optionalTextList(JsonNode node, String field, String location) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        String path = location + "." + field;
        if (!value.isArray()) {
            throw new TraceFormatException(path, "expected an array");
        }
        List<String> result = new ArrayList<>(value.size());
        for (int i = 0; i < value.size(); i++) {
            JsonNode element = value.get(i);
            if (!element.isTextual()) {
                throw new TraceFormatException(path + "[" + i + "]", "expected a string");
            }
            result.add(element.asText());
        }
        return result;
    }

    static JsonNode requireArray(JsonNode node, String field, String location) {
        JsonNode value = require(node, field, location);
        if (!value.isArray()) {
            throw new TraceFormatException(location + "." + field, "expected an array");
        }
        return value;
    }

    private static int asInt(JsonNode value, String path) {
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new TraceFormatException(path, "expected an integer, got " + value);
        }
        return value.asInt();
    }

    private static List<Integer> asIntList(JsonNode value, String path) {
        if (!value.isArray()) {
            throw new TraceFormatException(path, "expected an array");
        }
        List<Integer> result = new ArrayList<>(value.size());
        for (int i = 0; i < value.size(); i++) {
            result.add(asInt(value.get(i), path + "[" + i + "]"));
        }
        return result;
    }

    static void putInts(ArrayNode array, Iterable<Integer> values) {
        for (Integer value : values) {
            array.add(value);
        }
    }

    static List<Integer> sortedInts(Iterable<Integer> values) {
        List<Integer> list = new ArrayList<>();
        values.forEach(list::add);
        list.sort(null);
        return list;
    }
}
