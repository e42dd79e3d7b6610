package com.sunorcnys.mapping;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

public final class JsonFields {

    private JsonFields() {}

    public static String text(JsonNode node, String field) {
        JsonNode v = node == null ? null : node.get(field);
        if (v == null || v.isNull() || v.isContainerNode()) {
            return null;
        }
        String s = v.asText();
        return s.isBlank() ? null : s;
    }

    public static Integer integer(JsonNode node, String field) {
        JsonNode v = node == null ? null : node.get(field);
        if (v == null || !v.canConvertToInt()) {
            return null;
        }
        return v.asInt();
    }

    /**
     * {@code field} of each element of an array, in order, skipping blanks.
     */
    public static List<String> texts(JsonNode array, String field) {
        List<String> out = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return out;
        }
        for (JsonNode element : array) {
            String value = text(element, field);
            if (value != null) {
                out.add(value);
            }
        }
        return out;
    }
}
