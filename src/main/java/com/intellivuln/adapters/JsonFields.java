package com.intellivuln.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Безопасное чтение полей из JSON сканеров: отсутствующие ключи и чужие типы дают значение по умолчанию
 */
final class JsonFields {

    private JsonFields() {
    }

    static String text(JsonNode node, String field, String defaultValue) {
        if (node == null) {
            return defaultValue;
        }
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull() || value.isContainerNode()) {
            return defaultValue;
        }
        String text = value.asText();
        return text.isEmpty() ? defaultValue : text;
    }

    /**
     * Число из поля (число или строка). null если нет или не парсится.
     */
    static Double number(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.path(field);
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static boolean bool(JsonNode node, String field) {
        if (node == null) {
            return false;
        }
        JsonNode value = node.path(field);
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isTextual()) {
            return "true".equalsIgnoreCase(value.asText().trim()) || "yes".equalsIgnoreCase(value.asText().trim());
        }
        return false;
    }

    static Iterable<JsonNode> array(JsonNode node, String field) {
        if (node == null) {
            return List.of();
        }
        JsonNode value = node.path(field);
        return value.isArray() ? value : List.of();
    }

    /**
     * Список строк из массива (ссылки и т.п.), элементы-объекты берутся по полю url при наличии
     */
    static List<String> textList(JsonNode node, String field) {
        List<String> result = new ArrayList<>();
        for (JsonNode item : array(node, field)) {
            if (item.isTextual()) {
                result.add(item.asText());
            } else if (item.isObject()) {
                String url = text(item, "url", null);
                if (url != null) {
                    result.add(url);
                }
            }
        }
        return result;
    }

    static Iterator<String> fieldNames(JsonNode node) {
        return node != null && node.isObject() ? node.fieldNames() : List.<String>of().iterator();
    }

    static ObjectMapper mapper() {
        return Holder.MAPPER;
    }

    private static final class Holder {
        private static final ObjectMapper MAPPER = new ObjectMapper();
    }
}
