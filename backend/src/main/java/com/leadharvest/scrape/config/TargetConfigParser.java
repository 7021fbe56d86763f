package com.leadharvest.scrape.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadharvest.scrape.model.AttrSelector;
import com.leadharvest.scrape.model.FieldSpec;
import com.leadharvest.scrape.model.PlainSelector;
import com.leadharvest.scrape.model.StructuredSpec;
import com.leadharvest.scrape.model.TargetConfig;
import org.jsoup.select.QueryParser;
import org.jsoup.select.Selector;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

@Component
public class TargetConfigParser {
    private static final Set<String> WAIT_UNTIL_VALUES = Set.of("load", "domcontentloaded", "networkidle", "commit");

    private final ObjectMapper objectMapper;

    public TargetConfigParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public TargetConfig parse(String configJson) {
        if (configJson == null || configJson.isBlank()) {
            throw new TargetConfigException("document is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(configJson);
        } catch (JsonProcessingException e) {
            throw new TargetConfigException("document is not valid JSON", e);
        }
        return parse(root);
    }

    public TargetConfig parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new TargetConfigException("document must be a JSON object");
        }

        String itemSelector = text(root, "item_selector");
        if (itemSelector == null) {
            itemSelector = text(root, "items_selector");
        }
        if (itemSelector == null || itemSelector.isBlank()) {
            throw new TargetConfigException("item_selector is required");
        }
        validateSelector("item_selector", itemSelector);

        JsonNode fieldsNode = root.get("fields");
        if (fieldsNode == null || !fieldsNode.isObject() || fieldsNode.size() == 0) {
            throw new TargetConfigException("fields must be a non-empty object");
        }
        Map<String, FieldSpec> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = fieldsNode.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            fields.put(entry.getKey(), parseField(entry.getKey(), entry.getValue()));
        }

        String nextPageSelector = text(root, "next_page_selector");
        if (nextPageSelector != null && !nextPageSelector.isBlank()) {
            validateSelector("next_page_selector", nextPageSelector);
        } else {
            nextPageSelector = null;
        }

        int maxPages = positiveInt(root, "max_pages", TargetConfig.DEFAULT_MAX_PAGES);
        int timeoutSeconds = positiveInt(root, "timeout_seconds", TargetConfig.DEFAULT_TIMEOUT_SECONDS);

        String waitUntil = text(root, "wait_until");
        if (waitUntil == null || waitUntil.isBlank()) {
            waitUntil = TargetConfig.DEFAULT_WAIT_UNTIL;
        } else {
            waitUntil = waitUntil.trim().toLowerCase(Locale.ROOT);
            if (!WAIT_UNTIL_VALUES.contains(waitUntil)) {
                throw new TargetConfigException("wait_until must be one of " + WAIT_UNTIL_VALUES + " but was " + waitUntil);
            }
        }

        return new TargetConfig(
            itemSelector.trim(),
            fields,
            nextPageSelector == null ? null : nextPageSelector.trim(),
            maxPages,
            parseHeaders(root.get("headers")),
            timeoutSeconds,
            waitUntil
        );
    }

    private FieldSpec parseField(String name, JsonNode value) {
        if (value == null || value.isNull()) {
            throw new TargetConfigException("field '" + name + "' has no selector");
        }
        if (value.isTextual()) {
            return parseSelectorString(name, value.asText());
        }
        if (value.isObject()) {
            return parseStructured(name, value);
        }
        throw new TargetConfigException("field '" + name + "' must be a string or an object");
    }

    private FieldSpec parseSelectorString(String name, String raw) {
        String spec = raw == null ? "" : raw.trim();
        if (spec.isEmpty()) {
            throw new TargetConfigException("field '" + name + "' has an empty selector");
        }
        List<String> parts = splitTopLevel(spec, ',');
        boolean anyAttr = false;
        for (String part : parts) {
            if (lastTopLevelAt(part) >= 0) {
                anyAttr = true;
                break;
            }
        }
        if (!anyAttr) {
            validateSelector(name, spec);
            return new PlainSelector(spec);
        }

        List<AttrSelector.Alternative> alternatives = new ArrayList<>();
        for (String part : parts) {
            int at = lastTopLevelAt(part);
            if (at < 0) {
                validateSelector(name, part);
                alternatives.add(new AttrSelector.Alternative(part, null));
                continue;
            }
            String selector = part.substring(0, at).trim();
            String attribute = part.substring(at + 1).trim();
            if (selector.isEmpty() || attribute.isEmpty()) {
                throw new TargetConfigException("field '" + name + "' has a malformed selector@attr part: " + part);
            }
            validateSelector(name, selector);
            alternatives.add(new AttrSelector.Alternative(selector, attribute));
        }
        return new AttrSelector(alternatives);
    }

    private FieldSpec parseStructured(String name, JsonNode value) {
        String selector = text(value, "selector");
        selector = selector == null ? "" : selector.trim();
        if (!selector.isEmpty()) {
            validateSelector(name, selector);
        }
        String attribute = text(value, "attr");
        if (attribute != null && attribute.isBlank()) {
            attribute = null;
        }
        Pattern regex = null;
        String regexText = text(value, "regex");
        if (regexText != null && !regexText.isEmpty()) {
            try {
                regex = Pattern.compile(regexText);
            } catch (PatternSyntaxException e) {
                throw new TargetConfigException("field '" + name + "' has an invalid regex: " + e.getDescription(), e);
            }
        }
        JsonNode defaultNode = value.get("default");
        String defaultValue = defaultNode == null || defaultNode.isNull() ? "" : defaultNode.asText();
        return new StructuredSpec(selector, attribute == null ? null : attribute.trim(), regex, defaultValue);
    }

    private Map<String, String> parseHeaders(JsonNode node) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new TargetConfigException("headers must be an object of strings");
        }
        Map<String, String> headers = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = node.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (!entry.getValue().isValueNode() || entry.getValue().isNull()) {
                throw new TargetConfigException("header '" + entry.getKey() + "' must be a string");
            }
            headers.put(entry.getKey(), entry.getValue().asText());
        }
        return headers;
    }

    private void validateSelector(String field, String selector) {
        try {
            QueryParser.parse(selector);
        } catch (Selector.SelectorParseException | IllegalArgumentException e) {
            throw new TargetConfigException("selector for '" + field + "' does not parse: " + selector, e);
        }
    }

    private int positiveInt(JsonNode root, String key, int defaultValue) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        int value;
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            value = node.asInt();
        } else if (isIntegralText(node)) {
            value = Integer.parseInt(node.asText().trim());
        } else {
            throw new TargetConfigException(key + " must be a positive integer");
        }
        if (value <= 0) {
            throw new TargetConfigException(key + " must be a positive integer but was " + value);
        }
        return value;
    }

    private boolean isIntegralText(JsonNode node) {
        return node.isTextual() && node.asText().trim().matches("-?\\d{1,9}");
    }

    private String text(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isValueNode()) {
            throw new TargetConfigException(key + " must be a string");
        }
        return value.asText();
    }

    /**
     * Splits on {@code separator} only at bracket depth zero and outside quotes.
     */
    static List<String> splitTopLevel(String value, char separator) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                current.append(c);
            } else if (c == '\'' || c == '"') {
                quote = c;
                current.append(c);
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
                current.append(c);
            } else if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
                current.append(c);
            } else if (c == separator && depth == 0) {
                addIfPresent(parts, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        addIfPresent(parts, current);
        if (parts.isEmpty()) {
            parts.add(value.trim());
        }
        return parts;
    }

    static int lastTopLevelAt(String value) {
        int depth = 0;
        char quote = 0;
        int last = -1;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == '@' && depth == 0) {
                last = i;
            }
        }
        return last;
    }

    private static void addIfPresent(List<String> parts, StringBuilder current) {
        String trimmed = current.toString().trim();
        if (!trimmed.isEmpty()) {
            parts.add(trimmed);
        }
    }
}
