package com.dingdangmaoup.bootsync.layout;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Value;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Validates layout documents against {@code layout/storage-layout-schema.json}.
 * <p>
 * Understands the keywords that document uses: {@code type}, {@code required},
 * {@code properties}, {@code additionalProperties}, {@code items}, {@code minItems},
 * {@code enum}, {@code const}, {@code allOf} and {@code if}/{@code then}. Validation
 * stops at the first violation, reported with its slash separated location.
 */
public class StorageLayoutSchema {

    static final String SCHEMA_RESOURCE = "layout/storage-layout-schema.json";

    private final JsonNode schema;

    public StorageLayoutSchema(JsonNode schema) {
        this.schema = schema;
    }

    public static StorageLayoutSchema load() {
        try (InputStream in = StorageLayoutSchema.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing storage layout schema " + SCHEMA_RESOURCE);
            }
            return new StorageLayoutSchema(new ObjectMapper().readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read storage layout schema", e);
        }
    }

    /**
     * @throws StorageConfigException naming the location of the first violation
     */
    public void validate(JsonNode document) {
        firstError(schema, document, "").ifPresent(error -> {
            throw StorageConfigException.invalidAt(error.getPath(), error.getMessage());
        });
    }

    private Optional<Violation> firstError(JsonNode schema, JsonNode node, String path) {
        JsonNode type = schema.get("type");
        if (type != null && !hasType(node, type.asText())) {
            return violation(path, repr(node) + " is not of type '" + type.asText() + "'");
        }

        JsonNode constant = schema.get("const");
        if (constant != null && !constant.equals(node)) {
            return violation(path, repr(constant) + " was expected");
        }

        JsonNode allowed = schema.get("enum");
        if (allowed != null && !contains(allowed, node)) {
            return violation(path, repr(node) + " is not one of " + repr(allowed));
        }

        if (node.isObject()) {
            Optional<Violation> error = objectErrors(schema, node, path);
            if (error.isPresent()) {
                return error;
            }
        }

        if (node.isArray()) {
            JsonNode minItems = schema.get("minItems");
            if (minItems != null && node.size() < minItems.asInt()) {
                return violation(path, repr(node) + " is too short");
            }
            JsonNode items = schema.get("items");
            if (items != null) {
                for (int i = 0; i < node.size(); i++) {
                    Optional<Violation> error = firstError(items, node.get(i), child(path, String.valueOf(i)));
                    if (error.isPresent()) {
                        return error;
                    }
                }
            }
        }

        JsonNode allOf = schema.get("allOf");
        if (allOf != null) {
            for (JsonNode sub : allOf) {
                Optional<Violation> error = firstError(sub, node, path);
                if (error.isPresent()) {
                    return error;
                }
            }
        }

        JsonNode condition = schema.get("if");
        if (condition != null && schema.has("then") && firstError(condition, node, path).isEmpty()) {
            return firstError(schema.get("then"), node, path);
        }
        return Optional.empty();
    }

    private Optional<Violation> objectErrors(JsonNode schema, JsonNode node, String path) {
        JsonNode required = schema.get("required");
        if (required != null) {
            for (JsonNode name : required) {
                if (!node.has(name.asText())) {
                    return violation(path, repr(name) + " is a required property");
                }
            }
        }

        JsonNode properties = schema.path("properties");
        Iterator<Map.Entry<String, JsonNode>> declared = properties.fields();
        while (declared.hasNext()) {
            Map.Entry<String, JsonNode> property = declared.next();
            JsonNode value = node.get(property.getKey());
            if (value != null) {
                Optional<Violation> error = firstError(property.getValue(), value, child(path, property.getKey()));
                if (error.isPresent()) {
                    return error;
                }
            }
        }

        JsonNode additional = schema.get("additionalProperties");
        if (additional != null && additional.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (properties.has(field.getKey())) {
                    continue;
                }
                Optional<Violation> error = firstError(additional, field.getValue(), child(path, field.getKey()));
                if (error.isPresent()) {
                    return error;
                }
            }
        }
        return Optional.empty();
    }

    private static boolean hasType(JsonNode node, String type) {
        return switch (type) {
            case "object" -> node.isObject();
            case "array" -> node.isArray();
            case "string" -> node.isTextual();
            case "integer" -> node.isIntegralNumber();
            case "number" -> node.isNumber();
            case "boolean" -> node.isBoolean();
            case "null" -> node.isNull();
            default -> throw new IllegalStateException("Unsupported schema type: " + type);
        };
    }

    private static boolean contains(JsonNode values, JsonNode node) {
        for (JsonNode value : values) {
            if (value.equals(node)) {
                return true;
            }
            // IntNode and LongNode never compare equal
            if (value.isNumber() && node.isNumber()
                    && value.decimalValue().compareTo(node.decimalValue()) == 0) {
                return true;
            }
        }
        return false;
    }

    private static String child(String path, String name) {
        return path.isEmpty() ? name : path + "/" + name;
    }

    private static Optional<Violation> violation(String path, String message) {
        return Optional.of(new Violation(path, message));
    }

    /**
     * Renders a value the way the layout error messages quote it: single quoted strings,
     * {@code True}/{@code False}/{@code None} and bracketed lists.
     */
    static String repr(JsonNode node) {
        if (node.isTextual()) {
            return "'" + node.asText().replace("\\", "\\\\").replace("'", "\\'") + "'";
        }
        if (node.isBoolean()) {
            return node.asBoolean() ? "True" : "False";
        }
        if (node.isNull() || node.isMissingNode()) {
            return "None";
        }
        if (node.isArray()) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            node.forEach(item -> joiner.add(repr(item)));
            return joiner.toString();
        }
        if (node.isObject()) {
            StringJoiner joiner = new StringJoiner(", ", "{", "}");
            node.fields().forEachRemaining(field ->
                    joiner.add("'" + field.getKey() + "': " + repr(field.getValue())));
            return joiner.toString();
        }
        return node.asText();
    }

    @Value
    private static class Violation {
        String path;
        String message;
    }
}
