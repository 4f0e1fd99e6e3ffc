package com.jsonschema.generator.schema;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads a JSON Schema document into a {@link JsonSchema} graph.
 *
 * Only local references ({@code #}, {@code #/definitions/...}, {@code #/$defs/...} or any other
 * JSON pointer into the same document) are supported. Every node is registered under its JSON
 * pointer, so a location reached inline and through references yields one shared node and cycles
 * are preserved.
 */
public class JsonSchemaReader {

    private static final Logger log = LoggerFactory.getLogger(JsonSchemaReader.class);

    private final ObjectMapper objectMapper;

    public JsonSchemaReader() {
        this(new ObjectMapper());
    }

    public JsonSchemaReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonSchema read(Path file) throws SchemaReadException {
        log.debug("Reading schema from {}", file);
        try (InputStream in = Files.newInputStream(file)) {
            return read(objectMapper.readTree(in));
        } catch (IOException e) {
            throw new SchemaReadException("Unable to read schema file " + file + ": " + e.getMessage(), e);
        }
    }

    public JsonSchema read(String json) throws SchemaReadException {
        try {
            return read(objectMapper.readTree(json));
        } catch (IOException e) {
            throw new SchemaReadException("Unable to parse schema document: " + e.getMessage(), e);
        }
    }

    public JsonSchema read(JsonNode document) throws SchemaReadException {
        if (document == null || !(document.isObject() || document.isBoolean())) {
            throw new SchemaReadException("Schema document must be a JSON object");
        }
        return new ReadContext(document).readRoot();
    }

    /**
     * State of one read: the document and the nodes already created per JSON pointer.
     */
    private static final class ReadContext {

        private final JsonNode document;
        private final JsonSchema root = new JsonSchema();
        private final Map<String, JsonSchema> nodesByPointer = new HashMap<>();

        private ReadContext(JsonNode document) {
            this.document = document;
        }

        JsonSchema readRoot() throws SchemaReadException {
            nodesByPointer.put("", root);
            populate(root, document, "");
            return root;
        }

        /**
         * Returns the node of the location, creating and populating it on first visit. A location
         * reached both inline and through a reference yields the same node in either order.
         */
        private JsonSchema parse(JsonNode node, String pointer) throws SchemaReadException {
            JsonSchema existing = nodesByPointer.get(pointer);
            if (existing != null) {
                return existing;
            }
            // Register before populating so a reference back to this location terminates
            JsonSchema schema = new JsonSchema();
            nodesByPointer.put(pointer, schema);
            populate(schema, node, pointer);
            return schema;
        }

        private void populate(JsonSchema schema, JsonNode node, String pointer) throws SchemaReadException {
            if (node.isBoolean()) {
                return;
            }
            if (!node.isObject()) {
                throw new SchemaReadException("Expected a schema object but found: " + node.getNodeType());
            }

            readNullable(schema, node);
            if (node.hasNonNull("description")) {
                schema.setDescription(node.get("description").asText());
            }

            if (node.hasNonNull("$ref")) {
                schema.setReference(resolveReference(node.get("$ref").asText()));
                return;
            }

            readType(schema, node.get("type"));
            if (node.hasNonNull("format")) {
                schema.setFormat(node.get("format").asText());
            }
            if (node.hasNonNull("title") && schema.getTypeNameRaw() == null) {
                schema.setTypeNameRaw(node.get("title").asText());
            }

            JsonNode items = node.get("items");
            if (items != null) {
                if (items.isArray()) {
                    for (int i = 0; i < items.size(); i++) {
                        schema.getItems().add(parse(items.get(i), pointer + "/items/" + i));
                    }
                } else {
                    schema.setItem(parse(items, pointer + "/items"));
                }
            }

            JsonNode properties = node.get("properties");
            if (properties != null && properties.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    schema.getProperties().put(field.getKey(),
                            parse(field.getValue(), pointer + "/properties/" + escape(field.getKey())));
                }
            }

            JsonNode required = node.get("required");
            if (required != null && required.isArray()) {
                required.forEach(r -> schema.getRequiredProperties().add(r.asText()));
            }

            readEnumeration(schema, node);
            readAdditionalProperties(schema, node.get("additionalProperties"), pointer);

            JsonNode allOf = node.get("allOf");
            if (allOf != null && allOf.isArray()) {
                for (int i = 0; i < allOf.size(); i++) {
                    schema.getAllOf().add(parse(allOf.get(i), pointer + "/allOf/" + i));
                }
            }

            JsonNode discriminator = node.get("discriminator");
            if (discriminator != null) {
                schema.setDiscriminator(discriminator.isObject()
                        ? discriminator.path("propertyName").asText(null)
                        : discriminator.asText());
            }
        }

        private void readType(JsonSchema schema, JsonNode type) {
            if (type == null) {
                return;
            }
            if (type.isArray()) {
                type.forEach(t -> addType(schema, t.asText()));
            } else {
                addType(schema, type.asText());
            }
        }

        private void addType(JsonSchema schema, String keyword) {
            JsonObjectType flag = JsonObjectType.fromKeyword(keyword);
            if (flag == null) {
                log.warn("Ignoring unknown schema type '{}'", keyword);
                return;
            }
            schema.getType().add(flag);
        }

        private void readNullable(JsonSchema schema, JsonNode node) {
            JsonNode nullable = node.has("x-nullable") ? node.get("x-nullable") : node.get("nullable");
            if (nullable != null && nullable.isBoolean()) {
                schema.setNullableRaw(nullable.booleanValue());
            }
        }

        private void readEnumeration(JsonSchema schema, JsonNode node) {
            JsonNode values = node.get("enum");
            if (values != null && values.isArray()) {
                for (JsonNode value : values) {
                    if (value.isNull()) {
                        schema.getType().add(JsonObjectType.NULL);
                    } else if (value.isInt()) {
                        schema.getEnumeration().add(value.intValue());
                    } else if (value.isLong()) {
                        schema.getEnumeration().add(value.longValue());
                    } else if (value.isBigInteger()) {
                        schema.getEnumeration().add(value.bigIntegerValue());
                    } else if (value.isNumber()) {
                        schema.getEnumeration().add(value.decimalValue());
                    } else if (value.isBoolean()) {
                        schema.getEnumeration().add(value.booleanValue());
                    } else {
                        schema.getEnumeration().add(value.asText());
                    }
                }
            }

            JsonNode names = node.get("x-enumNames");
            if (names != null && names.isArray()) {
                names.forEach(n -> schema.getEnumerationNames().add(n.asText()));
            }
        }

        private void readAdditionalProperties(JsonSchema schema, JsonNode additional, String pointer)
                throws SchemaReadException {
            if (additional == null) {
                return;
            }
            if (additional.isBoolean()) {
                schema.setAllowAdditionalProperties(additional.booleanValue());
            } else if (additional.isObject()) {
                schema.setAllowAdditionalProperties(true);
                schema.setAdditionalPropertiesSchema(parse(additional, pointer + "/additionalProperties"));
            }
        }

        private JsonSchema resolveReference(String ref) throws SchemaReadException {
            if (!ref.startsWith("#")) {
                throw new SchemaReadException("Unsupported non-local reference: " + ref);
            }

            String pointer = ref.substring(1);
            JsonSchema schema = nodesByPointer.get(pointer);
            if (schema == null) {
                JsonNode target;
                try {
                    target = document.at(JsonPointer.compile(pointer));
                } catch (IllegalArgumentException e) {
                    throw new SchemaReadException("Invalid reference: " + ref, e);
                }
                if (target.isMissingNode()) {
                    throw new SchemaReadException("Unresolvable reference: " + ref);
                }
                schema = parse(target, pointer);
            }

            String key = pointer.substring(pointer.lastIndexOf('/') + 1)
                    .replace("~1", "/")
                    .replace("~0", "~");
            // Array positions ("/allOf/0") carry no name
            if (schema.getTypeNameRaw() == null && !key.isEmpty() && !key.chars().allMatch(Character::isDigit)) {
                schema.setTypeNameRaw(key);
            }
            log.debug("Resolved reference {} to {}", ref, schema);
            return schema;
        }

        private static String escape(String segment) {
            return segment.replace("~", "~0").replace("/", "~1");
        }
    }
}
