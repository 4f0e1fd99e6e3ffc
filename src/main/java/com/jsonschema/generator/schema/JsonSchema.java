package com.jsonschema.generator.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.Getter;
import lombok.Setter;

/**
 * A node of a schema graph.
 *
 * Nodes form a possibly cyclic graph, so identity is object identity: there is no
 * structural equals/hashCode. A node that is a reference only carries {@link #getReference()};
 * callers work on {@link #getActualSchema()}.
 */
@Getter
@Setter
public class JsonSchema {

    private Set<JsonObjectType> type = EnumSet.noneOf(JsonObjectType.class);
    private String format;

    /**
     * Type name declared by the document (title, or the definition key the node was read from).
     */
    private String typeNameRaw;
    private String description;

    private JsonSchema item;
    private List<JsonSchema> items = new ArrayList<>();

    private Map<String, JsonSchema> properties = new LinkedHashMap<>();
    private Set<String> requiredProperties = new LinkedHashSet<>();

    private List<Object> enumeration = new ArrayList<>();
    private List<String> enumerationNames = new ArrayList<>();

    private JsonSchema additionalPropertiesSchema;
    private boolean allowAdditionalProperties = true;

    private List<JsonSchema> allOf = new ArrayList<>();
    private String discriminator;

    /** Value of {@code x-nullable}, null when absent. */
    private Boolean nullableRaw;

    private JsonSchema reference;

    public static JsonSchema of(JsonObjectType... types) {
        JsonSchema schema = new JsonSchema();
        if (types.length > 0) {
            schema.setType(EnumSet.copyOf(Arrays.asList(types)));
        }
        return schema;
    }

    public static JsonSchema referenceTo(JsonSchema target) {
        JsonSchema schema = new JsonSchema();
        schema.setReference(target);
        return schema;
    }

    public JsonSchema addProperty(String name, JsonSchema property) {
        properties.put(name, property);
        return this;
    }

    public boolean hasReference() {
        return reference != null;
    }

    /**
     * Follows references until a concrete node is reached. A reference loop with no concrete
     * node stops at the last node visited.
     */
    public JsonSchema getActualSchema() {
        JsonSchema current = this;
        Set<JsonSchema> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        while (current.reference != null && visited.add(current)) {
            current = current.reference;
        }
        return current;
    }

    public boolean isEnumeration() {
        return enumeration != null && !enumeration.isEmpty();
    }

    public boolean isDictionary() {
        return type.contains(JsonObjectType.OBJECT)
                && getInheritedSchema() == null
                && getActualProperties().isEmpty()
                && (allowAdditionalProperties || additionalPropertiesSchema != null);
    }

    /**
     * True when the node places no constraint on its value.
     */
    public boolean isAnyType() {
        Set<JsonObjectType> declared = EnumSet.noneOf(JsonObjectType.class);
        declared.addAll(type);
        declared.remove(JsonObjectType.NULL);

        return declared.isEmpty()
                && reference == null
                && properties.isEmpty()
                && allOf.isEmpty()
                && item == null
                && items.isEmpty()
                && additionalPropertiesSchema == null
                && !isEnumeration();
    }

    public boolean isNullable(NullHandling nullHandling) {
        if (nullHandling == NullHandling.SWAGGER) {
            return Boolean.TRUE.equals(nullableRaw);
        }
        return type.contains(JsonObjectType.NULL) || getActualSchema().type.contains(JsonObjectType.NULL);
    }

    /**
     * Nullability of a property of this node. Under {@link NullHandling#SWAGGER} a property without
     * {@code x-nullable} is nullable when it is not required.
     */
    public boolean isPropertyNullable(String name, NullHandling nullHandling) {
        JsonSchema property = getActualProperties().get(name);
        if (property == null) {
            return false;
        }
        if (nullHandling == NullHandling.SWAGGER) {
            Boolean raw = property.nullableRaw != null ? property.nullableRaw : property.getActualSchema().nullableRaw;
            return raw != null ? raw : !isRequired(name);
        }
        return property.isNullable(NullHandling.JSON);
    }

    /**
     * The base type: the first {@code allOf} member that is a reference.
     */
    public JsonSchema getInheritedSchema() {
        for (JsonSchema member : allOf) {
            if (member.hasReference()) {
                return member.getActualSchema();
            }
        }
        return null;
    }

    /**
     * Own properties plus the properties of every {@code allOf} member except the inherited one,
     * in declaration order.
     */
    public Map<String, JsonSchema> getActualProperties() {
        Map<String, JsonSchema> result = new LinkedHashMap<>(properties);
        JsonSchema inherited = getInheritedSchema();
        for (JsonSchema member : allOf) {
            JsonSchema actual = member.getActualSchema();
            if (actual == inherited || actual == this) {
                continue;
            }
            actual.getProperties().forEach(result::putIfAbsent);
        }
        return result;
    }

    public boolean isRequired(String propertyName) {
        if (requiredProperties.contains(propertyName)) {
            return true;
        }
        JsonSchema inherited = getInheritedSchema();
        for (JsonSchema member : allOf) {
            JsonSchema actual = member.getActualSchema();
            if (actual != inherited && actual != this && actual.getRequiredProperties().contains(propertyName)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "JsonSchema{type=" + type
                + (typeNameRaw != null ? ", name=" + typeNameRaw : "")
                + (format != null ? ", format=" + format : "")
                + (reference != null ? ", ref" : "")
                + "}";
    }
}
