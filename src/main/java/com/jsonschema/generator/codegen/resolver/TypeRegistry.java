package com.jsonschema.generator.codegen.resolver;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonschema.generator.codegen.naming.TypeNameGenerator;
import com.jsonschema.generator.schema.JsonSchema;

/**
 * Type names and their generators for one generation run.
 *
 * Names are allocated once per dereferenced schema identity. Generators live in slots of an
 * arena; a name points at a slot, so replacing the generator of a name keeps both the name and
 * its position in {@link #entries()}.
 *
 * Not thread-safe: each run owns its own registry.
 *
 * @param <G> the generator type
 */
public class TypeRegistry<G> {

    private static final Logger log = LoggerFactory.getLogger(TypeRegistry.class);

    private final TypeNameGenerator typeNameGenerator;

    private final Map<JsonSchema, String> namesBySchema = new IdentityHashMap<>();
    private final Set<String> allocatedNames = new HashSet<>();

    private final Map<String, Integer> slotsByName = new LinkedHashMap<>();
    private final List<G> slots = new ArrayList<>();

    public TypeRegistry(TypeNameGenerator typeNameGenerator) {
        this.typeNameGenerator = Objects.requireNonNull(typeNameGenerator, "typeNameGenerator");
    }

    /**
     * Returns the name already allocated to the schema, or allocates one. The first hint wins;
     * later hints for the same schema are ignored.
     */
    public String getOrCreateName(JsonSchema schema, String typeNameHint) {
        JsonSchema actual = schema.getActualSchema();
        String existing = namesBySchema.get(actual);
        if (existing != null) {
            return existing;
        }

        String name = typeNameGenerator.generate(actual, typeNameHint, Collections.unmodifiableSet(allocatedNames));
        if (allocatedNames.contains(name)) {
            throw new IllegalStateException("Type name generator returned a reserved name: " + name);
        }
        namesBySchema.put(actual, name);
        allocatedNames.add(name);
        log.debug("Allocated type name {} for {}", name, actual);
        return name;
    }

    /**
     * Binds the generator to the name. An existing binding is replaced in place.
     */
    public void addOrReplace(String name, G generator) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(generator, "generator");

        Integer slot = slotsByName.get(name);
        if (slot == null) {
            slotsByName.put(name, slots.size());
            slots.add(generator);
            allocatedNames.add(name);
            log.debug("Registered generator for type {}", name);
        } else {
            slots.set(slot, generator);
            log.debug("Replaced generator for type {}", name);
        }
    }

    public Optional<G> get(String name) {
        Integer slot = slotsByName.get(name);
        return slot == null ? Optional.empty() : Optional.of(slots.get(slot));
    }

    public boolean contains(String name) {
        return slotsByName.containsKey(name);
    }

    /**
     * Snapshot of all bindings in registration order.
     */
    public List<Map.Entry<String, G>> entries() {
        List<Map.Entry<String, G>> result = new ArrayList<>(slotsByName.size());
        slotsByName.forEach((name, slot) -> result.add(new AbstractMap.SimpleImmutableEntry<>(name, slots.get(slot))));
        return result;
    }

    public int size() {
        return slotsByName.size();
    }
}
