package com.jsonschema.generator.codegen.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Rendering model of the C# Class template.
 */
@Value
@Builder(toBuilder = true)
public class ClassTemplateModel {

    @NonNull
    String className;

    String description;

    /** Base class name, null when the class does not inherit. */
    String baseClassName;

    /** Discriminator property name, null when the class is not polymorphic. */
    String discriminator;

    /** Discriminator as it appears inside a C# string literal. */
    String escapedDiscriminator;

    @NonNull
    @Builder.Default
    List<PropertyModel> properties = List.of();

    public boolean hasDescription() {
        return description != null && !description.isBlank();
    }

    public boolean isInherited() {
        return baseClassName != null;
    }

    public boolean hasDiscriminator() {
        return discriminator != null && !discriminator.isBlank();
    }
}
