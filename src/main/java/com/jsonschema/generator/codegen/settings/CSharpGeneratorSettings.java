package com.jsonschema.generator.codegen.settings;

import com.jsonschema.generator.schema.NullHandling;

import lombok.Builder;
import lombok.Value;

/**
 * Target-language mapping choices for C# generation.
 *
 * Pure data: the resolver and generators read these, nothing here has behavior.
 */
@Value
@Builder(toBuilder = true)
public class CSharpGeneratorSettings {

    @Builder.Default
    String namespace = "MyNamespace";

    /** Generic sequence container, parameterized with the item type. */
    @Builder.Default
    String arrayType = "System.Collections.ObjectModel.ObservableCollection";

    /** Generic string-keyed map container, parameterized with the value type. */
    @Builder.Default
    String dictionaryType = "System.Collections.Generic.Dictionary";

    @Builder.Default
    String dateType = "System.DateTime";

    @Builder.Default
    String dateTimeType = "System.DateTime";

    @Builder.Default
    String timeType = "System.TimeSpan";

    @Builder.Default
    String timeSpanType = "System.TimeSpan";

    @Builder.Default
    NullHandling nullHandling = NullHandling.JSON;

    @Builder.Default
    boolean generateDataAnnotations = true;

    @Builder.Default
    boolean requiredPropertiesMustBeDefined = true;

    public static CSharpGeneratorSettings defaults() {
        return CSharpGeneratorSettings.builder().build();
    }
}
