package com.jsonschema.generator.codegen.util;

import java.util.stream.Collectors;

import lombok.experimental.UtilityClass;

/**
 * Text helpers for assembling generated source.
 */
@UtilityClass
public class CodeFormatUtil {

    private static final String TAB = "    ";

    /**
     * Indents every non-blank line of the given code by the number of tab levels.
     */
    public String indent(String code, int levels) {
        if (code == null || code.isEmpty() || levels <= 0) {
            return code;
        }
        String prefix = TAB.repeat(levels);
        return code.lines()
                .map(line -> line.isBlank() ? "" : prefix + line)
                .collect(Collectors.joining("\n"));
    }

    /**
     * Escapes a value for use inside a C# string literal.
     */
    public String escapeLiteral(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
