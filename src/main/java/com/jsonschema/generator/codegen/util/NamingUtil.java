package com.jsonschema.generator.codegen.util;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Utility for consistent identifier naming in generated code.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts first-name, first_name or firstName to PascalCase (FirstName).
     * Characters that cannot appear in an identifier act as word separators.
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Arrays.stream(name.split("[^A-Za-z0-9]+"))
                .filter(part -> !part.isEmpty())
                .map(NamingUtil::capitalize)
                .collect(Collectors.joining(""));
    }

    /**
     * Converts a free-form name to a PascalCase identifier. Returns the fallback when nothing
     * usable remains; prefixes a leading digit with an underscore.
     */
    public static String toTypeIdentifier(String name, String fallback) {
        String pascal = toPascalCase(name);
        if (pascal == null || pascal.isEmpty()) {
            return fallback;
        }
        if (Character.isDigit(pascal.charAt(0))) {
            return "_" + pascal;
        }
        return pascal;
    }

    /**
     * Type name from a file name up to its first dot, e.g. {@code order-item.schema.json} gives
     * {@code OrderItem}. Returns the fallback when the path has no usable name.
     */
    public static String typeNameFromFile(Path file, String fallback) {
        if (file == null || file.getFileName() == null) {
            return fallback;
        }
        String fileName = file.getFileName().toString();
        int dot = fileName.indexOf('.');
        return toTypeIdentifier(dot > 0 ? fileName.substring(0, dot) : fileName, fallback);
    }

    /**
     * Disambiguates a name against the used names by appending a number suffix, starting at 2.
     */
    public static String disambiguate(String baseName, Set<String> usedNames) {
        if (!usedNames.contains(baseName)) {
            return baseName;
        }

        int suffix = 2;
        String candidate;
        do {
            candidate = baseName + suffix;
            suffix++;
        } while (usedNames.contains(candidate));

        return candidate;
    }

    private static String capitalize(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase(Locale.ROOT) + str.substring(1);
    }
}
