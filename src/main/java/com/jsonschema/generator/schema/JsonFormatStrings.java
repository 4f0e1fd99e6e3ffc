package com.jsonschema.generator.schema;

import lombok.experimental.UtilityClass;

/**
 * Well-known values of the JSON Schema "format" keyword.
 */
@UtilityClass
public class JsonFormatStrings {

    public static final String DATE = "date";
    public static final String DATE_TIME = "date-time";
    public static final String TIME = "time";
    public static final String TIME_SPAN = "duration";

    /** Legacy, superseded by {@link #UUID}. */
    public static final String GUID = "guid";
    public static final String UUID = "uuid";

    /** Legacy, superseded by {@link #BYTE}. */
    public static final String BASE64 = "base64";
    public static final String BYTE = "byte";

    public static final String DECIMAL = "decimal";
    public static final String LONG = "int64";
    public static final String LONG_LEGACY = "long";
}
