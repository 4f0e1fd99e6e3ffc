package com.jsonschema.generator.codegen.template;

/**
 * A located template failed while rendering its model.
 */
public class CodeRenderException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CodeRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
