package com.jsonschema.generator.codegen.template;

/**
 * A template bound to its model, ready to produce source text.
 */
public interface CodeTemplate {

    String render();
}
