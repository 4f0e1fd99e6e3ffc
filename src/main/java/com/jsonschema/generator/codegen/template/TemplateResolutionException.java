package com.jsonschema.generator.codegen.template;

import lombok.Getter;

/**
 * No template could be located for a (package, template name) pair. This is a packaging
 * defect: generation cannot proceed and the run must be discarded.
 */
@Getter
public class TemplateResolutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String packageName;
    private final String templateName;

    public TemplateResolutionException(String packageName, String templateName) {
        this(packageName, templateName, null);
    }

    public TemplateResolutionException(String packageName, String templateName, Throwable cause) {
        super("Could not load template '" + templateName + "' for package '" + packageName + "'.", cause);
        this.packageName = packageName;
        this.templateName = templateName;
    }
}
