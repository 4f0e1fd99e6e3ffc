package com.jsonschema.generator.codegen.template;

/**
 * Creates templates for a (language package, template name) pair.
 */
public interface TemplateFactory {

    /**
     * @throws TemplateResolutionException when no template is registered for the pair
     */
    CodeTemplate createTemplate(String packageName, String templateName, Object model);

    default String render(String packageName, String templateName, Object model) {
        return createTemplate(packageName, templateName, model).render();
    }
}
