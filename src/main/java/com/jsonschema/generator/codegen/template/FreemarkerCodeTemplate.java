package com.jsonschema.generator.codegen.template;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;

/**
 * A FreeMarker template loaded from the classpath. The model is exposed to the template as
 * {@code model}.
 */
public class FreemarkerCodeTemplate implements CodeTemplate {

    private final Template template;
    private final Object model;

    /**
     * Loads the template eagerly so that a missing or unparsable file fails at lookup time.
     */
    public FreemarkerCodeTemplate(Configuration configuration, String packageName, String templateName, Object model) {
        try {
            this.template = configuration.getTemplate(templatePath(packageName, templateName));
        } catch (IOException e) {
            throw new TemplateResolutionException(packageName, templateName, e);
        }
        this.model = model;
    }

    static String templatePath(String packageName, String templateName) {
        return packageName + "/" + templateName + ".ftl";
    }

    @Override
    public String render() {
        StringWriter out = new StringWriter();
        try {
            template.process(Map.of("model", model), out);
        } catch (TemplateException | IOException e) {
            throw new CodeRenderException("Failed to render template " + template.getName() + ": " + e.getMessage(), e);
        }
        return out.toString();
    }
}
