package com.jsonschema.generator.codegen.template;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import freemarker.template.Configuration;
import freemarker.template.TemplateExceptionHandler;
import lombok.Value;

/**
 * Template factory backed by an explicit table of (package, template name) to template
 * constructors. Lookups are by exact key; a miss is fatal.
 */
public class DefaultTemplateFactory implements TemplateFactory {

    private static final Logger log = LoggerFactory.getLogger(DefaultTemplateFactory.class);

    public static final String CSHARP = "CSharp";

    public static final String FILE_TEMPLATE = "File";
    public static final String CLASS_TEMPLATE = "Class";
    public static final String ENUM_TEMPLATE = "Enum";
    public static final String INHERITANCE_CONVERTER_TEMPLATE = "JsonInheritanceConverter";

    private final Map<TemplateKey, Function<Object, CodeTemplate>> factories = new HashMap<>();

    /**
     * Factory with the built-in C# templates from the classpath.
     */
    public static DefaultTemplateFactory createDefault() {
        Configuration cfg = createFreemarkerConfig();
        DefaultTemplateFactory factory = new DefaultTemplateFactory();
        factory.registerFreemarker(cfg, CSHARP, FILE_TEMPLATE);
        factory.registerFreemarker(cfg, CSHARP, CLASS_TEMPLATE);
        factory.registerFreemarker(cfg, CSHARP, ENUM_TEMPLATE);
        factory.registerFreemarker(cfg, CSHARP, INHERITANCE_CONVERTER_TEMPLATE);
        return factory;
    }

    static Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(DefaultTemplateFactory.class, "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public DefaultTemplateFactory register(String packageName, String templateName,
                                           Function<Object, CodeTemplate> factory) {
        Objects.requireNonNull(factory, "factory");
        factories.put(new TemplateKey(packageName, templateName), factory);
        log.debug("Registered template {}/{}", packageName, templateName);
        return this;
    }

    public DefaultTemplateFactory registerFreemarker(Configuration cfg, String packageName, String templateName) {
        return register(packageName, templateName,
                model -> new FreemarkerCodeTemplate(cfg, packageName, templateName, model));
    }

    public boolean isRegistered(String packageName, String templateName) {
        return factories.containsKey(new TemplateKey(packageName, templateName));
    }

    @Override
    public CodeTemplate createTemplate(String packageName, String templateName, Object model) {
        Function<Object, CodeTemplate> factory = factories.get(new TemplateKey(packageName, templateName));
        if (factory == null) {
            throw new TemplateResolutionException(packageName, templateName);
        }
        return factory.apply(model);
    }

    @Value
    private static class TemplateKey {
        String packageName;
        String templateName;
    }
}
