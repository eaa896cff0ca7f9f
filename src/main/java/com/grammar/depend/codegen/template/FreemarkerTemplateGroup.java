package com.grammar.depend.codegen.template;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import freemarker.template.TemplateNotFoundException;

/**
 * {@link TemplateGroup} backed by a directory of FreeMarker templates on the class path.
 * Template {@code name} lives in {@code /templates/<directory>/<name>.ftl}.
 */
public class FreemarkerTemplateGroup implements TemplateGroup {
    private static final Logger log = LoggerFactory.getLogger(FreemarkerTemplateGroup.class);

    static final String TEMPLATE_ROOT = "/templates";
    static final String TEMPLATE_EXTENSION = ".ftl";

    private final Configuration freemarkerConfig;
    private final String directory;

    public FreemarkerTemplateGroup(Configuration freemarkerConfig, String directory) {
        this.freemarkerConfig = freemarkerConfig;
        this.directory = directory;
    }

    /**
     * Group over {@code /templates/<directory>} with a configuration of its own.
     */
    public static FreemarkerTemplateGroup fromClasspath(String directory) {
        return new FreemarkerTemplateGroup(createFreemarkerConfig(), directory);
    }

    public static Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(FreemarkerTemplateGroup.class, TEMPLATE_ROOT);
        cfg.setDefaultEncoding("UTF-8");
        cfg.setLocalizedLookup(false);
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String getDirectory() {
        return directory;
    }

    @Override
    public boolean isDefined(String name) {
        try {
            freemarkerConfig.getTemplate(templatePath(name));
            return true;
        } catch (TemplateNotFoundException e) {
            return false;
        } catch (IOException e) {
            throw new TemplateRenderException("Failed to load template " + templatePath(name), e);
        }
    }

    @Override
    public String render(String name, Map<String, Object> bindings) {
        String path = templatePath(name);
        try {
            Template template = freemarkerConfig.getTemplate(path);
            StringWriter out = new StringWriter();
            template.process(bindings, out);
            log.debug("Rendered template {}", path);
            return out.toString();
        } catch (TemplateNotFoundException e) {
            throw new TemplateRenderException("No such template: " + path, e);
        } catch (IOException | TemplateException e) {
            throw new TemplateRenderException("Failed to render template " + path, e);
        }
    }

    private String templatePath(String name) {
        return directory + "/" + name + TEMPLATE_EXTENSION;
    }
}
