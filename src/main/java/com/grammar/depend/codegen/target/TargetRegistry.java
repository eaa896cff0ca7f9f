package com.grammar.depend.codegen.target;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.grammar.depend.codegen.template.FreemarkerTemplateGroup;
import com.grammar.depend.codegen.template.TemplateGroup;

import freemarker.template.Configuration;

/**
 * Resolves a language name to a {@link Target}. Each target keeps its templates under
 * {@code /templates/targets/<language>}.
 *
 * Resolution never throws: an unknown language, or one whose templates do not define
 * {@code codeFileExtension}, is reported and yields an empty result.
 */
public class TargetRegistry {
    private static final Logger log = LoggerFactory.getLogger(TargetRegistry.class);

    static final String TARGETS_DIRECTORY = "targets";

    private final Configuration freemarkerConfig;

    public TargetRegistry() {
        this(FreemarkerTemplateGroup.createFreemarkerConfig());
    }

    public TargetRegistry(Configuration freemarkerConfig) {
        this.freemarkerConfig = freemarkerConfig;
    }

    public Optional<Target> load(String language) {
        Optional<TargetLanguage> known = TargetLanguage.fromLanguageName(language);
        if (known.isEmpty()) {
            log.error("Cannot create target generator for language '{}'", language);
            return Optional.empty();
        }

        TemplateGroup templates = new FreemarkerTemplateGroup(freemarkerConfig,
                TARGETS_DIRECTORY + "/" + known.get().getLanguageName());
        if (!templates.isDefined(Target.CODE_FILE_EXTENSION)) {
            log.error("Templates for target '{}' are missing {}", language, Target.CODE_FILE_EXTENSION);
            return Optional.empty();
        }

        log.debug("Loaded target {}", language);
        return Optional.of(Target.builder()
                .language(known.get().getLanguageName())
                .needsHeader(known.get().needsHeader())
                .templates(templates)
                .build());
    }
}
