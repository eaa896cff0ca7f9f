package com.grammar.depend.codegen;

import java.util.Optional;

import com.grammar.depend.codegen.target.Target;
import com.grammar.depend.codegen.target.TargetRegistry;
import com.grammar.depend.grammar.model.Grammar;

/**
 * Naming rules of the code generator for one grammar and one target language.
 *
 * The target is looked up on first use and kept; an unknown language leaves
 * {@link #getTarget()} empty and every file-name method unusable.
 */
public class CodeGenerator {

    public static final String DEFAULT_LANGUAGE = "Java";
    public static final String VOCAB_FILE_EXTENSION = ".tokens";

    private final Grammar grammar;
    private final String language;
    private final TargetRegistry targetRegistry;

    private Target target;
    private boolean targetLoaded;

    public CodeGenerator(Grammar grammar, String language, TargetRegistry targetRegistry) {
        this.grammar = grammar;
        this.language = language != null ? language : DEFAULT_LANGUAGE;
        this.targetRegistry = targetRegistry;
    }

    public Grammar getGrammar() {
        return grammar;
    }

    public String getLanguage() {
        return language;
    }

    public Optional<Target> getTarget() {
        if (!targetLoaded) {
            target = targetRegistry.load(language).orElse(null);
            targetLoaded = true;
        }
        return Optional.ofNullable(target);
    }

    /**
     * e.g. TParser.java, or TParser.h for the header form.
     */
    public String getRecognizerFileName(boolean header) {
        return grammar.getRecognizerName() + fileExtension(header);
    }

    public String getListenerFileName(boolean header) {
        return grammar.getName() + "Listener" + fileExtension(header);
    }

    public String getBaseListenerFileName(boolean header) {
        return grammar.getName() + "BaseListener" + fileExtension(header);
    }

    public String getVisitorFileName(boolean header) {
        return grammar.getName() + "Visitor" + fileExtension(header);
    }

    public String getBaseVisitorFileName(boolean header) {
        return grammar.getName() + "BaseVisitor" + fileExtension(header);
    }

    /**
     * Token name to type mapping written for every grammar, e.g. T.tokens.
     */
    public String getVocabFileName() {
        return grammar.getName() + VOCAB_FILE_EXTENSION;
    }

    private String fileExtension(boolean header) {
        Target resolved = getTarget().orElseThrow(() -> new IllegalStateException(
                "No code generation target for language " + language));
        return resolved.getTemplates().render(header ? Target.HEADER_FILE_EXTENSION : Target.CODE_FILE_EXTENSION);
    }
}
