package com.grammar.depend.depend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.grammar.depend.codegen.CodeGenerator;
import com.grammar.depend.codegen.target.Target;
import com.grammar.depend.codegen.target.TargetRegistry;
import com.grammar.depend.codegen.template.FreemarkerTemplateGroup;
import com.grammar.depend.codegen.template.TemplateGroup;
import com.grammar.depend.codegen.template.TemplateRenderException;
import com.grammar.depend.grammar.model.Grammar;
import com.grammar.depend.grammar.model.GrammarType;
import com.grammar.depend.tool.ToolConfig;
import com.grammar.depend.util.PathUtil;

/**
 * Given a grammar file, lists the files the grammar compiler reads to process it and
 * the files it writes, and renders them as a make-compatible dependency list.
 *
 * A combined grammar T.g4 with no token import yields:
 *
 * <pre>
 * TParser.java : T.g4
 * T.tokens : T.g4
 * TLexer.java : T.g4
 * TLexer.tokens : T.g4
 * </pre>
 *
 * With listeners on, TListener.java and TBaseListener.java follow; with visitors on,
 * TVisitor.java and TBaseVisitor.java. A {@code tokenVocab=A} option together with
 * {@code -lib libdir} adds the input line
 *
 * <pre>
 * T.g4: libdir/A.tokens
 * </pre>
 *
 * and {@code -o outdir} moves every output under {@code outdir}.
 *
 * One instance per grammar. Not meant to be shared between threads, although
 * independent instances can run side by side.
 */
public class BuildDependencyGenerator {
    private static final Logger log = LoggerFactory.getLogger(BuildDependencyGenerator.class);

    static final String DEPENDENCY_TEMPLATE_DIRECTORY = "depend";
    static final String DEPENDENCIES_TEMPLATE = "dependencies";

    private final ToolConfig tool;
    private final Grammar grammar;
    private final CodeGenerator generator;

    private volatile TemplateGroup templates;

    public BuildDependencyGenerator(ToolConfig tool, Grammar grammar, TargetRegistry targetRegistry) {
        this(tool, grammar, new CodeGenerator(grammar, grammar.getOptionString(Grammar.LANGUAGE_OPTION),
                targetRegistry));
    }

    public BuildDependencyGenerator(ToolConfig tool, Grammar grammar, CodeGenerator generator) {
        this.tool = tool;
        this.grammar = grammar;
        this.generator = generator;
    }

    public CodeGenerator getGenerator() {
        return generator;
    }

    /**
     * Files the code generator writes for this grammar. An empty list when no target
     * could be loaded; empty {@link Optional} when the computation produced nothing.
     */
    public Optional<List<String>> computeOutputs() {
        Optional<Target> resolved = generator.getTarget();
        if (resolved.isEmpty()) {
            log.warn("No target for language {}; {} has no generated files", generator.getLanguage(),
                    grammar.getFileName());
            return Optional.of(List.of());
        }
        Target target = resolved.get();
        TemplateGroup targetTemplates = target.getTemplates();

        List<String> files = new ArrayList<>();

        // recognizer, e.g. TParser.java
        if (target.needsHeader()) {
            files.add(getOutputFile(generator.getRecognizerFileName(true)));
        }
        files.add(getOutputFile(generator.getRecognizerFileName(false)));

        // vocabulary, e.g. T.tokens
        files.add(getOutputFile(generator.getVocabFileName()));

        String headerExtension = null;
        String codeExtension = targetTemplates.render(Target.CODE_FILE_EXTENSION);
        if (targetTemplates.isDefined(Target.HEADER_FILE)) {
            headerExtension = targetTemplates.render(Target.HEADER_FILE_EXTENSION);
            String suffix = grammar.getType().getFileNameSuffix();
            files.add(getOutputFile(grammar.getName() + suffix + headerExtension));
        }

        if (grammar.isCombined()) {
            // implicit lexer, e.g. TLexer.java TLexer.tokens TLexer.h
            String lexer = grammar.getName() + GrammarType.LEXER.getFileNameSuffix();
            files.add(getOutputFile(lexer + codeExtension));
            files.add(getOutputFile(lexer + CodeGenerator.VOCAB_FILE_EXTENSION));
            if (headerExtension != null) {
                files.add(getOutputFile(lexer + headerExtension));
            }
        }

        if (tool.isGenerateListener()) {
            if (target.needsHeader()) {
                files.add(getOutputFile(generator.getListenerFileName(true)));
            }
            files.add(getOutputFile(generator.getListenerFileName(false)));

            if (target.needsHeader()) {
                files.add(getOutputFile(generator.getBaseListenerFileName(true)));
            }
            files.add(getOutputFile(generator.getBaseListenerFileName(false)));
        }

        if (tool.isGenerateVisitor()) {
            if (target.needsHeader()) {
                files.add(getOutputFile(generator.getVisitorFileName(true)));
            }
            files.add(getOutputFile(generator.getVisitorFileName(false)));

            if (target.needsHeader()) {
                files.add(getOutputFile(generator.getBaseVisitorFileName(true)));
            }
            files.add(getOutputFile(generator.getBaseVisitorFileName(false)));
        }

        for (Grammar imported : grammar.getAllImportedGrammars()) {
            files.add(getOutputFile(imported.getFileName()));
        }

        if (files.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Collections.unmodifiableList(files));
    }

    /**
     * Where {@code fileName} is written. The grammar's location decides the directory;
     * when that is the current directory the file's own name gets a chance, so
     * {@code -o} still applies.
     */
    public String getOutputFile(String fileName) {
        String outputDir = tool.resolveOutputDirectory(grammar.getFileName());
        if (PathUtil.isCurrentDirectory(outputDir)) {
            outputDir = tool.resolveOutputDirectory(fileName);
        }
        if (PathUtil.isCurrentDirectory(outputDir)) {
            return fileName;
        }
        return PathUtil.groomQualifiedFileName(outputDir, fileName);
    }

    /**
     * Files read to process this grammar: token vocabularies and imported grammars.
     */
    public Optional<List<String>> computeDependencies() {
        List<String> files = new ArrayList<>(computeInputs().orElse(List.of()));

        String libDirectory = tool.getLibDirectory();
        for (Grammar imported : grammar.getAllImportedGrammars()) {
            files.add(PathUtil.groomQualifiedFileName(libDirectory, imported.getFileName()));
        }

        if (files.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Collections.unmodifiableList(files));
    }

    /**
     * Dependencies other than imported grammars, which today means the
     * {@code tokenVocab} file.
     */
    public Optional<List<String>> computeInputs() {
        List<String> files = new ArrayList<>();

        String tokenVocab = grammar.getOptionString(Grammar.TOKEN_VOCAB_OPTION);
        if (tokenVocab != null) {
            String fileName = tokenVocab + CodeGenerator.VOCAB_FILE_EXTENSION;
            String libDirectory = tool.getLibDirectory();
            if (PathUtil.isCurrentDirectory(libDirectory)) {
                files.add(fileName);
            } else {
                files.add(PathUtil.join(libDirectory, fileName));
            }
        }

        if (files.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Collections.unmodifiableList(files));
    }

    public DependencyResult computeResult() {
        return DependencyResult.builder()
                .grammarFileName(grammar.getFileName())
                .inputs(computeDependencies().orElse(List.of()))
                .outputs(computeOutputs().orElse(List.of()))
                .build();
    }

    public String renderReport() {
        DependencyResult result = computeResult();

        Map<String, Object> bindings = new HashMap<>();
        bindings.put("inputs", result.getInputs());
        bindings.put("outputs", result.getOutputs());
        bindings.put("grammarFileName", result.getGrammarFileName());
        return loadDependencyTemplates().render(DEPENDENCIES_TEMPLATE, bindings);
    }

    /**
     * Loads the report templates on first call and returns the same group afterwards.
     */
    public TemplateGroup loadDependencyTemplates() {
        TemplateGroup loaded = templates;
        if (loaded == null) {
            synchronized (this) {
                loaded = templates;
                if (loaded == null) {
                    loaded = FreemarkerTemplateGroup.fromClasspath(DEPENDENCY_TEMPLATE_DIRECTORY);
                    if (!loaded.isDefined(DEPENDENCIES_TEMPLATE)) {
                        throw new TemplateRenderException("Missing template " + DEPENDENCIES_TEMPLATE + " in "
                                + DEPENDENCY_TEMPLATE_DIRECTORY);
                    }
                    templates = loaded;
                }
            }
        }
        return loaded;
    }
}
