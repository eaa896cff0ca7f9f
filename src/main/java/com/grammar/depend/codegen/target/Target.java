package com.grammar.depend.codegen.target;

import com.grammar.depend.codegen.template.TemplateGroup;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A code generation backend as far as file naming is concerned: whether it emits
 * separate header files and the templates that spell its file extensions.
 */
@Value
@Builder
public class Target {

    public static final String CODE_FILE_EXTENSION = "codeFileExtension";
    public static final String HEADER_FILE_EXTENSION = "headerFileExtension";
    public static final String HEADER_FILE = "headerFile";

    @NonNull
    String language;

    boolean needsHeader;

    @NonNull
    TemplateGroup templates;

    public boolean needsHeader() {
        return needsHeader;
    }
}
