package com.grammar.depend.grammar.parser;

import java.util.List;
import java.util.Map;

import com.grammar.depend.grammar.model.GrammarType;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * What the top of a grammar file declares, before imports are resolved to files.
 */
@Value
@Builder
public class GrammarHeader {

    @NonNull
    String name;

    @NonNull
    GrammarType type;

    @Singular
    Map<String, String> options;

    /**
     * Names of imported grammars, in declaration order.
     */
    @Singular
    List<String> importNames;
}
