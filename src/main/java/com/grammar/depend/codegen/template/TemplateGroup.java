package com.grammar.depend.codegen.template;

import java.util.Map;

/**
 * A named set of templates. Callers only ask whether a template exists and what it
 * renders to; the engine behind it is an implementation detail.
 */
public interface TemplateGroup {

    boolean isDefined(String name);

    String render(String name, Map<String, Object> bindings);

    default String render(String name) {
        return render(name, Map.of());
    }
}
