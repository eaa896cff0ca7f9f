package com.grammar.depend.depend;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * What one grammar reads and what the code generator writes for it.
 *
 * Order within each list is stable so reports are reproducible; build tools reading
 * the report do not depend on it.
 */
@Value
@Builder
public class DependencyResult {

    @NonNull
    String grammarFileName;

    @Singular
    List<String> inputs;

    @Singular
    List<String> outputs;
}
