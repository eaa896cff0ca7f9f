package com.grammar.depend.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.grammar.depend.tool.ToolConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps DependCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedDependOptions {
    ToolConfig toolConfig;
    List<Path> grammarFiles;
}
