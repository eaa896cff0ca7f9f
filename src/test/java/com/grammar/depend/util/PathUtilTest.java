package com.grammar.depend.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PathUtil.
 */
class PathUtilTest {

    @Test
    void testCurrentDirectoryLeavesFileNameBare() {
        assertThat(PathUtil.groomQualifiedFileName(".", "T.java")).isEqualTo("T.java");
    }

    @Test
    void testTrailingDotComponentIsStripped() {
        assertThat(PathUtil.groomQualifiedFileName("build/.", "T.java")).isEqualTo("build/T.java");
        assertThat(PathUtil.groomQualifiedFileName("/abs/out/.", "T.java")).isEqualTo("/abs/out/T.java");
    }

    @Test
    void testDotInsideNameIsKept() {
        assertThat(PathUtil.groomQualifiedFileName("build.d", "T.java")).isEqualTo("build.d/T.java");
    }

    @Test
    void testSpacesInLastComponentAreEscaped() {
        assertThat(PathUtil.groomQualifiedFileName("my dir", "T.java")).isEqualTo("my\\ dir/T.java");
        assertThat(PathUtil.groomQualifiedFileName("a b/my dir/.", "T.java")).isEqualTo("a\\ b/my\\ dir/T.java");
    }

    @Test
    void testSpacesOnlyInParentAreLeftAlone() {
        assertThat(PathUtil.groomQualifiedFileName("/home/my dir/out", "T.java")).isEqualTo("/home/my dir/out/T.java");
    }

    @Test
    void testGroomingIsRepeatable() {
        String first = PathUtil.groomQualifiedFileName("gen dir/.", "T.java");
        String second = PathUtil.groomQualifiedFileName("gen dir/.", "T.java");

        assertThat(first).isEqualTo(second).isEqualTo("gen\\ dir/T.java");
    }

    @Test
    void testJoin() {
        assertThat(PathUtil.join("out", "T.java")).isEqualTo("out/T.java");
        assertThat(PathUtil.join("out/", "T.java")).isEqualTo("out/T.java");
        assertThat(PathUtil.join("out", "/abs/T.java")).isEqualTo("/abs/T.java");
        assertThat(PathUtil.join("", "T.java")).isEqualTo("T.java");
    }

    @Test
    void testDirectoryOf() {
        assertThat(PathUtil.directoryOf("T.g4")).isEqualTo(".");
        assertThat(PathUtil.directoryOf("src/grammars/T.g4")).isEqualTo("src/grammars");
        assertThat(PathUtil.directoryOf("/T.g4")).isEqualTo("/");
    }

    @Test
    void testLastComponent() {
        assertThat(PathUtil.lastComponent("a/b")).isEqualTo("b");
        assertThat(PathUtil.lastComponent("a/b/")).isEqualTo("b");
        assertThat(PathUtil.lastComponent("out/.")).isEqualTo(".");
        assertThat(PathUtil.lastComponent("plain")).isEqualTo("plain");
    }
}
