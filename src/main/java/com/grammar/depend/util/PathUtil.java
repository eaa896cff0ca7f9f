package com.grammar.depend.util;

import java.io.File;
import java.nio.file.Path;

/**
 * String-level path helpers for dependency reports.
 *
 * Paths stay strings here: reports are consumed by whitespace-delimited build tools,
 * so spaces get escaped and the {@value #CURRENT_DIRECTORY} directory is never written
 * out as a prefix.
 */
public class PathUtil {

    public static final String CURRENT_DIRECTORY = ".";

    private static final String ESCAPED_SPACE = "\\ ";

    private PathUtil() {
        // Utility class
    }

    public static boolean isCurrentDirectory(String directory) {
        return CURRENT_DIRECTORY.equals(directory);
    }

    /**
     * Text before the last separator of {@code fileNameWithPath}, or
     * {@value #CURRENT_DIRECTORY} when it has none.
     */
    public static String directoryOf(String fileNameWithPath) {
        int lastSeparator = lastSeparatorIndex(fileNameWithPath);
        if (lastSeparator < 0) {
            return CURRENT_DIRECTORY;
        }
        if (lastSeparator == 0) {
            return fileNameWithPath.substring(0, 1);
        }
        return fileNameWithPath.substring(0, lastSeparator);
    }

    /**
     * Last name in {@code path}, ignoring trailing separators.
     */
    public static String lastComponent(String path) {
        int end = path.length();
        while (end > 0 && isSeparator(path.charAt(end - 1))) {
            end--;
        }
        String trimmed = path.substring(0, end);
        return trimmed.substring(lastSeparatorIndex(trimmed) + 1);
    }

    /**
     * Qualifies {@code fileName} with {@code directory} for a dependency report.
     *
     * <ul>
     * <li>{@value #CURRENT_DIRECTORY} leaves the file name bare.</li>
     * <li>A directory whose last name is exactly {@code .} loses everything from its
     * last dot on, so {@code out/.} becomes {@code out/}.</li>
     * <li>A directory whose last name contains a space has every space escaped.</li>
     * </ul>
     */
    public static String groomQualifiedFileName(String directory, String fileName) {
        if (isCurrentDirectory(directory)) {
            return fileName;
        }

        String groomed = directory;
        if (lastComponent(groomed).equals(CURRENT_DIRECTORY)) {
            groomed = groomed.substring(0, groomed.lastIndexOf('.'));
        }
        if (lastComponent(groomed).indexOf(' ') >= 0) {
            groomed = groomed.replace(" ", ESCAPED_SPACE);
        }
        return join(groomed, fileName);
    }

    /**
     * Joins like a platform path combine: no doubled separator, and an absolute
     * {@code fileName} is returned unchanged.
     */
    public static String join(String directory, String fileName) {
        if (directory.isEmpty() || Path.of(fileName).isAbsolute()) {
            return fileName;
        }
        if (isSeparator(directory.charAt(directory.length() - 1))) {
            return directory + fileName;
        }
        return directory + File.separator + fileName;
    }

    private static int lastSeparatorIndex(String path) {
        return Math.max(path.lastIndexOf('/'), path.lastIndexOf(File.separatorChar));
    }

    private static boolean isSeparator(char c) {
        return c == '/' || c == File.separatorChar;
    }
}
