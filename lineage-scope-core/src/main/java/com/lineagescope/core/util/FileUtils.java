package com.lineagescope.core.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Lists every regular file under a root directory, sorted by path.
     *
     * @param rootPath root directory
     * @return sorted list of files
     * @throws IOException if directory traversal fails
     */
    public static List<Path> listFiles(Path rootPath) throws IOException {
        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .sorted()
                .toList();
        }
    }

    /**
     * Checks whether a root-relative path matches any of the given glob patterns.
     *
     * <p>A leading {@code **}{@code /} also matches files directly under the root.
     *
     * @param relativePath path relative to the scan root
     * @param globPatterns glob patterns
     * @return true if at least one pattern matches
     */
    public static boolean matchesAny(Path relativePath, Collection<String> globPatterns) {
        for (String pattern : globPatterns) {
            if (matches(globMatcher(pattern), pattern, relativePath)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the root-relative path in portable form ({@code /} separators).
     *
     * @param rootPath scan root
     * @param path file under the root
     * @return portable relative path
     */
    public static String relativeName(Path rootPath, Path path) {
        return rootPath.relativize(path).toString().replace('\\', '/');
    }

    /**
     * Reads a file as UTF-8 text. Bytes that are not valid UTF-8 become U+FFFD instead
     * of failing the read, so legacy exports with Latin-1 comments still parse.
     *
     * @param path path to file
     * @return file content as string
     * @throws IOException if reading fails
     */
    public static String readString(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    /**
     * Gets the file name without its extension.
     *
     * @param path file path
     * @return file name up to the last dot
     */
    public static String getBaseName(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    /**
     * Gets the file extension without the dot.
     *
     * @param path file path
     * @return lowercased extension, or empty string if none
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1).toLowerCase(Locale.ROOT) : "";
    }

    private static PathMatcher globMatcher(String globPattern) {
        return FileSystems.getDefault().getPathMatcher("glob:" + globPattern);
    }

    private static boolean matches(PathMatcher matcher, String globPattern, Path relativePath) {
        if (matcher.matches(relativePath)) {
            return true;
        }
        // "**/x" also matches "x" with no leading directory
        if (globPattern.startsWith("**/")) {
            return globMatcher(globPattern.substring(3)).matches(relativePath);
        }
        return false;
    }
}
