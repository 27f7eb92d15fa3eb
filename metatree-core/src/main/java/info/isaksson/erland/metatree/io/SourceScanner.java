package info.isaksson.erland.metatree.io;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Deterministic discovery of source files for any set of registered extensions.
 *
 * <p>The result is sorted by path relative to the root (always with '/' separators), so two scans of
 * the same tree yield the same list on every platform.</p>
 */
public final class SourceScanner {

    /** Build output and tool folders directly under the root. */
    private static final List<String> SKIPPED_DIRS = List.of(
            "target/", "build/", "out/", "dist/", ".git/", ".hg/", ".svn/", ".idea/", ".gradle/",
            "node_modules/", "_build/", "deps/", "__pycache__/", ".venv/");

    private SourceScanner() {}

    /**
     * Scan for files under {@code root} whose extension is in {@code extensions}.
     *
     * @param root         folder to scan; a regular file is returned as-is when its extension matches
     * @param extensions   extensions including the dot (e.g. {@code .java}); matched case-insensitively
     * @param excludeGlobs glob patterns matched against the path relative to {@code root}
     */
    public static List<Path> scan(Path root, Collection<String> extensions, List<String> excludeGlobs) throws IOException {
        Objects.requireNonNull(root, "root");
        Set<String> exts = normalizeExtensions(extensions);
        if (Files.isRegularFile(root)) {
            return hasExtension(root, exts) ? List.of(root) : List.of();
        }
        final List<Predicate<Path>> excludeMatchers = compileExcludeMatchers(excludeGlobs);

        try (Stream<Path> stream = Files.walk(root)) {
            List<Path> out = new ArrayList<>();
            stream
                .filter(Files::isRegularFile)
                .filter(p -> hasExtension(p, exts))
                .filter(p -> !isUnderSkippedDir(root, p))
                .filter(p -> !matchesAny(root, p, excludeMatchers))
                .forEach(out::add);

            out.sort(Comparator.comparing(p -> relative(root, p)));
            return out;
        }
    }

    /** Path of {@code file} relative to {@code root}, with '/' separators. */
    public static String relative(Path root, Path file) {
        if (root.equals(file)) return file.getFileName().toString();
        return normalizePathString(root.relativize(file));
    }

    private static Set<String> normalizeExtensions(Collection<String> extensions) {
        Set<String> out = new TreeSet<>();
        if (extensions == null) return out;
        for (String e : extensions) {
            if (e == null || e.isBlank()) continue;
            String ext = e.trim().toLowerCase(Locale.ROOT);
            out.add(ext.startsWith(".") ? ext : "." + ext);
        }
        return out;
    }

    private static boolean hasExtension(Path p, Set<String> exts) {
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String ext : exts) {
            if (name.endsWith(ext) && name.length() > ext.length()) return true;
        }
        return false;
    }

    private static boolean matchesAny(Path root, Path absolutePath, List<Predicate<Path>> matchers) {
        if (matchers.isEmpty()) return false;
        final Path rel = root.relativize(absolutePath);
        for (Predicate<Path> m : matchers) {
            if (m.test(rel)) return true;
        }
        return false;
    }

    private static List<Predicate<Path>> compileExcludeMatchers(List<String> excludeGlobs) {
        if (excludeGlobs == null || excludeGlobs.isEmpty()) return Collections.emptyList();

        FileSystem fs = FileSystems.getDefault();
        List<Predicate<Path>> out = new ArrayList<>();
        for (String raw : excludeGlobs) {
            if (raw == null) continue;
            String pattern = raw.trim().replace("\\", "/");
            if (pattern.isEmpty()) continue;

            // A bare directory name excludes everything under it.
            if (!pattern.contains("*") && !pattern.contains("?") && !pattern.contains("[") && !pattern.endsWith("/")) {
                pattern = pattern + "/**";
            }

            final var matcher = fs.getPathMatcher("glob:" + pattern);
            out.add(p -> matcher.matches(Path.of(normalizePathString(p))));
        }
        return out;
    }

    private static boolean isUnderSkippedDir(Path root, Path absolutePath) {
        String rel = relative(root, absolutePath);
        for (String dir : SKIPPED_DIRS) {
            if (rel.startsWith(dir)) return true;
        }
        return false;
    }

    private static String normalizePathString(Path p) {
        return p.toString().replace("\\", "/");
    }
}
