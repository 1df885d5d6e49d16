package org.dxworks.codefix;

import org.dxworks.ignorerLibrary.Ignorer;
import org.dxworks.ignorerLibrary.IgnorerBuilder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Enumerates the files a run may rewrite: {@code .ignore} rules, excluded path fragments,
 * minified bundles, unsupported extensions and oversized files are filtered out.
 */
public class SourceCollector {

    private final CodefixConfig config;
    private final Path ignoreFile;

    public SourceCollector(CodefixConfig config) {
        this(config, Paths.get(".ignore"));
    }

    public SourceCollector(CodefixConfig config, Path ignoreFile) {
        this.config = config;
        this.ignoreFile = ignoreFile;
    }

    public List<Path> collect(Path input) throws IOException {
        List<Path> files = new ArrayList<>();
        Ignorer ignorer = Files.exists(ignoreFile) ? new IgnorerBuilder(ignoreFile).compile() : null;

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> ignorer == null || ignorer.accepts(p.toAbsolutePath().toString()))
                      .filter(p -> !isExcluded(input, p))
                      .filter(this::isCandidate)
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if ((ignorer == null || ignorer.accepts(input.toAbsolutePath().toString()))
                    && isCandidate(input)) {
                files.add(input);
            }
        }

        return files;
    }

    private boolean isCandidate(Path p) {
        return !LanguageDetector.isMinified(p)
                && LanguageDetector.detectLanguage(p).isPresent()
                && withinMaxLines(p, config.getMaxFileLines());
    }

    boolean isExcluded(Path root, Path file) {
        String relative = "/" + root.relativize(file).toString().replace('\\', '/').toLowerCase(Locale.ROOT);
        for (String fragment : config.getExcludedPathFragments()) {
            if (relative.contains(fragment.replace('\\', '/').toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            // unreadable here means unreadable later too; let the run report it
            return true;
        }
    }
}
