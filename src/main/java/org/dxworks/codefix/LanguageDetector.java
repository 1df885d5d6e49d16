package org.dxworks.codefix;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

public class LanguageDetector {

    public static Optional<Language> detectLanguage(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase(Locale.ROOT);
        for (Language lang : Language.values()) {
            if (lang.matchesFileName(fileName)) {
                return Optional.of(lang);
            }
        }
        return Optional.empty();
    }

    /**
     * Minified bundles are generated output and are never rewritten.
     */
    public static boolean isMinified(Path filePath) {
        return filePath.getFileName().toString().toLowerCase(Locale.ROOT).contains(".min.");
    }
}
