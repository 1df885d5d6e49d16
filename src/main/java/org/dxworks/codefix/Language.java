package org.dxworks.codefix;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum Language {
    GO("go", ".go"),
    JAVASCRIPT("javascript", ".js", ".jsx", ".mjs", ".cjs"),
    TYPESCRIPT("typescript", ".ts", ".tsx");

    private final String name;
    private final List<String> extensions;

    Language(String name, String... extensions) {
        this.name = name;
        this.extensions = Arrays.asList(extensions);
    }

    public String getName() {
        return name;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public boolean matchesFileName(String lowerCaseFileName) {
        return extensions.stream().anyMatch(lowerCaseFileName::endsWith);
    }

    public static Optional<Language> fromName(String name) {
        if (name == null) return Optional.empty();
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(l -> l.name.equals(normalized))
                .findFirst();
    }
}
