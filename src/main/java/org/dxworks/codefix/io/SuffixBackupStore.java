package org.dxworks.codefix.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the original text next to the file, as {@code <name><suffix>}.
 * An existing backup is kept, so the copy always holds the text from before the first run.
 */
public class SuffixBackupStore implements BackupStore {

    private final String suffix;

    public SuffixBackupStore(String suffix) {
        if (suffix == null || suffix.isBlank() || suffix.contains("/") || suffix.contains("\\")) {
            throw new IllegalArgumentException("Invalid backup suffix: '" + suffix + "'");
        }
        this.suffix = suffix;
    }

    public Path backupPathFor(Path file) {
        return file.resolveSibling(file.getFileName().toString() + suffix);
    }

    @Override
    public void backup(Path file, String originalText) throws BackupException {
        Path target = backupPathFor(file);
        if (Files.exists(target)) {
            return;
        }
        try {
            Files.writeString(target, originalText, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new BackupException(file, e);
        }
    }
}
