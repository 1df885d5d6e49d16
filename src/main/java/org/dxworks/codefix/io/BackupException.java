package org.dxworks.codefix.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The pre-rewrite copy of a file could not be persisted. The file must not be written.
 */
public class BackupException extends Exception {

    private final Path file;

    public BackupException(Path file, IOException cause) {
        super("Backup failed for " + file + ": " + cause.getMessage(), cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
