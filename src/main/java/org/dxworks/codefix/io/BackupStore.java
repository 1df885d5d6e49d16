package org.dxworks.codefix.io;

import java.nio.file.Path;

/**
 * Persists a recoverable copy of a file's original text before it is overwritten.
 */
public interface BackupStore {
    void backup(Path file, String originalText) throws BackupException;
}
