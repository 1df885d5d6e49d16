package org.dxworks.codefix;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.codefix.io.BackupException;
import org.dxworks.codefix.io.BackupStore;
import org.dxworks.codefix.io.FileCommitter;
import org.dxworks.codefix.io.SuffixBackupStore;
import org.dxworks.codefix.model.FileResult;
import org.dxworks.codefix.model.RunSummary;
import org.dxworks.codefix.rewriter.FileOutcome;
import org.dxworks.codefix.rewriter.RewriteEngine;
import org.dxworks.codefix.rewriter.literal.LiteralType;
import org.dxworks.codefix.rewriter.literal.RewriteRule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AppTest {

    private static final LiteralType WIDGET = LiteralType.of("&Widget", RewriteRule.of("newWidget", "Name", "Size"));
    private static final String SOURCE = "package p\n\nfunc f() {\n\tw := &Widget{Name: \"a\", Size: 3}\n}\n";
    private static final String REWRITTEN = "package p\n\nfunc f() {\n\tw := newWidget(\"a\", 3)\n}\n";

    @TempDir
    Path dir;

    private final RewriteEngine engine = new RewriteEngine(List.of(WIDGET), List.of(), 8);
    private final SuffixBackupStore backups = new SuffixBackupStore(".bak");
    private final FileCommitter committer = new FileCommitter();

    @Test
    void rewriteFile_BacksUpThenWrites() throws Exception {
        Path file = write("w_test.go", SOURCE);

        FileOutcome outcome = App.rewriteFile(file, Language.GO, engine, backups, committer, false);

        assertTrue(outcome.isChanged());
        assertEquals(REWRITTEN, read(file));
        assertEquals(SOURCE, read(dir.resolve("w_test.go.bak")));
    }

    @Test
    void rewriteFile_UnchangedFileIsNotTouched() throws Exception {
        String source = "package p\n\nvar w = &Widget{Name: \"a\"}\n";
        Path file = write("w_test.go", source);

        FileOutcome outcome = App.rewriteFile(file, Language.GO, engine, backups, committer, false);

        assertFalse(outcome.isChanged());
        assertEquals(1, outcome.getDiagnostics().size());
        assertEquals(source, read(file));
        assertFalse(Files.exists(dir.resolve("w_test.go.bak")));
    }

    @Test
    void rewriteFile_FailedBackupLeavesFileAlone() throws Exception {
        Path file = write("w_test.go", SOURCE);
        BackupStore failing = (f, text) -> {
            throw new BackupException(f, new IOException("disk full"));
        };

        assertThrows(BackupException.class,
                () -> App.rewriteFile(file, Language.GO, engine, failing, committer, false));
        assertEquals(SOURCE, read(file));
    }

    @Test
    void rewriteFile_DryRunWritesNothing() throws Exception {
        Path file = write("w_test.go", SOURCE);

        FileOutcome outcome = App.rewriteFile(file, Language.GO, engine, backups, committer, true);

        assertEquals(REWRITTEN, outcome.getRewrittenText());
        assertEquals(SOURCE, read(file));
        assertFalse(Files.exists(dir.resolve("w_test.go.bak")));
    }

    @Test
    void rewriteFile_ByteOrderMarkPreserved() throws Exception {
        Path file = write("w_test.go", "\uFEFF" + SOURCE);

        App.rewriteFile(file, Language.GO, engine, backups, committer, false);

        assertEquals("\uFEFF" + REWRITTEN, read(file));
        assertEquals("\uFEFF" + SOURCE, read(dir.resolve("w_test.go.bak")));
    }

    @Test
    void run_WritesReportAndSummary() throws Exception {
        Path root = Files.createDirectories(dir.resolve("repo"));
        write("repo/a_test.go", SOURCE);
        write("repo/b_test.go", "package p\n");
        write("repo/c_test.go", "package p\n\nvar w = &Widget{\"a\", 3}\n");
        Path report = dir.resolve("report.jsonl");
        CodefixConfig config = CodefixConfig.defaults().withLiteralTypes(List.of(WIDGET));

        RunSummary summary = App.run(root, report, config);

        assertEquals(3, summary.getFilesScanned());
        assertEquals(1, summary.getFilesChanged());
        assertEquals(1, summary.getTotalRewrites());
        assertEquals(1, summary.getDiagnostics());
        assertEquals(0, summary.getFilesWithErrors());
        assertEquals(REWRITTEN, read(root.resolve("a_test.go")));

        List<JsonNode> records = TestUtils.readReport(report);
        assertEquals(4, records.size());
        assertEquals("run", records.get(0).get("kind").asText());
        assertEquals("done", records.get(3).get("kind").asText());
        assertEquals(1, records.get(3).get("files_changed").asInt());
        long written = records.stream()
                .filter(r -> "file".equals(r.get("kind").asText()) && r.get("written").asBoolean())
                .count();
        assertEquals(1, written);
    }

    @Test
    void writeResult_ReportFailureDoesNotFailCommittedFile() {
        Writer broken = new Writer() {
            @Override
            public void write(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("report disk full");
            }

            @Override
            public void flush() throws IOException {
                throw new IOException("report disk full");
            }

            @Override
            public void close() {
            }
        };
        FileResult result = new FileResult();
        result.filePath = "a_test.go";
        result.changed = true;

        assertDoesNotThrow(() -> App.writeResult(new BufferedWriter(broken), dir.resolve("a_test.go"), result));
    }

    private Path write(String name, String text) throws IOException {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, text, StandardCharsets.UTF_8);
        return file;
    }

    private static String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }
}
