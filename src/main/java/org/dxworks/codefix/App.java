package org.dxworks.codefix;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.codefix.io.BackupException;
import org.dxworks.codefix.io.BackupStore;
import org.dxworks.codefix.io.FileCommitter;
import org.dxworks.codefix.io.SuffixBackupStore;
import org.dxworks.codefix.model.Diagnostic;
import org.dxworks.codefix.model.DiagnosticKind;
import org.dxworks.codefix.model.FileResult;
import org.dxworks.codefix.model.RunSummary;
import org.dxworks.codefix.rewriter.FileOutcome;
import org.dxworks.codefix.rewriter.RewriteEngine;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String BOM = "\uFEFF";

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar codefix.jar <input-path> <report-file>");
            System.err.println("  <input-path>:  Source directory or single file to rewrite");
            System.err.println("  <report-file>: Path to output JSONL report");
            System.err.println("Rules are read from codefix-config.yml in the working directory");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path report = Paths.get(args[1]);
        if (report.getParent() != null) {
            Files.createDirectories(report.getParent());
        }

        CodefixConfig config;
        try {
            config = CodefixConfig.load();
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
            return;
        }

        System.out.println("Starting rewrite...");
        System.out.println("Input: " + input.toAbsolutePath());
        if (config.isDryRun()) {
            System.out.println("Dry run: no file will be written");
        }

        RunSummary summary = run(input, report, config);

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Rewrite complete!");
        System.out.println("Files scanned: " + summary.getFilesScanned());
        System.out.println("Files changed: " + summary.getFilesChanged());
        System.out.println("Total rewrites: " + summary.getTotalRewrites());
        if (summary.getDiagnostics() > 0) {
            System.out.println("Literals left untouched: " + summary.getDiagnostics());
        }
        if (summary.getFilesWithErrors() > 0) {
            System.out.println("Errors: " + summary.getFilesWithErrors());
            summary.getFailures().forEach((file, reason) -> System.out.println("  - " + file + ": " + reason));
        }
        System.out.println("Report written to: " + report.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    public static RunSummary run(Path input, Path report, CodefixConfig config) throws IOException {
        RewriteEngine engine = new RewriteEngine(config);
        BackupStore backups = new SuffixBackupStore(config.getBackupSuffix());
        FileCommitter committer = new FileCommitter();

        List<Path> files = new SourceCollector(config).collect(input);
        System.out.println("Found " + files.size() + " source files");

        Instant startTime = Instant.now();
        RunSummary summary = new RunSummary();
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(report, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            runInfo.put("dry_run", config.isDryRun());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            files.parallelStream().forEach(file -> {
                Optional<Language> langOpt = LanguageDetector.detectLanguage(file);
                if (langOpt.isEmpty() || !engine.handles(langOpt.get())) {
                    return;
                }

                Language language = langOpt.get();
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Rewriting "
                            + language.getName() + ": " + file.getFileName());
                }

                FileOutcome outcome;
                try {
                    outcome = rewriteFile(file, language, engine, backups, committer, config.isDryRun());
                } catch (Exception e) {
                    Map<String, String> error = new LinkedHashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("language", language.getName());
                    error.put("reason", failureReason(e));
                    error.put("error", e.getMessage());

                    try {
                        synchronized (writer) {
                            writer.write(MAPPER.writeValueAsString(error));
                            writer.newLine();
                            writer.flush();
                        }
                    } catch (IOException ioException) {
                        System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                    }

                    summary.recordFailure(file.toString(), e.getMessage());
                    synchronized (System.err) {
                        System.err.println("  Error rewriting " + file.getFileName() + ": " + e.getMessage());
                    }
                    return;
                }

                summary.recordScanned();
                summary.recordDiagnostics(outcome.getDiagnostics().size());
                if (outcome.isChanged()) {
                    summary.recordChanged(outcome.getRewriteCount());
                }
                printWarnings(file, outcome.getDiagnostics());

                if (outcome.isChanged() || !outcome.getDiagnostics().isEmpty()) {
                    writeResult(writer, file, toResult(outcome, outcome.isChanged() && !config.isDryRun()));
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_scanned", summary.getFilesScanned());
            doneInfo.put("files_changed", summary.getFilesChanged());
            doneInfo.put("total_rewrites", summary.getTotalRewrites());
            doneInfo.put("files_with_errors", summary.getFilesWithErrors());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        return summary;
    }

    /**
     * Rewrites one file. The whole new text is computed first; when it differs from the original
     * the backup is taken and only then is the file replaced.
     */
    public static FileOutcome rewriteFile(Path file, Language language, RewriteEngine engine,
                                          BackupStore backups, FileCommitter committer, boolean dryRun)
            throws IOException, BackupException {
        String raw = Files.readString(file, StandardCharsets.UTF_8);

        // BOM is not part of the source text but must survive the rewrite
        boolean hasBom = raw.startsWith(BOM);
        String source = hasBom ? raw.substring(1) : raw;

        FileOutcome outcome = engine.rewrite(file.toString(), language, source);
        if (outcome.isChanged() && !dryRun) {
            backups.backup(file, raw);
            committer.commit(file, (hasBom ? BOM : "") + outcome.getRewrittenText());
        }
        return outcome;
    }

    /**
     * Writes one file record. The file is already committed, so a report failure is printed and the
     * file is not counted as failed.
     */
    static void writeResult(BufferedWriter writer, Path file, FileResult result) {
        try {
            synchronized (writer) {
                writer.write(MAPPER.writeValueAsString(result));
                writer.newLine();
                writer.flush();
            }
        } catch (IOException e) {
            synchronized (System.err) {
                System.err.println("Failed to write result for " + file + ": " + e.getMessage());
            }
        }
    }

    private static FileResult toResult(FileOutcome outcome, boolean written) {
        FileResult result = new FileResult();
        result.filePath = outcome.getFilePath();
        result.language = outcome.getLanguage().getName();
        result.changed = outcome.isChanged();
        result.written = written;
        result.rewrites = outcome.getRewriteCount();
        result.literalRewrites = outcome.getLiteralRewrites();
        result.substitutions = outcome.getSubstitutions();
        result.insertedHelpers.addAll(outcome.getInsertedHelpers());
        result.diagnostics.addAll(outcome.getDiagnostics());
        return result;
    }

    private static String failureReason(Exception e) {
        if (e instanceof BackupException) return "backup";
        if (e instanceof IOException) return "io";
        return "internal";
    }

    private static void printWarnings(Path file, List<Diagnostic> diagnostics) {
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.kind == DiagnosticKind.UNTERMINATED_LITERAL
                    || diagnostic.kind == DiagnosticKind.PASS_LIMIT_REACHED) {
                synchronized (System.out) {
                    System.out.println("  Warning: " + file.getFileName() + ":" + diagnostic.line
                            + " " + diagnostic.message);
                }
            }
        }
    }
}
