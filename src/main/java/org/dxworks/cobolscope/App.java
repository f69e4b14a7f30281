package org.dxworks.cobolscope;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.cobolscope.analytics.CodebaseAnalytics;
import org.dxworks.cobolscope.diagnostic.Diagnostic;
import org.dxworks.cobolscope.index.CodeIndex;
import org.dxworks.cobolscope.ingest.IngestionBatch;
import org.dxworks.cobolscope.ingest.IngestionResult;
import org.dxworks.cobolscope.ingest.IngestionService;
import org.dxworks.cobolscope.ingest.IngestionStatus;
import org.dxworks.cobolscope.ingest.SourceCollector;
import org.dxworks.cobolscope.source.SourceUnit;
import org.dxworks.cobolscope.store.CanonicalJson;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

public class App {
    private static final ObjectMapper MAPPER = CanonicalJson.mapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar cobolscope.jar <input-folder> <output-file> [--copybooks <dir>]... [--cache <dir>]");
            System.err.println("  <input-folder>: Path to COBOL source directory or file");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.err.println("  --copybooks:    Additional COPY member search directory (repeatable)");
            System.err.println("  --cache:        Directory for persisted program models");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        CobolScopeConfig config;
        try {
            config = configure(CobolScopeConfig.load(), input, args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(2);
            return;
        }

        System.out.println("Starting COBOL analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        List<SourceUnit> units = new SourceCollector(config).collect(input);
        System.out.println("Found " + units.size() + " source files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger unchangedCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        CodeIndex index = new CodeIndex();
        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8);
             IngestionService ingestion = IngestionService.fromConfig(config, index)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", units.size());
            runInfo.put("dialect", config.getDialect().getExtensions());
            writeRecord(writer, runInfo);

            IngestionBatch batch = ingestion.submit(units);
            Runtime.getRuntime().addShutdownHook(new Thread(batch::cancel));
            batch.await(result -> {
                int current = progressCounter.incrementAndGet();
                System.out.println("[" + current + "/" + units.size() + "] " + result.getStatus() + ": "
                        + result.getUnitId());
                try {
                    if (result.isSuccess()) {
                        writeRecord(writer, modelRecord(result));
                        if (result.getStatus() == IngestionStatus.UNCHANGED) {
                            unchangedCount.incrementAndGet();
                        } else {
                            successCount.incrementAndGet();
                        }
                    } else {
                        writeRecord(writer, errorRecord(result));
                        errorCount.incrementAndGet();
                        System.err.println("  Error analyzing " + result.getUnitId() + ": " + result.getMessage());
                    }
                } catch (IOException e) {
                    System.err.println("Failed to write result for " + result.getUnitId() + ": " + e.getMessage());
                }
            });

            writeRecord(writer, new CodebaseAnalytics(index).report());

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_analyzed", successCount.get());
            doneInfo.put("files_unchanged", unchangedCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writeRecord(writer, doneInfo);
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Successfully analyzed: " + (successCount.get() + unchangedCount.get()) + " files");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    static CobolScopeConfig configure(CobolScopeConfig base, Path input, String[] args) {
        List<Path> copybookPaths = new ArrayList<>(base.getCopybookPaths());
        CobolScopeConfig config = base;
        for (int i = 2; i < args.length; i++) {
            switch (args[i]) {
                case "--copybooks":
                    copybookPaths.add(Paths.get(requireValue(args, ++i, "--copybooks")));
                    break;
                case "--cache":
                    config = config.withCacheDirectory(Paths.get(requireValue(args, ++i, "--cache")));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        // members sitting next to the programs are found without extra options
        Path inputDir = Files.isDirectory(input) ? input : input.toAbsolutePath().getParent();
        if (inputDir != null && !copybookPaths.contains(inputDir)) {
            copybookPaths.add(inputDir);
        }
        return config.withCopybookPaths(copybookPaths);
    }

    private static String requireValue(String[] args, int i, String option) {
        if (i >= args.length) {
            throw new IllegalArgumentException(option + " requires a directory");
        }
        return args[i];
    }

    private static Map<String, Object> modelRecord(IngestionResult result) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("kind", "model");
        record.put("unit", result.getUnitId());
        record.put("status", result.getStatus().name());
        record.put("model", result.getModel().orElseThrow());
        return record;
    }

    private static Map<String, Object> errorRecord(IngestionResult result) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("kind", "error");
        error.put("file", result.getUnitId());
        error.put("language", "cobol");
        error.put("error", result.getMessage());
        error.put("diagnostics", result.getDiagnostics().stream()
                .map(Diagnostic::toString)
                .collect(Collectors.toList()));
        return error;
    }

    private static void writeRecord(BufferedWriter writer, Object record) throws IOException {
        synchronized (writer) {
            writer.write(MAPPER.writeValueAsString(record));
            writer.newLine();
            writer.flush();
        }
    }
}
