package com.pgmetrics.log.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pgmetrics.log.config.LogReaderConfig;
import com.pgmetrics.log.parser.accumulator.LogFactsAccumulator;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Command line front end for {@link LogReader}.
 */
@Command(name = "pgLogReader", mixinStandardHelpOptions = true, version = "1.0",
         description = "Extract auto_explain plans, autovacuum runs and deadlocks from the recent part of PostgreSQL log files")
public class LogReaderApp implements Callable<Integer> {

    static final Logger logger = LoggerFactory.getLogger(LogReaderApp.class);

    @Option(names = { "-f", "--files" }, description = "PostgreSQL log file(s)", arity = "1..*")
    private List<String> fileNames = new ArrayList<>();

    @Option(names = { "--log-dir" }, description = "Read all files in this directory modified within the span")
    private String logDir;

    @Option(names = { "--prefix" }, description = "The server's log_line_prefix setting")
    private String prefix;

    @Option(names = { "--config" }, description = "Properties file with log_line_prefix, log.span.minutes, log.files, log.dir")
    private String configFile;

    @Option(names = { "--span" }, description = "Minutes of log to read (default: 5)")
    private Integer spanMinutes;

    @Option(names = { "--json" }, description = "JSON output file")
    private String jsonOutputFile;

    @Option(names = { "--text" }, description = "Print a text report to the console")
    private boolean textOutput = false;

    private final LogReader reader;

    public LogReaderApp() {
        this(new LogReader());
    }

    LogReaderApp(LogReader reader) {
        this.reader = reader;
    }

    @Override
    public Integer call() throws Exception {
        LogReaderConfig config = loadConfiguration();

        Instant start = reader.windowStart(config.getSpanMinutes());
        List<Path> files = config.getFiles();
        if (config.getLogDir() != null) {
            files.addAll(filesModifiedSince(config.getLogDir(), start));
        }
        if (files.isEmpty()) {
            System.err.println("No log files to read");
            return 1;
        }

        LogFactsAccumulator facts = new LogFactsAccumulator();
        int successfulFiles = reader.readLogs(config.getSettings(), config.getSpanMinutes(), files, facts);
        if (successfulFiles == 0) {
            System.err.println("No files were successfully read");
            return 1;
        }

        if (textOutput) {
            facts.report();
        }
        if (jsonOutputFile != null) {
            JsonReportGenerator.generateReport(jsonOutputFile, facts, start);
            System.out.println("JSON report written to " + jsonOutputFile);
        }
        return 0;
    }

    LogReaderConfig loadConfiguration() throws IOException {
        LogReaderConfig config = new LogReaderConfig();
        if (configFile != null) {
            config.load(Paths.get(configFile));
            logger.info("Loaded configuration from: {}", configFile);
        }
        if (prefix != null) {
            config.setLogLinePrefix(prefix);
        }
        if (spanMinutes != null) {
            config.setSpanMinutes(spanMinutes);
        }
        for (String f : fileNames) {
            config.addFile(Paths.get(f));
        }
        if (logDir != null) {
            config.setLogDir(Paths.get(logDir));
        }
        return config;
    }

    /**
     * Regular files in {@code dir} last modified at or after {@code since},
     * in name order.
     */
    static List<Path> filesModifiedSince(Path dir, Instant since) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        try {
                            return !Files.getLastModifiedTime(p).toInstant().isBefore(since);
                        } catch (IOException e) {
                            logger.warn("Skipping {}: {}", p, e.getMessage());
                            return false;
                        }
                    })
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LogReaderApp()).execute(args);
        System.exit(exitCode);
    }
}
