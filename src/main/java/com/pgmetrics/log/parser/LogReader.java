package com.pgmetrics.log.parser;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pgmetrics.log.parser.accumulator.LogFactsAccumulator;
import com.pgmetrics.log.parser.extractor.EntryClassifier;
import com.pgmetrics.log.prefix.LogConfigurationException;
import com.pgmetrics.log.prefix.PrefixCompiler;
import com.pgmetrics.log.prefix.PrefixPattern;

/**
 * Reads the last few minutes of PostgreSQL log files and collects the
 * auto_explain plans, autovacuum runs and deadlocks found there.
 *
 * <p>Problems with the configuration or the files are logged and skipped;
 * the methods of this class that take a settings map never throw. Facts from
 * a file are only added to the caller's accumulator once that file has been
 * read completely.
 */
public class LogReader {

    static final Logger logger = LoggerFactory.getLogger(LogReader.class);

    public static final String LOG_LINE_PREFIX = "log_line_prefix";

    private final Clock clock;

    public LogReader() {
        this(Clock.systemUTC());
    }

    public LogReader(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return true if the file was read
     */
    public boolean readLog(Map<String, String> settings, int spanMinutes, Path file, LogFactsAccumulator sink) {
        return readLogs(settings, spanMinutes, List.of(file), sink) == 1;
    }

    /**
     * Reads each file in turn with the same compiled prefix. A file that
     * cannot be read does not stop the others.
     *
     * @return the number of files read
     */
    public int readLogs(Map<String, String> settings, int spanMinutes, List<Path> files, LogFactsAccumulator sink) {
        String prefix = settings.get(LOG_LINE_PREFIX);
        if (prefix == null) {
            logger.warn("failed to get log_line_prefix setting, cannot read log file");
            return 0;
        }

        PrefixPattern pattern;
        try {
            pattern = PrefixCompiler.compile(prefix);
        } catch (LogConfigurationException e) {
            logger.warn("Cannot read log files: {}", e.getMessage());
            return 0;
        }

        Instant start = windowStart(spanMinutes);
        int successfulFiles = 0;
        for (Path file : files) {
            LogFactsAccumulator facts = new LogFactsAccumulator();
            try {
                int lines = readLogLines(file, pattern, start, facts);
                sink.accumulate(facts);
                successfulFiles++;
                logger.info("Read {} log lines from {}: {} plans, {} autovacuums, {} deadlocks", lines, file,
                        facts.getPlans().size(), facts.getAutoVacuums().size(), facts.getDeadlocks().size());
            } catch (IOException e) {
                logger.warn("Failed to read log file {}: {}", file, e.toString());
            }
        }
        return successfulFiles;
    }

    public Instant windowStart(int spanMinutes) {
        return clock.instant().minus(Duration.ofMinutes(spanMinutes));
    }

    /**
     * Reads {@code file} from just before {@code start} to its end and
     * classifies every entry in the window into {@code facts}.
     *
     * @return the number of log lines inside the window
     */
    public static int readLogLines(Path file, PrefixPattern prefix, Instant start, LogFactsAccumulator facts)
            throws IOException {
        String text;
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "r")) {
            long length = raf.length();
            if (length <= 0) {
                return 0;
            }
            long ofs = WindowLocator.locate(raf, length, prefix, start);

            long size = length - ofs;
            if (size > Integer.MAX_VALUE - 8) {
                throw new IOException("log window of " + size + " bytes is too large to read");
            }
            byte[] buf = new byte[(int) size];
            raf.seek(ofs);
            raf.readFully(buf);
            text = new String(buf, StandardCharsets.UTF_8);
        }

        EntryClassifier classifier = new EntryClassifier(facts);
        return EntryAssembler.assemble(text, prefix, start, classifier::classify);
    }
}
