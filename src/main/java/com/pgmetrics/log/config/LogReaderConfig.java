package com.pgmetrics.log.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import com.pgmetrics.log.parser.LogReader;

/**
 * Settings for reading server logs.
 *
 * <p>Properties understood by {@link #loadFromProperties}:
 * <ul>
 * <li>log_line_prefix: the server's log_line_prefix setting</li>
 * <li>log.span.minutes: how far back to read (default 5)</li>
 * <li>log.files: comma-separated list of log files</li>
 * <li>log.dir: directory holding log files</li>
 * </ul>
 */
public class LogReaderConfig {

    public static final int DEFAULT_SPAN_MINUTES = 5;

    public static final String SPAN_MINUTES = "log.span.minutes";
    public static final String FILES = "log.files";
    public static final String DIR = "log.dir";

    private final Map<String, String> settings = new HashMap<>();
    private int spanMinutes = DEFAULT_SPAN_MINUTES;
    private List<Path> files = new ArrayList<>();
    private Path logDir;

    public void load(Path file) throws IOException {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        }
        loadFromProperties(props);
    }

    public void loadFromProperties(Properties props) {
        String prefix = props.getProperty(LogReader.LOG_LINE_PREFIX);
        if (prefix != null) {
            settings.put(LogReader.LOG_LINE_PREFIX, prefix);
        }

        String span = props.getProperty(SPAN_MINUTES);
        if (span != null && !span.trim().isEmpty()) {
            setSpanMinutes(Integer.parseInt(span.trim()));
        }

        String fileList = props.getProperty(FILES);
        if (fileList != null && !fileList.trim().isEmpty()) {
            for (String f : fileList.split(",")) {
                String trimmed = f.trim();
                if (!trimmed.isEmpty()) {
                    files.add(Paths.get(trimmed));
                }
            }
        }

        String dir = props.getProperty(DIR);
        if (dir != null && !dir.trim().isEmpty()) {
            logDir = Paths.get(dir.trim());
        }
    }

    /**
     * Server settings keyed by name, as the reader expects them.
     */
    public Map<String, String> getSettings() {
        return new HashMap<>(settings);
    }

    public void setLogLinePrefix(String prefix) {
        settings.put(LogReader.LOG_LINE_PREFIX, prefix);
    }

    public int getSpanMinutes() {
        return spanMinutes;
    }

    public void setSpanMinutes(int spanMinutes) {
        if (spanMinutes <= 0) {
            throw new IllegalArgumentException("log span must be a positive number of minutes: " + spanMinutes);
        }
        this.spanMinutes = spanMinutes;
    }

    public List<Path> getFiles() {
        return new ArrayList<>(files);
    }

    public void addFile(Path file) {
        files.add(file);
    }

    public Path getLogDir() {
        return logDir;
    }

    public void setLogDir(Path logDir) {
        this.logDir = logDir;
    }
}
