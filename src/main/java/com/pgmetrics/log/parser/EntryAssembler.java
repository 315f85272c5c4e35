package com.pgmetrics.log.parser;

import java.time.Instant;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pgmetrics.log.prefix.PrefixPattern;

/**
 * Turns log text into logical {@link LogEntry} objects.
 *
 * <p>Each prefix match starts a physical line which runs up to the next
 * match. A line whose level is one of the top-level severities starts a new
 * entry; any other line is appended to the entry in progress. An entry is
 * handed to the consumer when the next one starts or the text ends.
 */
public class EntryAssembler {

    private static final Logger logger = LoggerFactory.getLogger(EntryAssembler.class);

    static final Pattern LEVEL = Pattern.compile("^([A-Z]+):\\s+");

    static final Set<String> SEVERITIES = Set.of(
            "DEBUG", "LOG", "INFO", "NOTICE", "WARNING", "ERROR", "FATAL", "PANIC");

    /**
     * One prefixed line, with its level split off.
     */
    public static class LogLine {

        private final Instant timestamp;
        private final String user;
        private final String database;
        private final String level;
        private final String text;

        public LogLine(Instant timestamp, String user, String database, String level, String text) {
            this.timestamp = timestamp;
            this.user = user;
            this.database = database;
            this.level = level;
            this.text = text;
        }

        /**
         * Builds a line from the raw text following a prefix: drops one
         * trailing line terminator and splits off a leading "LEVEL:".
         */
        public static LogLine of(Instant timestamp, String user, String database, String raw) {
            String text = raw;
            if (text.endsWith("\n")) {
                text = text.substring(0, text.length() - 1);
                if (text.endsWith("\r")) {
                    text = text.substring(0, text.length() - 1);
                }
            }
            String level = "";
            Matcher m = LEVEL.matcher(text);
            if (m.lookingAt()) {
                level = m.group(1);
                text = text.substring(m.end());
            }
            return new LogLine(timestamp, user, database, level, text);
        }

        public Instant getTimestamp() {
            return timestamp;
        }

        public String getUser() {
            return user;
        }

        public String getDatabase() {
            return database;
        }

        public String getLevel() {
            return level;
        }

        public String getText() {
            return text;
        }

        public boolean startsEntry() {
            return SEVERITIES.contains(level);
        }
    }

    /**
     * Folds one line into the entry in progress and returns the entry in
     * progress afterwards. When the line starts a new entry the previous one
     * is sealed and passed to {@code sealed}. A continuation line with no
     * entry in progress is dropped.
     */
    public static LogEntry step(LogEntry current, LogLine line, Consumer<LogEntry> sealed) {
        if (line.startsEntry()) {
            if (current != null) {
                sealed.accept(current);
            }
            return new LogEntry(line.getTimestamp(), line.getUser(), line.getDatabase(),
                    line.getLevel(), line.getText());
        }
        if (current != null) {
            current.addExtra(line.getLevel(), line.getText());
        }
        return current;
    }

    /**
     * Assembles all entries in {@code text} whose lines are not older than
     * {@code start}. Stops quietly at the first timestamp that cannot be
     * decoded; entries sealed before that point have already been delivered.
     *
     * @return the number of lines inside the window
     */
    public static int assemble(CharSequence text, PrefixPattern prefix, Instant start, Consumer<LogEntry> sink) {
        Matcher m = prefix.matcher(text);
        if (!m.find()) {
            return 0;
        }

        LogEntry current = null;
        int count = 0;
        boolean more = true;
        while (more) {
            Instant t;
            try {
                t = TimestampDecoder.decode(m, prefix);
            } catch (TimestampDecodeException e) {
                logger.debug("Stopping log read at offset {}: {}", m.start(), e.getMessage());
                return count;
            }
            String user = prefix.user(m);
            String db = prefix.database(m);
            int lineStart = m.end();

            more = m.find();
            int lineEnd = more ? m.start() : text.length();

            // lines without a timestamp are dropped along with those before the window
            if (t != null && !t.isBefore(start)) {
                LogLine line = LogLine.of(t, user, db, text.subSequence(lineStart, lineEnd).toString());
                current = step(current, line, sink);
                count++;
            }
        }

        if (current != null) {
            sink.accept(current);
        }
        return count;
    }
}
