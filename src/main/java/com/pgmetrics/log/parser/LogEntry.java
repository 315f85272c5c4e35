package com.pgmetrics.log.parser;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A logical log entry: the line that started it plus the continuation lines
 * (DETAIL, CONTEXT, STATEMENT ...) that followed it.
 */
public class LogEntry {

    private final Instant timestamp;
    private final String user;
    private final String database;
    private final String level;
    private final String line;
    private final List<Extra> extras = new ArrayList<>();

    public LogEntry(Instant timestamp, String user, String database, String level, String line) {
        this.timestamp = timestamp;
        this.user = user;
        this.database = database;
        this.level = level;
        this.line = line;
    }

    public void addExtra(String level, String line) {
        extras.add(new Extra(level, line));
    }

    /**
     * Text of the first continuation line with the given level, or empty.
     */
    public String get(String level) {
        for (Extra e : extras) {
            if (e.getLevel().equals(level)) {
                return e.getLine();
            }
        }
        return "";
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

    public String getLine() {
        return line;
    }

    public List<Extra> getExtras() {
        return Collections.unmodifiableList(extras);
    }

    @Override
    public String toString() {
        return String.format("%s [%s@%s] %s: %s (+%d)", timestamp, user, database, level, line, extras.size());
    }

    public static class Extra {

        private final String level;
        private final String line;

        public Extra(String level, String line) {
            this.level = level;
            this.line = line;
        }

        public String getLevel() {
            return level;
        }

        public String getLine() {
            return line;
        }
    }
}
