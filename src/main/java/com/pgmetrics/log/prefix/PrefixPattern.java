package com.pgmetrics.log.prefix;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A compiled log_line_prefix together with the directives it captures.
 */
public class PrefixPattern {

    private final String prefix;
    private final Pattern pattern;
    private final boolean hasT;
    private final boolean hasM;
    private final boolean hasN;
    private final boolean hasUser;
    private final boolean hasDatabase;

    PrefixPattern(String prefix, Pattern pattern, boolean hasT, boolean hasM, boolean hasN,
            boolean hasUser, boolean hasDatabase) {
        this.prefix = prefix;
        this.pattern = pattern;
        this.hasT = hasT;
        this.hasM = hasM;
        this.hasN = hasN;
        this.hasUser = hasUser;
        this.hasDatabase = hasDatabase;
    }

    public Matcher matcher(CharSequence input) {
        return pattern.matcher(input);
    }

    public boolean hasT() {
        return hasT;
    }

    public boolean hasM() {
        return hasM;
    }

    public boolean hasN() {
        return hasN;
    }

    public boolean hasUser() {
        return hasUser;
    }

    /**
     * Value of the user group of a successful match, or empty if the prefix
     * has no %u or it did not participate.
     */
    public String user(Matcher m) {
        return groupOrEmpty(m, hasUser, "u");
    }

    public String database(Matcher m) {
        return groupOrEmpty(m, hasDatabase, "d");
    }

    private static String groupOrEmpty(Matcher m, boolean present, String name) {
        if (!present) {
            return "";
        }
        String value = m.group(name);
        return value != null ? value : "";
    }

    @Override
    public String toString() {
        return prefix + " -> " + pattern.pattern();
    }
}
