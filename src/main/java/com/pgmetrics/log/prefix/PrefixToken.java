package com.pgmetrics.log.prefix;

import java.util.Objects;

/**
 * One element of a parsed log_line_prefix: either literal text or a single
 * %-directive.
 */
public class PrefixToken {

    public enum Kind {
        /** Text copied verbatim from the prefix. */
        LITERAL,
        /** %t, %m or %n. */
        TIMESTAMP,
        /** %u or %d. */
        FIELD,
        /** %s, matched but not captured. */
        PROCESS_START,
        /** %q, everything after it is optional. */
        OPTIONAL_START,
        /** Any other directive, matched as one optional run of non-whitespace. */
        OTHER
    }

    private final Kind kind;
    private final char directive;
    private final String text;

    private PrefixToken(Kind kind, char directive, String text) {
        this.kind = kind;
        this.directive = directive;
        this.text = text;
    }

    public static PrefixToken literal(String text) {
        return new PrefixToken(Kind.LITERAL, '\0', text);
    }

    public static PrefixToken directive(Kind kind, char directive) {
        return new PrefixToken(kind, directive, null);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The directive character (t, m, n, u, d ...) or NUL for literals.
     */
    public char getDirective() {
        return directive;
    }

    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PrefixToken that = (PrefixToken) o;
        return kind == that.kind && directive == that.directive && Objects.equals(text, that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, directive, text);
    }

    @Override
    public String toString() {
        return kind == Kind.LITERAL ? "'" + text + "'" : "%" + directive;
    }
}
