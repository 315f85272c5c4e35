package com.pgmetrics.log.prefix;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Renders prefix tokens into a java.util.regex pattern string. Timestamp,
 * user and database directives become named groups of the same name as the
 * directive letter.
 */
public class PrefixPatternRenderer {

    static final String TIMESTAMP = "\\d{4}-\\d{1,2}-\\d{1,2} \\d{2}:\\d{2}:\\d{2} \\S+";
    static final String TIMESTAMP_MILLIS = "\\d{4}-\\d{1,2}-\\d{1,2} \\d{2}:\\d{2}:\\d{2}\\.\\d+ \\S+";
    static final String EPOCH = "\\d+\\.\\d+";
    static final String NAME = "[A-Za-z0-9_.\\[\\]-]{1,64}";

    public static String render(List<PrefixToken> tokens) {
        StringBuilder sb = new StringBuilder();
        Set<Character> named = new HashSet<>();
        int openGroups = 0;

        for (PrefixToken token : tokens) {
            switch (token.getKind()) {
                case LITERAL:
                    sb.append(quote(token.getText()));
                    break;
                case TIMESTAMP:
                    sb.append(group(named, token.getDirective(), timestampPattern(token.getDirective())));
                    break;
                case FIELD:
                    sb.append(group(named, token.getDirective(), NAME));
                    break;
                case PROCESS_START:
                    sb.append(TIMESTAMP);
                    break;
                case OPTIONAL_START:
                    sb.append("(?:");
                    openGroups++;
                    break;
                default:
                    sb.append("(\\S+)?");
                    break;
            }
        }

        for (int i = 0; i < openGroups; i++) {
            sb.append(")?");
        }
        return sb.toString();
    }

    private static String timestampPattern(char directive) {
        switch (directive) {
            case 'm':
                return TIMESTAMP_MILLIS;
            case 'n':
                return EPOCH;
            default:
                return TIMESTAMP;
        }
    }

    // a repeated directive is matched again but only the first one is captured
    private static String group(Set<Character> named, char name, String body) {
        if (!named.add(name)) {
            return "(?:" + body + ")";
        }
        return "(?<" + name + ">" + body + ")";
    }

    /**
     * Escapes every character that is not a letter, digit or space, so
     * the text only ever matches itself.
     */
    static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() * 2);
        text.codePoints().forEach(cp -> {
            if (!Character.isLetterOrDigit(cp) && cp != ' ') {
                sb.append('\\');
            }
            sb.appendCodePoint(cp);
        });
        return sb.toString();
    }
}
