package com.pgmetrics.log.prefix;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a PostgreSQL log_line_prefix into literal and directive tokens.
 * Adjacent literal characters are merged into one token.
 */
public class PrefixParser {

    public static List<PrefixToken> parse(String prefix) {
        List<PrefixToken> tokens = new ArrayList<>();
        StringBuilder literal = new StringBuilder();

        for (int i = 0; i < prefix.length(); i++) {
            char c = prefix.charAt(i);
            if (c != '%') {
                literal.append(c);
                continue;
            }
            // postgres ignores a dangling % at the end
            if (i + 1 >= prefix.length()) {
                break;
            }
            char d = prefix.charAt(++i);
            if (d == '%') {
                literal.append('%');
                continue;
            }
            if (literal.length() > 0) {
                tokens.add(PrefixToken.literal(literal.toString()));
                literal.setLength(0);
            }
            tokens.add(PrefixToken.directive(kindOf(d), d));
        }

        if (literal.length() > 0) {
            tokens.add(PrefixToken.literal(literal.toString()));
        }
        return tokens;
    }

    static PrefixToken.Kind kindOf(char directive) {
        switch (directive) {
            case 't':
            case 'm':
            case 'n':
                return PrefixToken.Kind.TIMESTAMP;
            case 'u':
            case 'd':
                return PrefixToken.Kind.FIELD;
            case 's':
                return PrefixToken.Kind.PROCESS_START;
            case 'q':
                return PrefixToken.Kind.OPTIONAL_START;
            default:
                return PrefixToken.Kind.OTHER;
        }
    }
}
