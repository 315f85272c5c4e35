package com.pgmetrics.log.prefix;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a PostgreSQL log_line_prefix into a {@link PrefixPattern}.
 *
 * <p>The prefix is first split into tokens by {@link PrefixParser}, then
 * rendered into a regular expression by {@link PrefixPatternRenderer}. A
 * prefix without %t, %m or %n is rejected because log entries cannot be
 * delimited without a timestamp.
 */
public class PrefixCompiler {

    private static final Logger logger = LoggerFactory.getLogger(PrefixCompiler.class);

    public static PrefixPattern compile(String prefix) throws LogConfigurationException {
        if (prefix == null) {
            throw new LogConfigurationException("log_line_prefix is not set");
        }

        List<PrefixToken> tokens = PrefixParser.parse(prefix);

        boolean hasT = false, hasM = false, hasN = false, hasUser = false, hasDatabase = false;
        for (PrefixToken token : tokens) {
            switch (token.getDirective()) {
                case 't': hasT = true; break;
                case 'm': hasM = true; break;
                case 'n': hasN = true; break;
                case 'u': hasUser = true; break;
                case 'd': hasDatabase = true; break;
                default: break;
            }
        }
        if (!hasT && !hasM && !hasN) {
            throw new LogConfigurationException("no timestamp escape sequence was found in log_line_prefix");
        }

        String regex = PrefixPatternRenderer.render(tokens);
        Pattern pattern;
        try {
            pattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new LogConfigurationException("log_line_prefix produced an invalid pattern: " + regex, e);
        }

        // an empty match would never advance past itself
        if (pattern.matcher("").matches()) {
            throw new LogConfigurationException("log_line_prefix can match empty text: " + prefix);
        }

        PrefixPattern compiled = new PrefixPattern(prefix, pattern, hasT, hasM, hasN, hasUser, hasDatabase);
        logger.debug("Compiled log_line_prefix {}", compiled);
        return compiled;
    }
}
