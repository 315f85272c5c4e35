package com.pgmetrics.log.parser;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalQueries;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pgmetrics.log.prefix.PrefixPattern;

/**
 * Decodes the timestamp captured by a prefix match. %m is preferred over %t,
 * and %t over %n, when a prefix carries more than one of them.
 */
public class TimestampDecoder {

    private static final Logger logger = LoggerFactory.getLogger(TimestampDecoder.class);

    private static final DateTimeFormatter DATE_TIME = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-M-d HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .toFormatter(Locale.ENGLISH);

    private static final DateTimeFormatter ZONE_NAME = DateTimeFormatter.ofPattern("z", Locale.ENGLISH);

    // postgres prints a bare offset when the zone has no abbreviation, e.g. "+03"
    private static final Pattern NUMERIC_OFFSET = Pattern.compile("[+-]\\d{2}(:?\\d{2})?");

    /**
     * Returns the instant of a successful prefix match, or null when none of
     * the timestamp groups took part in the match.
     */
    public static Instant decode(Matcher match, PrefixPattern prefix) throws TimestampDecodeException {
        String text = group(match, prefix.hasM(), "m");
        if (text != null) {
            return parseDateTime(text);
        }
        text = group(match, prefix.hasT(), "t");
        if (text != null) {
            return parseDateTime(text);
        }
        text = group(match, prefix.hasN(), "n");
        if (text != null) {
            return parseEpoch(text);
        }
        return null;
    }

    private static String group(Matcher match, boolean present, String name) {
        if (!present) {
            return null;
        }
        String value = match.group(name);
        return value == null || value.isEmpty() ? null : value;
    }

    /**
     * Parses "YYYY-MM-DD HH:MM:SS[.fff] ZONE".
     */
    static Instant parseDateTime(String text) throws TimestampDecodeException {
        int space = text.lastIndexOf(' ');
        if (space <= 0) {
            throw new TimestampDecodeException("bad time format in log line: " + text);
        }
        try {
            LocalDateTime local = LocalDateTime.parse(text.substring(0, space), DATE_TIME);
            return local.atZone(zone(text.substring(space + 1))).toInstant();
        } catch (DateTimeException e) {
            throw new TimestampDecodeException("bad time format in log line: " + text, e);
        }
    }

    static ZoneId zone(String name) {
        if (NUMERIC_OFFSET.matcher(name).matches()) {
            return ZoneOffset.of(name);
        }
        try {
            return ZONE_NAME.parse(name, TemporalQueries.zone());
        } catch (DateTimeException e) {
            // unknown abbreviations are taken as UTC
            logger.trace("Unknown time zone '{}', assuming UTC", name);
            return ZoneOffset.UTC;
        }
    }

    /**
     * Parses "seconds.fraction" since the Unix epoch.
     */
    static Instant parseEpoch(String text) throws TimestampDecodeException {
        String[] parts = text.split("\\.", -1);
        if (parts.length > 2) {
            throw new TimestampDecodeException("wrong %n format in log line: " + text);
        }
        try {
            long seconds = Long.parseLong(parts[0]);
            long nanos = 0;
            if (parts.length == 2) {
                String fraction = parts[1];
                if (fraction.isEmpty() || !fraction.chars().allMatch(Character::isDigit)) {
                    throw new TimestampDecodeException("bad time format in log line: " + text);
                }
                nanos = Long.parseLong((fraction + "000000000").substring(0, 9));
            }
            return Instant.ofEpochSecond(seconds, nanos);
        } catch (NumberFormatException | DateTimeException e) {
            throw new TimestampDecodeException("bad time format in log line: " + text, e);
        }
    }
}
