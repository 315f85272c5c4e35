package com.pgmetrics.log.parser.extractor;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pgmetrics.log.parser.LogEntry;
import com.pgmetrics.log.parser.accumulator.LogFactsAccumulator;
import com.pgmetrics.log.parser.model.AutoVacuum;

/**
 * Completed autovacuum runs, logged when log_autovacuum_min_duration is
 * exceeded:
 *
 * <pre>
 * automatic vacuum of table "mydb.public.orders": index scans: 1
 *     pages: 0 removed, 45 remain, 0 skipped due to pins, 0 skipped frozen
 *     ...
 *     system usage: CPU: user: 0.01 s, system: 0.00 s, elapsed: 12.34 s
 * </pre>
 */
public class AutoVacuumExtractor implements EntryExtractor {

    private static final Logger logger = LoggerFactory.getLogger(AutoVacuumExtractor.class);

    static final Pattern START = Pattern.compile(
            "automatic (aggressive )?vacuum (to prevent wraparound )?of table \"([^\"]+)\": index");

    static final Pattern ELAPSED = Pattern.compile("elapsed: ([0-9.]+) s");

    @Override
    public boolean matches(LogEntry entry) {
        return START.matcher(entry.getLine()).find();
    }

    @Override
    public void extract(LogEntry entry, LogFactsAccumulator accumulator) {
        Matcher m = START.matcher(entry.getLine());
        if (!m.find()) {
            return;
        }
        String table = m.group(3);

        String elapsedText = findElapsed(entry);
        if (elapsedText == null) {
            logger.debug("No elapsed time in autovacuum entry for {}", table);
            return;
        }
        double elapsed;
        try {
            elapsed = Double.parseDouble(elapsedText);
        } catch (NumberFormatException e) {
            logger.debug("Bad elapsed time '{}' in autovacuum entry for {}", elapsedText, table);
            return;
        }
        accumulator.accumulate(new AutoVacuum(entry.getTimestamp().getEpochSecond(), table, elapsed));
    }

    private static String findElapsed(LogEntry entry) {
        Matcher m = ELAPSED.matcher(entry.getLine());
        if (m.find()) {
            return m.group(1);
        }
        for (LogEntry.Extra extra : entry.getExtras()) {
            m = ELAPSED.matcher(extra.getLine());
            if (m.find()) {
                return m.group(1);
            }
        }
        return null;
    }
}
