package com.pgmetrics.log.parser.extractor;

import com.pgmetrics.log.parser.LogEntry;
import com.pgmetrics.log.parser.accumulator.LogFactsAccumulator;
import com.pgmetrics.log.parser.model.Deadlock;

/**
 * "ERROR:  deadlock detected" followed by a DETAIL line naming the
 * processes involved. Only the first DETAIL line is used.
 */
public class DeadlockExtractor implements EntryExtractor {

    static final String DEADLOCK_DETECTED = "deadlock detected";

    @Override
    public boolean matches(LogEntry entry) {
        return DEADLOCK_DETECTED.equals(entry.getLine());
    }

    @Override
    public void extract(LogEntry entry, LogFactsAccumulator accumulator) {
        String detail = entry.get("DETAIL").replace("\t", "") + "\n";
        accumulator.accumulate(new Deadlock(entry.getTimestamp().getEpochSecond(), detail));
    }
}
