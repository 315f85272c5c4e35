package com.pgmetrics.log.parser.extractor;

import com.pgmetrics.log.parser.LogEntry;
import com.pgmetrics.log.parser.accumulator.LogFactsAccumulator;

/**
 * Recognises one kind of log entry and turns it into a fact.
 */
public interface EntryExtractor {

    boolean matches(LogEntry entry);

    /**
     * Called only for entries accepted by {@link #matches}. May add nothing
     * when the entry lacks the details the fact needs.
     */
    void extract(LogEntry entry, LogFactsAccumulator accumulator);
}
