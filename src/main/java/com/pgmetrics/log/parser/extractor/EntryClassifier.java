package com.pgmetrics.log.parser.extractor;

import java.util.List;

import com.pgmetrics.log.parser.LogEntry;
import com.pgmetrics.log.parser.accumulator.LogFactsAccumulator;

/**
 * Runs each sealed entry past the extractors in priority order; the first
 * one that matches handles it.
 */
public class EntryClassifier {

    private final List<EntryExtractor> extractors;
    private final LogFactsAccumulator accumulator;

    public EntryClassifier(LogFactsAccumulator accumulator) {
        this(accumulator, List.of(new AutoExplainExtractor(), new AutoVacuumExtractor(), new DeadlockExtractor()));
    }

    public EntryClassifier(LogFactsAccumulator accumulator, List<EntryExtractor> extractors) {
        this.accumulator = accumulator;
        this.extractors = extractors;
    }

    /**
     * @return true if one of the extractors recognised the entry
     */
    public boolean classify(LogEntry entry) {
        for (EntryExtractor extractor : extractors) {
            if (extractor.matches(entry)) {
                extractor.extract(entry, accumulator);
                return true;
            }
        }
        return false;
    }
}
