package com.pgmetrics.log.parser.model;

import java.util.Objects;

public class AutoVacuum {

    private final long at;
    private final String table;
    private final double elapsed;

    public AutoVacuum(long at, String table, double elapsed) {
        this.at = at;
        this.table = table;
        this.elapsed = elapsed;
    }

    public long getAt() {
        return at;
    }

    public String getTable() {
        return table;
    }

    /**
     * Wall clock duration of the run, in seconds.
     */
    public double getElapsed() {
        return elapsed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AutoVacuum other = (AutoVacuum) o;
        return at == other.at && Double.compare(elapsed, other.elapsed) == 0 && Objects.equals(table, other.table);
    }

    @Override
    public int hashCode() {
        return Objects.hash(at, table, elapsed);
    }

    @Override
    public String toString() {
        return String.format("AutoVacuum[%s %.2fs at=%d]", table, elapsed, at);
    }
}
