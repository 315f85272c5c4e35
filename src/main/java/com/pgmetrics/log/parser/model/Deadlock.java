package com.pgmetrics.log.parser.model;

import java.util.Objects;

public class Deadlock {

    private final long at;
    private final String detail;

    public Deadlock(long at, String detail) {
        this.at = at;
        this.detail = detail;
    }

    public long getAt() {
        return at;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Deadlock other = (Deadlock) o;
        return at == other.at && Objects.equals(detail, other.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(at, detail);
    }

    @Override
    public String toString() {
        return "Deadlock[at=" + at + "]";
    }
}
