package com.pgmetrics.log.parser.model;

import java.util.Objects;

/**
 * An execution plan captured by auto_explain.
 */
public class Plan {

    private final String database;
    private final String userName;
    private final PlanFormat format;
    private final long at;
    private final String query;
    private final String plan;

    public Plan(String database, String userName, PlanFormat format, long at, String query, String plan) {
        this.database = database;
        this.userName = userName;
        this.format = format;
        this.at = at;
        this.query = query;
        this.plan = plan;
    }

    public String getDatabase() {
        return database;
    }

    public String getUserName() {
        return userName;
    }

    public PlanFormat getFormat() {
        return format;
    }

    /**
     * Seconds since the Unix epoch.
     */
    public long getAt() {
        return at;
    }

    public String getQuery() {
        return query;
    }

    /**
     * The plan body; empty for xml and yaml output.
     */
    public String getPlan() {
        return plan;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Plan other = (Plan) o;
        return at == other.at &&
               format == other.format &&
               Objects.equals(database, other.database) &&
               Objects.equals(userName, other.userName) &&
               Objects.equals(query, other.query) &&
               Objects.equals(plan, other.plan);
    }

    @Override
    public int hashCode() {
        return Objects.hash(database, userName, format, at, query, plan);
    }

    @Override
    public String toString() {
        return String.format("Plan[%s@%s %s at=%d]", userName, database, format, at);
    }
}
