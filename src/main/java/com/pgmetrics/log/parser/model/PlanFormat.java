package com.pgmetrics.log.parser.model;

/**
 * auto_explain.log_format values.
 */
public enum PlanFormat {
    TEXT("text"),
    JSON("json"),
    XML("xml"),
    YAML("yaml");

    PlanFormat(final String pName) {
        this.name = pName;
    }

    private final String name;

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
