package com.pgmetrics.log.parser.accumulator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.pgmetrics.log.parser.model.AutoVacuum;
import com.pgmetrics.log.parser.model.Deadlock;
import com.pgmetrics.log.parser.model.Plan;

/**
 * Collects the plans, autovacuum runs and deadlocks extracted from the log
 * during one collection cycle. Facts are kept in the order they were found.
 */
public class LogFactsAccumulator {

    private final List<Plan> plans = new ArrayList<>();
    private final List<AutoVacuum> autoVacuums = new ArrayList<>();
    private final List<Deadlock> deadlocks = new ArrayList<>();

    public void accumulate(Plan plan) {
        plans.add(plan);
    }

    public void accumulate(AutoVacuum autoVacuum) {
        autoVacuums.add(autoVacuum);
    }

    public void accumulate(Deadlock deadlock) {
        deadlocks.add(deadlock);
    }

    /**
     * Appends everything collected by another accumulator, keeping its order.
     */
    public void accumulate(LogFactsAccumulator other) {
        plans.addAll(other.plans);
        autoVacuums.addAll(other.autoVacuums);
        deadlocks.addAll(other.deadlocks);
    }

    public List<Plan> getPlans() {
        return Collections.unmodifiableList(plans);
    }

    public List<AutoVacuum> getAutoVacuums() {
        return Collections.unmodifiableList(autoVacuums);
    }

    public List<Deadlock> getDeadlocks() {
        return Collections.unmodifiableList(deadlocks);
    }

    public boolean isEmpty() {
        return plans.isEmpty() && autoVacuums.isEmpty() && deadlocks.isEmpty();
    }

    public void report() {
        if (isEmpty()) {
            System.out.println("No plans, autovacuum runs or deadlocks found in logs");
            return;
        }

        System.out.println("\n=== Log Summary ===");
        System.out.println(String.format("Plans: %,d  AutoVacuums: %,d  Deadlocks: %,d",
                plans.size(), autoVacuums.size(), deadlocks.size()));

        if (!plans.isEmpty()) {
            System.out.println("\n=== Captured Plans ===");
            System.out.println(String.format("%-25s %-20s %-20s %-6s %s", "At", "Database", "User", "Format", "Query"));
            System.out.println("=".repeat(100));
            for (Plan p : plans) {
                System.out.println(String.format("%-25s %-20s %-20s %-6s %s",
                        Instant.ofEpochSecond(p.getAt()), p.getDatabase(), p.getUserName(), p.getFormat(),
                        truncate(p.getQuery(), 60)));
            }
        }

        if (!autoVacuums.isEmpty()) {
            System.out.println("\n=== AutoVacuum Runs ===");
            System.out.println(String.format("%-25s %-50s %12s", "At", "Table", "ElapsedSec"));
            System.out.println("=".repeat(89));
            for (AutoVacuum av : autoVacuums) {
                System.out.println(String.format("%-25s %-50s %12.2f",
                        Instant.ofEpochSecond(av.getAt()), truncate(av.getTable(), 50), av.getElapsed()));
            }
        }

        if (!deadlocks.isEmpty()) {
            System.out.println("\n=== Deadlocks ===");
            for (Deadlock d : deadlocks) {
                System.out.println(Instant.ofEpochSecond(d.getAt()));
                System.out.print(d.getDetail());
            }
        }
    }

    private static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        String flat = s.replace('\n', ' ').trim();
        return flat.length() <= max ? flat : flat.substring(0, max - 3) + "...";
    }
}
