package com.simforge.orchestrator.service;

import com.simforge.orchestrator.model.StageName;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered stage-key → elapsed-seconds accumulator for one job.
 *
 * The initial attempt uses the plain stage key; refinement iteration n uses
 * {@code iteration_n/<key>}. Failed attempts of a stage add to the same key.
 * Confined to the job's thread.
 */
public class StageTimings {

    private final Map<String, Double> seconds = new LinkedHashMap<>();

    public static String key(int iteration, StageName stage) {
        return iteration == 0 ? stage.key() : "iteration_" + iteration + "/" + stage.key();
    }

    public void record(int iteration, StageName stage, Duration elapsed) {
        seconds.merge(key(iteration, stage), elapsed.toNanos() / 1_000_000_000d, Double::sum);
    }

    public Map<String, Double> snapshot() {
        return new LinkedHashMap<>(seconds);
    }
}
