package com.dailystatus.report;

import com.dailystatus.model.Outcome;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outcome tally and absent sources of one report.
 *
 * @param tally counts per outcome in order of first appearance; zero counts are never present
 */
public record StatusSummary(
        String workflowRepo,
        Map<Outcome, Integer> tally,
        List<String> absentWorkflows,
        List<String> absentClients
) {
    public StatusSummary {
        workflowRepo = workflowRepo == null ? "" : workflowRepo;
        tally = tally == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tally));
        absentWorkflows = absentWorkflows == null ? List.of() : List.copyOf(absentWorkflows);
        absentClients = absentClients == null ? List.of() : List.copyOf(absentClients);
    }

    public int count(Outcome outcome) {
        return tally.getOrDefault(outcome, 0);
    }

    public int total() {
        return tally.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int absentCount() {
        return absentWorkflows.size() + absentClients.size();
    }

    /**
     * One-line subject, e.g. {@code org/repo daily summary: 12 PASSED, 1 FAILED, 2 ABSENT}.
     * An empty window yields {@code org/repo daily summary: NOTHING}.
     */
    public String subject() {
        String prefix = workflowRepo + " daily summary: ";
        if (total() == 0) {
            return prefix + "NOTHING";
        }
        String subject = prefix + tally.entrySet().stream()
                .map(e -> e.getValue() + " " + e.getKey().label())
                .collect(Collectors.joining(", "));
        int absent = absentCount();
        if (absent > 0) {
            subject += ", " + absent + " ABSENT";
        }
        return subject;
    }
}
