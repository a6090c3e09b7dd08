package io.sqlbench.eval.runtime.report;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sqlbench.eval.runtime.model.InstanceIds;
import io.sqlbench.eval.runtime.model.InstanceOutcome;
import io.sqlbench.eval.runtime.pipeline.RunStatistics;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything written at the end of a run. Outcomes and their input records are paired and sorted by
 * instance id.
 */
public record RunReport(RunStatistics.Snapshot statistics,
                        List<Entry> entries,
                        LocalDateTime timestamp,
                        Map<String, Double> phaseMeanMillis,
                        List<String> fatalErrors) {

    public record Entry(InstanceOutcome outcome, ObjectNode record) {
    }

    public RunReport {
        entries = List.copyOf(entries);
        phaseMeanMillis = Collections.unmodifiableMap(new LinkedHashMap<>(phaseMeanMillis));
        fatalErrors = List.copyOf(fatalErrors);
    }

    /**
     * @param outcomes one outcome per input record, in input order
     * @throws IllegalStateException when the two lists do not correspond one to one
     */
    public static RunReport of(RunStatistics.Snapshot statistics,
                               List<InstanceOutcome> outcomes,
                               List<ObjectNode> records,
                               LocalDateTime timestamp,
                               Map<String, Double> phaseMeanMillis,
                               List<String> fatalErrors) {
        if (outcomes.size() != records.size()) {
            throw new IllegalStateException("Got %d outcomes for %d records".formatted(outcomes.size(), records.size()));
        }
        var entries = new ArrayList<Entry>(outcomes.size());
        for (int i = 0; i < outcomes.size(); i++) {
            entries.add(new Entry(outcomes.get(i), records.get(i)));
        }
        entries.sort(Comparator.comparing((Entry e) -> e.outcome().instanceId(), InstanceIds.ORDER));
        return new RunReport(statistics, entries, timestamp, phaseMeanMillis, fatalErrors);
    }

    public boolean hasFatalErrors() {
        return !fatalErrors.isEmpty();
    }

    public List<InstanceOutcome> outcomes() {
        return entries.stream().map(Entry::outcome).toList();
    }
}
