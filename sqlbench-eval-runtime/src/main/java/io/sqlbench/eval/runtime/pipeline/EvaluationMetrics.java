package io.sqlbench.eval.runtime.pipeline;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

public final class EvaluationMetrics {

    public static final String ACQUIRE = "acquire";
    public static final String PREPROCESS = "preprocess";
    public static final String CANDIDATE = "candidate";
    public static final String PREDICATES = "predicates";
    public static final String CLEANUP = "cleanup";
    public static final String RESET = "reset";

    public static final List<String> PHASES = List.of(ACQUIRE, PREPROCESS, CANDIDATE, PREDICATES, CLEANUP, RESET);

    private final MeterRegistry registry;
    private final Map<String, Timer> timers = new LinkedHashMap<>();
    private final Counter success;
    private final Counter failed;

    public EvaluationMetrics() {
        this(new SimpleMeterRegistry());
    }

    public EvaluationMetrics(MeterRegistry registry) {
        this.registry = registry;
        for (String phase : PHASES) {
            timers.put(phase, timer(phase));
        }
        this.success = counter("success");
        this.failed = counter("failed");
    }

    private Counter counter(String status) {
        return Counter.builder("sqlbench.instance." + status + ".count")
                .register(registry);
    }

    private Timer timer(String phase) {
        return Timer.builder("sqlbench.pipeline." + phase + ".timer")
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry);
    }

    public <T> T time(String phase, Supplier<T> work) {
        return timers.get(phase).record(work);
    }

    public void run(String phase, Runnable work) {
        timers.get(phase).record(work);
    }

    public void recordOutcome(boolean succeeded) {
        (succeeded ? success : failed).increment();
    }

    /**
     * Mean duration per phase in milliseconds, for phases that ran at least once.
     */
    public Map<String, Double> meanMillis() {
        var means = new LinkedHashMap<String, Double>();
        timers.forEach((phase, timer) -> {
            if (timer.count() > 0) {
                means.put(phase, timer.mean(TimeUnit.MILLISECONDS));
            }
        });
        return means;
    }

    public MeterRegistry registry() {
        return registry;
    }
}
