package com.gamevault.game_library.observability;

import com.gamevault.game_library.library.LibraryCategory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/**
 * Metrics for library transitions.
 *
 * - library.transitions: applied transitions, tagged by from/to category
 * - library.transitions.unchanged: idempotent requests that changed nothing
 * - library.transitions.rejected: rejected requests, tagged by error
 * - library.transitions.retries: attempts that hit a concurrent modification
 * - library.transition.duration: end-to-end transition latency
 */
@Component
public class LibraryMetrics {

    private static final String NONE = "none";

    private final MeterRegistry registry;
    private final Timer transitionTimer;

    public LibraryMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.transitionTimer = Timer.builder("library.transition.duration")
                .description("Time taken to apply a library transition")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordApplied(LibraryCategory from, LibraryCategory to) {
        registry.counter("library.transitions",
                "from", tagOf(from),
                "to", tagOf(to)
        ).increment();
    }

    public void recordUnchanged(LibraryCategory category) {
        registry.counter("library.transitions.unchanged", "category", tagOf(category)).increment();
    }

    public void recordRejected(String error) {
        registry.counter("library.transitions.rejected", "error", error).increment();
    }

    public void recordRetry() {
        registry.counter("library.transitions.retries").increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void stopTimer(Timer.Sample sample) {
        sample.stop(transitionTimer);
    }

    private static String tagOf(LibraryCategory category) {
        return category != null ? category.getValue() : NONE;
    }
}
