package cz.vut.fit.coloprobe.orchestration;

import cz.vut.fit.coloprobe.models.EnrichedResult;
import cz.vut.fit.coloprobe.models.RunSummary;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * The outcome of a whole run.
 *
 * @param results     The results in completion order.
 * @param thresholdMs The latency threshold the results were classified with.
 * @param summary     The verdict counts.
 * @param startedAt   The time the run started.
 * @param elapsed     The wall-clock duration of the run, including the DNS resolution phase.
 */
public record ProbeReport(@NotNull List<EnrichedResult> results,
                          double thresholdMs,
                          @NotNull RunSummary summary,
                          @NotNull Instant startedAt,
                          @NotNull Duration elapsed) {
}
