package cz.vut.fit.coloprobe.orchestration;

import cz.vut.fit.coloprobe.models.EnrichedResult;
import org.jetbrains.annotations.NotNull;

/**
 * Receives the results of a run as they complete. Called on the thread that started the run.
 */
@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = (result, completed, total) -> {
    };

    /**
     * @param result    The completed result.
     * @param completed The number of results completed so far, including this one.
     * @param total     The number of targets in the run.
     */
    void onResult(@NotNull EnrichedResult result, int completed, int total);
}
