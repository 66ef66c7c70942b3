package cz.vut.fit.coloprobe.orchestration;

import cz.vut.fit.coloprobe.models.ColoStatus;
import org.jetbrains.annotations.NotNull;

public final class StatusClassifier {
    private StatusClassifier() {
    }

    /**
     * Classifies a handshake measurement. A successful handshake strictly faster than the threshold
     * is {@link ColoStatus#COLO}, a slower one (including one exactly at the threshold) is
     * {@link ColoStatus#SLOW}, and a failed one is {@link ColoStatus#FAIL} regardless of its latency.
     */
    @NotNull
    public static ColoStatus classify(boolean success, double latencyMs, double thresholdMs) {
        if (!success)
            return ColoStatus.FAIL;

        return latencyMs < thresholdMs ? ColoStatus.COLO : ColoStatus.SLOW;
    }
}
