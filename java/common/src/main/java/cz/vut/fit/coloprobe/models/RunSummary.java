package cz.vut.fit.coloprobe.models;

import org.jetbrains.annotations.NotNull;

import java.util.Collection;

/**
 * Verdict counts of a finished run.
 */
public record RunSummary(int coloCount, int slowCount, int failCount, int totalCount) {

    public static RunSummary of(@NotNull Collection<EnrichedResult> results) {
        int colo = 0, slow = 0, fail = 0;
        for (var result : results) {
            switch (result.status()) {
                case COLO -> colo++;
                case SLOW -> slow++;
                case FAIL -> fail++;
            }
        }
        return new RunSummary(colo, slow, fail, results.size());
    }

    /**
     * The share of COLO results in percent, or zero for an empty run.
     */
    public double coloPercentage() {
        if (totalCount == 0)
            return 0.0;

        return coloCount * 100.0 / totalCount;
    }
}
