package cz.vut.fit.coloprobe.models;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunSummaryTest {

    private static EnrichedResult result(ColoStatus status) {
        return new EnrichedResult("API", "Spot", "api.example.com", "1.2.3.4", 5.0, status,
                "No PTR", "Japan", "Tokyo", "Tokyo");
    }

    @Test
    void countsVerdicts() {
        var results = new ArrayList<EnrichedResult>();
        for (int i = 0; i < 3; i++) results.add(result(ColoStatus.COLO));
        for (int i = 0; i < 2; i++) results.add(result(ColoStatus.SLOW));
        results.add(result(ColoStatus.FAIL));

        var summary = RunSummary.of(results);

        assertEquals(3, summary.coloCount());
        assertEquals(2, summary.slowCount());
        assertEquals(1, summary.failCount());
        assertEquals(6, summary.totalCount());
        assertEquals(50.0, summary.coloPercentage(), 1e-9);
    }

    @Test
    void emptyRunHasZeroPercentage() {
        var summary = RunSummary.of(List.of());

        assertEquals(0, summary.totalCount());
        assertEquals(0.0, summary.coloPercentage());
    }
}
