package cz.vut.fit.coloprobe.orchestration;

import cz.vut.fit.coloprobe.models.ColoStatus;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class StatusClassifierTest {

    @ParameterizedTest
    @CsvSource({
            "true,  11.99,  12.0, COLO",
            "true,  0.0,    12.0, COLO",
            "true,  12.0,   12.0, SLOW",
            "true,  12.01,  12.0, SLOW",
            "true,  250.5,  12.0, SLOW",
            "false, 0.0,    12.0, FAIL",
            "false, 3.2,    12.0, FAIL",
            "false, 4000.0, 12.0, FAIL",
            "true,  5.0,    5.0,  SLOW",
            "true,  4.99,   5.0,  COLO"
    })
    void classifiesAgainstThreshold(boolean success, double latency, double threshold, ColoStatus expected) {
        assertEquals(expected, StatusClassifier.classify(success, latency, threshold));
    }
}
