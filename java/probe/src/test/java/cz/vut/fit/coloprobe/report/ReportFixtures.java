package cz.vut.fit.coloprobe.report;

import cz.vut.fit.coloprobe.models.*;
import cz.vut.fit.coloprobe.orchestration.ProbeReport;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

final class ReportFixtures {
    private ReportFixtures() {
    }

    static EnrichedResult result(String constant, String ip, double latency, ColoStatus status, String awsRegion) {
        var target = new ResolvedTarget(new EndpointRecord(constant, "Spot", "api.example.com"), ip);
        return EnrichedResult.of(target, latency, status, awsRegion, new GeoLocation("Japan", "Tokyo", "Tokyo"));
    }

    static ProbeReport report(List<EnrichedResult> results) {
        return new ProbeReport(results, 12.0, RunSummary.of(results),
                Instant.parse("2024-05-01T10:00:00Z"), Duration.ofSeconds(3));
    }

    static ProbeReport sample() {
        return report(List.of(
                result("SPOT_API_URL", "10.0.0.3", 25.5, ColoStatus.SLOW, "server-10-0-0-3.example.net"),
                result("SPOT_API_URL", "10.0.0.1", 3.14159, ColoStatus.COLO, "AWS TOKYO ap-northeast-1c"),
                result("SPOT_WS_URL", "10.0.0.2", 4000.0, ColoStatus.FAIL, "No PTR")));
    }
}
