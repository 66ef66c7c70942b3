package cz.vut.fit.coloprobe.report;

import cz.vut.fit.coloprobe.models.ColoStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HtmlReportWriterTest {

    private final HtmlReportWriter _writer =
            new HtmlReportWriter(Clock.fixed(Instant.parse("2024-05-01T10:15:00Z"), ZoneOffset.UTC));

    @Test
    void rendersSummaryAndTimestamp() {
        var html = _writer.render(ReportFixtures.sample());

        assertTrue(html.contains("Latency Report &ndash; 2024-05-01 10:15"));
        assertTrue(html.contains("<strong>1</strong> / <strong>3</strong> IPs under 12.0 ms &rarr; "
                + "<strong>33.3% co-located</strong>"), html);
    }

    @Test
    void rowsAreSortedByLatency() {
        var html = _writer.render(ReportFixtures.sample());

        int colo = html.indexOf("<td>10.0.0.1</td>");
        int slow = html.indexOf("<td>10.0.0.3</td>");
        int fail = html.indexOf("<td>10.0.0.2</td>");
        assertTrue(colo > 0 && colo < slow && slow < fail);
        assertTrue(html.contains("<tr class=\"colo\">"));
        assertTrue(html.contains("<tr class=\"slow\">"));
        assertTrue(html.contains("<tr class=\"fail\">"));
        assertTrue(html.contains("<td>3.14</td>"));
        assertTrue(html.contains("<td>4000.00</td>"));
    }

    @Test
    void zeroLatencyIsNotAvailable() {
        var html = _writer.render(ReportFixtures.report(List.of(
                ReportFixtures.result("SPOT_API_URL", "10.0.0.1", 0.0, ColoStatus.FAIL, "No PTR"))));

        assertTrue(html.contains("<td>N/A</td>"));
    }

    @Test
    void cellsAreEscaped() {
        var html = _writer.render(ReportFixtures.report(List.of(
                ReportFixtures.result("SPOT_API_URL", "10.0.0.1", 5.0, ColoStatus.COLO, "<script>x</script>&"))));

        assertFalse(html.contains("<script>x</script>"));
        assertTrue(html.contains("&lt;script&gt;x&lt;/script&gt;&amp;"));
    }

    @Test
    void emptyRunRendersZeroPercent() {
        var html = _writer.render(ReportFixtures.report(List.of()));

        assertTrue(html.contains("<strong>0</strong> / <strong>0</strong> IPs under 12.0 ms &rarr; "
                + "<strong>0.0% co-located</strong>"));
        assertFalse(html.contains("<tr class="));
    }

    @Test
    void writesFileWithParentDirectories(@TempDir Path dir) throws IOException {
        var file = dir.resolve("results").resolve("latency_results.html");

        _writer.write(ReportFixtures.sample(), file);

        var html = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(html.startsWith("<!DOCTYPE html>"));
        assertTrue(html.strip().endsWith("</html>"));
    }
}
