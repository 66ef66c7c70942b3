package cz.vut.fit.coloprobe.report;

import com.google.common.escape.Escaper;
import com.google.common.html.HtmlEscapers;
import cz.vut.fit.coloprobe.models.EnrichedResult;
import cz.vut.fit.coloprobe.orchestration.ProbeReport;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Locale;

/**
 * Renders the results as a single HTML page with a sortable table. The rows are ordered by latency and
 * colored by their status. The table scripts and styles are loaded from public CDNs.
 */
public class HtmlReportWriter implements ReportWriter {
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final Escaper ESCAPER = HtmlEscapers.htmlEscaper();

    private static final String HEAD = """
            <!DOCTYPE html>
            <html>
            <head>
                <meta charset="utf-8">
                <title>Co-location Report</title>
                <link rel="stylesheet" href="https://cdn.datatables.net/1.13.6/css/jquery.dataTables.min.css">
                <style>
                    body { font-family: Arial, sans-serif; margin: 2em; background: #1a1a1a; color: #eee; }
                    table { background: #2d2d2d; width: 100%; }
                    th { background: #007acc; color: white; }
                    td { padding: 8px; border-bottom: 1px solid #444; }
                    .colo { background: #0f5132 !important; color: #d4edda; font-weight: bold; }
                    .slow { background: #664d03 !important; color: #fff3cd; }
                    .fail { background: #842029 !important; color: #f8d7da; }
                    .summary { margin: 1em 0 2em 0; padding: 1em; background: #2d2d2d; border-radius: 5px; }
                </style>
            </head>
            """;

    private static final String TABLE_HEAD = """
                <table id="t">
                    <thead>
                        <tr>
                            <th>Constant</th>
                            <th>Category</th>
                            <th>Domain</th>
                            <th>IP</th>
                            <th>Latency (ms)</th>
                            <th>Status</th>
                            <th>AWS Region</th>
                            <th>Country</th>
                            <th>Region</th>
                            <th>City</th>
                        </tr>
                    </thead>
                    <tbody>
            """;

    private static final String TAIL = """
                    </tbody>
                </table>
                <script src="https://code.jquery.com/jquery-3.7.1.min.js"></script>
                <script src="https://cdn.datatables.net/1.13.6/js/jquery.dataTables.min.js"></script>
                <script>
                    $(() => $('#t').DataTable({
                        "pageLength": 100,
                        "order": [[4, "asc"]]
                    }));
                </script>
            </body>
            </html>
            """;

    private final Clock _clock;

    public HtmlReportWriter() {
        this(Clock.systemDefaultZone());
    }

    public HtmlReportWriter(@NotNull Clock clock) {
        _clock = clock;
    }

    @Override
    public void write(@NotNull ProbeReport report, @NotNull Path file) throws IOException {
        ReportWriter.createParentDirectories(file);
        Files.writeString(file, render(report), StandardCharsets.UTF_8);
    }

    @NotNull
    public String render(@NotNull ProbeReport report) {
        final var summary = report.summary();
        final var html = new StringBuilder(HEAD);

        html.append("<body>\n")
                .append("    <h1>Latency Report &ndash; ")
                .append(LocalDateTime.now(_clock).format(TIMESTAMP_FORMAT))
                .append("</h1>\n")
                .append("    <div class=\"summary\">\n")
                .append("        <p><strong>").append(summary.coloCount()).append("</strong> / <strong>")
                .append(summary.totalCount()).append("</strong> IPs under ").append(report.thresholdMs())
                .append(" ms &rarr; <strong>")
                .append(String.format(Locale.ROOT, "%.1f", summary.coloPercentage()))
                .append("% co-located</strong></p>\n")
                .append("    </div>\n")
                .append(TABLE_HEAD);

        // The results come in completion order
        var rows = new ArrayList<>(report.results());
        rows.sort(Comparator.comparingDouble(EnrichedResult::latencyMs));
        for (var row : rows) {
            appendRow(html, row);
        }

        return html.append(TAIL).toString();
    }

    private static void appendRow(StringBuilder html, EnrichedResult row) {
        final var latency = row.latencyMs() == 0.0
                ? "N/A"
                : String.format(Locale.ROOT, "%.2f", row.latencyMs());

        html.append("            <tr class=\"").append(row.status().name().toLowerCase(Locale.ROOT)).append("\">\n");
        for (var cell : new String[]{row.constant(), row.category(), row.domain(), row.ip(), latency,
                row.status().name(), row.awsRegion(), row.country(), row.region(), row.city()}) {
            html.append("                <td>").append(ESCAPER.escape(cell)).append("</td>\n");
        }
        html.append("            </tr>\n");
    }
}
