package cz.vut.fit.coloprobe.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import cz.vut.fit.coloprobe.Common;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportWriterTest {

    private final ObjectMapper _mapper = Common.makeMapper().build();

    @Test
    void writesResultsInCompletionOrder(@TempDir Path dir) throws IOException {
        var file = dir.resolve("results").resolve("nested").resolve("latency_results.json");

        new JsonReportWriter(_mapper).write(ReportFixtures.sample(), file);

        var root = _mapper.readTree(file.toFile());
        assertTrue(root.isArray());
        assertEquals(3, root.size());

        var first = root.get(0);
        var keys = new ArrayList<String>();
        first.fieldNames().forEachRemaining(keys::add);
        assertEquals(List.of("Constant", "Category", "Domain", "IP", "Latency_ms", "Status", "AWS_Region",
                "Country", "Region", "City"), keys);

        assertEquals("SPOT_API_URL", first.get("Constant").asText());
        assertEquals("10.0.0.3", first.get("IP").asText());
        assertEquals(25.5, first.get("Latency_ms").asDouble());
        assertEquals("SLOW", first.get("Status").asText());
        assertEquals("COLO", root.get(1).get("Status").asText());
        assertEquals("AWS TOKYO ap-northeast-1c", root.get(1).get("AWS_Region").asText());
    }

    @Test
    void emptyRunIsEmptyArray(@TempDir Path dir) throws IOException {
        var file = dir.resolve("empty.json");

        new JsonReportWriter(_mapper).write(ReportFixtures.report(List.of()), file);

        assertEquals("[ ]", Files.readString(file).strip());
    }
}
