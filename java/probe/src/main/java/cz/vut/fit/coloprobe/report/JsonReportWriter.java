package cz.vut.fit.coloprobe.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import cz.vut.fit.coloprobe.orchestration.ProbeReport;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes the results as a pretty-printed JSON array of objects, in the order they completed.
 */
public class JsonReportWriter implements ReportWriter {
    private final ObjectMapper _mapper;

    public JsonReportWriter(@NotNull ObjectMapper mapper) {
        _mapper = mapper;
    }

    @Override
    public void write(@NotNull ProbeReport report, @NotNull Path file) throws IOException {
        ReportWriter.createParentDirectories(file);
        _mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), report.results());
    }
}
