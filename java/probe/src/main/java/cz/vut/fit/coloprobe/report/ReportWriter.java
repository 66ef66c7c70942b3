package cz.vut.fit.coloprobe.report;

import cz.vut.fit.coloprobe.orchestration.ProbeReport;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Persists a finished run.
 */
public interface ReportWriter {
    /**
     * Writes the report to a file, replacing it if it exists. Missing parent directories are created.
     *
     * @throws IOException if the file or its directories cannot be written.
     */
    void write(@NotNull ProbeReport report, @NotNull Path file) throws IOException;

    static void createParentDirectories(@NotNull Path file) throws IOException {
        var parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
