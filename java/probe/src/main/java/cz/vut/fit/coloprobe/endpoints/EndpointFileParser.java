package cz.vut.fit.coloprobe.endpoints;

import cz.vut.fit.coloprobe.Common;
import cz.vut.fit.coloprobe.models.EndpointRecord;
import org.jetbrains.annotations.NotNull;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads endpoint declarations from a line-oriented text file:
 * <pre>
 * # Spot
 * SPOT_API_URL = "https://api.example.com"
 * SPOT_WS_URL = "wss://ws.example.com:9443/stream"
 * </pre>
 * A line starting with '#' sets the category of the declarations that follow it. A declaration
 * with an {@code http}, {@code https} or {@code wss} URL yields an endpoint with the URL's host name.
 * Any other line is ignored.
 */
public final class EndpointFileParser {
    public static final String COMPONENT_NAME = "parser";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(EndpointFileParser.class);

    private static final Pattern DECLARATION = Pattern.compile("(\\w+)\\s*=\\s*\"(https?://|wss://)([^\"/:]+)");

    private EndpointFileParser() {
    }

    /**
     * Parses an endpoint file in UTF-8.
     *
     * @throws java.nio.file.NoSuchFileException if the file does not exist.
     * @throws IOException                       if the file cannot be read.
     */
    public static List<EndpointRecord> parse(@NotNull Path file) throws IOException {
        try (var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            var endpoints = parse(reader);
            Logger.info("Loaded {} endpoints from {}", endpoints.size(), file);
            return endpoints;
        }
    }

    public static List<EndpointRecord> parse(@NotNull BufferedReader reader) throws IOException {
        final var endpoints = new ArrayList<EndpointRecord>();
        String category = null;
        String line;
        while ((line = reader.readLine()) != null) {
            line = line.strip();
            if (line.startsWith("#")) {
                category = line.substring(1).strip();
                continue;
            }

            var matcher = DECLARATION.matcher(line);
            if (matcher.find()) {
                var effectiveCategory = category == null || category.isEmpty()
                        ? EndpointRecord.UNKNOWN_CATEGORY : category;
                endpoints.add(new EndpointRecord(matcher.group(1), effectiveCategory, matcher.group(3)));
            } else if (!line.isEmpty()) {
                Logger.trace("Ignoring line: {}", line);
            }
        }
        return endpoints;
    }

    public static List<EndpointRecord> parse(@NotNull String text) {
        try {
            return parse(new BufferedReader(new StringReader(text)));
        } catch (IOException e) {
            // StringReader does not throw
            throw new UncheckedIOException(e);
        }
    }
}
