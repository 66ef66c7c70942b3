package cz.vut.fit.coloprobe.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jetbrains.annotations.NotNull;

/**
 * A probed target merged with its region hint, its location and its verdict. This is the unit written
 * to the reports.
 */
@JsonPropertyOrder({"Constant", "Category", "Domain", "IP", "Latency_ms", "Status", "AWS_Region",
        "Country", "Region", "City"})
public record EnrichedResult(@JsonProperty("Constant") @NotNull String constant,
                             @JsonProperty("Category") @NotNull String category,
                             @JsonProperty("Domain") @NotNull String domain,
                             @JsonProperty("IP") @NotNull String ip,
                             @JsonProperty("Latency_ms") double latencyMs,
                             @JsonProperty("Status") @NotNull ColoStatus status,
                             @JsonProperty("AWS_Region") @NotNull String awsRegion,
                             @JsonProperty("Country") @NotNull String country,
                             @JsonProperty("Region") @NotNull String region,
                             @JsonProperty("City") @NotNull String city) {

    public static EnrichedResult of(@NotNull ResolvedTarget target, double latencyMs, @NotNull ColoStatus status,
                                    @NotNull String awsRegion, @NotNull GeoLocation location) {
        final var endpoint = target.endpoint();
        return new EnrichedResult(endpoint.name(), endpoint.category(), endpoint.domain(), target.ip(),
                latencyMs, status, awsRegion, location.country(), location.region(), location.city());
    }
}
