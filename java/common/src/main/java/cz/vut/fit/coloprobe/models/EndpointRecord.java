package cz.vut.fit.coloprobe.models;

import org.jetbrains.annotations.NotNull;

/**
 * A named endpoint declared in the endpoint-definition file.
 *
 * @param name     The declared constant name, e.g. {@code SPOT_API_URL}.
 * @param category The category label in effect at the declaration.
 * @param domain   The host name of the endpoint URL, without the port and the path.
 */
public record EndpointRecord(@NotNull String name,
                             @NotNull String category,
                             @NotNull String domain) {
    public static final String UNKNOWN_CATEGORY = "Unknown";
}
