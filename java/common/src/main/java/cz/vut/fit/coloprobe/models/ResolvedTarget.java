package cz.vut.fit.coloprobe.models;

import org.jetbrains.annotations.NotNull;

/**
 * A pair of an endpoint and one of the IPv4 addresses its domain resolved to.
 *
 * @param endpoint The endpoint.
 * @param ip       The IP address.
 */
public record ResolvedTarget(@NotNull EndpointRecord endpoint, @NotNull String ip) {
}
