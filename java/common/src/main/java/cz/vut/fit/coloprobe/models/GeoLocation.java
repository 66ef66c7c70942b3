package cz.vut.fit.coloprobe.models;

import org.jetbrains.annotations.NotNull;

/**
 * A record that represents the coarse location of an IP address.
 */
public record GeoLocation(@NotNull String country,
                          @NotNull String region,
                          @NotNull String city) {
    public static final String UNKNOWN = "Unknown";
    public static final GeoLocation UNKNOWN_LOCATION = new GeoLocation(UNKNOWN, UNKNOWN, UNKNOWN);
}
