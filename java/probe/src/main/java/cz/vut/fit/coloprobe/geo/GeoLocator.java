package cz.vut.fit.coloprobe.geo;

import cz.vut.fit.coloprobe.models.GeoLocation;
import cz.vut.fit.coloprobe.models.results.LookupResult;
import org.jetbrains.annotations.NotNull;

/**
 * Looks up the coarse location of an IP address.
 */
public interface GeoLocator {
    /**
     * @param ip The IP address.
     * @return The location, or an error result if the lookup failed.
     */
    @NotNull
    LookupResult<GeoLocation> lookup(@NotNull String ip);

    /**
     * Same as {@link #lookup(String)} but returns {@link GeoLocation#UNKNOWN_LOCATION} on failure.
     */
    @NotNull
    default GeoLocation locate(@NotNull String ip) {
        return lookup(ip).orElse(GeoLocation.UNKNOWN_LOCATION);
    }
}
