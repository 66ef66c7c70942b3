package cz.vut.fit.coloprobe.dns;

import cz.vut.fit.coloprobe.models.results.LookupResult;
import org.jetbrains.annotations.NotNull;

/**
 * Looks up the PTR record of an IP address.
 */
public interface ReverseResolver {
    /**
     * @param ip The IP address.
     * @return The PTR target without the trailing dot, or an error result.
     */
    @NotNull
    LookupResult<String> resolvePTR(@NotNull String ip);
}
