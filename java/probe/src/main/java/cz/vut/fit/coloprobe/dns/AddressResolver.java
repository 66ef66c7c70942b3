package cz.vut.fit.coloprobe.dns;

import cz.vut.fit.coloprobe.models.results.LookupResult;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.SortedSet;

/**
 * Resolves domain names to IPv4 addresses.
 */
public interface AddressResolver {
    /**
     * Queries the A records of a domain name.
     *
     * @param domain The domain name.
     * @return The deduplicated addresses in ascending numeric order, or an error result if the name
     * cannot be resolved (NXDOMAIN, no records, timeout).
     */
    @NotNull
    LookupResult<SortedSet<String>> resolveA(@NotNull String domain);

    /**
     * Same as {@link #resolveA(String)} but collapses failures to an empty set.
     */
    @NotNull
    default SortedSet<String> resolve(@NotNull String domain) {
        return resolveA(domain).orElse(Collections.emptySortedSet());
    }
}
