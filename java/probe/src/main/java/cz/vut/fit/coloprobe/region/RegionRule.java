package cz.vut.fit.coloprobe.region;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A substring rule that recognizes a cloud region in a PTR host name.
 *
 * @param marker The lower-case substring to look for, e.g. {@code ap-northeast-1}.
 * @param label  The label prepended to the marker in the classification, e.g. {@code AWS TOKYO}.
 */
public record RegionRule(@NotNull String marker, @NotNull String label) {

    public RegionRule {
        marker = marker.trim().toLowerCase(Locale.ROOT);
        label = label.trim();
        if (marker.isEmpty())
            throw new IllegalArgumentException("The region marker must not be empty");
    }

    /**
     * Tests the rule against a lower-cased PTR value.
     *
     * @param lowerPtr The PTR value in lower case.
     * @return {@code "<label> <marker><zone>"} if the PTR contains the marker, where the zone is the run of
     * letters {@code a} to {@code f} right after the marker, or {@code ?} if there is no such letter.
     * An empty optional if the marker is not present.
     */
    public Optional<String> apply(@NotNull String lowerPtr) {
        final int index = lowerPtr.indexOf(marker);
        if (index < 0)
            return Optional.empty();

        int end = index + marker.length();
        while (end < lowerPtr.length() && lowerPtr.charAt(end) >= 'a' && lowerPtr.charAt(end) <= 'f') {
            end++;
        }

        var zone = lowerPtr.substring(index + marker.length(), end);
        if (zone.isEmpty())
            zone = "?";

        return Optional.of(label + " " + marker + zone);
    }

    /**
     * Parses a rule list in the {@code marker=label;marker=label} format.
     *
     * @throws IllegalArgumentException if an entry does not contain '=' or has an empty marker.
     */
    public static List<RegionRule> parse(@NotNull String rules) {
        final var result = new ArrayList<RegionRule>();
        for (var entry : rules.split(";")) {
            if (entry.isBlank())
                continue;

            final int eq = entry.indexOf('=');
            if (eq < 0)
                throw new IllegalArgumentException("Invalid region rule (expected marker=label): " + entry);

            result.add(new RegionRule(entry.substring(0, eq), entry.substring(eq + 1)));
        }
        return List.copyOf(result);
    }

    public static List<RegionRule> defaults() {
        return List.of(new RegionRule("ap-northeast-1", "AWS TOKYO"));
    }
}
