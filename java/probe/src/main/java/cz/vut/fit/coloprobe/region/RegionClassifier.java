package cz.vut.fit.coloprobe.region;

import cz.vut.fit.coloprobe.Common;
import cz.vut.fit.coloprobe.ProbeConfig;
import cz.vut.fit.coloprobe.dns.ReverseResolver;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * Derives a cloud region hint for an IP address from its PTR record.
 * <p>
 * The rules are tried in order and the first one that matches wins. When no rule matches, the PTR value
 * itself (cut to {@value #MAX_PTR_LENGTH} characters) is the result.
 */
public class RegionClassifier {
    public static final String COMPONENT_NAME = "region";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(RegionClassifier.class);

    public static final String NO_PTR = "No PTR";
    public static final int MAX_PTR_LENGTH = 50;

    private final ReverseResolver _resolver;
    private final List<RegionRule> _rules;

    public RegionClassifier(@NotNull ReverseResolver resolver, @NotNull List<RegionRule> rules) {
        _resolver = resolver;
        _rules = List.copyOf(rules);
    }

    public RegionClassifier(@NotNull ReverseResolver resolver, @NotNull Properties properties) {
        this(resolver, RegionRule.parse(properties.getProperty(ProbeConfig.REGION_RULES_CONFIG,
                ProbeConfig.REGION_RULES_DEFAULT)));
    }

    @NotNull
    public String classify(@NotNull String ip) {
        final var ptrResult = _resolver.resolvePTR(ip);
        if (!ptrResult.success() || ptrResult.data() == null) {
            Logger.trace("[{}] No PTR: {}", ip, ptrResult.error());
            return NO_PTR;
        }

        final var ptr = ptrResult.data();
        final var lowerPtr = ptr.toLowerCase(Locale.ROOT);
        for (var rule : _rules) {
            var match = rule.apply(lowerPtr);
            if (match.isPresent()) {
                Logger.trace("[{}] PTR {} matched {}", ip, ptr, rule.marker());
                return match.get();
            }
        }

        return ptr.length() > MAX_PTR_LENGTH ? ptr.substring(0, MAX_PTR_LENGTH) : ptr;
    }

    public List<RegionRule> getRules() {
        return _rules;
    }
}
