package cz.vut.fit.coloprobe.dns;

import com.google.common.net.InetAddresses;
import com.google.common.primitives.UnsignedBytes;
import cz.vut.fit.coloprobe.Common;
import cz.vut.fit.coloprobe.ProbeConfig;
import cz.vut.fit.coloprobe.models.ResultCodes;
import cz.vut.fit.coloprobe.models.results.LookupResult;
import org.jetbrains.annotations.NotNull;
import org.xbill.DNS.*;
import org.xbill.DNS.lookup.LookupSession;
import org.xbill.DNS.lookup.NoSuchDomainException;
import org.xbill.DNS.lookup.NoSuchRRSetException;

import java.net.Inet4Address;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Forward (A) and reverse (PTR) lookups backed by a dnsjava {@link LookupSession}.
 * <p>
 * Every call makes exactly one lookup attempt; failures are returned as error results and never thrown.
 */
public class InternalDNSResolver implements AddressResolver, ReverseResolver {
    public static final String COMPONENT_NAME = "dns";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(InternalDNSResolver.class);

    private static final Comparator<String> IPV4_ORDER = Comparator.comparing(
            (String ip) -> InetAddresses.forString(ip).getAddress(), UnsignedBytes.lexicographicalComparator());

    private final LookupSession _lookupSession;
    private final Duration _timeout;

    public InternalDNSResolver(@NotNull Resolver resolver, @NotNull Duration timeout) {
        _timeout = timeout;
        _lookupSession = LookupSession.builder()
                .resolver(resolver)
                .build();
    }

    public InternalDNSResolver(@NotNull Properties properties) throws UnknownHostException {
        this(makeMainResolver(properties), Duration.ofMillis(Common.getInt(properties,
                ProbeConfig.DNS_TIMEOUT_MS_CONFIG, ProbeConfig.DNS_TIMEOUT_MS_DEFAULT)));
    }

    /**
     * Creates the resolver used for all queries. Uses the configured nameservers or,
     * if none are configured, the system ones.
     *
     * @throws UnknownHostException if a configured nameserver address is invalid.
     */
    public static ExtendedResolver makeMainResolver(Properties properties) throws UnknownHostException {
        var dnsServers = Arrays.stream(properties.getProperty(ProbeConfig.DNS_RESOLVER_IPS_CONFIG,
                        ProbeConfig.DNS_RESOLVER_IPS_DEFAULT).split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);
        var timeout = Duration.ofMillis(Common.getInt(properties,
                ProbeConfig.DNS_TIMEOUT_MS_CONFIG, ProbeConfig.DNS_TIMEOUT_MS_DEFAULT));

        var resolver = dnsServers.length == 0 ? new ExtendedResolver() : new ExtendedResolver(dnsServers);
        for (var inResolver : resolver.getResolvers()) {
            inResolver.setTimeout(timeout);
        }

        // One attempt per query
        resolver.setRetries(1);
        resolver.setTimeout(timeout);
        return resolver;
    }

    @Override
    public @NotNull LookupResult<SortedSet<String>> resolveA(@NotNull String domain) {
        final Name name;
        try {
            name = Name.fromString(domain, Name.root);
        } catch (TextParseException e) {
            Logger.debug("Invalid domain name {}: {}", domain, e.getMessage());
            return LookupResult.error(ResultCodes.INVALID_DOMAIN_NAME, e.getMessage());
        }

        final LookupResult<List<org.xbill.DNS.Record>> records = lookup(name, Type.A);
        if (!records.success()) {
            Logger.debug("Cannot resolve {}: {}", domain, records.error());
            return LookupResult.error(records.statusCode(), records.error());
        }

        var addresses = new ArrayList<String>();
        for (var record : Objects.requireNonNull(records.data())) {
            // Sanity check: you never know what the DNS returns
            if (record instanceof ARecord aRecord && aRecord.getAddress() instanceof Inet4Address) {
                addresses.add(aRecord.getAddress().getHostAddress());
            }
        }

        if (addresses.isEmpty()) {
            Logger.debug("No A records for {}", domain);
            return LookupResult.error(ResultCodes.NOT_FOUND, "No A records");
        }

        var sorted = sortedAddresses(addresses);
        Logger.trace("{} resolved to {}", domain, sorted);
        return LookupResult.of(sorted);
    }

    @Override
    public @NotNull LookupResult<String> resolvePTR(@NotNull String ip) {
        final Name reverseName;
        try {
            reverseName = ReverseMap.fromAddress(ip);
        } catch (UnknownHostException e) {
            Logger.debug("Invalid IP address {}", ip);
            return LookupResult.error(ResultCodes.INVALID_ADDRESS, e.getMessage());
        }

        final LookupResult<List<org.xbill.DNS.Record>> records = lookup(reverseName, Type.PTR);
        if (!records.success()) {
            Logger.trace("No PTR for {}: {}", ip, records.error());
            return LookupResult.error(records.statusCode(), records.error());
        }

        return Objects.requireNonNull(records.data()).stream()
                .filter(record -> record instanceof PTRRecord)
                .map(record -> ((PTRRecord) record).getTarget().toString(true))
                .findFirst()
                .map(LookupResult::of)
                .orElseGet(() -> LookupResult.error(ResultCodes.NOT_FOUND, "No PTR records"));
    }

    private LookupResult<List<org.xbill.DNS.Record>> lookup(Name name, int type) {
        try {
            var result = _lookupSession.lookupAsync(name, type)
                    .toCompletableFuture()
                    .orTimeout(_timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .join();

            if (result == null || result.getRecords().isEmpty()) {
                return LookupResult.error(ResultCodes.NOT_FOUND, "Empty response");
            }

            return LookupResult.of(result.getRecords());
        } catch (CompletionException e) {
            var cause = e.getCause();
            if (cause instanceof NoSuchDomainException) {
                return LookupResult.error(ResultCodes.NOT_FOUND, "NXDOMAIN");
            } else if (cause instanceof NoSuchRRSetException) {
                return LookupResult.error(ResultCodes.NOT_FOUND, "No records of type " + Type.string(type));
            } else if (cause instanceof TimeoutException) {
                return LookupResult.error(ResultCodes.TIMEOUT,
                        "Lookup timed out (%d ms)".formatted(_timeout.toMillis()));
            } else {
                var message = cause == null ? e.getMessage() : cause.getClass().getName() + ": " + cause.getMessage();
                return LookupResult.error(ResultCodes.OTHER_DNS_ERROR, message);
            }
        } catch (RuntimeException e) {
            // Thrown outside the CompletionStage chain
            Logger.warn("Top-level exception when resolving {} for {}", Type.string(type), name, e);
            return LookupResult.error(ResultCodes.INTERNAL_ERROR, e.getMessage());
        }
    }

    /**
     * Deduplicates IPv4 address strings and orders them by their numeric value.
     */
    public static SortedSet<String> sortedAddresses(@NotNull Collection<String> addresses) {
        var sorted = new TreeSet<>(IPV4_ORDER);
        sorted.addAll(addresses);
        return Collections.unmodifiableSortedSet(sorted);
    }
}
