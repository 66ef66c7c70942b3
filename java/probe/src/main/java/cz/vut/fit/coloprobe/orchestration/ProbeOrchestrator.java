package cz.vut.fit.coloprobe.orchestration;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import cz.vut.fit.coloprobe.Common;
import cz.vut.fit.coloprobe.dns.AddressResolver;
import cz.vut.fit.coloprobe.geo.GeoLocator;
import cz.vut.fit.coloprobe.models.*;
import cz.vut.fit.coloprobe.models.results.ProbeOutcome;
import cz.vut.fit.coloprobe.region.RegionClassifier;
import cz.vut.fit.coloprobe.tls.HandshakeProber;
import org.jetbrains.annotations.NotNull;

import java.io.Closeable;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the whole measurement: resolves the endpoint domains, probes every resolved address on a fixed pool
 * of worker threads, enriches each measurement with the region hint and the location, and classifies it.
 * <p>
 * Every target yields exactly one {@link EnrichedResult}. A failure of a component only affects the fields of
 * the target it happened in. There are no retries and no run-wide timeout; each network operation relies
 * on its own timeout.
 */
public class ProbeOrchestrator implements Closeable {
    public static final String COMPONENT_NAME = "orchestrator";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(ProbeOrchestrator.class);

    private final AddressResolver _resolver;
    private final HandshakeProber _prober;
    private final RegionClassifier _regionClassifier;
    private final GeoLocator _geoLocator;
    private final double _thresholdMs;
    private final ExecutorService _executor;

    public ProbeOrchestrator(@NotNull AddressResolver resolver,
                             @NotNull HandshakeProber prober,
                             @NotNull RegionClassifier regionClassifier,
                             @NotNull GeoLocator geoLocator,
                             int workers,
                             double thresholdMs) {
        if (workers < 1)
            throw new IllegalArgumentException("The number of workers must be positive");

        _resolver = resolver;
        _prober = prober;
        _regionClassifier = regionClassifier;
        _geoLocator = geoLocator;
        _thresholdMs = thresholdMs;
        _executor = Executors.newFixedThreadPool(workers, new ThreadFactoryBuilder()
                .setNameFormat("probe-worker-%d")
                .setDaemon(true)
                .build());
    }

    /**
     * Resolves the domain of every endpoint, one domain at a time. Each distinct domain is resolved once.
     *
     * @return An unmodifiable map from domains to their addresses, in the order the domains first appear.
     * Unresolvable domains map to an empty set.
     */
    public Map<String, SortedSet<String>> resolveDomains(@NotNull List<EndpointRecord> endpoints) {
        final var cache = new LinkedHashMap<String, SortedSet<String>>();
        for (var endpoint : endpoints) {
            final var domain = endpoint.domain();
            if (cache.containsKey(domain))
                continue;

            SortedSet<String> addresses;
            try {
                addresses = _resolver.resolve(domain);
            } catch (RuntimeException e) {
                Logger.warn("Unexpected error when resolving {}", domain, e);
                addresses = Collections.emptySortedSet();
            }

            if (addresses.isEmpty()) {
                Logger.info("{} did not resolve to any IPv4 address", domain);
            } else {
                Logger.debug("{} resolved to {}", domain, addresses);
            }
            cache.put(domain, addresses);
        }
        return Collections.unmodifiableMap(cache);
    }

    /**
     * Pairs every endpoint with each address of its domain. Endpoints of unresolved domains yield no targets.
     */
    public static List<ResolvedTarget> expandTargets(@NotNull List<EndpointRecord> endpoints,
                                                     @NotNull Map<String, SortedSet<String>> addresses) {
        final var targets = new ArrayList<ResolvedTarget>();
        for (var endpoint : endpoints) {
            for (var ip : addresses.getOrDefault(endpoint.domain(), Collections.emptySortedSet())) {
                targets.add(new ResolvedTarget(endpoint, ip));
            }
        }
        return targets;
    }

    public ProbeReport run(@NotNull List<EndpointRecord> endpoints) throws InterruptedException {
        return run(endpoints, ProgressListener.NONE);
    }

    /**
     * Runs the measurement and blocks until every target has a result.
     *
     * @param endpoints The endpoints to measure.
     * @param listener  Notified of every result on the calling thread, in completion order. An exception
     *                  thrown by the listener is logged and does not stop the run.
     * @return The report with the results in completion order.
     * @throws InterruptedException if the calling thread is interrupted while waiting for the results.
     *                              The targets already submitted keep running until their own timeouts.
     */
    public ProbeReport run(@NotNull List<EndpointRecord> endpoints, @NotNull ProgressListener listener)
            throws InterruptedException {
        final var startedAt = Instant.now();
        final long start = System.nanoTime();

        final var addresses = resolveDomains(endpoints);
        final var targets = expandTargets(endpoints, addresses);
        Logger.info("Probing {} addresses of {} domains ({} endpoints)", targets.size(), addresses.size(),
                endpoints.size());

        // Workers put their results here; the calling thread is the only consumer
        final var completed = new LinkedBlockingQueue<EnrichedResult>();
        for (var target : targets) {
            final var taskStart = new AtomicLong();
            CompletableFuture.supplyAsync(() -> {
                        taskStart.set(System.nanoTime());
                        return processTarget(target);
                    }, _executor)
                    .exceptionally(e -> {
                        Logger.warn("[{}] Unexpected error when processing {}", target.endpoint().domain(),
                                target.ip(), e);
                        final long taskStartNanos = taskStart.get();
                        final var latency = taskStartNanos == 0 ? 0.0
                                : Common.nanosToRoundedMillis(System.nanoTime() - taskStartNanos);
                        return EnrichedResult.of(target, latency, ColoStatus.FAIL, RegionClassifier.NO_PTR,
                                GeoLocation.UNKNOWN_LOCATION);
                    })
                    .thenAccept(completed::add);
        }

        final var results = new ArrayList<EnrichedResult>(targets.size());
        while (results.size() < targets.size()) {
            var result = completed.take();
            results.add(result);
            try {
                listener.onResult(result, results.size(), targets.size());
            } catch (RuntimeException e) {
                Logger.warn("Progress listener failed at result {}/{}", results.size(), targets.size(), e);
            }
        }

        final var summary = RunSummary.of(results);
        final var elapsed = Duration.ofNanos(System.nanoTime() - start);
        Logger.info("Finished {} targets in {} ms: {} COLO, {} SLOW, {} FAIL", summary.totalCount(),
                elapsed.toMillis(), summary.coloCount(), summary.slowCount(), summary.failCount());

        return new ProbeReport(Collections.unmodifiableList(results), _thresholdMs, summary, startedAt, elapsed);
    }

    /**
     * Probes a single target and enriches the measurement. Never throws; a failing component is replaced
     * with its fallback value.
     */
    @NotNull
    EnrichedResult processTarget(@NotNull ResolvedTarget target) {
        final var ip = target.ip();
        final var domain = target.endpoint().domain();
        final long start = System.nanoTime();

        ProbeOutcome outcome;
        try {
            outcome = _prober.probe(ip, domain);
        } catch (RuntimeException e) {
            Logger.warn("[{}] Prober failed unexpectedly for {}", domain, ip, e);
            outcome = ProbeOutcome.failed(ip, Common.nanosToRoundedMillis(System.nanoTime() - start),
                    ResultCodes.INTERNAL_ERROR, e.getMessage());
        }

        String region;
        try {
            region = _regionClassifier.classify(ip);
        } catch (RuntimeException e) {
            Logger.warn("[{}] Region classification failed unexpectedly for {}", domain, ip, e);
            region = RegionClassifier.NO_PTR;
        }

        GeoLocation location;
        try {
            location = _geoLocator.locate(ip);
        } catch (RuntimeException e) {
            Logger.warn("[{}] Geolocation failed unexpectedly for {}", domain, ip, e);
            location = GeoLocation.UNKNOWN_LOCATION;
        }

        final var status = StatusClassifier.classify(outcome.success(), outcome.latencyMs(), _thresholdMs);
        Logger.debug("[{}] {} {} ms {} ({})", domain, ip, outcome.latencyMs(), status, region);
        return EnrichedResult.of(target, outcome.latencyMs(), status, region, location);
    }

    public double getThresholdMs() {
        return _thresholdMs;
    }

    @Override
    public void close() {
        _executor.shutdown();
    }
}
