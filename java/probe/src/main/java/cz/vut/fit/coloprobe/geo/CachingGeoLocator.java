package cz.vut.fit.coloprobe.geo;

import cz.vut.fit.coloprobe.Common;
import cz.vut.fit.coloprobe.ExpiringConcurrentCache;
import cz.vut.fit.coloprobe.models.GeoLocation;
import cz.vut.fit.coloprobe.models.results.LookupResult;
import org.jetbrains.annotations.NotNull;

import java.io.Closeable;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * A {@link GeoLocator} that remembers successful lookups of another locator for a limited time.
 * Failed lookups are not remembered and are retried on the next request for the same IP.
 * <p>
 * Two workers asking for the same uncached IP at once may both query the underlying locator.
 */
public class CachingGeoLocator implements GeoLocator, Closeable {
    public static final String COMPONENT_NAME = "geo-cache";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(CachingGeoLocator.class);

    private final GeoLocator _inner;
    private final ExpiringConcurrentCache<String, GeoLocation> _cache;

    public CachingGeoLocator(@NotNull GeoLocator inner, @NotNull Duration lifetime) {
        _inner = inner;
        final long lifetimeMs = Math.max(1, lifetime.toMillis());
        _cache = new ExpiringConcurrentCache<>(lifetimeMs, lifetimeMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public @NotNull LookupResult<GeoLocation> lookup(@NotNull String ip) {
        var cached = _cache.get(ip);
        if (cached != null) {
            Logger.trace("[{}] Cache hit", ip);
            return LookupResult.of(cached);
        }

        var result = _inner.lookup(ip);
        if (result.success() && result.data() != null) {
            _cache.putIfAbsent(ip, result.data());
        }
        return result;
    }

    public int size() {
        return _cache.size();
    }

    @Override
    public void close() {
        _cache.close();
    }
}
