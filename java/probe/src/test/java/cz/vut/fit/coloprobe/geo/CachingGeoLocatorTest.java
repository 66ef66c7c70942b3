package cz.vut.fit.coloprobe.geo;

import cz.vut.fit.coloprobe.models.GeoLocation;
import cz.vut.fit.coloprobe.models.ResultCodes;
import cz.vut.fit.coloprobe.models.results.LookupResult;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CachingGeoLocatorTest {

    private static class CountingLocator implements GeoLocator {
        final AtomicInteger calls = new AtomicInteger();
        volatile boolean fail;

        @Override
        public @NotNull LookupResult<GeoLocation> lookup(@NotNull String ip) {
            calls.incrementAndGet();
            return fail
                    ? LookupResult.error(ResultCodes.TIMEOUT, "timed out")
                    : LookupResult.of(new GeoLocation("Japan", "Tokyo", "Tokyo " + ip));
        }
    }

    @Test
    void successfulLookupsAreReused() {
        var inner = new CountingLocator();
        try (var locator = new CachingGeoLocator(inner, Duration.ofMinutes(10))) {
            var first = locator.locate("1.1.1.1");
            var second = locator.locate("1.1.1.1");
            locator.locate("2.2.2.2");

            assertEquals(first, second);
            assertEquals(2, inner.calls.get());
            assertEquals(2, locator.size());
        }
    }

    @Test
    void failuresAreRetried() {
        var inner = new CountingLocator();
        inner.fail = true;
        try (var locator = new CachingGeoLocator(inner, Duration.ofMinutes(10))) {
            assertEquals(GeoLocation.UNKNOWN_LOCATION, locator.locate("1.1.1.1"));

            inner.fail = false;
            assertEquals("Tokyo 1.1.1.1", locator.locate("1.1.1.1").city());
            assertEquals(2, inner.calls.get());
        }
    }
}
