package cz.vut.fit.coloprobe.dns;

import cz.vut.fit.coloprobe.models.ResultCodes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InternalDNSResolverTest {
    private FakeDnsServer server;
    private InternalDNSResolver resolver;

    @BeforeEach
    void setUp() throws Exception {
        server = new FakeDnsServer()
                .withA("api.example.com", "10.0.0.10", "10.0.0.2", "10.0.0.2", "9.255.0.1")
                .withPTR("10.0.0.2", "ec2-10-0-0-2.ap-northeast-1.compute.amazonaws.com.");
        resolver = new InternalDNSResolver(server.resolver(), Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void resolvesSortedDeduplicatedAddresses() {
        var result = resolver.resolveA("api.example.com");

        assertTrue(result.success(), result.error());
        assertEquals(List.of("9.255.0.1", "10.0.0.2", "10.0.0.10"), List.copyOf(result.data()));
    }

    @Test
    void resolvingTwiceYieldsTheSameSet() {
        assertEquals(resolver.resolve("api.example.com"), resolver.resolve("api.example.com"));
    }

    @Test
    void unknownDomainYieldsEmptySet() {
        var result = resolver.resolveA("missing.example.com");

        assertFalse(result.success());
        assertEquals(ResultCodes.NOT_FOUND, result.statusCode());
        assertTrue(resolver.resolve("missing.example.com").isEmpty());
    }

    @Test
    void invalidDomainNameYieldsEmptySet() {
        var result = resolver.resolveA("bad..name");

        assertEquals(ResultCodes.INVALID_DOMAIN_NAME, result.statusCode());
        assertTrue(resolver.resolve("bad..name").isEmpty());
    }

    @Test
    void reverseLookupStripsTrailingDot() {
        var result = resolver.resolvePTR("10.0.0.2");

        assertTrue(result.success(), result.error());
        assertEquals("ec2-10-0-0-2.ap-northeast-1.compute.amazonaws.com", result.data());
    }

    @Test
    void reverseLookupWithoutRecordFails() {
        assertFalse(resolver.resolvePTR("10.0.0.10").success());
    }

    @Test
    void reverseLookupOfGarbageFails() {
        assertEquals(ResultCodes.INVALID_ADDRESS, resolver.resolvePTR("not-an-ip").statusCode());
    }

    @Test
    void silentNameserverTimesOutIntoEmptySet() throws Exception {
        // Nothing answers on the closed server's port
        var silent = server.resolver();
        server.close();
        var timingOut = new InternalDNSResolver(silent, Duration.ofMillis(300));

        assertTrue(timingOut.resolve("api.example.com").isEmpty());
    }

    @Test
    void sortsAddressesNumerically() {
        var sorted = InternalDNSResolver.sortedAddresses(List.of("52.1.1.1", "3.112.0.1", "52.1.1.1", "13.0.0.1"));

        assertEquals(List.of("3.112.0.1", "13.0.0.1", "52.1.1.1"), List.copyOf(sorted));
    }
}
