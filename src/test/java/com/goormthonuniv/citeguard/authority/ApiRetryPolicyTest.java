package com.goormthonuniv.citeguard.authority;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ApiRetryPolicyTest {

    private final ApiRetryPolicy policy = new ApiRetryPolicy(3, 0);

    @Test
    void retriesServerErrorsUpToAttemptLimit() {
        AtomicInteger calls = new AtomicInteger();

        ProviderOutcome<String> out = policy.execute("moz", () -> {
            calls.incrementAndGet();
            return ProviderOutcome.failed("HTTP 503", 503, true);
        });

        assertEquals(3, calls.get());
        assertEquals(ProviderOutcome.Kind.FAILED, out.kind());
        assertEquals("server_error", out.errorType());
    }

    @Test
    void clientErrorsAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        ProviderOutcome<String> out = policy.execute("crossref", () -> {
            calls.incrementAndGet();
            return ProviderOutcome.failed("HTTP 404", 404, false);
        });

        assertEquals(1, calls.get());
        assertEquals("client_error", out.errorType());
    }

    @Test
    void stopsAtFirstSuccess() {
        AtomicInteger calls = new AtomicInteger();

        ProviderOutcome<String> out = policy.execute("ahrefs", () -> calls.incrementAndGet() == 1
                ? ProviderOutcome.failed("timeout", null, true)
                : ProviderOutcome.success("ok", 200));

        assertEquals(2, calls.get());
        assertTrue(out.isSuccess());
        assertEquals("ok", out.get());
    }

    @Test
    void unavailableIsReturnedImmediately() {
        AtomicInteger calls = new AtomicInteger();

        ProviderOutcome<String> out = policy.execute("moz", () -> {
            calls.incrementAndGet();
            return ProviderOutcome.unavailable("not configured");
        });

        assertEquals(1, calls.get());
        assertTrue(out.isUnavailable());
        assertNull(out.errorType());
    }

    @Test
    void waitsBetweenAttempts() {
        ApiRetryPolicy delayed = new ApiRetryPolicy(2, 50);
        AtomicInteger calls = new AtomicInteger();

        long start = System.nanoTime();
        ProviderOutcome<String> out = delayed.execute("crossref", () -> {
            calls.incrementAndGet();
            return ProviderOutcome.failed("HTTP 502", 502, true);
        });
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertEquals(2, calls.get());
        assertEquals(ProviderOutcome.Kind.FAILED, out.kind());
        assertTrue(elapsedMs >= 50, "elapsed " + elapsedMs);
    }

    @Test
    void atLeastOneAttemptIsMade() {
        assertEquals(1, new ApiRetryPolicy(0, 0).attempts());
    }
}
