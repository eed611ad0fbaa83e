package org.example.learnpath.service.llm;

import org.example.learnpath.config.LearningProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LlmGatewayTest {

    private static final LlmOptions OPTIONS = LlmOptions.bounded(0.5, 100);

    private LlmGateway gateway;

    @BeforeEach
    void setUp() {
        LearningProperties properties = new LearningProperties();
        properties.getGeneration().setTimeout(Duration.ofMillis(200));
        gateway = new LlmGateway(properties);
    }

    @AfterEach
    void tearDown() {
        gateway.shutdown();
    }

    @Test
    void call_providerReturnsText_succeeds() {
        LlmResult result = gateway.call(provider(true, prompt -> "{\"questions\": []}"), "prompt", OPTIONS, "test");

        assertTrue(result.succeeded());
        assertEquals("{\"questions\": []}", result.text());
        assertEquals("stub", result.providerName());
        assertNull(result.failureKind());
    }

    @Test
    void call_providerExceedsDeadline_returnsTimeout() {
        CountDownLatch never = new CountDownLatch(1);
        LlmResult result = gateway.call(provider(true, prompt -> {
            try {
                never.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        }), "prompt", OPTIONS, "test");

        assertFalse(result.succeeded());
        assertEquals(LlmResult.FailureKind.TIMEOUT, result.failureKind());
        assertTrue(result.durationMs() < 5000);
    }

    @Test
    void call_providerRateLimited_mapsKind() {
        LlmResult result = gateway.call(provider(true, prompt -> {
            throw new LlmProviderException(LlmProviderException.Kind.RATE_LIMITED, "429 from upstream");
        }), "prompt", OPTIONS, "test");

        assertEquals(LlmResult.FailureKind.RATE_LIMITED, result.failureKind());
        assertEquals("RATE_LIMITED: 429 from upstream", result.describeFailure());
    }

    @Test
    void call_providerThrowsUnexpectedException_mapsToProviderError() {
        LlmResult result = gateway.call(provider(true, prompt -> {
            throw new IllegalStateException("boom");
        }), "prompt", OPTIONS, "test");

        assertEquals(LlmResult.FailureKind.PROVIDER_ERROR, result.failureKind());
    }

    @Test
    void call_blankResponse_returnsEmptyResponse() {
        LlmResult result = gateway.call(provider(true, prompt -> "   "), "prompt", OPTIONS, "test");

        assertEquals(LlmResult.FailureKind.EMPTY_RESPONSE, result.failureKind());
    }

    @Test
    void call_unavailableOrMissingProvider_returnsUnavailable() {
        LlmResult unavailable = gateway.call(provider(false, prompt -> "unused"), "prompt", OPTIONS, "test");
        LlmResult missing = gateway.call(null, "prompt", OPTIONS, "test");

        assertEquals(LlmResult.FailureKind.UNAVAILABLE, unavailable.failureKind());
        assertEquals(LlmResult.FailureKind.UNAVAILABLE, missing.failureKind());
        assertEquals("none", missing.providerName());
    }

    private static LlmProvider provider(boolean available, Function<String, String> body) {
        return new LlmProvider() {
            @Override
            public String generate(String prompt, LlmOptions options) {
                return body.apply(prompt);
            }

            @Override
            public boolean isAvailable() {
                return available;
            }

            @Override
            public String getProviderName() {
                return "stub";
            }

            @Override
            public String getModelName() {
                return "stub-model";
            }
        };
    }
}
