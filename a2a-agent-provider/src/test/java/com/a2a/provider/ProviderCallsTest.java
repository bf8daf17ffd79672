package com.a2a.provider;

import com.a2a.message.ChatMessage;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProviderCallsTest {

    private static Provider provider(String id, BiFunction<String, List<ChatMessage>, CompletionStage<String>> body) {
        return new Provider() {
            @Override
            public String getId() {
                return id;
            }

            @Override
            public boolean isReady() {
                return true;
            }

            @Override
            public CompletionStage<String> generate(String prompt, List<ChatMessage> messages) {
                return body.apply(prompt, messages);
            }
        };
    }

    @Test
    void call_returnsProviderTextAndPassesPromptAndMessages() throws Exception {
        List<ChatMessage> messages = List.of(ChatMessage.user("hi"));
        Provider p = provider("p", (prompt, msgs) -> CompletableFuture.completedFuture(prompt + "/" + msgs.size()));

        assertEquals("hi/1", ProviderCalls.call(p, "hi", messages).get(1, TimeUnit.SECONDS));
    }

    @Test
    void call_asyncProviderIsInvokedOnce() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        Provider p = provider("async-ok", (prompt, msgs) -> {
            calls.incrementAndGet();
            return CompletableFuture.supplyAsync(() -> "later " + prompt);
        });

        assertEquals("later ping", ProviderCalls.call(p, "ping", List.of(ChatMessage.user("ping"))).get(5, TimeUnit.SECONDS));
        assertEquals(1, calls.get());
    }

    @Test
    void call_synchronousThrowBecomesDiagnostic() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        Provider p = provider("thrower", (prompt, msgs) -> {
            calls.incrementAndGet();
            throw new IllegalStateException("boom");
        });

        assertEquals("[framework/provider error] boom", ProviderCalls.call(p, "x", List.of()).get(1, TimeUnit.SECONDS));
        assertEquals(1, calls.get());
    }

    @Test
    void call_exceptionalCompletionBecomesDiagnostic() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        Provider p = provider("async", (prompt, msgs) -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new IOException("connection refused"));
        });

        assertEquals("[framework/provider error] connection refused", ProviderCalls.call(p, "x", List.of()).get(1, TimeUnit.SECONDS));
        assertEquals(1, calls.get());
    }

    @Test
    void call_blockingProviderRunsOnceOffCallerThread() throws Exception {
        TestProviders.CountingBlockingProvider p = new TestProviders.CountingBlockingProvider();

        String text = ProviderCalls.call(p, "ping", List.of(ChatMessage.user("ping"))).get(5, TimeUnit.SECONDS);

        assertEquals("blocking ping 1", text);
        assertEquals(1, p.calls.get());
        assertNotSame(Thread.currentThread(), p.ranOn);
    }

    @Test
    void call_blockingProviderFailureBecomesDiagnostic() throws Exception {
        BlockingProvider p = new BlockingProvider(Runnable::run) {
            @Override
            public String getId() {
                return "failing";
            }

            @Override
            public boolean isReady() {
                return true;
            }

            @Override
            protected String generateBlocking(String prompt, List<ChatMessage> messages) throws Exception {
                throw new IOException("HTTP 500");
            }
        };

        assertEquals("[framework/provider error] HTTP 500", ProviderCalls.call(p, "x", List.of()).get(1, TimeUnit.SECONDS));
    }

    @Test
    void call_nullStageAndNullTextAreTolerated() throws Exception {
        Provider nullStage = provider("ns", (prompt, msgs) -> null);
        Provider nullText = provider("nt", (prompt, msgs) -> CompletableFuture.completedFuture(null));

        assertEquals("", ProviderCalls.call(nullStage, "x", null).get(1, TimeUnit.SECONDS));
        assertEquals("", ProviderCalls.call(nullText, "x", null).get(1, TimeUnit.SECONDS));
    }

    @Test
    void callForOutcome_keepsDegradedStatusAndCause() throws Exception {
        IllegalArgumentException failure = new IllegalArgumentException("bad model");
        Provider p = provider("outcome-test", (prompt, msgs) -> CompletableFuture.failedFuture(failure));
        double before = DispatchMetrics.count("outcome-test", CallOutcome.Status.DEGRADED);

        CallOutcome outcome = ProviderCalls.callForOutcome(p, "x", List.of()).get(1, TimeUnit.SECONDS);

        assertFalse(outcome.isOk());
        assertEquals("[framework/provider error] bad model", outcome.text());
        assertTrue(outcome.getCause().isPresent());
        assertEquals(failure, outcome.getCause().get());
        assertEquals(before + 1, DispatchMetrics.count("outcome-test", CallOutcome.Status.DEGRADED));
    }

    @Test
    void callForOutcome_successIsCountedAsOk() throws Exception {
        Provider p = new TestProviders.FixedProvider("ok-test");
        double before = DispatchMetrics.count("ok-test", CallOutcome.Status.OK);

        CallOutcome outcome = ProviderCalls.callForOutcome(p, "x", List.of()).get(1, TimeUnit.SECONDS);

        assertTrue(outcome.isOk());
        assertEquals("ok-test: x", outcome.text());
        assertEquals(before + 1, DispatchMetrics.count("ok-test", CallOutcome.Status.OK));
    }

    @Test
    void call_nullProviderDegrades() throws Exception {
        assertTrue(ProviderCalls.call(null, "x", List.of()).get(1, TimeUnit.SECONDS).startsWith(ProviderCalls.ERROR_PREFIX));
    }
}
