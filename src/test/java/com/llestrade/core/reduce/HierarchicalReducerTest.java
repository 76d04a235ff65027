package com.llestrade.core.reduce;

import com.llestrade.core.chunking.ChunkingEngine;
import com.llestrade.core.chunking.ModelTarget;
import com.llestrade.core.coordinator.CancellationToken;
import com.llestrade.core.errors.BudgetExceededException;
import com.llestrade.core.errors.CancellationRequestedException;
import com.llestrade.core.errors.ReductionException;
import com.llestrade.core.errors.TransientProviderException;
import com.llestrade.core.llm.FakeProvider;
import com.llestrade.core.llm.TokenEstimates;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HierarchicalReducerTest {

    private static final BatchPromptBuilder JOIN = batch -> String.join("\n\n", batch);

    private FakeProvider provider;
    private ChunkingEngine chunkingEngine;
    private HierarchicalReducer reducer;
    private ModelTarget target;

    @BeforeEach
    void setUp() {
        provider = new FakeProvider("fake", 100_000);
        chunkingEngine = new ChunkingEngine();
        reducer = new HierarchicalReducer(chunkingEngine, 0.65, 8);
        target = new ModelTarget(provider, "m");
    }

    private ReductionRequest request(List<String> items, CancellationToken cancellation) {
        return new ReductionRequest(items, "sys", JOIN, target, 0.1, 1_000, cancellation);
    }

    /** A text of exactly {@code tokens} estimated tokens. */
    private static String textOf(int tokens) {
        return "a".repeat(tokens * TokenEstimates.CHARS_PER_TOKEN);
    }

    private static List<String> items(int count, int tokensEach) {
        List<String> items = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            items.add(textOf(tokensEach));
        }
        return items;
    }

    @Test
    @DisplayName("budget is the merge fraction of the context window")
    void budget() {
        assertEquals(65_000, reducer.budget(target));
    }

    @Test
    @DisplayName("inputs that fit together take a single call")
    void fastPath() {
        ReductionResult result = reducer.reduce(request(List.of("one", "two", "three"), null));

        assertEquals(1, result.invocations());
        assertEquals(1, result.levels());
        assertEquals(1, provider.callCount());
        assertEquals("one\n\ntwo\n\nthree", provider.calls().get(0).userPrompt());
    }

    @Test
    @DisplayName("39 inputs of 5K tokens are batched once and merged in a final pass")
    void hierarchicalScenario() {
        ReductionResult result = reducer.reduce(request(items(39, 5_000), null));

        // 12 + 12 + 12 + 3, then one final merge
        assertEquals(5, result.invocations());
        assertEquals(2, result.levels());
        assertEquals(5, provider.callCount());
        for (FakeProvider.Call call : provider.calls()) {
            int tokens = TokenEstimates.estimate(call.systemPrompt()) + TokenEstimates.estimate(call.userPrompt());
            assertTrue(tokens <= 65_000, "call used " + tokens + " tokens");
        }
        assertEquals("summary 5", result.text());
    }

    @Test
    @DisplayName("batching keeps input order and closes a batch before it overflows")
    void batchOrder() {
        List<String> inputs = List.of(textOf(30_000), textOf(30_000), textOf(30_000));

        List<List<String>> batches = reducer.batch(request(inputs, null), inputs, 65_000);

        assertEquals(2, batches.size());
        assertEquals(2, batches.get(0).size());
        assertEquals(1, batches.get(1).size());
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("an input larger than the budget on its own is rejected")
        void singleInputTooLarge() {
            var error = assertThrows(BudgetExceededException.class,
                    () -> reducer.reduce(request(List.of(textOf(70_000), "small"), null)));

            assertEquals(65_000, error.getBudget());
            assertEquals(0, provider.callCount());
        }

        @Test
        @DisplayName("a level where no two inputs fit together is rejected")
        void noProgress() {
            assertThrows(BudgetExceededException.class,
                    () -> reducer.reduce(request(items(3, 40_000), null)));
            assertEquals(0, provider.callCount());
        }

        @Test
        @DisplayName("stops after the configured number of levels")
        void maxLevels() {
            HierarchicalReducer shallow = new HierarchicalReducer(chunkingEngine, 0.65, 1);
            provider.respondingWith((s, u) -> textOf(20_000));

            var error = assertThrows(BudgetExceededException.class,
                    () -> shallow.reduce(request(items(39, 5_000), null)));

            assertTrue(error.getMessage().contains("did not converge"));
            assertEquals(4, provider.callCount());
        }

        @Test
        @DisplayName("a failing batch is reported with its level and position")
        void wrapsBatchErrors() {
            AtomicInteger calls = new AtomicInteger();
            provider.respondingWith((s, u) -> {
                if (calls.incrementAndGet() == 2) {
                    throw new TransientProviderException("All providers failed", 503);
                }
                return "ok";
            });

            var error = assertThrows(ReductionException.class,
                    () -> reducer.reduce(request(items(39, 5_000), null)));

            assertEquals(1, error.getLevel());
            assertEquals(2, error.getBatchIndex());
            assertTrue(error.getMessage().startsWith("Hierarchical reduction failed at level 1, batch 2/4"));
            assertInstanceOf(TransientProviderException.class, error.getCause());
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("cancelling mid-reduction stops before the next call")
        void midReduction() {
            provider.respondingWith((s, u) -> "partial");
            CancellationToken token = () -> provider.callCount() >= 2;

            assertThrows(CancellationRequestedException.class,
                    () -> reducer.reduce(request(items(39, 5_000), token)));

            assertEquals(2, provider.callCount());
        }

        @Test
        @DisplayName("a result that arrives after cancellation is discarded")
        void lateResult() {
            AtomicBoolean cancelled = new AtomicBoolean();
            provider.respondingWith((s, u) -> {
                cancelled.set(true);
                return "late";
            });

            assertThrows(CancellationRequestedException.class,
                    () -> reducer.reduce(request(List.of("a", "b"), cancelled::get)));
            assertEquals(1, provider.callCount());
        }

        @Test
        @DisplayName("an already cancelled request makes no calls")
        void alreadyCancelled() {
            assertThrows(CancellationRequestedException.class,
                    () -> reducer.reduce(request(List.of("a"), () -> true)));
            assertEquals(0, provider.callCount());
        }
    }
}
