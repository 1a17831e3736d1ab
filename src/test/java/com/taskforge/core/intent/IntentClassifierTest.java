package com.taskforge.core.intent;

import com.taskforge.core.capability.CapabilityRegistry;
import com.taskforge.core.concurrent.MutableClock;
import com.taskforge.core.llm.ModelBackend;
import com.taskforge.core.llm.ModelBackendException;
import com.taskforge.core.model.Intent;
import com.taskforge.core.model.TaskAction;
import com.taskforge.core.model.TaskStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class IntentClassifierTest {

    private static final String SEARCH_ANSWER = """
            {"steps":[{"action":"search","reasoning":"find experts","requiredCapabilities":["expert_search"]}]}
            """;

    private ModelBackend model;
    private IntentProperties properties;
    private MutableClock clock;
    private IntentClassifier classifier;

    @BeforeEach
    void setUp() {
        model = mock(ModelBackend.class);
        properties = new IntentProperties();
        clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
        classifier = new IntentClassifier(model, new CapabilityRegistry(), properties, clock);
    }

    // -- Explicit sequences ---------------------------------------------------

    @Nested
    @DisplayName("explicit capability sequences")
    class ExplicitSequence {

        @Test
        @DisplayName("a Required tools header wins without calling the model")
        void requiredToolsHeader() {
            Intent intent = classifier.classify("""
                    Build the supplier overview.
                    Required tools:
                    - expert_search
                    - create_file

                    Thanks!
                    """, List.of("expert_search", "create_file"));

            assertEquals(Intent.ClassifiedBy.FALLBACK, intent.classifiedBy());
            assertTrue(intent.multiStep());
            assertEquals(List.of(TaskAction.SEARCH, TaskAction.CREATE),
                    intent.steps().stream().map(TaskStep::action).toList());
            assertEquals(List.of("expert_search"), intent.steps().get(0).requiredCapabilities());
            verifyNoInteractions(model);
        }

        @Test
        @DisplayName("numbered steps naming known capabilities are used in order")
        void numberedSteps() {
            Intent intent = classifier.classify("""
                    1. run category_search for pumps
                    2. then compare_products on the hits
                    """, List.of("category_search", "compare_products"));

            assertEquals(List.of("category_search", "compare_products"),
                    intent.steps().stream().map(TaskStep::firstCapability).toList());
            verifyNoInteractions(model);
        }
    }

    // -- Model path -----------------------------------------------------------

    @Nested
    @DisplayName("model classification")
    class ModelPath {

        @Test
        @DisplayName("uses the model answer when it decodes")
        void usesModelAnswer() {
            when(model.complete(anyString(), anyString())).thenReturn(SEARCH_ANSWER);

            Intent intent = classifier.classify("Find experts on heat pumps");

            assertEquals(Intent.ClassifiedBy.MODEL, intent.classifiedBy());
            assertFalse(intent.multiStep());
            assertEquals(TaskAction.SEARCH, intent.steps().get(0).action());
        }

        @Test
        @DisplayName("falls back to the pattern table when the model throws")
        void modelFailure() {
            when(model.complete(anyString(), anyString())).thenThrow(new ModelBackendException("boom"));

            Intent intent = classifier.classify("Search suppliers and generate a PDF report");

            assertEquals(Intent.ClassifiedBy.FALLBACK, intent.classifiedBy());
            assertEquals(List.of(TaskAction.SEARCH, TaskAction.CREATE),
                    intent.steps().stream().map(TaskStep::action).toList());
        }

        @Test
        @DisplayName("falls back when the model answer is not decodable")
        void undecodableAnswer() {
            when(model.complete(anyString(), anyString())).thenReturn("no idea, sorry");

            Intent intent = classifier.classify("compute the average");

            assertEquals(Intent.ClassifiedBy.FALLBACK, intent.classifiedBy());
            assertEquals(TaskAction.CALCULATE, intent.steps().get(0).action());
        }

        @Test
        @DisplayName("skips the model when it is disabled")
        void modelDisabled() {
            properties.setModelEnabled(false);

            Intent intent = classifier.classify("compare two offers");

            assertEquals(TaskAction.COMPARE, intent.steps().get(0).action());
            verifyNoInteractions(model);
        }

        @Test
        @DisplayName("works without any model backend")
        void noBackend() {
            var local = new IntentClassifier(null, new CapabilityRegistry(), properties, clock);

            Intent intent = local.classify("examine the logs");

            assertEquals(Intent.ClassifiedBy.FALLBACK, intent.classifiedBy());
            assertEquals(TaskAction.ANALYZE, intent.steps().get(0).action());
        }
    }

    // -- Cache ----------------------------------------------------------------

    @Nested
    @DisplayName("cache")
    class CacheTests {

        @Test
        @DisplayName("same normalized instruction is classified once")
        void cachesByNormalizedText() {
            when(model.complete(anyString(), anyString())).thenReturn(SEARCH_ANSWER);

            Intent first = classifier.classify("Find experts on heat pumps");
            Intent second = classifier.classify("   FIND EXPERTS ON HEAT PUMPS  ");

            assertSame(first, second);
            verify(model, times(1)).complete(anyString(), anyString());
        }

        @Test
        @DisplayName("entries expire after the TTL")
        void expires() {
            when(model.complete(anyString(), anyString())).thenReturn(SEARCH_ANSWER);

            classifier.classify("Find experts on heat pumps");
            clock.advance(Duration.ofMillis(properties.getCacheTtlMs()).plusSeconds(1));
            classifier.classify("Find experts on heat pumps");

            verify(model, times(2)).complete(anyString(), anyString());
        }

        @Test
        @DisplayName("clearCache forces reclassification")
        void clearCache() {
            when(model.complete(anyString(), anyString())).thenReturn(SEARCH_ANSWER);

            classifier.classify("Find experts on heat pumps");
            classifier.clearCache();
            classifier.classify("Find experts on heat pumps");

            verify(model, times(2)).complete(anyString(), anyString());
        }

        @Test
        @DisplayName("normalize lowercases, trims and truncates the key")
        void normalize() {
            assertEquals("hello world", IntentClassifier.normalize("  Hello World "));
            assertEquals(IntentClassifier.CACHE_KEY_LENGTH, IntentClassifier.normalize("x".repeat(500)).length());
            assertEquals("", IntentClassifier.normalize(null));
        }
    }
}
