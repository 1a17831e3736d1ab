package com.taskforge.core.intent;

import com.taskforge.core.model.TaskAction;
import com.taskforge.core.model.TaskStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IntentDecoderTest {

    @Nested
    @DisplayName("accepted answers")
    class Accepted {

        @Test
        @DisplayName("decodes bare JSON")
        void bareJson() {
            var result = IntentDecoder.decode("""
                    {"steps":[{"action":"search","reasoning":"look it up","requiredCapabilities":["expert_search"]}]}
                    """);

            assertTrue(result.isSuccess());
            List<TaskStep> steps = result.value();
            assertEquals(1, steps.size());
            assertEquals(TaskAction.SEARCH, steps.get(0).action());
            assertEquals("look it up", steps.get(0).reasoning());
            assertEquals(List.of("expert_search"), steps.get(0).requiredCapabilities());
        }

        @Test
        @DisplayName("decodes JSON inside a markdown fence")
        void fencedJson() {
            var result = IntentDecoder.decode("""
                    Here you go:
                    ```json
                    {"steps":[{"action":"extract","requiredCapabilities":["view"]},
                              {"action":"create","requiredCapabilities":["create_file"]}]}
                    ```
                    """);

            assertTrue(result.isSuccess());
            assertEquals(List.of(TaskAction.EXTRACT, TaskAction.CREATE),
                    result.value().stream().map(TaskStep::action).toList());
        }

        @Test
        @DisplayName("finds the first balanced object in prose, ignoring braces in strings")
        void embeddedInProse() {
            var result = IntentDecoder.decode(
                    "Plan: {\"steps\":[{\"action\":\"compare\",\"reasoning\":\"match {a} to {b}\"}]} done.");

            assertTrue(result.isSuccess());
            assertEquals("match {a} to {b}", result.value().get(0).reasoning());
        }

        @Test
        @DisplayName("accepts requiredTools as an alias")
        void requiredToolsAlias() {
            var result = IntentDecoder.decode("{\"steps\":[{\"action\":\"calculate\",\"requiredTools\":[\"bash_tool\"]}]}");

            assertEquals(List.of("bash_tool"), result.value().get(0).requiredCapabilities());
        }

        @Test
        @DisplayName("drops steps with an unknown action")
        void dropsUnknownActions() {
            var result = IntentDecoder.decode("{\"steps\":[{\"action\":\"dance\"},{\"action\":\"ANALYZE\"}]}");

            assertTrue(result.isSuccess());
            assertEquals(1, result.value().size());
            assertEquals(TaskAction.ANALYZE, result.value().get(0).action());
        }
    }

    @Nested
    @DisplayName("rejected answers")
    class Rejected {

        @Test
        @DisplayName("empty text")
        void empty() {
            assertEquals("Empty model response", IntentDecoder.decode("  ").error().message());
            assertEquals("Empty model response", IntentDecoder.decode(null).error().message());
        }

        @Test
        @DisplayName("no JSON object")
        void noObject() {
            var result = IntentDecoder.decode("I cannot help with that");

            assertFalse(result.isSuccess());
            assertEquals("No JSON object found in model response", result.error().message());
        }

        @Test
        @DisplayName("malformed JSON")
        void malformed() {
            var result = IntentDecoder.decode("{steps: oops}");

            assertFalse(result.isSuccess());
            assertTrue(result.error().message().startsWith("Malformed JSON"));
        }

        @Test
        @DisplayName("missing steps array")
        void missingSteps() {
            assertEquals("Missing steps array", IntentDecoder.decode("{\"plan\":[]}").error().message());
        }

        @Test
        @DisplayName("no valid steps left after filtering")
        void noValidSteps() {
            assertEquals("No valid steps in model response",
                    IntentDecoder.decode("{\"steps\":[{\"action\":\"fly\"}]}").error().message());
        }
    }
}
