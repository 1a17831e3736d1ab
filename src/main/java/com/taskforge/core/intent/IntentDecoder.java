package com.taskforge.core.intent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskforge.core.model.TaskAction;
import com.taskforge.core.model.TaskStep;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes a model's intent answer into {@link TaskStep}s.
 * <p>
 * Accepts bare JSON, JSON wrapped in a markdown code fence, or JSON embedded in prose
 * (the first balanced object is used). Steps with an unknown action are dropped.
 * No I/O and no shared mutable state.
 */
public final class IntentDecoder {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern FENCE = Pattern.compile("```(?:json)?\\s*(.*?)```", Pattern.DOTALL);

    private IntentDecoder() {}

    public static DecodeResult<List<TaskStep>> decode(String text) {
        if (text == null || text.isBlank()) {
            return DecodeResult.failure("Empty model response");
        }
        String body = text;
        Matcher fence = FENCE.matcher(text);
        if (fence.find()) {
            body = fence.group(1);
        }
        Optional<String> json = firstBalancedObject(body);
        if (json.isEmpty()) {
            return DecodeResult.failure("No JSON object found in model response");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json.get());
        } catch (JsonProcessingException e) {
            return DecodeResult.failure("Malformed JSON: " + e.getOriginalMessage());
        }
        JsonNode stepsNode = root.get("steps");
        if (stepsNode == null || !stepsNode.isArray()) {
            return DecodeResult.failure("Missing steps array");
        }
        List<TaskStep> steps = new ArrayList<>();
        for (JsonNode node : stepsNode) {
            Optional<TaskAction> action = TaskAction.fromWireName(node.path("action").asText(null));
            if (action.isEmpty()) {
                continue;
            }
            steps.add(new TaskStep(action.get(), capabilities(node), node.path("reasoning").asText("")));
        }
        if (steps.isEmpty()) {
            return DecodeResult.failure("No valid steps in model response");
        }
        return DecodeResult.success(steps);
    }

    private static List<String> capabilities(JsonNode step) {
        JsonNode list = step.has("requiredCapabilities") ? step.get("requiredCapabilities") : step.get("requiredTools");
        List<String> names = new ArrayList<>();
        if (list != null && list.isArray()) {
            for (JsonNode n : list) {
                if (n.isTextual() && !n.asText().isBlank()) {
                    names.add(n.asText().trim());
                }
            }
        }
        return names;
    }

    /**
     * Finds the first brace-balanced {@code {...}} span, ignoring braces inside JSON strings.
     */
    static Optional<String> firstBalancedObject(String text) {
        int start = text.indexOf('{');
        while (start >= 0) {
            int depth = 0;
            boolean inString = false;
            boolean escaped = false;
            for (int i = start; i < text.length(); i++) {
                char c = text.charAt(i);
                if (inString) {
                    if (escaped) {
                        escaped = false;
                    } else if (c == '\\') {
                        escaped = true;
                    } else if (c == '"') {
                        inString = false;
                    }
                    continue;
                }
                if (c == '"') {
                    inString = true;
                } else if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        return Optional.of(text.substring(start, i + 1));
                    }
                }
            }
            start = text.indexOf('{', start + 1);
        }
        return Optional.empty();
    }
}
