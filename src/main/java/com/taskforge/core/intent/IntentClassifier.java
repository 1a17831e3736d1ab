package com.taskforge.core.intent;

import com.taskforge.core.capability.CapabilityRegistry;
import com.taskforge.core.llm.ModelBackend;
import com.taskforge.core.model.Intent;
import com.taskforge.core.model.TaskAction;
import com.taskforge.core.model.TaskStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decomposes an instruction into ordered {@link TaskStep}s.
 * <p>
 * Three strategies are tried in order: an explicit capability sequence written in the
 * instruction itself, a model-assisted classification, and the regex
 * {@link ActionPatternTable}. Results are cached per normalized instruction.
 * Classification never fails: model errors and malformed answers fall through.
 */
@Service
public class IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(IntentClassifier.class);

    static final int CACHE_KEY_LENGTH = 200;

    private static final String SYSTEM_PROMPT = """
            You decompose a user instruction into the ordered steps an agent must perform.
            Allowed actions: %s.
            Answer with JSON only, in the form:
            {"steps":[{"action":"<action>","reasoning":"<why>","requiredCapabilities":["<capability>"]}]}
            Use only capability names from the provided list. Use a single step when the
            instruction asks for one thing.
            """.formatted(String.join(", ",
                    Arrays.stream(TaskAction.values()).map(TaskAction::wireName).toList()));

    private final ModelBackend modelBackend;
    private final CapabilityRegistry registry;
    private final IntentProperties properties;
    private final Clock clock;
    private final ConcurrentHashMap<String, CachedIntent> cache = new ConcurrentHashMap<>();

    public IntentClassifier(@Autowired(required = false) ModelBackend modelBackend,
                            CapabilityRegistry registry,
                            IntentProperties properties,
                            Clock clock) {
        this.modelBackend = modelBackend;
        this.registry = registry;
        this.properties = properties;
        this.clock = clock;
    }

    public Intent classify(String instruction) {
        return classify(instruction, registry.names());
    }

    public Intent classify(String instruction, Collection<String> availableCapabilities) {
        String key = normalize(instruction);
        Instant now = clock.instant();
        CachedIntent cached = cache.get(key);
        if (cached != null && cached.expiresAt().isAfter(now)) {
            return cached.intent();
        }

        Intent intent = classifyUncached(instruction == null ? "" : instruction, availableCapabilities);
        if (cache.size() >= properties.getCacheMaxEntries()) {
            cache.values().removeIf(c -> !c.expiresAt().isAfter(now));
        }
        cache.put(key, new CachedIntent(intent, now.plusMillis(properties.getCacheTtlMs())));
        log.info("Classified instruction into {} step(s) via {}: {}", intent.steps().size(),
                intent.classifiedBy(), intent.steps().stream().map(s -> s.action().wireName()).toList());
        return intent;
    }

    private Intent classifyUncached(String instruction, Collection<String> available) {
        List<String> explicit = ExplicitSequenceParser.parse(instruction, available);
        if (!explicit.isEmpty()) {
            List<TaskStep> steps = new ArrayList<>();
            for (String capability : explicit) {
                Set<TaskAction> actions = registry.actionsFor(capability);
                TaskAction action = actions.isEmpty() ? TaskAction.ANALYZE : actions.iterator().next();
                steps.add(new TaskStep(action, List.of(capability), "Explicitly requested: " + capability));
            }
            return Intent.of(steps, Intent.ClassifiedBy.FALLBACK);
        }

        if (modelBackend != null && properties.isModelEnabled()) {
            try {
                String answer = modelBackend.complete(SYSTEM_PROMPT, userPrompt(instruction, available));
                DecodeResult<List<TaskStep>> decoded = IntentDecoder.decode(answer);
                if (decoded.isSuccess()) {
                    return Intent.of(decoded.value(), Intent.ClassifiedBy.MODEL);
                }
                log.debug("Model intent rejected: {}", decoded.error().message());
            } catch (Exception e) {
                log.warn("Model intent classification failed, using pattern fallback: {}", e.getMessage());
            }
        }

        return Intent.of(ActionPatternTable.match(instruction), Intent.ClassifiedBy.FALLBACK);
    }

    private static String userPrompt(String instruction, Collection<String> available) {
        return "Available capabilities: " + (available.isEmpty() ? "(none)" : String.join(", ", available))
                + "\n\nInstruction:\n" + instruction;
    }

    static String normalize(String instruction) {
        String key = instruction == null ? "" : instruction.trim().toLowerCase(Locale.ROOT);
        return key.length() > CACHE_KEY_LENGTH ? key.substring(0, CACHE_KEY_LENGTH) : key;
    }

    public void clearCache() {
        cache.clear();
    }

    private record CachedIntent(Intent intent, Instant expiresAt) {}
}
