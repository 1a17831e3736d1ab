package com.taskforge.core.react;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.taskforge.core.capability.CapabilityDescriptor;
import com.taskforge.core.capability.CapabilityRegistry;
import com.taskforge.core.concurrent.CancellationToken;
import com.taskforge.core.intent.ContinuationPrompts;
import com.taskforge.core.intent.IntentClassifier;
import com.taskforge.core.intent.TaskCompletionValidator;
import com.taskforge.core.llm.ModelBackend;
import com.taskforge.core.metrics.TaskforgeMetrics;
import com.taskforge.core.model.Intent;
import com.taskforge.core.model.TaskAction;
import com.taskforge.core.model.TaskCompletion;
import com.taskforge.core.model.TaskStep;
import com.taskforge.core.model.TranscriptEntry;
import com.taskforge.core.router.ToolExecutionRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Runs the think-act-observe loop for one instruction.
 * <p>
 * The first cycle lets the model call capabilities until it produces an answer.
 * Multi-step intents then enter a bounded continuation loop: whenever the executed
 * capabilities leave a step unsatisfied, a continuation hint naming that step is
 * appended and the model is asked again. Capability calls are deduplicated across
 * the whole run. A run never throws; failures become a best-effort result.
 */
@Service
public class ReActController {

    private static final Logger log = LoggerFactory.getLogger(ReActController.class);

    static final Set<String> COMPUTE_CAPABILITIES = Set.of("bash_tool", "execute_code", "execute_bash");

    private final IntentClassifier intentClassifier;
    private final ToolExecutionRouter router;
    private final ModelBackend modelBackend;
    private final CapabilityRegistry registry;
    private final TaskCompletionValidator completionValidator;
    private final ReActProperties properties;
    private final TaskforgeMetrics metrics;
    private final ObjectMapper mapper = new ObjectMapper()
            .findAndRegisterModules()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    public ReActController(IntentClassifier intentClassifier,
                           ToolExecutionRouter router,
                           ModelBackend modelBackend,
                           CapabilityRegistry registry,
                           @Autowired(required = false) TaskCompletionValidator completionValidator,
                           ReActProperties properties,
                           TaskforgeMetrics metrics) {
        this.intentClassifier = intentClassifier;
        this.router = router;
        this.modelBackend = modelBackend;
        this.registry = registry;
        this.completionValidator = completionValidator;
        this.properties = properties;
        this.metrics = metrics;
    }

    public ReActResult run(String instruction, List<TranscriptEntry> history, List<String> attachments) {
        return run(instruction, history, attachments, RunListener.NONE, CancellationToken.create());
    }

    public ReActResult run(String instruction, List<TranscriptEntry> history, List<String> attachments,
                           RunListener listener, CancellationToken token) {
        return run(instruction, history, attachments, listener, token, properties.getMaxToolTurns());
    }

    /**
     * @param maxToolTurns capability turns allowed per cycle, overriding the configured default
     */
    public ReActResult run(String instruction, List<TranscriptEntry> history, List<String> attachments,
                           RunListener listener, CancellationToken token, int maxToolTurns) {
        Intent intent = intentClassifier.classify(instruction);
        RunState state = new RunState(
                TranscriptTrimmer.trim(history, properties.getMaxContextMessages(), properties.getRecentKeep()),
                listener, token, maxToolTurns > 0 ? maxToolTurns : properties.getMaxToolTurns());
        if (intent.multiStep()) {
            listener.onStep("Multi-step task (" + intent.steps().size() + " steps): "
                    + intent.steps().stream().map(s -> s.action().wireName()).toList());
        }

        state.transcript.add(TranscriptEntry.user(userContent(instruction, attachments)));
        runCycle(state);

        if (!intent.multiStep() || completionValidator == null) {
            return state.toResult(0, intent);
        }

        int attempts = 0;
        while (attempts < properties.getMaxContinuationAttempts() && !state.stopped) {
            TaskCompletion completion = completionValidator.validate(intent, state.executed);
            if (completion.complete()) {
                listener.onStep("All steps completed");
                break;
            }
            if (state.executed.isEmpty()) {
                log.info("No capability was invoked; not issuing continuation prompts");
                break;
            }
            TaskStep pending = completion.missingSteps().get(0);
            if (isRecomputeAlreadySatisfied(pending, state.executed)) {
                log.info("Remaining {} step already covered by a compute call", pending.action().wireName());
                break;
            }

            listener.onStep("Continuing with " + pending.action().wireName());
            state.transcript.add(TranscriptEntry.user(ContinuationPrompts.build(pending, state.lastResult)));
            int invocationsBefore = state.invocations;
            runCycle(state);
            attempts++;
            if (state.invocations == invocationsBefore) {
                log.info("No new capability calls after continuation {}; stopping", attempts);
                break;
            }
        }
        if (attempts >= properties.getMaxContinuationAttempts()) {
            log.warn("Reached max continuation attempts ({}) for multi-step task", attempts);
        }
        metrics.recordContinuationAttempts(attempts);
        return state.toResult(attempts, intent);
    }

    static boolean isRecomputeAlreadySatisfied(TaskStep pending, Set<String> executed) {
        if (pending.action() != TaskAction.CALCULATE) {
            return false;
        }
        for (String capability : executed) {
            if (COMPUTE_CAPABILITIES.contains(capability)) {
                return true;
            }
        }
        return false;
    }

    private void runCycle(RunState state) {
        String systemPrompt = systemPrompt();
        for (int turn = 0; turn < state.maxToolTurns; turn++) {
            if (state.token.isCancelled()) {
                state.stop("Run cancelled: " + state.token.reason());
                return;
            }
            ReActTurn next;
            try {
                next = modelBackend.structuredCall(systemPrompt, render(state), ReActTurn.class);
            } catch (Exception e) {
                log.warn("Model turn failed: {}", e.getMessage());
                state.stop("Model unavailable: " + e.getMessage());
                return;
            }
            if (next == null) {
                state.stop("Model returned no turn");
                return;
            }
            if (next.thought() != null && !next.thought().isBlank()) {
                state.transcript.add(TranscriptEntry.assistant(next.thought()));
            }
            if (next.calls().isEmpty()) {
                String answer = next.answer() == null ? "" : next.answer();
                state.answer = answer;
                if (!answer.isBlank()) {
                    state.transcript.add(TranscriptEntry.assistant(answer));
                }
                return;
            }
            try {
                for (CapabilityCall call : next.calls()) {
                    state.token.throwIfCancelled();
                    act(state, call);
                }
            } catch (CancellationException e) {
                state.stop("Run cancelled: " + e.getMessage());
                return;
            }
        }
        log.info("Cycle stopped after {} capability turns", state.maxToolTurns);
        if (state.answer == null || state.answer.isBlank()) {
            state.answer = "Stopped after " + state.maxToolTurns + " capability turns";
        }
    }

    private void act(RunState state, CapabilityCall call) {
        String signature = call.capability() + "::" + json(call.args());
        Object result;
        if (state.dedup.containsKey(signature)) {
            result = state.dedup.get(signature);
            log.debug("Reusing result of {} within the run", call.capability());
        } else {
            state.listener.onStep("Calling " + call.capability());
            try {
                result = router.execute(call.capability(), call.args());
            } catch (RuntimeException e) {
                Map<String, Object> failure = new LinkedHashMap<>();
                failure.put("success", false);
                failure.put("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                result = failure;
            }
            state.dedup.put(signature, result);
            state.executed.add(call.capability());
            state.invocations++;
        }
        state.lastResult = result;
        state.transcript.add(TranscriptEntry.observation(call.capability(), truncate(json(result))));
    }

    private String systemPrompt() {
        StringBuilder prompt = new StringBuilder(properties.getSystemPrompt().strip()).append("\n\nCapabilities:\n");
        List<CapabilityDescriptor> descriptors = registry.descriptors();
        if (descriptors.isEmpty()) {
            prompt.append("- (none)\n");
        }
        for (CapabilityDescriptor d : descriptors) {
            prompt.append("- ").append(d.name());
            if (d.description() != null && !d.description().isBlank()) {
                prompt.append(": ").append(d.description());
            }
            prompt.append('\n');
        }
        return prompt.toString();
    }

    private static String render(RunState state) {
        StringBuilder text = new StringBuilder();
        for (TranscriptEntry e : state.context) {
            appendEntry(text, e);
        }
        for (TranscriptEntry e : state.transcript) {
            appendEntry(text, e);
        }
        return text.toString();
    }

    private static void appendEntry(StringBuilder text, TranscriptEntry e) {
        switch (e.role()) {
            case USER -> text.append("USER: ");
            case ASSISTANT -> text.append("ASSISTANT: ");
            case OBSERVATION -> text.append("OBSERVATION[").append(e.capability()).append("]: ");
        }
        text.append(e.content()).append("\n\n");
    }

    private static String userContent(String instruction, List<String> attachments) {
        if (attachments == null || attachments.isEmpty()) {
            return instruction;
        }
        return instruction + "\n\nAttachments:\n- " + String.join("\n- ", attachments);
    }

    private String json(Object value) {
        if (value instanceof String s) {
            return s;
        }
        try {
            return mapper.writeValueAsString(value);
        } catch (Exception e) {
            return String.valueOf(value);
        }
    }

    private String truncate(String text) {
        int max = properties.getObservationMaxChars();
        return text.length() > max ? text.substring(0, max) + "...(truncated)" : text;
    }

    private static final class RunState {
        final List<TranscriptEntry> context;
        final List<TranscriptEntry> transcript = new ArrayList<>();
        final Map<String, Object> dedup = new LinkedHashMap<>();
        final Set<String> executed = new LinkedHashSet<>();
        final RunListener listener;
        final CancellationToken token;
        final int maxToolTurns;
        int invocations;
        Object lastResult;
        String answer;
        boolean stopped;

        RunState(List<TranscriptEntry> context, RunListener listener, CancellationToken token, int maxToolTurns) {
            this.context = context;
            this.listener = listener;
            this.token = token;
            this.maxToolTurns = maxToolTurns;
        }

        void stop(String reason) {
            stopped = true;
            if (answer == null || answer.isBlank()) {
                answer = reason;
            }
        }

        ReActResult toResult(int attempts, Intent intent) {
            return new ReActResult(answer == null ? "" : answer, List.copyOf(transcript),
                    List.copyOf(executed), attempts, intent);
        }
    }
}
