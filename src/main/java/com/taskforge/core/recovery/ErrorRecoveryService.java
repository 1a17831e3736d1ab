package com.taskforge.core.recovery;

import com.taskforge.core.concurrent.Sleeper;
import com.taskforge.core.metrics.TaskforgeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executes the recovery strategy chosen for a failed capability call.
 * <p>
 * Retry strategies re-run the call through the supplied {@link Reinvoker}; skip and
 * simplify produce a structured failure result the model can read; abort gives up.
 */
@Service
public class ErrorRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(ErrorRecoveryService.class);

    private final ErrorClassifier classifier;
    private final RecoveryProperties properties;
    private final TaskforgeMetrics metrics;
    private final Sleeper sleeper;

    @Autowired
    public ErrorRecoveryService(ErrorClassifier classifier, RecoveryProperties properties,
                                TaskforgeMetrics metrics) {
        this(classifier, properties, metrics, Sleeper.SYSTEM);
    }

    public ErrorRecoveryService(ErrorClassifier classifier, RecoveryProperties properties,
                                TaskforgeMetrics metrics, Sleeper sleeper) {
        this.classifier = classifier;
        this.properties = properties;
        this.metrics = metrics;
        this.sleeper = sleeper;
    }

    public ClassifiedError classify(Throwable error) {
        return classifier.classify(error);
    }

    public RecoveryStrategy selectStrategy(ClassifiedError error) {
        return classifier.selectStrategy(error);
    }

    /**
     * Attempts recovery once for a classified failure of {@code capability}.
     */
    public RecoveryOutcome recover(ClassifiedError error, String capability, Reinvoker reinvoker) {
        RecoveryStrategy strategy = classifier.selectStrategy(error);
        log.info("Recovering {} from {} using {}", capability, error.kind().wireName(), strategy.wireName());
        RecoveryOutcome outcome = switch (strategy) {
            case RETRY_WITH_BACKOFF -> properties.toRetryPolicy()
                    .retryWithBackoff(() -> reinvoker.invoke(capability), sleeper);
            case RETRY -> RetryPolicy.retrySimple(() -> reinvoker.invoke(capability),
                    properties.getSimpleRetryAttempts());
            case ALTERNATIVE_TOOL -> tryAlternative(capability, reinvoker);
            case SKIP_STEP -> RecoveryOutcome.success(
                    failureResult(error, "Step skipped: the requested resource does not exist", true),
                    strategy, 0);
            case SIMPLIFY_REQUEST -> RecoveryOutcome.success(
                    failureResult(error, "Simplify the arguments and call the capability again", false),
                    strategy, 0);
            case ABORT -> RecoveryOutcome.failure(strategy, 0, error.message());
        };
        metrics.recordRecovery(strategy.wireName(), outcome.recovered());
        return outcome;
    }

    private RecoveryOutcome tryAlternative(String capability, Reinvoker reinvoker) {
        String alternative = properties.getAlternatives().get(capability);
        if (alternative == null || alternative.equals(capability)) {
            return RecoveryOutcome.failure(RecoveryStrategy.ALTERNATIVE_TOOL, 0,
                    "No alternative configured for " + capability);
        }
        try {
            Object result = reinvoker.invoke(alternative);
            return RecoveryOutcome.success(result, RecoveryStrategy.ALTERNATIVE_TOOL, 1);
        } catch (Exception e) {
            log.warn("Alternative {} for {} also failed: {}", alternative, capability, e.getMessage());
            return RecoveryOutcome.failure(RecoveryStrategy.ALTERNATIVE_TOOL, 1, e.getMessage());
        }
    }

    private static Map<String, Object> failureResult(ClassifiedError error, String hint, boolean skipped) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", false);
        result.put("error", error.message());
        result.put("errorType", error.kind().wireName());
        result.put("hint", hint);
        if (skipped) {
            result.put("skipped", true);
        }
        return result;
    }

    /**
     * Re-runs a capability call by name with the original arguments.
     */
    @FunctionalInterface
    public interface Reinvoker {
        Object invoke(String capability) throws Exception;
    }
}
