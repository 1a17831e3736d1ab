package com.taskforge.core.router;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.taskforge.core.capability.Capability;
import com.taskforge.core.capability.CapabilityRegistry;
import com.taskforge.core.capability.CapabilityRejectedException;
import com.taskforge.core.concurrent.Sleeper;
import com.taskforge.core.logging.MdcContext;
import com.taskforge.core.metrics.TaskforgeMetrics;
import com.taskforge.core.recovery.ClassifiedError;
import com.taskforge.core.recovery.ErrorRecoveryService;
import com.taskforge.core.recovery.RecoveryOutcome;
import com.taskforge.core.recovery.RecoveryStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single entry point for every capability invocation.
 * <p>
 * Gates, in order: path and argument validation, pending-workflow enforcement,
 * result cache, resource quota. Then the capability runs under a per-call time
 * limit; failures are classified and recovered once. Successful results feed the cache, the invocation hooks
 * and the loop detector.
 */
@Service
public class ToolExecutionRouter {

    private static final Logger log = LoggerFactory.getLogger(ToolExecutionRouter.class);

    private final CapabilityRegistry registry;
    private final PathArgumentValidator pathValidator;
    private final PendingWorkflowTracker workflowTracker;
    private final ErrorRecoveryService recoveryService;
    private final TaskforgeMetrics metrics;
    private final RouterProperties properties;
    private final ResourceManager resourceManager;
    private final List<InvocationHook> hooks;
    private final Executor hookExecutor;
    private final ExecutorService callExecutor;
    private final Clock clock;
    private final Sleeper sleeper;

    private final ResultCache cache;
    private final CallHistory history;
    private final ObjectMapper keyMapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    @Autowired
    public ToolExecutionRouter(CapabilityRegistry registry,
                               PathArgumentValidator pathValidator,
                               PendingWorkflowTracker workflowTracker,
                               ErrorRecoveryService recoveryService,
                               TaskforgeMetrics metrics,
                               RouterProperties properties,
                               ObjectProvider<ResourceManager> resourceManager,
                               ObjectProvider<InvocationHook> hooks,
                               @Qualifier("taskforgeWorkers") ExecutorService workers,
                               Clock clock) {
        this(registry, pathValidator, workflowTracker, recoveryService, metrics, properties,
                resourceManager.getIfAvailable(), hooks.orderedStream().toList(), workers, workers, clock,
                Sleeper.SYSTEM);
    }

    /**
     * Router that invokes capabilities on the calling thread, without a time limit.
     */
    public ToolExecutionRouter(CapabilityRegistry registry,
                               PathArgumentValidator pathValidator,
                               PendingWorkflowTracker workflowTracker,
                               ErrorRecoveryService recoveryService,
                               TaskforgeMetrics metrics,
                               RouterProperties properties,
                               ResourceManager resourceManager,
                               List<InvocationHook> hooks,
                               Executor hookExecutor,
                               Clock clock,
                               Sleeper sleeper) {
        this(registry, pathValidator, workflowTracker, recoveryService, metrics, properties,
                resourceManager, hooks, hookExecutor, null, clock, sleeper);
    }

    public ToolExecutionRouter(CapabilityRegistry registry,
                               PathArgumentValidator pathValidator,
                               PendingWorkflowTracker workflowTracker,
                               ErrorRecoveryService recoveryService,
                               TaskforgeMetrics metrics,
                               RouterProperties properties,
                               ResourceManager resourceManager,
                               List<InvocationHook> hooks,
                               Executor hookExecutor,
                               ExecutorService callExecutor,
                               Clock clock,
                               Sleeper sleeper) {
        this.registry = registry;
        this.pathValidator = pathValidator;
        this.workflowTracker = workflowTracker;
        this.recoveryService = recoveryService;
        this.metrics = metrics;
        this.properties = properties;
        this.resourceManager = resourceManager;
        this.hooks = List.copyOf(hooks);
        this.hookExecutor = hookExecutor;
        this.callExecutor = callExecutor;
        this.clock = clock;
        this.sleeper = sleeper;
        this.cache = new ResultCache(properties.getCacheMaxEntries());
        RouterProperties.History h = properties.getHistory();
        this.history = new CallHistory(h.getCallsPerCapability(), h.getWindowMs(), h.getMaxCapabilities());
    }

    /**
     * Invokes {@code capabilityName} with {@code args}.
     *
     * @return the capability result, a cached copy of it, or a recovery result;
     *         never null
     * @throws CapabilityRejectedException  when a gate refuses the call before invocation
     * @throws RateLimitExceededException   when the quota is exhausted
     * @throws LoopDetectedException        when the same empty result keeps coming back
     */
    public Object execute(String capabilityName, Map<String, Object> args) {
        Map<String, Object> safeArgs = args == null ? Map.of() : args;
        String runId = MdcContext.currentRunId();
        MdcContext.setCapability(capabilityName);
        try {
            Optional<Capability> capability = registry.find(capabilityName);
            try {
                pathValidator.validate(capabilityName, safeArgs);
                if (capability.isPresent()) {
                    capability.get().validate(safeArgs);
                }
                workflowTracker.check(runId, capabilityName);
            } catch (CapabilityRejectedException e) {
                metrics.recordRejection(e.getReason());
                log.warn("Rejected {}: {}", capabilityName, e.getMessage());
                throw e;
            }

            String argsJson = serialize(safeArgs);
            String cacheKey = capabilityName + ":" + argsJson;
            Optional<Object> cached = cache.get(cacheKey);
            if (cached.isPresent()) {
                metrics.recordCacheHit();
                log.debug("Cache hit for {}", capabilityName);
                updateWorkflow(runId, capability, safeArgs, cached.get());
                return cached.get();
            }
            metrics.recordCacheMiss();

            if (resourceManager != null) {
                LimitCheck check = resourceManager.checkLimits(capabilityName, argsJson.length() / 4);
                if (!check.allowed()) {
                    metrics.recordRejection("rate_limit");
                    throw new RateLimitExceededException(check.reason());
                }
            }

            long start = clock.millis();
            Object result = invokeWithRecovery(capabilityName, safeArgs, start);
            long latency = clock.millis() - start;

            String resultJson = serialize(result);
            boolean nonInformative = NonInformativeResults.isNonInformative(result);
            if (!nonInformative) {
                cache.put(cacheKey, result);
            }
            updateWorkflow(runId, capability, safeArgs, result);
            if (resourceManager != null) {
                resourceManager.recordUsage(capabilityName, resultJson.length() / 4);
            }
            fireHooks(new CapabilityInvocation(runId, capabilityName, safeArgs, result, latency, clock.instant()));
            checkForRepeatedResults(capabilityName, resultJson, nonInformative);
            return result;
        } finally {
            MdcContext.clearCapability();
        }
    }

    private Object invokeWithRecovery(String capabilityName, Map<String, Object> args, long start) {
        try {
            Object result = invoke(capabilityName, args);
            metrics.recordCapabilityCall(capabilityName, "success", clock.millis() - start);
            return result;
        } catch (Exception e) {
            metrics.recordCapabilityCall(capabilityName, "failure", clock.millis() - start);
            ClassifiedError classified = recoveryService.classify(e);
            RecoveryStrategy strategy = recoveryService.selectStrategy(classified);
            log.warn("Capability {} failed ({} -> {}): {}", capabilityName,
                    classified.kind().wireName(), strategy.wireName(), classified.message());
            if (strategy == RecoveryStrategy.ABORT) {
                throw propagate(capabilityName, e);
            }
            RecoveryOutcome outcome = recoveryService.recover(classified, capabilityName,
                    name -> invoke(name, args));
            if (outcome.recovered()) {
                log.info("Recovered {} via {} after {} attempt(s)", capabilityName,
                        outcome.strategy().wireName(), outcome.attempts());
                return outcome.result();
            }
            throw propagate(capabilityName, e);
        }
    }

    private Object invoke(String capabilityName, Map<String, Object> args) throws Exception {
        Object result = invokeWithTimeout(registry.require(capabilityName), args);
        if (result == null) {
            Map<String, Object> failure = new LinkedHashMap<>();
            failure.put("success", false);
            failure.put("error", "Capability " + capabilityName + " returned no result");
            return failure;
        }
        return result;
    }

    /**
     * Runs the capability on the call executor and waits at most the configured limit.
     * A call that overruns is interrupted and reported as a {@link TimeoutException}.
     */
    private Object invokeWithTimeout(Capability capability, Map<String, Object> args) throws Exception {
        long timeoutMs = properties.callTimeoutFor(capability.name());
        if (callExecutor == null || timeoutMs <= 0) {
            return capability.invoke(args);
        }
        Map<String, String> mdc = MdcContext.copy();
        Future<Object> future = callExecutor.submit(() -> {
            MdcContext.restore(mdc);
            try {
                return capability.invoke(args);
            } finally {
                MdcContext.clear();
            }
        });
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TimeoutException(capability.name() + " gave no answer within " + timeoutMs + " ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception failure) {
                throw failure;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    private void updateWorkflow(String runId, Optional<Capability> capability, Map<String, Object> args,
                                Object result) {
        if (capability.isEmpty()) {
            return;
        }
        Capability c = capability.get();
        workflowTracker.onCompleted(runId, c.name());
        c.followUpFor(args, result).ifPresent(f -> workflowTracker.require(runId, f));
    }

    private void fireHooks(CapabilityInvocation invocation) {
        for (InvocationHook hook : hooks) {
            try {
                hookExecutor.execute(() -> {
                    try {
                        hook.afterInvocation(invocation);
                    } catch (Exception e) {
                        log.warn("Invocation hook {} failed for {}: {}", hook.getClass().getSimpleName(),
                                invocation.capability(), e.getMessage());
                    }
                });
            } catch (RejectedExecutionException e) {
                log.warn("Invocation hook {} not scheduled: {}", hook.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private void checkForRepeatedResults(String capabilityName, String resultJson, boolean nonInformative) {
        List<CallHistory.Entry> recent = history.record(capabilityName, resultJson, nonInformative, clock.millis());
        int n = recent.size();
        if (n < 2) {
            return;
        }
        CallHistory.Entry previous = recent.get(n - 2);
        CallHistory.Entry latest = recent.get(n - 1);
        if (!latest.nonInformative() || !latest.serializedResult().equals(previous.serializedResult())) {
            return;
        }
        RouterProperties.History settings = properties.getHistory();
        if (n >= settings.getLoopThreshold()) {
            metrics.recordLoopDetected(capabilityName);
            throw new LoopDetectedException(capabilityName, n);
        }
        long wait = Math.min(settings.getBackoffBaseMs() * (1L << (n - 2)), settings.getBackoffMaxMs());
        log.warn("Repeated non-informative result from {}; backing off {} ms", capabilityName, wait);
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static RuntimeException propagate(String capabilityName, Exception e) {
        if (e instanceof RuntimeException runtime) {
            return runtime;
        }
        return new CapabilityExecutionException(capabilityName, e);
    }

    String serialize(Object value) {
        if (value == null) {
            return "null";
        }
        try {
            return keyMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    public int cacheSize() {
        return cache.size();
    }

    public boolean isCached(String capabilityName, Map<String, Object> args) {
        return cache.contains(capabilityName + ":" + serialize(args == null ? Map.of() : args));
    }

    public void clearCache() {
        cache.clear();
    }
}
