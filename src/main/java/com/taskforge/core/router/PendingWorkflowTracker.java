package com.taskforge.core.router;

import com.taskforge.core.capability.CapabilityRejectedException;
import com.taskforge.core.capability.PendingFollowUp;
import com.taskforge.core.events.EventBus;
import com.taskforge.core.events.TaskforgeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks obligatory follow-up calls per run. While a follow-up is pending,
 * only the designated capability may be invoked in that run. Entries are dropped
 * when the task or session owning the run reaches a terminal status.
 */
@Component
public class PendingWorkflowTracker {

    private static final Logger log = LoggerFactory.getLogger(PendingWorkflowTracker.class);

    private static final Set<String> RUN_END_EVENTS = Set.of(
            "task.completed", "task.failed", "task.cancelled",
            "session.completed", "session.failed", "session.cancelled");

    private final ConcurrentHashMap<String, PendingFollowUp> pendingByRun = new ConcurrentHashMap<>();

    public PendingWorkflowTracker() {
    }

    @Autowired
    public PendingWorkflowTracker(EventBus eventBus) {
        eventBus.subscribeAll(this::onEvent);
    }

    private void onEvent(TaskforgeEvent event) {
        if (RUN_END_EVENTS.contains(event.eventType()) && pendingByRun.remove(event.runId()) != null) {
            log.debug("Dropped pending follow-up of finished run {}", event.runId());
        }
    }

    public void require(String runId, PendingFollowUp followUp) {
        pendingByRun.put(runId, followUp);
        log.info("Run {} must call {} next ({})", runId, followUp.requiredCapability(), followUp.reason());
    }

    public Optional<PendingFollowUp> pending(String runId) {
        return Optional.ofNullable(pendingByRun.get(runId));
    }

    /**
     * @throws CapabilityRejectedException if a different follow-up is pending for the run
     */
    public void check(String runId, String capability) {
        PendingFollowUp followUp = pendingByRun.get(runId);
        if (followUp == null || followUp.requiredCapability().equals(capability)) {
            return;
        }
        throw new CapabilityRejectedException(capability, "pending_workflow",
                "Workflow requires " + followUp.requiredCapability() + " to run next (pending since "
                        + followUp.triggeredBy() + "): " + followUp.reason());
    }

    /**
     * Clears the pending follow-up when {@code capability} is the one it was waiting for.
     */
    public void onCompleted(String runId, String capability) {
        pendingByRun.computeIfPresent(runId,
                (k, followUp) -> followUp.requiredCapability().equals(capability) ? null : followUp);
    }

    public void clear(String runId) {
        pendingByRun.remove(runId);
    }
}
