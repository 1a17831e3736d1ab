package com.taskforge.core.engine;

import com.taskforge.core.audit.AuditSigner;
import com.taskforge.core.audit.Signature;
import com.taskforge.core.queue.BackgroundTask;
import com.taskforge.core.queue.TaskContext;
import com.taskforge.core.queue.TaskExecutor;
import com.taskforge.core.queue.TaskResult;
import com.taskforge.core.react.ReActController;
import com.taskforge.core.react.ReActResult;
import com.taskforge.core.react.RunListener;
import com.taskforge.core.spawn.SessionContext;
import com.taskforge.core.spawn.SessionExecutor;
import com.taskforge.core.spawn.SessionOutcome;
import com.taskforge.core.spawn.SpawnConfig;
import com.taskforge.core.spawn.SpawnedSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the ReAct loop as the body of background tasks and spawned sessions.
 * <p>
 * Progress notes from the loop become progress reports on the task or session, so
 * they count as iterations for checkpointing and show up as events. Session results
 * are signed when an {@link AuditSigner} is configured.
 */
@Service
public class AgentRunner implements TaskExecutor, SessionExecutor {

    private static final Logger log = LoggerFactory.getLogger(AgentRunner.class);

    private static final int PROGRESS_PER_STEP = 10;
    private static final int PROGRESS_CEILING = 95;
    private static final int SIGNED_PREVIEW_LENGTH = 500;

    private final ReActController controller;
    private final AuditSigner signer;

    public AgentRunner(ReActController controller, @Autowired(required = false) AuditSigner signer) {
        this.controller = controller;
        this.signer = signer;
    }

    @Override
    public TaskResult execute(BackgroundTask task, TaskContext context) {
        RunListener listener = progressListener(context::reportProgress);
        ReActResult result = controller.run(task.getInstruction(), task.getHistory(), task.getAttachments(),
                listener, context.token(), task.getMaxIterations());
        context.token().throwIfCancelled();
        return new TaskResult(result.result(), result.transcript());
    }

    @Override
    public SessionOutcome execute(SpawnedSession session, SpawnConfig config, SessionContext context) {
        long started = System.currentTimeMillis();
        RunListener listener = progressListener(context::reportProgress);
        ReActResult result = controller.run(config.instruction(), List.of(), List.of(),
                listener, context.token(), session.getMaxIterations());
        context.token().throwIfCancelled();
        String signature = sign(session, result.result(), System.currentTimeMillis() - started);
        return new SessionOutcome(result.result(), signature, result.executedCapabilities());
    }

    private String sign(SpawnedSession session, String result, long latencyMs) {
        if (signer == null) {
            return null;
        }
        String preview = result.length() > SIGNED_PREVIEW_LENGTH ? result.substring(0, SIGNED_PREVIEW_LENGTH) : result;
        try {
            Signature signature = signer.sign("session:" + session.getName(),
                    Map.of("runId", session.getRunId(), "instruction", session.getInstruction()),
                    preview, latencyMs);
            return signature == null ? null : signature.value();
        } catch (Exception e) {
            log.warn("Could not sign result of session {}: {}", session.getRunId(), e.getMessage());
            return null;
        }
    }

    private static RunListener progressListener(ProgressSink sink) {
        AtomicInteger steps = new AtomicInteger();
        return message -> sink.report(
                Math.min(PROGRESS_CEILING, steps.incrementAndGet() * PROGRESS_PER_STEP), message);
    }

    @FunctionalInterface
    private interface ProgressSink {
        void report(int percent, String step);
    }
}
