package com.taskforge.core.spawn;

import com.taskforge.core.concurrent.CancellationToken;

/**
 * Progress reporter and cancellation flag for one spawned session.
 */
public final class SessionContext {

    private final SessionSpawner spawner;
    private final SpawnedSession session;
    private final CancellationToken token;

    SessionContext(SessionSpawner spawner, SpawnedSession session, CancellationToken token) {
        this.spawner = spawner;
        this.session = session;
        this.token = token;
    }

    public String runId() {
        return session.getRunId();
    }

    /**
     * Reports progress. Values are capped at 99; only completion sets 100.
     */
    public void reportProgress(int percent, String step) {
        spawner.reportProgress(session, percent, step);
    }

    public CancellationToken token() {
        return token;
    }
}
