package com.taskforge.core.spawn;

@FunctionalInterface
public interface SessionExecutor {

    SessionOutcome execute(SpawnedSession session, SpawnConfig config, SessionContext context) throws Exception;
}
