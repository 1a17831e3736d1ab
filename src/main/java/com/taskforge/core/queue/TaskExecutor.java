package com.taskforge.core.queue;

/**
 * Work submitted to {@link TaskQueue#runInBackground}. Runs on a worker thread.
 */
@FunctionalInterface
public interface TaskExecutor {

    TaskResult execute(BackgroundTask task, TaskContext context) throws Exception;
}
