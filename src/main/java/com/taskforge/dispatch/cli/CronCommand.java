package com.taskforge.dispatch.cli;

import com.taskforge.core.scheduler.CronExpression;
import com.taskforge.core.scheduler.CronScheduler;
import com.taskforge.core.scheduler.InvalidCronExpressionException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: taskforge cron "&lt;expression&gt;"
 * <p>
 * Validates a cron expression and shows whether it matches now and when it next fires.
 */
@Command(name = "cron", mixinStandardHelpOptions = true, description = "Check a cron expression")
@Component
public class CronCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Five-field cron expression, e.g. \"0 9 * * 1-5\"")
    private String expression;

    private final CronScheduler scheduler;

    public CronCommand(CronScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public Integer call() {
        try {
            CronExpression.parse(expression);
        } catch (InvalidCronExpressionException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        ConsoleOutput.success("Valid: " + expression);
        System.out.println("  Matches now: " + scheduler.shouldRunNow(expression));
        Optional<Instant> next = scheduler.getNextRun(expression);
        System.out.println("  Next run:    " + next.map(Instant::toString).orElse("none within 48h"));
        return 0;
    }
}
