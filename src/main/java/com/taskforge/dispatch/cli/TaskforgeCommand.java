package com.taskforge.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command. Routes to subcommands: run, classify, cron, verify-audit, serve.
 */
@Command(
        name = "taskforge",
        mixinStandardHelpOptions = true,
        version = "Taskforge 0.1.0",
        description = "Task-execution agent core: intent planning, capability routing and background runs",
        subcommands = {
                RunCommand.class,
                ClassifyCommand.class,
                CronCommand.class,
                VerifyAuditCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TaskforgeCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // the configured instance, so subcommands keep their injected dependencies
        spec.commandLine().usage(System.out);
    }
}
