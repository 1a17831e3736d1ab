package com.taskforge.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle: parses the arguments, runs the
 * matching subcommand and reports its exit code.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final TaskforgeCommand taskforgeCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TaskforgeCommand taskforgeCommand, IFactory factory) {
        this.taskforgeCommand = taskforgeCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // Serve mode is handled by the embedded web server; picocli would return at once.
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = new CommandLine(taskforgeCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
