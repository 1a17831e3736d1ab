package com.taskforge.dispatch.cli;

import com.taskforge.core.concurrent.CancellationToken;
import com.taskforge.core.react.ReActController;
import com.taskforge.core.react.ReActResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: taskforge run "&lt;instruction&gt;"
 * <p>
 * Runs the ReAct loop in the foreground and prints each step as it happens.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run an instruction in the foreground")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Natural language instruction")
    private String instruction;

    @Option(names = {"--attach", "-a"}, description = "Attachment name or path to mention to the agent")
    private List<String> attachments = new ArrayList<>();

    private final ReActController controller;

    public RunCommand(ReActController controller) {
        this.controller = controller;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Running: " + instruction);

        long started = System.currentTimeMillis();
        ReActResult result = controller.run(instruction, List.of(), attachments,
                ConsoleOutput::step, CancellationToken.create());

        System.out.println();
        System.out.println(result.result());
        System.out.println();
        if (!result.executedCapabilities().isEmpty()) {
            ConsoleOutput.info("Capabilities used: " + String.join(", ", result.executedCapabilities()));
        }
        if (result.continuationAttempts() > 0) {
            ConsoleOutput.info("Continuation prompts: " + result.continuationAttempts());
        }
        ConsoleOutput.success("Done in " + ConsoleOutput.formatDuration(System.currentTimeMillis() - started));
        return 0;
    }
}
