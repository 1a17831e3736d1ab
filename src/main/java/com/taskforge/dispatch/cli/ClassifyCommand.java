package com.taskforge.dispatch.cli;

import com.taskforge.core.intent.IntentClassifier;
import com.taskforge.core.model.Intent;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: taskforge classify "&lt;instruction&gt;"
 * <p>
 * Prints the step plan the intent classifier derives for an instruction.
 */
@Command(name = "classify", mixinStandardHelpOptions = true, description = "Show the step plan for an instruction")
@Component
public class ClassifyCommand implements Runnable {

    @Parameters(index = "0", description = "Natural language instruction")
    private String instruction;

    private final IntentClassifier classifier;

    public ClassifyCommand(IntentClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public void run() {
        Intent intent = classifier.classify(instruction);
        ConsoleOutput.intent(intent);
    }
}
