package com.taskforge.dispatch.cli;

import com.taskforge.core.audit.AuditLogParseException;
import com.taskforge.core.audit.AuditLogVerifier;
import com.taskforge.core.audit.AuditRecord;
import com.taskforge.core.audit.VerificationReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: taskforge verify-audit &lt;file&gt; [--gate]
 * <p>
 * Verifies an exported audit log. Exit code 0 means allow, 1 deny, 2 unreadable input.
 */
@Command(name = "verify-audit", mixinStandardHelpOptions = true, description = "Verify an audit log export")
@Component
public class VerifyAuditCommand implements Callable<Integer> {

    static final int EXIT_DENY = 1;
    static final int EXIT_UNREADABLE = 2;

    @Parameters(index = "0", description = "JSON file: an array of entries or {\"entries\": [...]}")
    private Path file;

    @Option(names = "--gate", description = "Also deny unsigned or unverified entries")
    private boolean gate;

    private final AuditLogVerifier verifier;

    public VerifyAuditCommand(AuditLogVerifier verifier) {
        this.verifier = verifier;
    }

    @Override
    public Integer call() {
        List<AuditRecord> records;
        try {
            records = verifier.parse(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + file + ": " + e.getMessage());
            return EXIT_UNREADABLE;
        } catch (AuditLogParseException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_UNREADABLE;
        }

        VerificationReport report = gate ? verifier.gate(records) : verifier.verify(records);
        ConsoleOutput.report(report);
        return report.ok() ? 0 : EXIT_DENY;
    }
}
