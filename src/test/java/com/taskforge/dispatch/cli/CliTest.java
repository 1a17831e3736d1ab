package com.taskforge.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskforge.core.audit.AuditLogVerifier;
import com.taskforge.core.audit.AuditSigner;
import com.taskforge.core.audit.AuditTrailRecorder;
import com.taskforge.core.audit.Signature;
import com.taskforge.core.concurrent.CancellationToken;
import com.taskforge.core.intent.IntentClassifier;
import com.taskforge.core.model.Intent;
import com.taskforge.core.model.TaskAction;
import com.taskforge.core.model.TaskStep;
import com.taskforge.core.react.ReActController;
import com.taskforge.core.react.ReActResult;
import com.taskforge.core.react.RunListener;
import com.taskforge.core.router.CapabilityInvocation;
import com.taskforge.core.scheduler.CronScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the Taskforge CLI command structure.
 * These tests exercise picocli directly without Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private ReActController controller;
    private IntentClassifier classifier;
    private CronScheduler scheduler;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        controller = mock(ReActController.class);
        classifier = mock(IntentClassifier.class);
        scheduler = mock(CronScheduler.class);
    }

    /**
     * Custom picocli IFactory that provides mock dependencies for commands.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(controller);
                }
                if (cls == ClassifyCommand.class) {
                    return (K) new ClassifyCommand(classifier);
                }
                if (cls == CronCommand.class) {
                    return (K) new CronCommand(scheduler);
                }
                if (cls == VerifyAuditCommand.class) {
                    return (K) new VerifyAuditCommand(new AuditLogVerifier());
                }
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand();
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new TaskforgeCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private Path writeAuditLog(AuditSigner signer, int entries) throws Exception {
        var recorder = new AuditTrailRecorder(signer);
        for (int i = 0; i < entries; i++) {
            recorder.afterInvocation(new CapabilityInvocation("spawn_1", "read_file", Map.of("path", "/tmp/" + i),
                    "contents " + i, 5, Instant.parse("2026-03-02T10:00:00Z")));
        }
        Path file = tempDir.resolve("audit.json");
        Files.writeString(file, new ObjectMapper().writeValueAsString(recorder.export()));
        return file;
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            String output = result.output();
            for (String sub : List.of("run", "classify", "cron", "verify-audit", "serve", "help")) {
                assertTrue(output.contains(sub), "Help should list '" + sub + "' subcommand");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Taskforge 0.1.0"));
        }

        @Test
        @DisplayName("no arguments prints banner and usage")
        void noArguments() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("TASKFORGE v0.1.0"));
            assertTrue(result.output().contains("Usage: taskforge"));
        }
    }

    // =====================================================================
    //  run
    // =====================================================================

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("prints steps, the answer and the capabilities used")
        void runsInstruction() {
            when(controller.run(anyString(), anyList(), anyList(), any(RunListener.class),
                    any(CancellationToken.class))).thenAnswer(inv -> {
                RunListener listener = inv.getArgument(3);
                listener.onStep("Calling read_file");
                return new ReActResult("The file has 42 rows", List.of(), List.of("read_file"), 1,
                        Intent.of(List.of(), Intent.ClassifiedBy.FALLBACK));
            });

            CliResult result = execute("run", "Count rows", "-a", "/mnt/user-data/a.csv");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Running: Count rows"));
            assertTrue(result.output().contains("> Calling read_file"));
            assertTrue(result.output().contains("The file has 42 rows"));
            assertTrue(result.output().contains("Capabilities used: read_file"));
            assertTrue(result.output().contains("Continuation prompts: 1"));
            verify(controller).run(eq("Count rows"), eq(List.of()), eq(List.of("/mnt/user-data/a.csv")),
                    any(RunListener.class), any(CancellationToken.class));
        }

        @Test
        @DisplayName("missing instruction is a usage error")
        void missingInstruction() {
            CliResult result = execute("run");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Missing required parameter"));
            verifyNoInteractions(controller);
        }
    }

    // =====================================================================
    //  classify
    // =====================================================================

    @Test
    @DisplayName("classify prints the numbered step plan")
    void classify() {
        when(classifier.classify("Extract the rows then build a report")).thenReturn(Intent.of(List.of(
                new TaskStep(TaskAction.EXTRACT, List.of("read_file"), "get rows"),
                new TaskStep(TaskAction.CREATE, List.of(), "build report")), Intent.ClassifiedBy.MODEL));

        CliResult result = execute("classify", "Extract the rows then build a report");

        assertEquals(0, result.exitCode());
        assertTrue(result.output().contains("Intent (model, multi-step)"));
        assertTrue(result.output().contains("1. extract    read_file  (get rows)"));
        assertTrue(result.output().contains("2. create     -  (build report)"));
    }

    // =====================================================================
    //  cron
    // =====================================================================

    @Nested
    @DisplayName("cron")
    class CronTests {

        @Test
        @DisplayName("valid expression shows the next run")
        void validExpression() {
            when(scheduler.shouldRunNow("0 9 * * 1-5")).thenReturn(false);
            when(scheduler.getNextRun("0 9 * * 1-5")).thenReturn(Optional.of(Instant.parse("2026-03-03T09:00:00Z")));

            CliResult result = execute("cron", "0 9 * * 1-5");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Valid: 0 9 * * 1-5"));
            assertTrue(result.output().contains("Matches now: false"));
            assertTrue(result.output().contains("Next run:    2026-03-03T09:00:00Z"));
        }

        @Test
        @DisplayName("invalid expression exits 1 with the parse error")
        void invalidExpression() {
            CliResult result = execute("cron", "x y z");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("need 5 fields, got 3"));
            verifyNoInteractions(scheduler);
        }

        @Test
        @DisplayName("an expression that never fires within 48h says so")
        void neverFires() {
            when(scheduler.getNextRun("0 0 31 2 *")).thenReturn(Optional.empty());

            CliResult result = execute("cron", "0 0 31 2 *");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("none within 48h"));
        }
    }

    // =====================================================================
    //  verify-audit
    // =====================================================================

    @Nested
    @DisplayName("verify-audit")
    class VerifyAuditTests {

        @Test
        @DisplayName("a signed chain is allowed")
        void allow() throws Exception {
            Path file = writeAuditLog((c, a, p, l) -> new Signature("sig", "ed25519", "v1", true), 2);

            CliResult result = execute("verify-audit", file.toString(), "--gate");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("[ALLOW] 2 entries verified"));
            assertTrue(result.output().contains("Checks: crypto-fields, replay, hash-chain, provenance"));
        }

        @Test
        @DisplayName("the gate denies unverified signatures")
        void gateDeniesUnverified() throws Exception {
            Path file = writeAuditLog((c, a, p, l) -> new Signature("sig", "ed25519", "v1", false), 2);

            CliResult result = execute("verify-audit", file.toString(), "--gate");

            assertEquals(VerifyAuditCommand.EXIT_DENY, result.exitCode());
            assertTrue(result.output().contains("[DENY] Provenance gate: 0 unsigned, 2 unverified record(s)"));
        }

        @Test
        @DisplayName("an empty log is denied")
        void emptyLog() throws Exception {
            Path file = tempDir.resolve("empty.json");
            Files.writeString(file, "{\"entries\":[]}");

            CliResult result = execute("verify-audit", file.toString());

            assertEquals(VerifyAuditCommand.EXIT_DENY, result.exitCode());
            assertTrue(result.output().contains("[DENY] No audit entries found"));
        }

        @Test
        @DisplayName("unreadable or malformed input exits 2")
        void unreadable() throws Exception {
            Path malformed = tempDir.resolve("bad.json");
            Files.writeString(malformed, "{\"records\":[]}");

            CliResult missing = execute("verify-audit", tempDir.resolve("nope.json").toString());
            CliResult bad = execute("verify-audit", malformed.toString());

            assertEquals(VerifyAuditCommand.EXIT_UNREADABLE, missing.exitCode());
            assertTrue(missing.output().contains("Cannot read"));
            assertEquals(VerifyAuditCommand.EXIT_UNREADABLE, bad.exitCode());
        }
    }
}
