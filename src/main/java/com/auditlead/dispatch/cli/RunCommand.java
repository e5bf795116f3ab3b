package com.auditlead.dispatch.cli;

import com.auditlead.core.engine.AuditEngine;
import com.auditlead.core.engine.RunRequest;
import com.auditlead.core.events.AuditEvent;
import com.auditlead.core.model.RunMode;
import com.auditlead.core.model.RunOutcome;
import com.auditlead.core.model.RunReport;
import com.auditlead.core.model.TaskRecord;
import com.auditlead.core.scheduler.CancellationSignal;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Consumer;

/**
 * CLI command: auditlead run &lt;target&gt;
 * <p>
 * Runs one audit of the target with every registered agent the mode includes, printing
 * live progress and a summary. Exits with 0 when at least one agent produced output and
 * with {@value #EXIT_NO_OUTPUT} when none did.
 */
@Command(name = "run", mixinStandardHelpOptions = true,
        description = {"Run an audit of a target",
                "Only agents with a registered implementation take part; see 'auditlead agents'."})
@Component
public class RunCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_NO_OUTPUT = 2;

    @Parameters(index = "0", description = "Target to audit, e.g. a website URL")
    private String target;

    @Option(names = {"--mode", "-m"}, description = "Run mode: quick or full", defaultValue = "full")
    private String mode;

    @Option(names = {"--timeout", "-t"}, description = "Run deadline, e.g. 45m or 90s (default from configuration)")
    private String timeout;

    @Option(names = "--json", description = "Print the run report as JSON instead of live output")
    private boolean json;

    private final AuditEngine auditEngine;

    public RunCommand(AuditEngine auditEngine) {
        this.auditEngine = auditEngine;
    }

    @Override
    public Integer call() {
        RunMode runMode;
        Duration deadline;
        try {
            runMode = RunMode.parse(mode);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid mode: " + mode + ". Valid modes: quick, full");
            return EXIT_USAGE;
        }
        try {
            deadline = timeout == null ? null : DurationStyle.detectAndParse(timeout);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid timeout: " + timeout);
            return EXIT_USAGE;
        }

        List<Consumer<AuditEvent>> listeners = new ArrayList<>();
        if (!json) {
            ConsoleOutput.printBanner();
            ConsoleOutput.info("Auditing " + target + " (" + runMode.name().toLowerCase(Locale.ROOT) + " mode)");
            listeners.add(new ConsoleProgressReporter());
        }

        RunReport report;
        try {
            var request = new RunRequest(auditEngine.generateRunId(), target, runMode, deadline);
            report = auditEngine.runAudit(request, new CancellationSignal(), listeners);
        } catch (Exception e) {
            ConsoleOutput.error("Audit failed: " + rootCauseMessage(e));
            return EXIT_USAGE;
        }

        if (json) {
            try {
                System.out.println(toJson(report));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Could not render report: " + e.getOriginalMessage());
                return EXIT_USAGE;
            }
        } else {
            ConsoleOutput.summary(report);
        }
        return report.outcome() == RunOutcome.NO_OUTPUT ? EXIT_NO_OUTPUT : EXIT_OK;
    }

    static String toJson(RunReport report) throws JsonProcessingException {
        var mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);

        var agents = new ArrayList<Map<String, Object>>();
        for (TaskRecord record : report.records()) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("name", record.name());
            entry.put("status", record.status().wireName());
            entry.put("progress", record.progressPercent());
            entry.put("attempts", record.attempts());
            entry.put("startedAt", record.startedAt());
            entry.put("finishedAt", record.finishedAt());
            entry.put("error", record.errorDetail());
            entry.put("result", record.resultPayload());
            agents.add(entry);
        }

        var root = new LinkedHashMap<String, Object>();
        root.put("runId", report.runId());
        root.put("target", report.targetId());
        root.put("mode", report.mode().name().toLowerCase(Locale.ROOT));
        root.put("outcome", report.outcome().name());
        root.put("cancelled", report.cancelled());
        root.put("elapsedMs", report.elapsed().toMillis());
        root.put("artifacts", report.artifactCounts());
        root.put("agents", agents);
        return mapper.writeValueAsString(root);
    }

    private static String rootCauseMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
