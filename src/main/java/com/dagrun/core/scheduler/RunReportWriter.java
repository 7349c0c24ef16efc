package com.dagrun.core.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Renders a {@link RunReport} as JSON for callers that keep run records outside the process.
 */
public class RunReportWriter {

    private final ObjectMapper objectMapper;

    public RunReportWriter() {
        this(new ObjectMapper());
    }

    public RunReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(RunReport report) {
        try {
            return objectMapper.writeValueAsString(view(report));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize run report " + report.runId(), e);
        }
    }

    public void write(RunReport report, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(file.toFile(), view(report));
    }

    static ReportView view(RunReport report) {
        List<OutcomeView> outcomes = report.outcomes().stream()
                .map(RunReportWriter::view)
                .toList();
        return new ReportView(report.runId(), report.cancelled(), report.allSucceeded(), outcomes);
    }

    private static OutcomeView view(TaskOutcome outcome) {
        String errorType = null;
        String errorMessage = null;
        String origin = null;
        if (outcome.error() != null) {
            errorType = outcome.error().getClass().getSimpleName();
            Throwable root = outcome.rootCause().orElse(outcome.error());
            errorMessage = root.getClass().getName() + ": " + root.getMessage();
            if (outcome.error() instanceof FailedDependencyException skipped) {
                origin = String.valueOf(skipped.origin().task());
            }
        }
        String cleanupError = outcome.cleanupFailure()
                .map(f -> String.valueOf(f.getCause()))
                .orElse(null);
        return new OutcomeView(
                String.valueOf(outcome.task()),
                outcome.status().name(),
                errorType,
                errorMessage,
                origin,
                outcome.cleanedUp(),
                cleanupError,
                outcome.elapsed().toMillis());
    }

    public record ReportView(String runId, boolean cancelled, boolean allSucceeded, List<OutcomeView> tasks) {}

    public record OutcomeView(
        String task,
        String status,
        String errorType,
        String errorMessage,
        String originTask,
        boolean cleanedUp,
        String cleanupError,
        long elapsedMs
    ) {}
}
