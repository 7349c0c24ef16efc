package com.dagrun.core.scheduler;

import com.dagrun.core.graph.NodeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Logs the outcome of a run: every run and cleanup error with its stack trace, then counts.
 */
public class RunSummaryLogger {

    private static final Logger log = LoggerFactory.getLogger(RunSummaryLogger.class);

    public void log(RunReport report) {
        List<TaskOutcome> runFailures = report.withStatus(NodeStatus.FAILED);
        List<TaskOutcome> cleanupFailures = report.cleanupFailures();

        if (!runFailures.isEmpty()) {
            log.warn("======== RUN ERRORS ==========");
            for (TaskOutcome outcome : runFailures) {
                log.warn("Run failure: {}", outcome.task(), outcome.error());
            }
        }
        if (!cleanupFailures.isEmpty()) {
            log.warn("======= CLEANUP ERRORS =======");
            for (TaskOutcome outcome : cleanupFailures) {
                log.warn("Cleanup failure: {}", outcome.task(), outcome.cleanupError());
            }
        }

        Summary summary = summarize(report);
        log.info("======== RUN STATUS ==========");
        if (!summary.allOk()) {
            log.warn("Run failures          : {}", summary.runFailures());
            log.warn("  dependency failures : {}", summary.dependencyFailures());
            log.warn("Clean failures        : {}", summary.cleanupFailures());
        }
        if (summary.cancelled() > 0 || summary.notStarted() > 0) {
            log.warn("Cancelled             : {}", summary.cancelled());
            log.warn("Never started         : {}", summary.notStarted());
        }
        log.info("Already existing : {}", summary.alreadyDone());
        log.info("Run successes    : {} / {}", summary.runSuccesses(), summary.runAttempts());
        log.info("Clean successes  : {} / {}", summary.cleanupSuccesses(), summary.cleanupAttempts());

        if (summary.allOk()) {
            log.info("All tasks successful.");
        } else {
            log.warn("There were failed tasks.");
        }
    }

    /**
     * Counts behind the logged summary.
     *
     * @param runAttempts tasks that needed work, i.e. everything not already done
     */
    public record Summary(
        long alreadyDone,
        long runSuccesses,
        long runAttempts,
        long runFailures,
        long dependencyFailures,
        long cleanupSuccesses,
        long cleanupFailures,
        long cleanupAttempts,
        long cancelled,
        long notStarted
    ) {
        public boolean allOk() {
            return runFailures == 0 && dependencyFailures == 0 && cleanupFailures == 0
                    && cancelled == 0 && notStarted == 0;
        }
    }

    public Summary summarize(RunReport report) {
        var counts = report.countsByStatus();
        long alreadyDone = counts.getOrDefault(NodeStatus.DONE_ALREADY, 0L);
        long cleanupSuccesses = report.outcomes().stream().filter(TaskOutcome::cleanedUp).count();
        long cleanupFailures = report.cleanupFailures().size();
        return new Summary(
                alreadyDone,
                counts.getOrDefault(NodeStatus.SUCCEEDED, 0L),
                report.outcomes().size() - alreadyDone,
                counts.getOrDefault(NodeStatus.FAILED, 0L),
                counts.getOrDefault(NodeStatus.SKIPPED_DEPENDENCY_FAILURE, 0L),
                cleanupSuccesses,
                cleanupFailures,
                cleanupSuccesses + cleanupFailures,
                counts.getOrDefault(NodeStatus.CANCELLED, 0L),
                counts.getOrDefault(NodeStatus.PENDING, 0L));
    }
}
