package com.dagrun.core.scheduler;

import com.dagrun.core.DagrunException;
import com.dagrun.core.events.DagEvent;
import com.dagrun.core.events.EventBus;
import com.dagrun.core.graph.Dag;
import com.dagrun.core.graph.NodeStatus;
import com.dagrun.core.graph.TaskNode;
import com.dagrun.core.logging.MdcContext;
import com.dagrun.core.metrics.DagrunMetrics;
import com.dagrun.core.target.Target;
import com.dagrun.core.task.CleanableTask;
import com.dagrun.core.task.RunOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives every node of a {@link Dag} to a terminal status.
 * <p>
 * A single coordinating loop, running on the caller's thread, owns all node state. Each run
 * and cleanup is started as a {@link CompletionStage}; its completion is posted back to the
 * loop as a message, so node state is never touched from another thread. Any number of nodes
 * may be in flight at once; throttling belongs to whatever executor the tasks receive through
 * their {@link RunOptions}.
 * <p>
 * A failed run marks every transitive dependent {@link NodeStatus#SKIPPED_DEPENDENCY_FAILURE}
 * without running it; unrelated branches carry on. A {@link CleanableTask} that produced its
 * output is cleaned up once all of its direct dependents are terminal, which for a node with no
 * dependents is right after its own completion.
 */
public class Scheduler {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final EventBus eventBus;
    private final DagrunMetrics metrics;
    private final RunSummaryLogger summaryLogger;
    private final boolean cleanupRoots;

    public Scheduler() {
        this(new EventBus(), DagrunMetrics.standalone(), new RunSummaryLogger(), true);
    }

    /**
     * @param eventBus      receives lifecycle events for every run
     * @param metrics       task and run metrics
     * @param summaryLogger logs a summary after each run; null disables the summary
     * @param cleanupRoots  whether nodes without dependents are cleaned up too. When true,
     *                      a requested root task that is cleanable releases its own output
     *                      right after producing it
     */
    public Scheduler(EventBus eventBus, DagrunMetrics metrics, RunSummaryLogger summaryLogger,
                     boolean cleanupRoots) {
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.summaryLogger = summaryLogger;
        this.cleanupRoots = cleanupRoots;
    }

    public EventBus eventBus() {
        return eventBus;
    }

    /**
     * Runs the DAG to completion on the calling thread.
     * <p>
     * Interrupting the calling thread cancels in-flight runs and cleanups; the returned report
     * is then flagged {@link RunReport#cancelled()}, never-started tasks stay PENDING and the
     * interrupt flag is restored.
     *
     * @throws IllegalStateException if the loop ends with a node in a non-terminal state
     *                               outside of cancellation
     */
    public RunReport run(Dag dag, RunOptions options) {
        return run(dag, options, newRunId());
    }

    /**
     * Runs the DAG under a caller-chosen run id, so that listeners can
     * {@linkplain EventBus#subscribe(String, java.util.function.Consumer) subscribe} to it
     * before the first event fires.
     *
     * @throws IllegalArgumentException if {@code runId} is blank
     */
    public RunReport run(Dag dag, RunOptions options, String runId) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be blank");
        }
        MdcContext.setRun(runId);
        try {
            RunReport report = new Execution(runId, dag, options).drive();
            if (summaryLogger != null) {
                summaryLogger.log(report);
            }
            return report;
        } finally {
            MdcContext.clear();
        }
    }

    public RunReport run(Dag dag) {
        return run(dag, RunOptions.empty());
    }

    /**
     * Runs the DAG on a thread taken from {@code executor}. Cancelling the returned future
     * interrupts the coordinating loop, which cancels in-flight work.
     */
    public CompletableFuture<RunReport> runAsync(Dag dag, RunOptions options, Executor executor) {
        return runAsync(dag, options, executor, newRunId());
    }

    public CompletableFuture<RunReport> runAsync(Dag dag, RunOptions options, Executor executor,
                                                 String runId) {
        var coordinator = new AtomicReference<Thread>();
        var result = new CompletableFuture<RunReport>() {
            @Override
            public boolean cancel(boolean mayInterruptIfRunning) {
                boolean cancelled = super.cancel(mayInterruptIfRunning);
                Thread thread = coordinator.get();
                if (cancelled && thread != null) {
                    thread.interrupt();
                }
                return cancelled;
            }
        };
        executor.execute(() -> {
            coordinator.set(Thread.currentThread());
            try {
                if (!result.isDone()) {
                    result.complete(run(dag, options, runId));
                }
            } catch (RuntimeException | Error e) {
                result.completeExceptionally(e);
            } finally {
                coordinator.set(null);
                Thread.interrupted();
            }
        });
        return result;
    }

    /** Fresh id for a run whose caller did not choose one. */
    public static String newRunId() {
        return UUID.randomUUID().toString();
    }

    private enum Phase { RUN, CLEANUP }

    private record Completion(TaskNode node, Phase phase, Throwable error) {}

    /** Mutable per-node bookkeeping, confined to the coordinating thread. */
    private static final class NodeState {
        NodeStatus status;
        int unresolvedDependencies;
        int outstandingDependents;
        DagrunException error;
        CompletableFuture<?> runFuture;
        CompletableFuture<?> cleanupFuture;
        boolean cleanupStarted;
        boolean cleanedUp;
        CleanupFailure cleanupError;
        long startedNanos;
        Duration elapsed = Duration.ZERO;
    }

    /** One run of one DAG. */
    private final class Execution {
        private final String runId;
        private final Dag dag;
        private final RunOptions options;
        private final Map<TaskNode, NodeState> states = new IdentityHashMap<>();
        private final BlockingQueue<Completion> inbox = new LinkedBlockingQueue<>();
        private final Deque<TaskNode> ready = new ArrayDeque<>();
        private int inFlight;

        Execution(String runId, Dag dag, RunOptions options) {
            this.runId = runId;
            this.dag = dag;
            this.options = options;
            for (TaskNode node : dag.nodes()) {
                var state = new NodeState();
                state.status = node.discoveryStatus();
                state.unresolvedDependencies = node.dependencies().size();
                state.outstandingDependents = node.dependents().size();
                states.put(node, state);
            }
        }

        RunReport drive() {
            Instant started = Instant.now();
            log.info("Starting run {}: {} tasks, {} already done",
                    runId, dag.size(), dag.size() - dag.pendingCount());

            for (TaskNode node : dag.nodes()) {
                if (node.isDoneAlready()) {
                    log.info("{} already done.", node.task());
                    terminate(node, NodeStatus.DONE_ALREADY, null);
                }
            }
            for (TaskNode node : dag.nodes()) {
                if (!node.isDoneAlready() && node.dependencies().isEmpty()) {
                    ready.add(node);
                }
            }

            boolean cancelled = false;
            while (true) {
                while (!ready.isEmpty()) {
                    start(ready.poll());
                }
                if (inFlight == 0) {
                    break;
                }
                Completion completion;
                try {
                    completion = inbox.take();
                } catch (InterruptedException e) {
                    cancelInFlight();
                    Thread.currentThread().interrupt();
                    cancelled = true;
                    break;
                }
                inFlight--;
                if (completion.phase() == Phase.RUN) {
                    onRunCompleted(completion.node(), completion.error());
                } else {
                    onCleanupCompleted(completion.node(), completion.error());
                }
            }

            if (!cancelled) {
                for (var entry : states.entrySet()) {
                    if (!entry.getValue().status.isTerminal()) {
                        throw new IllegalStateException("Run " + runId + " finished with "
                                + entry.getKey().task() + " in state " + entry.getValue().status);
                    }
                }
            }

            RunReport report = report(cancelled);
            metrics.recordRun(report.allSucceeded(), Duration.between(started, Instant.now()));
            publish(DagEvent.RUN_COMPLETED, null, Map.of(
                    "cancelled", cancelled,
                    "allSucceeded", report.allSucceeded()));
            return report;
        }

        private void start(TaskNode node) {
            NodeState state = states.get(node);
            if (state.status != NodeStatus.PENDING) {
                throw new IllegalStateException("Cannot start " + node.task() + " in state " + state.status);
            }
            state.status = NodeStatus.RUNNING;
            state.startedNanos = System.nanoTime();

            MdcContext.setTask(runId, String.valueOf(node.task()), "run");
            try {
                log.info("Run {} entered.", node.task());
                publish(DagEvent.TASK_STARTED, node, Map.of());
                CompletionStage<?> stage;
                try {
                    List<Target> inputs = new ArrayList<>(node.requirements().size());
                    for (TaskNode requirement : node.requirements()) {
                        inputs.add(requirement.task().output());
                    }
                    stage = node.task().runAsync(inputs, options);
                    if (stage == null) {
                        stage = CompletableFuture.completedFuture(null);
                    }
                } catch (Throwable e) {
                    // a broken input target fails this node like any other run error
                    stage = CompletableFuture.failedFuture(e);
                }
                state.runFuture = stage.toCompletableFuture();
                inFlight++;
                stage.whenComplete((value, error) -> inbox.add(new Completion(node, Phase.RUN, error)));
            } finally {
                MdcContext.clearTask();
            }
        }

        private void onRunCompleted(TaskNode node, Throwable error) {
            NodeState state = states.get(node);
            state.runFuture = null;
            state.elapsed = Duration.ofNanos(System.nanoTime() - state.startedNanos);
            String type = node.task().getClass().getSimpleName();
            if (error == null) {
                log.info("Run {} done.", node.task());
                metrics.recordTaskExecution(type, NodeStatus.SUCCEEDED.name(), state.elapsed);
                terminate(node, NodeStatus.SUCCEEDED, null);
            } else {
                Throwable cause = unwrap(error);
                var failure = new TaskExecutionFailure(node.task(), cause);
                log.error("Run {} failed.", node.task(), cause);
                metrics.recordTaskExecution(type, NodeStatus.FAILED.name(), state.elapsed);
                terminate(node, NodeStatus.FAILED, failure);
            }
        }

        /**
         * Moves a node into a terminal status and propagates the consequences: dependents are
         * released or skipped, and dependencies with nothing left waiting on them are cleaned up.
         */
        private void terminate(TaskNode first, NodeStatus firstStatus, DagrunException firstError) {
            Deque<TaskNode> work = new ArrayDeque<>();
            setTerminal(first, firstStatus, firstError);
            work.add(first);

            while (!work.isEmpty()) {
                TaskNode node = work.poll();
                NodeState state = states.get(node);

                for (TaskNode dependency : node.dependencies()) {
                    NodeState depState = states.get(dependency);
                    depState.outstandingDependents--;
                    maybeCleanup(dependency, depState);
                }

                if (state.status.isSatisfied()) {
                    for (TaskNode dependent : node.dependents()) {
                        NodeState dependentState = states.get(dependent);
                        dependentState.unresolvedDependencies--;
                        if (dependentState.unresolvedDependencies == 0
                                && dependentState.status == NodeStatus.PENDING) {
                            ready.add(dependent);
                        }
                    }
                } else if (state.status.isFailure()) {
                    TaskExecutionFailure origin = state.error instanceof FailedDependencyException skipped
                            ? skipped.origin()
                            : (TaskExecutionFailure) state.error;
                    for (TaskNode dependent : node.dependents()) {
                        if (states.get(dependent).status == NodeStatus.PENDING) {
                            log.warn("Run {} skipped: dependency {} failed.", dependent.task(), node.task());
                            setTerminal(dependent, NodeStatus.SKIPPED_DEPENDENCY_FAILURE,
                                    new FailedDependencyException(dependent.task(), origin));
                            work.add(dependent);
                        }
                    }
                }

                // dependents may all have been skipped while this node was still running
                maybeCleanup(node, state);
            }
        }

        private void setTerminal(TaskNode node, NodeStatus status, DagrunException error) {
            NodeState state = states.get(node);
            state.status = status;
            state.error = error;
            metrics.recordTaskOutcome(status.name());
            switch (status) {
                case DONE_ALREADY -> publish(DagEvent.TASK_ALREADY_DONE, node, Map.of());
                case SUCCEEDED -> publish(DagEvent.TASK_SUCCEEDED, node,
                        Map.of("elapsedMs", state.elapsed.toMillis()));
                case FAILED -> publish(DagEvent.TASK_FAILED, node, errorPayload(error));
                case SKIPPED_DEPENDENCY_FAILURE -> publish(DagEvent.TASK_SKIPPED, node, errorPayload(error));
                case CANCELLED -> publish(DagEvent.TASK_CANCELLED, node, Map.of());
                default -> throw new IllegalStateException("Not a terminal status: " + status);
            }
        }

        private void maybeCleanup(TaskNode node, NodeState state) {
            if (state.outstandingDependents > 0
                    || state.cleanupStarted
                    || !state.status.isSatisfied()
                    || !(node.task() instanceof CleanableTask cleanable)) {
                return;
            }
            if (node.dependents().isEmpty() && !cleanupRoots) {
                log.debug("Keeping output of {}: no dependents and root cleanup disabled", node.task());
                return;
            }
            state.cleanupStarted = true;
            MdcContext.setTask(runId, String.valueOf(node.task()), "cleanup");
            try {
                log.info("Cleanup {} entered.", node.task());
                publish(DagEvent.CLEANUP_STARTED, node, Map.of());
                CompletionStage<?> stage;
                try {
                    stage = cleanable.cleanupAsync(options);
                    if (stage == null) {
                        stage = CompletableFuture.completedFuture(null);
                    }
                } catch (Throwable e) {
                    stage = CompletableFuture.failedFuture(e);
                }
                state.cleanupFuture = stage.toCompletableFuture();
                inFlight++;
                stage.whenComplete((value, error) -> inbox.add(new Completion(node, Phase.CLEANUP, error)));
            } finally {
                MdcContext.clearTask();
            }
        }

        private void onCleanupCompleted(TaskNode node, Throwable error) {
            NodeState state = states.get(node);
            state.cleanupFuture = null;
            metrics.recordCleanup(error == null);
            if (error == null) {
                state.cleanedUp = true;
                log.info("Cleanup {} done.", node.task());
                publish(DagEvent.CLEANUP_SUCCEEDED, node, Map.of());
            } else {
                Throwable cause = unwrap(error);
                state.cleanupError = new CleanupFailure(node.task(), cause);
                log.error("Cleanup {} failed.", node.task(), cause);
                publish(DagEvent.CLEANUP_FAILED, node, errorPayload(state.cleanupError));
            }
        }

        private void cancelInFlight() {
            log.warn("Run {} interrupted, cancelling {} in-flight invocation(s)", runId, inFlight);
            for (TaskNode node : dag.nodes()) {
                NodeState state = states.get(node);
                if (state.runFuture != null) {
                    state.runFuture.cancel(true);
                    state.runFuture = null;
                }
                if (state.cleanupFuture != null) {
                    state.cleanupFuture.cancel(true);
                    state.cleanupFuture = null;
                }
                if (state.status == NodeStatus.RUNNING) {
                    state.elapsed = Duration.ofNanos(System.nanoTime() - state.startedNanos);
                    setTerminal(node, NodeStatus.CANCELLED, null);
                }
            }
        }

        private RunReport report(boolean cancelled) {
            var outcomes = new ArrayList<TaskOutcome>(dag.size());
            for (TaskNode node : dag.nodes()) {
                NodeState state = states.get(node);
                outcomes.add(new TaskOutcome(node.task(), state.status, state.error,
                        state.cleanedUp, state.cleanupError, state.elapsed));
            }
            return new RunReport(runId, outcomes, cancelled);
        }

        private void publish(String type, TaskNode node, Map<String, Object> payload) {
            eventBus.publish(new DagEvent(type, runId,
                    node == null ? null : String.valueOf(node.task()), payload, Instant.now()));
        }
    }

    private static Map<String, Object> errorPayload(Throwable error) {
        Throwable cause = error.getCause() != null ? error.getCause() : error;
        return Map.of(
                "error", error.getClass().getSimpleName(),
                "cause", cause.getClass().getName(),
                "message", String.valueOf(cause.getMessage()));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
