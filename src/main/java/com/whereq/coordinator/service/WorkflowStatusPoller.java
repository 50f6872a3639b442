package com.whereq.coordinator.service;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodic status polling for in-flight workflows.
 *
 * One task per workflow, keyed by workflow id, waits in a {@link DelayQueue}. A single
 * dispatcher thread takes due tasks and hands them to a bounded worker pool. A task is
 * dropped when its poll reports a terminal state, when it is cancelled, or after
 * {@code maxFailures} consecutive failed polls.
 */
@Slf4j
public class WorkflowStatusPoller implements AutoCloseable {

    /**
     * Callback invoked for each poll
     */
    public interface PollHandler {
        /**
         * Poll one workflow
         *
         * @return true when the workflow reached a terminal state
         * @throws Exception when the status could not be read
         */
        boolean poll(String workflowId) throws Exception;

        /**
         * Called once when polling gives up after repeated failures
         */
        void onPollingAbandoned(String workflowId, Throwable lastError);
    }

    private final PollHandler handler;
    private final long intervalNanos;
    private final int maxFailures;
    private final ThreadPoolExecutor workers;
    private final DelayQueue<PollTask> timer = new DelayQueue<>();
    private final ConcurrentHashMap<String, PollTask> tasks = new ConcurrentHashMap<>();

    private volatile Thread dispatcher;
    private volatile boolean running;

    public WorkflowStatusPoller(PollHandler handler, Duration interval, int workerThreads, int maxFailures) {
        this.handler = handler;
        this.intervalNanos = interval.toNanos();
        this.maxFailures = Math.max(1, maxFailures);
        AtomicInteger threadCount = new AtomicInteger();
        this.workers = new ThreadPoolExecutor(workerThreads, workerThreads, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(workerThreads * 64),
            runnable -> {
                Thread thread = new Thread(runnable, "status-poller-" + threadCount.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        dispatcher = new Thread(this::dispatch, "status-poll-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();
        log.info("Status poller started: interval={} ms, workers={}",
            TimeUnit.NANOSECONDS.toMillis(intervalNanos), workers.getCorePoolSize());
    }

    /**
     * Start polling a workflow after one interval. A workflow already being polled
     * keeps its existing task.
     */
    public void schedule(String workflowId) {
        PollTask task = new PollTask(workflowId, System.nanoTime() + intervalNanos);
        if (tasks.putIfAbsent(workflowId, task) == null) {
            timer.put(task);
            log.debug("Scheduled status polling for workflow {}", workflowId);
        }
    }

    /**
     * Stop polling a workflow
     */
    public void cancel(String workflowId) {
        PollTask task = tasks.remove(workflowId);
        if (task != null) {
            task.cancelled = true;
            timer.remove(task);
            log.debug("Cancelled status polling for workflow {}", workflowId);
        }
    }

    public boolean isScheduled(String workflowId) {
        return tasks.containsKey(workflowId);
    }

    public int getScheduledCount() {
        return tasks.size();
    }

    private void dispatch() {
        while (running) {
            try {
                PollTask task = timer.take();
                if (task.cancelled || tasks.get(task.workflowId) != task) {
                    continue;
                }
                try {
                    workers.execute(() -> runPoll(task));
                } catch (RejectedExecutionException e) {
                    log.warn("Poll workers saturated, deferring workflow {}", task.workflowId);
                    reschedule(task);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("Status poll dispatcher stopped");
    }

    private void runPoll(PollTask task) {
        if (task.cancelled) {
            return;
        }
        try {
            boolean terminal = handler.poll(task.workflowId);
            task.failures = 0;
            if (terminal) {
                tasks.remove(task.workflowId, task);
                log.debug("Workflow {} terminal, polling stopped", task.workflowId);
            } else {
                reschedule(task);
            }
        } catch (Exception e) {
            task.failures++;
            if (task.failures >= maxFailures) {
                tasks.remove(task.workflowId, task);
                log.error("Polling workflow {} failed {} times in a row, giving up", task.workflowId, task.failures, e);
                try {
                    handler.onPollingAbandoned(task.workflowId, e);
                } catch (RuntimeException callbackError) {
                    log.error("Failed to mark workflow {} as lost", task.workflowId, callbackError);
                }
            } else {
                log.warn("Poll {} of workflow {} failed: {}", task.failures, task.workflowId, e.getMessage());
                reschedule(task);
            }
        }
    }

    private void reschedule(PollTask task) {
        if (!running || task.cancelled) {
            return;
        }
        task.dueAtNanos = System.nanoTime() + intervalNanos;
        timer.put(task);
    }

    /**
     * Stop dispatching, let running polls finish and return
     */
    @Override
    public synchronized void close() {
        if (!running) {
            return;
        }
        running = false;
        if (dispatcher != null) {
            dispatcher.interrupt();
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        timer.clear();
        tasks.clear();
        log.info("Status poller stopped");
    }

    private static final class PollTask implements Delayed {
        private final String workflowId;
        private volatile long dueAtNanos;
        private volatile boolean cancelled;
        private int failures;

        PollTask(String workflowId, long dueAtNanos) {
            this.workflowId = workflowId;
            this.dueAtNanos = dueAtNanos;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(dueAtNanos - System.nanoTime(), TimeUnit.NANOSECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(getDelay(TimeUnit.NANOSECONDS), other.getDelay(TimeUnit.NANOSECONDS));
        }
    }
}
