package com.whereq.coordinator.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class WorkflowStatusPollerTest {

    private WorkflowStatusPoller poller;

    @AfterEach
    void tearDown() {
        if (poller != null) {
            poller.close();
        }
    }

    @Test
    void pollingStopsOnceTheWorkflowIsTerminal() {
        RecordingHandler handler = new RecordingHandler();
        handler.terminalAfter.put("wf-1", 3);
        poller = new WorkflowStatusPoller(handler, Duration.ofMillis(10), 2, 5);
        poller.start();

        poller.schedule("wf-1");

        await().atMost(Duration.ofSeconds(5)).until(() -> !poller.isScheduled("wf-1"));
        assertThat(handler.polls("wf-1")).isEqualTo(3);
        assertThat(handler.abandoned.get()).isNull();
    }

    @Test
    void pollingIsAbandonedAfterRepeatedFailures() {
        RecordingHandler handler = new RecordingHandler();
        handler.failing.put("wf-2", Boolean.TRUE);
        poller = new WorkflowStatusPoller(handler, Duration.ofMillis(10), 2, 3);
        poller.start();

        poller.schedule("wf-2");

        await().atMost(Duration.ofSeconds(5)).until(() -> handler.abandoned.get() != null);
        assertThat(handler.abandoned.get()).isEqualTo("wf-2");
        assertThat(handler.lastError.get()).hasMessage("engine down");
        assertThat(handler.polls("wf-2")).isEqualTo(3);
        assertThat(poller.isScheduled("wf-2")).isFalse();
    }

    @Test
    void cancelledWorkflowIsNoLongerPolled() {
        RecordingHandler handler = new RecordingHandler();
        poller = new WorkflowStatusPoller(handler, Duration.ofMillis(10), 2, 5);
        poller.start();

        poller.schedule("wf-3");
        await().atMost(Duration.ofSeconds(5)).until(() -> handler.polls("wf-3") > 0);
        poller.cancel("wf-3");
        int polled = handler.polls("wf-3");

        assertThat(poller.isScheduled("wf-3")).isFalse();
        await().during(Duration.ofMillis(100)).atMost(Duration.ofSeconds(1))
            .until(() -> handler.polls("wf-3") <= polled + 1);
    }

    @Test
    void schedulingTwiceKeepsOneTask() {
        poller = new WorkflowStatusPoller(new RecordingHandler(), Duration.ofMinutes(1), 1, 5);

        poller.schedule("wf-4");
        poller.schedule("wf-4");
        poller.schedule("wf-5");

        assertThat(poller.getScheduledCount()).isEqualTo(2);
        poller.cancel("wf-4");
        assertThat(poller.getScheduledCount()).isEqualTo(1);
    }

    private static class RecordingHandler implements WorkflowStatusPoller.PollHandler {
        private final Map<String, AtomicInteger> counts = new ConcurrentHashMap<>();
        private final Map<String, Integer> terminalAfter = new ConcurrentHashMap<>();
        private final Map<String, Boolean> failing = new ConcurrentHashMap<>();
        private final AtomicReference<String> abandoned = new AtomicReference<>();
        private final AtomicReference<Throwable> lastError = new AtomicReference<>();

        @Override
        public boolean poll(String workflowId) throws Exception {
            int count = counts.computeIfAbsent(workflowId, id -> new AtomicInteger()).incrementAndGet();
            if (failing.containsKey(workflowId)) {
                throw new IllegalStateException("engine down");
            }
            Integer limit = terminalAfter.get(workflowId);
            return limit != null && count >= limit;
        }

        @Override
        public void onPollingAbandoned(String workflowId, Throwable lastError) {
            this.lastError.set(lastError);
            abandoned.set(workflowId);
        }

        int polls(String workflowId) {
            AtomicInteger count = counts.get(workflowId);
            return count == null ? 0 : count.get();
        }
    }
}
