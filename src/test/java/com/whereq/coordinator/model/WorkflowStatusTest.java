package com.whereq.coordinator.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowStatusTest {

    private static final Instant CREATED = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void mergeNeverMovesPhaseOrProgressBackwards() {
        WorkflowStatus running = pending().mergeObserved(observed(WorkflowPhase.RUNNING, 40), CREATED.plusSeconds(5));

        WorkflowStatus merged = running.mergeObserved(observed(WorkflowPhase.PENDING, 10), CREATED.plusSeconds(10));

        assertThat(merged.getStatus()).isEqualTo(WorkflowPhase.RUNNING);
        assertThat(merged.getProgress()).isEqualTo(40);
    }

    @Test
    void succeededRecordIsComplete() {
        WorkflowStatus observed = observed(WorkflowPhase.SUCCEEDED, 80).toBuilder()
            .startedAt(CREATED.plusSeconds(2))
            .finishedAt(CREATED.plusSeconds(62))
            .build();

        WorkflowStatus merged = pending().mergeObserved(observed, CREATED.plusSeconds(70));

        assertThat(merged.isTerminal()).isTrue();
        assertThat(merged.getProgress()).isEqualTo(100);
        assertThat(merged.getFinishedAt()).isEqualTo(CREATED.plusSeconds(62));
        assertThat(merged.getDurationSeconds()).isEqualTo(60);
        assertThat(merged.getEstimatedCompletionTime()).isNull();
        assertThat(merged.getFailedStage()).isNull();
    }

    @Test
    void failedExecutionIsAttributedToExecutionStage() {
        WorkflowStatus observed = observed(WorkflowPhase.FAILED, 50).toBuilder()
            .errorMessage("OOMKilled")
            .build();

        WorkflowStatus merged = pending().mergeObserved(observed, CREATED.plusSeconds(30));

        assertThat(merged.getStatus()).isEqualTo(WorkflowPhase.FAILED);
        assertThat(merged.getFailedStage()).isEqualTo("execution");
        assertThat(merged.getErrorMessage()).isEqualTo("OOMKilled");
        assertThat(merged.getFinishedAt()).isEqualTo(CREATED.plusSeconds(30));
    }

    @Test
    void terminalRecordIsFrozen() {
        WorkflowStatus cancelled = pending().terminate(WorkflowPhase.FAILED, "cancellation", "Cancelled", CREATED.plusSeconds(5));

        assertThat(cancelled.mergeObserved(observed(WorkflowPhase.SUCCEEDED, 100), CREATED.plusSeconds(9))).isSameAs(cancelled);
        assertThat(cancelled.terminate(WorkflowPhase.ERROR, "polling", "lost", CREATED.plusSeconds(9))).isSameAs(cancelled);
        assertThat(cancelled.getFailedStage()).isEqualTo("cancellation");
        assertThat(cancelled.getDurationSeconds()).isEqualTo(5);
    }

    @Test
    void recordHasNoSetters() {
        assertThat(Arrays.stream(WorkflowStatus.class.getMethods()).map(Method::getName))
            .noneMatch(name -> name.startsWith("set"));
    }

    @Test
    void frozenRecordSurvivesJsonRoundTrip() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        WorkflowStatus cancelled = pending().terminate(WorkflowPhase.FAILED, "cancellation", "Cancelled", CREATED.plusSeconds(5));

        WorkflowStatus read = objectMapper.readValue(objectMapper.writeValueAsString(cancelled), WorkflowStatus.class);

        assertThat(read).isEqualTo(cancelled);
        assertThat(read.isTerminal()).isTrue();
        assertThat(read.mergeObserved(observed(WorkflowPhase.SUCCEEDED, 100), CREATED.plusSeconds(9))).isSameAs(read);
    }

    @Test
    void terminateRequiresTerminalPhase() {
        assertThatThrownBy(() -> pending().terminate(WorkflowPhase.RUNNING, "x", "y", CREATED))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nodesMergeById() {
        WorkflowStatus first = pending().mergeObserved(observedWithNodes(
            node("n1", WorkflowPhase.RUNNING, 50), node("n2", WorkflowPhase.PENDING, 0)), CREATED);

        WorkflowStatus second = first.mergeObserved(observedWithNodes(
            node("n1", WorkflowPhase.SUCCEEDED, 100), node("n3", WorkflowPhase.RUNNING, 10)), CREATED.plusSeconds(5));

        assertThat(second.getNodes()).extracting(WorkflowNode::getId).containsExactly("n1", "n2", "n3");
        assertThat(second.getNodes().get(0).getPhase()).isEqualTo(WorkflowPhase.SUCCEEDED);
        assertThat(second.getNodes().get(0).getProgress()).isEqualTo(100);
    }

    private static WorkflowStatus pending() {
        return WorkflowStatus.builder()
            .id("wf-1")
            .type("room-layout")
            .userId("user-1")
            .status(WorkflowPhase.PENDING)
            .createdAt(CREATED)
            .build();
    }

    private static WorkflowStatus observed(WorkflowPhase phase, int progress) {
        return WorkflowStatus.builder().id("wf-1").status(phase).progress(progress).build();
    }

    private static WorkflowStatus observedWithNodes(WorkflowNode... nodes) {
        return WorkflowStatus.builder().id("wf-1").status(WorkflowPhase.RUNNING).nodes(List.of(nodes)).build();
    }

    private static WorkflowNode node(String id, WorkflowPhase phase, int progress) {
        return WorkflowNode.builder().id(id).name(id).phase(phase).progress(progress).build();
    }
}
