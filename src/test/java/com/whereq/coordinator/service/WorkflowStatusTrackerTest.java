package com.whereq.coordinator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.coordinator.config.CoordinatorProperties;
import com.whereq.coordinator.exception.WorkflowNotFoundException;
import com.whereq.coordinator.model.WorkflowPhase;
import com.whereq.coordinator.model.WorkflowStatus;
import com.whereq.coordinator.store.InMemoryKeyValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowStatusTrackerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final CoordinatorProperties properties = new CoordinatorProperties();
    private InMemoryKeyValueStore store;
    private WorkflowStatusTracker tracker;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        tracker = new WorkflowStatusTracker(store, objectMapper, properties);
    }

    @Test
    void unknownWorkflowIsNotFound() {
        StepVerifier.create(tracker.get("wf-missing"))
            .expectError(WorkflowNotFoundException.class)
            .verify();
        StepVerifier.create(tracker.update("wf-missing", status -> status))
            .expectError(WorkflowNotFoundException.class)
            .verify();
    }

    @Test
    void updatesArePersisted() {
        tracker.create(status("wf-1", "user-1", NOW)).block();

        StepVerifier.create(tracker.update("wf-1", status -> status.toBuilder().status(WorkflowPhase.RUNNING).build()))
            .assertNext(transition -> {
                assertThat(transition.isChanged()).isTrue();
                assertThat(transition.becameTerminal()).isFalse();
                assertThat(transition.getPrevious().getStatus()).isEqualTo(WorkflowPhase.PENDING);
            })
            .verifyComplete();

        assertThat(store.values().get(WorkflowStatusTracker.STATUS_KEY_PREFIX + "wf-1")).contains("\"Running\"");
    }

    @Test
    void terminalRecordLeavesMemoryButStaysReadable() {
        tracker.create(status("wf-1", "user-1", NOW)).block();

        StepVerifier.create(tracker.update("wf-1", status -> status.terminate(WorkflowPhase.FAILED, "cancellation",
                "Cancelled", NOW.plusSeconds(5))))
            .assertNext(transition -> assertThat(transition.becameTerminal()).isTrue())
            .verifyComplete();

        assertThat(tracker.listActive(null)).isEmpty();
        StepVerifier.create(tracker.get("wf-1"))
            .assertNext(status -> {
                assertThat(status.getStatus()).isEqualTo(WorkflowPhase.FAILED);
                assertThat(status.getDurationSeconds()).isEqualTo(5L);
            })
            .verifyComplete();

        StepVerifier.create(tracker.update("wf-1", status -> status.terminate(WorkflowPhase.ERROR, "polling",
                "lost", NOW.plusSeconds(9))))
            .assertNext(transition -> {
                assertThat(transition.becameTerminal()).isFalse();
                assertThat(transition.getCurrent().getStatus()).isEqualTo(WorkflowPhase.FAILED);
            })
            .verifyComplete();
    }

    @Test
    void activeWorkflowsAreFilteredAndOrdered() {
        tracker.create(status("wf-2", "user-1", NOW.plusSeconds(10))).block();
        tracker.create(status("wf-1", "user-1", NOW)).block();
        tracker.create(status("wf-3", "user-2", NOW.plusSeconds(5))).block();

        assertThat(tracker.listActive(null)).extracting(WorkflowStatus::getId).containsExactly("wf-1", "wf-3", "wf-2");
        assertThat(tracker.listActive("user-1")).extracting(WorkflowStatus::getId).containsExactly("wf-1", "wf-2");
        assertThat(tracker.countActive(List.of("room-layout"))).isEqualTo(3);
        assertThat(tracker.countActive(List.of("material-recognition"))).isZero();
    }

    @Test
    void activeRecordsAreRecoveredByANewTracker() {
        tracker.create(status("wf-1", "user-1", NOW)).block();
        tracker.create(status("wf-2", "user-1", NOW)).block();
        tracker.update("wf-2", status -> status.terminate(WorkflowPhase.ERROR, "submission", "down", NOW)).block();
        store.set(WorkflowStatusTracker.STATUS_KEY_PREFIX + "wf-bad", "{not json", Duration.ofHours(1)).block();

        WorkflowStatusTracker restarted = new WorkflowStatusTracker(store, objectMapper, properties);

        StepVerifier.create(restarted.recoverActive())
            .assertNext(status -> assertThat(status.getId()).isEqualTo("wf-1"))
            .verifyComplete();
        assertThat(restarted.listActive(null)).extracting(WorkflowStatus::getId).containsExactly("wf-1");
    }

    private static WorkflowStatus status(String id, String userId, Instant createdAt) {
        return WorkflowStatus.builder()
            .id(id)
            .type("room-layout")
            .userId(userId)
            .status(WorkflowPhase.PENDING)
            .createdAt(createdAt)
            .build();
    }
}
