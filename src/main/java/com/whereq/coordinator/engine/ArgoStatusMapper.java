package com.whereq.coordinator.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.coordinator.model.ProcessingStage;
import com.whereq.coordinator.model.QualityLevel;
import com.whereq.coordinator.model.WorkflowNode;
import com.whereq.coordinator.model.WorkflowPhase;
import com.whereq.coordinator.model.WorkflowStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Translates an Argo Workflow resource into an {@link EngineObservation}
 */
public class ArgoStatusMapper {

    /**
     * Grouping nodes, not steps
     */
    private static final Set<String> STRUCTURAL_NODE_TYPES = Set.of("DAG", "StepGroup", "Steps", "TaskGroup");

    private static final Set<String> FINISHED_NODE_PHASES = Set.of("Succeeded", "Failed", "Error", "Skipped", "Omitted");

    private final Clock clock;

    public ArgoStatusMapper(Clock clock) {
        this.clock = clock;
    }

    public EngineObservation toObservation(JsonNode workflow) {
        JsonNode metadata = workflow.path("metadata");
        JsonNode labels = metadata.path("labels");
        JsonNode status = workflow.path("status");

        WorkflowPhase phase = WorkflowPhase.fromEngine(text(status, "phase"));
        List<WorkflowNode> nodes = parseNodes(status.path("nodes"));
        int progress = calculateProgress(nodes);
        Instant startedAt = instant(status, "startedAt");

        WorkflowStatus observed = WorkflowStatus.builder()
            .id(metadata.path("name").asText(null))
            .type(labels.path("workflow-type").asText(null))
            .userId(labels.path("user-id").asText(null))
            .qualityLevel(qualityLevel(labels.path("quality-level").asText(null)))
            .status(phase)
            .progress(phase == WorkflowPhase.SUCCEEDED ? 100 : progress)
            .startedAt(startedAt)
            .finishedAt(phase.isTerminal() ? instant(status, "finishedAt") : null)
            .estimatedCompletionTime(phase.isTerminal() ? null : estimateCompletion(startedAt, progress))
            .errorMessage(phase == WorkflowPhase.FAILED || phase == WorkflowPhase.ERROR ? text(status, "message") : null)
            .nodes(nodes)
            .build();

        JsonNode outputs = status.path("outputs");
        return EngineObservation.builder()
            .status(observed)
            .outputs(outputs.isMissingNode() ? null : outputs)
            .build();
    }

    /**
     * Finished step nodes over all step nodes, as a percentage
     */
    int calculateProgress(List<WorkflowNode> nodes) {
        if (nodes.isEmpty()) {
            return 0;
        }
        long finished = nodes.stream()
            .filter(node -> node.getPhase() != null && node.getPhase().isTerminal())
            .count();
        return (int) Math.round(finished * 100.0 / nodes.size());
    }

    /**
     * Linear extrapolation of elapsed time over progress
     */
    Instant estimateCompletion(Instant startedAt, int progress) {
        if (startedAt == null || progress <= 0 || progress >= 100) {
            return null;
        }
        Instant now = clock.instant();
        long elapsedMs = Duration.between(startedAt, now).toMillis();
        long remainingMs = elapsedMs * (100 - progress) / progress;
        return now.plusMillis(remainingMs);
    }

    private List<WorkflowNode> parseNodes(JsonNode nodes) {
        List<WorkflowNode> result = new ArrayList<>();
        Iterator<JsonNode> it = nodes.elements();
        while (it.hasNext()) {
            JsonNode node = it.next();
            String type = text(node, "type");
            if (type != null && STRUCTURAL_NODE_TYPES.contains(type)) {
                continue;
            }
            String name = node.path("displayName").asText(node.path("name").asText(null));
            String nodePhase = text(node, "phase");
            result.add(WorkflowNode.builder()
                .id(node.path("id").asText(null))
                .name(name)
                .stage(ProcessingStage.fromTemplateName(node.path("templateName").asText(name)))
                .phase(WorkflowPhase.fromEngine(nodePhase))
                .message(text(node, "message"))
                .progress(nodePhase != null && FINISHED_NODE_PHASES.contains(nodePhase) ? 100 : parseProgress(text(node, "progress")))
                .startedAt(instant(node, "startedAt"))
                .finishedAt(instant(node, "finishedAt"))
                .build());
        }
        result.sort(Comparator.comparing(WorkflowNode::getStartedAt, Comparator.nullsLast(Comparator.naturalOrder())));
        return result;
    }

    /**
     * Argo reports node progress as "done/total"
     */
    static int parseProgress(String progress) {
        if (progress == null) {
            return 0;
        }
        int slash = progress.indexOf('/');
        if (slash <= 0) {
            return 0;
        }
        try {
            long done = Long.parseLong(progress.substring(0, slash).trim());
            long total = Long.parseLong(progress.substring(slash + 1).trim());
            return total > 0 ? (int) Math.min(100, done * 100 / total) : 0;
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static QualityLevel qualityLevel(String value) {
        if (value == null) {
            return null;
        }
        try {
            return QualityLevel.fromValue(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }

    private static Instant instant(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
