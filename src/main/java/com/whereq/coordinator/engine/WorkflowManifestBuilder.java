package com.whereq.coordinator.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.coordinator.config.CoordinatorProperties;
import com.whereq.coordinator.dto.WorkflowRequest;
import com.whereq.coordinator.model.QualityLevel;
import com.whereq.coordinator.model.ResourceAllocation;
import com.whereq.coordinator.model.Toleration;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Builds the Argo Workflow manifest for a request. The pipeline itself lives in a
 * WorkflowTemplate named after the request type; this fills in labels, arguments,
 * scheduling constraints and container resources.
 */
@Component
public class WorkflowManifestBuilder {

    static final String APP_LABEL = "whereq-ml";
    private static final String GPU_RESOURCE = "nvidia.com/gpu";

    private final ObjectMapper objectMapper;
    private final CoordinatorProperties properties;

    public WorkflowManifestBuilder(ObjectMapper objectMapper, CoordinatorProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public ObjectNode build(String workflowId, WorkflowRequest request, QualityLevel qualityLevel,
                            ResourceAllocation allocation) {
        ObjectNode workflow = objectMapper.createObjectNode();
        workflow.put("apiVersion", "argoproj.io/v1alpha1");
        workflow.put("kind", "Workflow");

        ObjectNode metadata = workflow.putObject("metadata");
        metadata.put("name", workflowId);
        metadata.put("namespace", properties.getEngine().getNamespace());
        ObjectNode labels = metadata.putObject("labels");
        labels.put("app", APP_LABEL);
        labels.put("workflow-type", request.getType());
        labels.put("quality-level", qualityLevel.getValue());
        labels.put("user-id", request.getUserId());
        labels.put("subscription-tier", request.getSubscriptionTier().getValue());

        ObjectNode spec = workflow.putObject("spec");
        spec.putObject("workflowTemplateRef").put("name", request.getType());
        spec.put("serviceAccountName", properties.getEngine().getServiceAccountName());
        spec.put("priorityClassName", allocation.getPriorityClassName());
        spec.put("podPriority", allocation.getPriorityValue());

        ObjectNode nodeSelector = spec.putObject("nodeSelector");
        allocation.getNodeSelector().forEach(nodeSelector::put);

        ArrayNode tolerations = spec.putArray("tolerations");
        for (Toleration toleration : allocation.getTolerations()) {
            ObjectNode node = tolerations.addObject();
            node.put("key", toleration.getKey());
            node.put("operator", toleration.getOperator());
            if (toleration.getValue() != null) {
                node.put("value", toleration.getValue());
            }
            node.put("effect", toleration.getEffect());
        }

        spec.put("podSpecPatch", podSpecPatch(allocation));

        ObjectNode podLabels = spec.putObject("podMetadata").putObject("labels");
        podLabels.put("app", APP_LABEL);
        podLabels.put("workflow-type", request.getType());
        podLabels.put("quality-level", qualityLevel.getValue());
        podLabels.put("user-id", request.getUserId());

        ArrayNode parameters = spec.putObject("arguments").putArray("parameters");
        addParameter(parameters, "user-id", request.getUserId());
        addParameter(parameters, "subscription-tier", request.getSubscriptionTier().getValue());
        addParameter(parameters, "quality-target", qualityLevel.getValue());
        if (request.getParameters() != null) {
            for (Map.Entry<String, Object> entry : request.getParameters().entrySet()) {
                addParameter(parameters, entry.getKey(), parameterValue(entry.getValue()));
            }
        }
        return workflow;
    }

    private String podSpecPatch(ResourceAllocation allocation) {
        ObjectNode patch = objectMapper.createObjectNode();
        ObjectNode container = patch.putArray("containers").addObject();
        container.put("name", "main");
        ObjectNode resources = container.putObject("resources");
        ObjectNode requests = resources.putObject("requests");
        requests.put("cpu", allocation.getCpu());
        requests.put("memory", allocation.getMemory());
        ObjectNode limits = resources.putObject("limits");
        limits.put("cpu", allocation.getCpu());
        limits.put("memory", allocation.getMemory());
        if (allocation.getGpu() > 0) {
            limits.put(GPU_RESOURCE, String.valueOf(allocation.getGpu()));
        }
        return patch.toString();
    }

    private String parameterValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String s) {
            return s;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Parameter value is not serializable: " + value, e);
        }
    }

    private static void addParameter(ArrayNode parameters, String name, String value) {
        parameters.addObject()
            .put("name", name)
            .put("value", value);
    }
}
