package com.whereq.coordinator.quality;

import com.whereq.coordinator.dto.WorkflowRequest;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Content heuristics per workflow type. Each request is rated on input size and
 * complexity (small/medium/large and low/medium/high map to 0.25/0.5/0.75) and the
 * score is their mean. Unknown types score 0.5.
 */
@Component
public class InputComplexityAnalyzer {

    static final double NEUTRAL_SCORE = 0.5;

    private static final Set<String> COMPLEX_ROOMS = Set.of("kitchen", "bathroom", "office");
    private static final Set<String> ORDINARY_ROOMS = Set.of("bedroom", "living-room");

    enum Rating {
        LOW(0.25), MEDIUM(0.5), HIGH(0.75);

        private final double score;

        Rating(double score) {
            this.score = score;
        }
    }

    public double analyze(WorkflowRequest request) {
        Map<String, Object> params = request.getParameters() != null ? request.getParameters() : Map.of();
        String type = request.getType() == null ? "" : request.getType();

        return switch (type) {
            case "3d-reconstruction" -> reconstruction(params);
            case "material-recognition" -> materialRecognition(params);
            case "scene-graph-generation" -> sceneGraph(params);
            case "room-layout" -> roomLayout(params);
            default -> NEUTRAL_SCORE;
        };
    }

    private double reconstruction(Map<String, Object> params) {
        Object images = params.get("input-images");
        int imageCount = images instanceof Collection<?> c ? c.size() : 1;
        Rating size = imageCount <= 5 ? Rating.LOW : imageCount <= 20 ? Rating.MEDIUM : Rating.HIGH;
        Rating complexity = rating(string(params.get("scene-complexity")), Rating.MEDIUM);
        return combine(size, complexity);
    }

    private double materialRecognition(Map<String, Object> params) {
        Rating complexity = "true".equalsIgnoreCase(string(params.get("extract-properties"))) ? Rating.HIGH : Rating.MEDIUM;
        String resolution = string(params.get("image-resolution"));
        Rating size = Rating.MEDIUM;
        if ("hd".equals(resolution) || "high".equals(resolution)) {
            size = Rating.HIGH;
        } else if ("low".equals(resolution)) {
            size = Rating.LOW;
        }
        return combine(size, complexity);
    }

    private double sceneGraph(Map<String, Object> params) {
        Rating complexity = "high".equals(string(params.get("relationship-detail"))) ? Rating.HIGH : Rating.MEDIUM;
        Rating size = Rating.MEDIUM;
        Integer maxObjects = integer(params.get("max-objects"));
        if (maxObjects != null) {
            if (maxObjects <= 10) {
                size = Rating.LOW;
            } else if (maxObjects >= 50) {
                size = Rating.HIGH;
            }
        }
        return combine(size, complexity);
    }

    private double roomLayout(Map<String, Object> params) {
        String roomType = string(params.get("room-type"));
        Rating complexity = Rating.MEDIUM;
        if (roomType != null) {
            if (COMPLEX_ROOMS.contains(roomType)) {
                complexity = Rating.HIGH;
            } else if (!ORDINARY_ROOMS.contains(roomType)) {
                complexity = Rating.LOW;
            }
        }
        String roomSize = string(params.get("room-size"));
        Rating size = "large".equals(roomSize) ? Rating.HIGH : "small".equals(roomSize) ? Rating.LOW : Rating.MEDIUM;
        return combine(size, complexity);
    }

    private static double combine(Rating size, Rating complexity) {
        return (size.score + complexity.score) / 2;
    }

    private static Rating rating(String value, Rating fallback) {
        if (value == null) {
            return fallback;
        }
        return switch (value) {
            case "low" -> Rating.LOW;
            case "medium" -> Rating.MEDIUM;
            case "high" -> Rating.HIGH;
            default -> fallback;
        };
    }

    private static String string(Object value) {
        return value == null ? null : value.toString();
    }

    private static Integer integer(Object value) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
