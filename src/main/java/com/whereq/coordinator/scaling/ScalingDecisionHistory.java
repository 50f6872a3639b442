package com.whereq.coordinator.scaling;

import com.whereq.coordinator.config.CoordinatorProperties;
import com.whereq.coordinator.model.ScalingDirective;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded audit trail of applied scaling directives, newest first
 */
@Component
public class ScalingDecisionHistory {

    private final int maxEntries;
    private final Deque<ScalingDirective> decisions = new ArrayDeque<>();

    public ScalingDecisionHistory(CoordinatorProperties properties) {
        this.maxEntries = properties.getScaling().getPredictive().getDecisionHistoryMax();
    }

    public synchronized void add(ScalingDirective directive) {
        decisions.addFirst(directive);
        while (decisions.size() > maxEntries) {
            decisions.removeLast();
        }
    }

    public synchronized List<ScalingDirective> recent(int limit) {
        List<ScalingDirective> result = new ArrayList<>(Math.min(limit, decisions.size()));
        for (ScalingDirective directive : decisions) {
            if (result.size() >= limit) {
                break;
            }
            result.add(directive);
        }
        return result;
    }

    public synchronized int size() {
        return decisions.size();
    }
}
