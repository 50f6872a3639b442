package com.whereq.coordinator.scaling;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Mean of the most recent {@code window} observations
 */
public class MovingAverageForecaster implements LoadForecaster {

    public static final String NAME = "moving-average";

    private final int window;

    public MovingAverageForecaster(int window) {
        if (window < 1) {
            throw new IllegalArgumentException("Window must be at least 1: " + window);
        }
        this.window = window;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public OptionalDouble forecast(List<Double> history) {
        if (history == null || history.isEmpty()) {
            return OptionalDouble.empty();
        }
        int from = Math.max(0, history.size() - window);
        return history.subList(from, history.size()).stream()
            .mapToDouble(Double::doubleValue)
            .average();
    }
}
