package com.whereq.coordinator.scaling;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Forecasts the next value of a load series
 */
public interface LoadForecaster {

    String name();

    /**
     * @param history observed values, oldest first
     * @return the expected next value, empty when the history is too short
     */
    OptionalDouble forecast(List<Double> history);
}
