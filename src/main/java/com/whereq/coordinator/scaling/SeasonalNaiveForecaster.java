package com.whereq.coordinator.scaling;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Repeats the value observed one season ago. Until a full season has been observed
 * the mean of the available history is used instead.
 */
public class SeasonalNaiveForecaster implements LoadForecaster {

    public static final String NAME = "seasonal-naive";

    private final int seasonLength;

    public SeasonalNaiveForecaster(int seasonLength) {
        if (seasonLength < 1) {
            throw new IllegalArgumentException("Season length must be at least 1: " + seasonLength);
        }
        this.seasonLength = seasonLength;
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
        if (history.size() < seasonLength) {
            return history.stream().mapToDouble(Double::doubleValue).average();
        }
        return OptionalDouble.of(history.get(history.size() - seasonLength));
    }
}
