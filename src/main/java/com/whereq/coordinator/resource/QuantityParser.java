package com.whereq.coordinator.resource;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parse and format Kubernetes resource quantities ("500m", "2", "8Gi", "1234Ki", "250000000n")
 */
public final class QuantityParser {

    private static final Pattern QUANTITY_PATTERN = Pattern.compile("([0-9]+(?:\\.[0-9]+)?)([a-zA-Z]*)");

    private static final long KI = 1024L;
    private static final long MI = KI * 1024;
    private static final long GI = MI * 1024;
    private static final long TI = GI * 1024;

    private QuantityParser() {
    }

    /**
     * Parse a CPU quantity to millicores
     *
     * @throws IllegalArgumentException for malformed quantities
     */
    public static long parseCpuMillis(String quantity) {
        Matcher matcher = match(quantity);
        BigDecimal value = new BigDecimal(matcher.group(1));
        String unit = matcher.group(2);

        BigDecimal millis = switch (unit) {
            case "" -> value.multiply(BigDecimal.valueOf(1000));
            case "m" -> value;
            case "u" -> value.divide(BigDecimal.valueOf(1_000L), 3, RoundingMode.HALF_UP);
            case "n" -> value.divide(BigDecimal.valueOf(1_000_000L), 3, RoundingMode.HALF_UP);
            case "k" -> value.multiply(BigDecimal.valueOf(1_000_000L));
            default -> throw new IllegalArgumentException("Unsupported CPU unit: " + quantity);
        };
        return millis.setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    /**
     * Parse a memory quantity to bytes
     *
     * @throws IllegalArgumentException for malformed quantities
     */
    public static long parseMemoryBytes(String quantity) {
        Matcher matcher = match(quantity);
        BigDecimal value = new BigDecimal(matcher.group(1));
        String unit = matcher.group(2);

        long multiplier = switch (unit) {
            case "" -> 1L;
            case "Ki" -> KI;
            case "Mi" -> MI;
            case "Gi" -> GI;
            case "Ti" -> TI;
            case "k", "K" -> 1_000L;
            case "M" -> 1_000_000L;
            case "G" -> 1_000_000_000L;
            case "T" -> 1_000_000_000_000L;
            default -> throw new IllegalArgumentException("Unsupported memory unit: " + quantity);
        };
        return value.multiply(BigDecimal.valueOf(multiplier)).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    /**
     * Format millicores, e.g. 1500 → "1500m"
     */
    public static String formatCpu(long millis) {
        return millis + "m";
    }

    /**
     * Format bytes in Gi when whole, otherwise in Mi rounded down
     */
    public static String formatMemory(long bytes) {
        if (bytes % GI == 0) {
            return (bytes / GI) + "Gi";
        }
        return (bytes / MI) + "Mi";
    }

    private static Matcher match(String quantity) {
        if (quantity == null) {
            throw new IllegalArgumentException("Quantity is null");
        }
        Matcher matcher = QUANTITY_PATTERN.matcher(quantity.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid quantity: " + quantity);
        }
        return matcher;
    }
}
