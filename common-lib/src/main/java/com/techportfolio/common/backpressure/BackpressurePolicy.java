package com.techportfolio.common.backpressure;

import com.techportfolio.common.exception.ValidationException;

import java.util.Locale;

/**
 * Flow-control policy selected per subscription.
 *
 * <p>Textual form, as accepted by {@link #parse(String, int, int)}:
 * <pre>
 *   buffer        bounded buffer with the default capacity
 *   buffer:32     bounded buffer holding at most 32 unread items
 *   drop          discard items produced while the subscriber has no demand
 *   latest        keep only the newest undelivered item
 * </pre>
 *
 * @param strategy buffering strategy
 * @param capacity maximum number of unread items; only meaningful for {@link Strategy#BUFFER}
 */
public record BackpressurePolicy(Strategy strategy, int capacity) {

    public static final int DEFAULT_CAPACITY = 16;

    /** Largest capacity a caller may request when no other ceiling is configured. */
    public static final int MAX_CAPACITY = 1024;

    public enum Strategy { BUFFER, DROP, LATEST }

    public BackpressurePolicy {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy must not be null");
        }
        if (strategy == Strategy.BUFFER && capacity < 1) {
            throw new IllegalArgumentException("buffer capacity must be positive, got " + capacity);
        }
    }

    public static BackpressurePolicy buffer(int capacity) {
        return new BackpressurePolicy(Strategy.BUFFER, capacity);
    }

    public static BackpressurePolicy drop() {
        return new BackpressurePolicy(Strategy.DROP, 0);
    }

    public static BackpressurePolicy latest() {
        return new BackpressurePolicy(Strategy.LATEST, 0);
    }

    public static BackpressurePolicy defaultPolicy() {
        return buffer(DEFAULT_CAPACITY);
    }

    public static BackpressurePolicy parse(String value, int defaultCapacity) {
        return parse(value, defaultCapacity, MAX_CAPACITY);
    }

    /**
     * Parses the textual policy form. A blank value yields a buffer with
     * {@code defaultCapacity}.
     *
     * @param maxCapacity largest capacity accepted in {@code buffer:n}
     * @throws ValidationException for an unknown policy name, or a capacity that is
     *         malformed, non-positive or above {@code maxCapacity}
     */
    public static BackpressurePolicy parse(String value, int defaultCapacity, int maxCapacity) {
        if (value == null || value.isBlank()) {
            return buffer(defaultCapacity);
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        String name = normalized;
        String argument = null;
        int separator = normalized.indexOf(':');
        if (separator >= 0) {
            name = normalized.substring(0, separator);
            argument = normalized.substring(separator + 1);
        }

        return switch (name) {
            case "buffer" -> buffer(argument == null ? defaultCapacity : parseCapacity(argument, maxCapacity));
            case "drop"   -> drop();
            case "latest" -> latest();
            default -> throw new ValidationException("Unknown backpressure policy '" + value + "'");
        };
    }

    private static int parseCapacity(String argument, int maxCapacity) {
        try {
            int capacity = Integer.parseInt(argument);
            if (capacity < 1) {
                throw new ValidationException("Buffer capacity must be positive, got " + capacity);
            }
            if (capacity > maxCapacity) {
                throw new ValidationException("Buffer capacity must not exceed " + maxCapacity + ", got " + capacity);
            }
            return capacity;
        } catch (NumberFormatException e) {
            throw new ValidationException("Buffer capacity '" + argument + "' is not a number");
        }
    }

    @Override
    public String toString() {
        return strategy == Strategy.BUFFER
            ? "buffer:" + capacity
            : strategy.name().toLowerCase(Locale.ROOT);
    }
}
