package com.trading.cld.strategy;

import com.trading.cld.api.ExecutionStrategy;

import java.util.Properties;

/**
 * Factory methods for the built-in strategies, including creation from
 * configuration properties.
 *
 * Recognised properties:
 * <ul>
 * <li>{@code cld.strategy}: {@code single-pass} (default), {@code multi-pass}
 * or {@code convergence}.</li>
 * <li>{@code cld.maxIterations}: required for multi-pass, optional for
 * convergence (default {@value ConvergenceStrategy#DEFAULT_MAX_ITERATIONS}).</li>
 * <li>{@code cld.threshold}: required for convergence.</li>
 * </ul>
 */
public final class ExecutionStrategies {
    public static final String STRATEGY = "cld.strategy";
    public static final String MAX_ITERATIONS = "cld.maxIterations";
    public static final String THRESHOLD = "cld.threshold";

    private ExecutionStrategies() {
    }

    public static ExecutionStrategy singlePass() {
        return new SinglePassStrategy();
    }

    public static ExecutionStrategy multiPass(int maxIterations) {
        return new MultiPassStrategy(maxIterations);
    }

    public static ExecutionStrategy convergence(double threshold) {
        return new ConvergenceStrategy(threshold);
    }

    public static ExecutionStrategy convergence(double threshold, int maxIterations) {
        return new ConvergenceStrategy(threshold, maxIterations);
    }

    /**
     * Builds a strategy from properties.
     *
     * @throws IllegalArgumentException on an unknown strategy name, a missing
     *                                  required key or an unparsable number.
     */
    public static ExecutionStrategy fromProperties(Properties props) {
        String name = props.getProperty(STRATEGY, "single-pass").trim().toLowerCase();
        switch (name) {
            case "single-pass":
                return singlePass();
            case "multi-pass":
                return multiPass(requireInt(props, MAX_ITERATIONS));
            case "convergence":
                double threshold = requireDouble(props, THRESHOLD);
                String max = props.getProperty(MAX_ITERATIONS);
                return max == null
                        ? convergence(threshold)
                        : convergence(threshold, parseInt(MAX_ITERATIONS, max));
            default:
                throw new IllegalArgumentException("Unknown " + STRATEGY + ": \"" + name
                        + "\" (expected single-pass, multi-pass or convergence)");
        }
    }

    private static int requireInt(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null)
            throw new IllegalArgumentException("Missing required property " + key);
        return parseInt(key, value);
    }

    private static double requireDouble(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null)
            throw new IllegalArgumentException("Missing required property " + key);
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not a number: \"" + value + "\"", e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not an integer: \"" + value + "\"", e);
        }
    }
}
