package com.trading.cld.strategy;

import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class MultiPassStrategyTest {

    @Test
    public void testRunsExactlyMaxIterations() {
        MultiPassStrategy strategy = new MultiPassStrategy(3);
        assertTrue(strategy.shouldContinue(1, Map.of()));
        assertTrue(strategy.shouldContinue(2, Map.of()));
        assertFalse(strategy.shouldContinue(3, Map.of()));
        assertEquals(3, strategy.maxIterations());
    }

    @Test
    public void testSingleIterationCap() {
        assertFalse(new MultiPassStrategy(1).shouldContinue(1, Map.of()));
    }

    @Test
    public void testRejectsNonPositiveCap() {
        try {
            new MultiPassStrategy(0);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("maxIterations must be at least 1, got 0", e.getMessage());
        }
    }

    @Test
    public void testNoBackEdgeValuesOnFirstIteration() {
        MultiPassStrategy strategy = new MultiPassStrategy(5);
        assertTrue(strategy.backEdgeDefaults(1, null).isEmpty());
        assertTrue(strategy.backEdgeDefaults(1, Map.of("A", Map.of("delta", 1.0))).isEmpty());
        assertTrue(strategy.backEdgeDefaults(2, null).isEmpty());
    }

    @Test
    public void testBackEdgeValuesFromPreviousNumericOutputs() {
        Map<String, Map<String, Object>> previous = new LinkedHashMap<>();
        previous.put("A", Map.of("delta", 2.5, "label", "text"));
        previous.put("B", Map.of("count", 3));
        previous.put("C", Map.of());

        Map<String, Double> defaults = new MultiPassStrategy(5).backEdgeDefaults(2, previous);

        assertEquals(2, defaults.size());
        assertEquals(2.5, defaults.get("A.delta"), 1e-9);
        assertEquals(3.0, defaults.get("B.count"), 1e-9);
        assertFalse(defaults.containsKey("A.label"));
    }

    @Test
    public void testToString() {
        assertEquals("MultiPass(4)", new MultiPassStrategy(4).toString());
    }
}
