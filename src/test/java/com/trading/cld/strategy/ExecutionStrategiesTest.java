package com.trading.cld.strategy;

import com.trading.cld.api.ExecutionStrategy;
import org.junit.Test;

import java.util.Properties;

import static org.junit.Assert.*;

public class ExecutionStrategiesTest {

    private static Properties props(String... kv) {
        Properties p = new Properties();
        for (int i = 0; i < kv.length; i += 2)
            p.setProperty(kv[i], kv[i + 1]);
        return p;
    }

    @Test
    public void testDefaultsToSinglePass() {
        assertTrue(ExecutionStrategies.fromProperties(new Properties()) instanceof SinglePassStrategy);
    }

    @Test
    public void testMultiPass() {
        ExecutionStrategy s = ExecutionStrategies.fromProperties(
                props(ExecutionStrategies.STRATEGY, "multi-pass", ExecutionStrategies.MAX_ITERATIONS, " 7 "));
        assertEquals(7, ((MultiPassStrategy) s).maxIterations());
    }

    @Test
    public void testConvergenceWithDefaultCap() {
        ExecutionStrategy s = ExecutionStrategies.fromProperties(
                props(ExecutionStrategies.STRATEGY, "Convergence", ExecutionStrategies.THRESHOLD, "1e-4"));
        ConvergenceStrategy c = (ConvergenceStrategy) s;
        assertEquals(1e-4, c.threshold(), 0.0);
        assertEquals(ConvergenceStrategy.DEFAULT_MAX_ITERATIONS, c.maxIterations());
    }

    @Test
    public void testConvergenceWithCap() {
        ConvergenceStrategy c = (ConvergenceStrategy) ExecutionStrategies.fromProperties(
                props("cld.strategy", "convergence", "cld.threshold", "0.5", "cld.maxIterations", "12"));
        assertEquals(12, c.maxIterations());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownStrategy() {
        ExecutionStrategies.fromProperties(props("cld.strategy", "random"));
    }

    @Test
    public void testMultiPassRequiresCap() {
        try {
            ExecutionStrategies.fromProperties(props("cld.strategy", "multi-pass"));
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("Missing required property cld.maxIterations", e.getMessage());
        }
    }

    @Test
    public void testUnparsableNumber() {
        try {
            ExecutionStrategies.fromProperties(props("cld.strategy", "convergence", "cld.threshold", "small"));
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getCause() instanceof NumberFormatException);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidValuesStillChecked() {
        ExecutionStrategies.fromProperties(props("cld.strategy", "multi-pass", "cld.maxIterations", "0"));
    }
}
