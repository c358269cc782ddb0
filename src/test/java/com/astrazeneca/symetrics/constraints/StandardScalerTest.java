package com.astrazeneca.symetrics.constraints;

import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

public class StandardScalerTest {
    private static final double DELTA = 1e-12;

    @Test
    public void testFitAndTransform() {
        double[] values = {1, 2, 3, 4, 5};
        StandardScaler scaler = StandardScaler.fit(values);
        assertEquals(scaler.getMean(), 3.0, DELTA);
        assertEquals(scaler.getScale(), Math.sqrt(2.0), DELTA);

        double[] scaled = scaler.transform(values);
        double sum = 0;
        double squares = 0;
        for (double value : scaled) {
            sum += value;
            squares += value * value;
        }
        assertEquals(sum / scaled.length, 0.0, DELTA);
        assertEquals(squares / scaled.length, 1.0, DELTA);
        assertEquals(scaler.transform(3.0), 0.0, DELTA);
    }

    @Test
    public void testConstantSampleIsOnlyCentered() {
        StandardScaler scaler = StandardScaler.fit(new double[]{2.5, 2.5, 2.5});
        assertEquals(scaler.getScale(), 1.0);
        assertEquals(scaler.transform(2.5), 0.0);
        assertEquals(scaler.transform(3.5), 1.0, DELTA);
    }

    @Test
    public void testNaNIsSkipped() {
        StandardScaler scaler = StandardScaler.fit(new double[]{1, Double.NaN, 3});
        assertEquals(scaler.getMean(), 2.0, DELTA);
        assertEquals(scaler.getScale(), 1.0, DELTA);
        assertTrue(Double.isNaN(scaler.transform(Double.NaN)));
    }
}
