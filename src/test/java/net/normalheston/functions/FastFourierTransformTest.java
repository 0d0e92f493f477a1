package net.normalheston.functions;

import org.apache.commons.math3.random.MersenneTwister;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class FastFourierTransformTest {

    private final MersenneTwister randomGenerator = new MersenneTwister(3271);

    @Test
    public void testPowerOfTwoAgainstDirectSummation() {
        assertTransformAgreesWithDirectSummation(256);
    }

    @Test
    public void testNonPowerOfTwoAgainstDirectSummation() {
        for(int length : new int[] { 3, 12, 120, 1000 }) {
            assertTransformAgreesWithDirectSummation(length);
        }
    }

    @Test
    public void testArgumentsAreNotModified() {
        double[] real = { 1.0, 2.0, 3.0, 4.0, 5.0 };
        double[] imaginary = { 0.5, 0.0, -0.5, 0.0, 1.0 };
        FastFourierTransform.transform(real, imaginary);

        assertEquals(3.0, real[2], 0.0);
        assertEquals(-0.5, imaginary[2], 0.0);
    }

    @Test
    public void testTransformOfDeltaIsConstant() {
        int length = 120;
        double[] real = new double[length];
        double[] imaginary = new double[length];
        real[0] = 1.0;

        double[][] transform = FastFourierTransform.transform(real, imaginary);
        for(int k = 0; k < length; k++) {
            assertEquals(1.0, transform[0][k], 1E-12);
            assertEquals(0.0, transform[1][k], 1E-12);
        }
    }

    @Test
    public void testIsPowerOfTwo() {
        assertTrue(FastFourierTransform.isPowerOfTwo(4096));
        assertFalse(FastFourierTransform.isPowerOfTwo(120000));
        assertFalse(FastFourierTransform.isPowerOfTwo(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDifferentLengthsAreRejected() {
        FastFourierTransform.transform(new double[4], new double[3]);
    }

    private void assertTransformAgreesWithDirectSummation(int length) {
        double[] real = new double[length];
        double[] imaginary = new double[length];
        for(int n = 0; n < length; n++) {
            real[n] = randomGenerator.nextDouble() - 0.5;
            imaginary[n] = randomGenerator.nextDouble() - 0.5;
        }

        double[][] transform = FastFourierTransform.transform(real, imaginary);

        for(int k = 0; k < length; k++) {
            double expectedReal = 0.0;
            double expectedImaginary = 0.0;
            for(int n = 0; n < length; n++) {
                double angle = -2.0 * Math.PI * ((long)n * k % length) / length;
                expectedReal += real[n] * Math.cos(angle) - imaginary[n] * Math.sin(angle);
                expectedImaginary += real[n] * Math.sin(angle) + imaginary[n] * Math.cos(angle);
            }
            assertEquals("Real part, length " + length + ", index " + k, expectedReal, transform[0][k], 1E-10);
            assertEquals("Imaginary part, length " + length + ", index " + k, expectedImaginary, transform[1][k], 1E-10);
        }
    }
}
