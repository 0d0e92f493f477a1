package net.normalheston.montecarlo.process;

import net.finmath.time.TimeDiscretization;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class ArithmeticAssetSchemeTest {

    @Test
    public void testEulerStepUsesStartOfIntervalVariance() {
        PathState state = new PathState(1, 2, 1.0, 0.04);
        state.getEffectiveVariance()[0][1] = 0.09;
        state.getEffectiveVariance()[0][2] = 0.16;

        double timeStep = 0.5;
        new ArithmeticAssetScheme(0.03, 0.01).evolve(state, new double[][] { { 0.1, -0.2 } }, new TimeDiscretization(0.0, 2, timeStep));

        double[] asset = state.getAssetValue()[0];
        assertEquals(1.0, asset[0], 0.0);
        assertEquals(1.0 + 0.02 * timeStep + 0.2 * 0.1, asset[1], 1E-15);
        assertEquals(asset[1] + 0.02 * timeStep + 0.3 * -0.2, asset[2], 1E-15);
        assertEquals(asset[2], state.getTerminalAssetValue(0), 0.0);
    }

    @Test
    public void testNonUniformTimeSteps() {
        PathState state = new PathState(1, 2, 0.0, 0.0);

        new ArithmeticAssetScheme(0.1, 0.0).evolve(state, new double[][] { { 0.0, 0.0 } }, new TimeDiscretization(new double[] { 0.0, 0.25, 1.0 }));

        assertEquals(0.025, state.getAssetValue()[0][1], 1E-15);
        assertEquals(0.1, state.getTerminalAssetValue(0), 1E-15);
    }

    @Test
    public void testZeroVarianceGivesDeterministicDrift() {
        PathState state = new PathState(3, 10, -0.5, 0.0);
        double[][] increments = new double[3][10];
        for(double[] row : increments) {
            java.util.Arrays.fill(row, 1.0);
        }

        new ArithmeticAssetScheme(0.05, 0.0).evolve(state, increments, new TimeDiscretization(0.0, 10, 0.1));

        for(int path = 0; path < 3; path++) {
            assertEquals(-0.5 + 0.05, state.getTerminalAssetValue(path), 1E-15);
        }
        assertEquals(3, state.getNumberOfAbsorbedPaths(0));
    }
}
