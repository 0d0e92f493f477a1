package net.normalheston.montecarlo;

import net.finmath.montecarlo.BrownianMotion;
import net.finmath.stochastic.RandomVariableInterface;
import net.finmath.time.TimeDiscretization;
import net.finmath.time.TimeDiscretizationInterface;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class CorrelatedBrownianIncrementsTest {

    private static final int NUMBER_OF_PATHS = 50000;
    private static final int NUMBER_OF_TIME_STEPS = 4;
    private static final double TIME_STEP = 0.25;

    private final TimeDiscretizationInterface timeDiscretization = new TimeDiscretization(0.0, NUMBER_OF_TIME_STEPS, TIME_STEP);

    @Test
    public void testSampleCorrelation() {
        for(double correlation : new double[] { -1.0, -0.9, -0.3, 0.0, 0.5, 1.0 }) {
            BrownianIncrements increments = new CorrelatedBrownianIncrements(timeDiscretization, correlation, NUMBER_OF_PATHS, 3026).getIncrements();

            double[] first = new double[NUMBER_OF_PATHS];
            double[] second = new double[NUMBER_OF_PATHS];
            for(int timeIndex = 0; timeIndex < NUMBER_OF_TIME_STEPS; timeIndex++) {
                for(int path = 0; path < NUMBER_OF_PATHS; path++) {
                    first[path] = increments.getVarianceIncrements()[path][timeIndex];
                    second[path] = increments.getAssetIncrements()[path][timeIndex];
                }
                double sampleCorrelation = new PearsonsCorrelation().correlation(first, second);
                assertEquals("Sample correlation for rho=" + correlation, correlation, sampleCorrelation, 0.02);
            }
        }
    }

    @Test
    public void testMeanAndVariance() {
        BrownianIncrements increments = new CorrelatedBrownianIncrements(timeDiscretization, -0.9, NUMBER_OF_PATHS, 7).getIncrements();

        SummaryStatistics varianceDriver = new SummaryStatistics();
        SummaryStatistics assetDriver = new SummaryStatistics();
        for(int path = 0; path < NUMBER_OF_PATHS; path++) {
            for(int timeIndex = 0; timeIndex < NUMBER_OF_TIME_STEPS; timeIndex++) {
                varianceDriver.addValue(increments.getVarianceIncrements()[path][timeIndex]);
                assetDriver.addValue(increments.getAssetIncrements()[path][timeIndex]);
            }
        }

        assertEquals(0.0, varianceDriver.getMean(), 0.01);
        assertEquals(0.0, assetDriver.getMean(), 0.01);
        assertEquals(TIME_STEP, varianceDriver.getVariance(), 0.01);
        assertEquals(TIME_STEP, assetDriver.getVariance(), 0.01);
    }

    @Test
    public void testSameSeedGivesSameIncrements() {
        BrownianIncrements first = new CorrelatedBrownianIncrements(new TimeDiscretization(0.0, 20, 0.01), 0.3, 10, 42).getIncrements();
        BrownianIncrements second = new CorrelatedBrownianIncrements(new TimeDiscretization(0.0, 20, 0.01), 0.3, 10, 42).getIncrements();

        for(int path = 0; path < 10; path++) {
            assertArrayEquals(first.getVarianceIncrements()[path], second.getVarianceIncrements()[path], 0.0);
            assertArrayEquals(first.getAssetIncrements()[path], second.getAssetIncrements()[path], 0.0);
        }
        assertEquals(10, first.getNumberOfPaths());
        assertEquals(20, first.getNumberOfTimeSteps());
    }

    @Test
    public void testFullCorrelationGivesIdenticalIncrements() {
        BrownianIncrements increments = new CorrelatedBrownianIncrements(new TimeDiscretization(0.0, 10, 0.01), 1.0, 5, 1).getIncrements();
        for(int path = 0; path < 5; path++) {
            assertArrayEquals(increments.getVarianceIncrements()[path], increments.getAssetIncrements()[path], 1E-15);
        }
    }

    @Test
    public void testIncrementsAgreeWithBrownianMotion() {
        BrownianMotion brownianMotion = new BrownianMotion(timeDiscretization, 2, 100, 11);
        CorrelatedBrownianIncrements correlatedIncrements = new CorrelatedBrownianIncrements(brownianMotion, 0.6);

        RandomVariableInterface varianceIncrement = correlatedIncrements.getVarianceIncrement(2);
        RandomVariableInterface assetIncrement = correlatedIncrements.getAssetIncrement(2);
        for(int path = 0; path < 100; path++) {
            double dW = brownianMotion.getBrownianIncrement(2, 0).get(path);
            double dZ = brownianMotion.getBrownianIncrement(2, 1).get(path);
            assertEquals(dW, varianceIncrement.get(path), 0.0);
            assertEquals(0.6 * dW + 0.8 * dZ, assetIncrement.get(path), 1E-15);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidCorrelationIsRejected() {
        new CorrelatedBrownianIncrements(timeDiscretization, 1.5, 10, 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBrownianMotionWithOneFactorIsRejected() {
        new CorrelatedBrownianIncrements(new BrownianMotion(timeDiscretization, 1, 10, 1), 0.5);
    }
}
