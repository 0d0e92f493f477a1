/*
 * (c) Copyright the normalheston-lib authors. All rights reserved.
 *
 * Created on 19.10.2026
 */
package net.normalheston.montecarlo;

import net.finmath.montecarlo.BrownianMotion;
import net.finmath.montecarlo.BrownianMotionInterface;
import net.finmath.stochastic.RandomVariableInterface;
import net.finmath.time.TimeDiscretizationInterface;

/**
 * Two correlated Brownian increments built from a two factor Brownian motion \( (W, Z) \),
 * \[ \Delta W_{1} = \Delta W, \quad \Delta W_{2} = \rho \Delta W_{1} + \sqrt{1-\rho^{2}} \Delta Z. \]
 *
 * The Brownian motion draws its normal variates from a Mersenne Twister via the inverse of the normal distribution
 * function, such that the increments are reproducible for a given seed.
 *
 * @author normalheston-lib authors
 */
public class CorrelatedBrownianIncrements {

    private final BrownianMotionInterface brownianMotion;
    private final double correlation;

    /**
     * @param brownianMotion A Brownian motion with (at least) two factors.
     * @param correlation The correlation \( \rho \), required to be in [-1, 1].
     */
    public CorrelatedBrownianIncrements(BrownianMotionInterface brownianMotion, double correlation) {
        if(Math.abs(correlation) > 1.0 || Double.isNaN(correlation)) {
            throw new IllegalArgumentException("Correlation " + correlation + " is outside [-1, 1], no real factor sqrt(1-rho^2) exists.");
        }
        if(brownianMotion.getNumberOfFactors() < 2) {
            throw new IllegalArgumentException("Brownian motion requires two factors, got " + brownianMotion.getNumberOfFactors() + ".");
        }
        this.brownianMotion = brownianMotion;
        this.correlation = correlation;
    }

    /**
     * @param timeDiscretization The time discretization.
     * @param correlation The correlation \( \rho \), required to be in [-1, 1].
     * @param numberOfPaths The number of paths.
     * @param seed The seed of the random number generator.
     */
    public CorrelatedBrownianIncrements(TimeDiscretizationInterface timeDiscretization, double correlation, int numberOfPaths, int seed) {
        this(new BrownianMotion(timeDiscretization, 2, numberOfPaths, seed), correlation);
    }

    /**
     * @param timeIndex The index of the time interval.
     * @return The increment \( \Delta W_{1} \) driving the variance.
     */
    public RandomVariableInterface getVarianceIncrement(int timeIndex) {
        return brownianMotion.getBrownianIncrement(timeIndex, 0);
    }

    /**
     * @param timeIndex The index of the time interval.
     * @return The increment \( \Delta W_{2} \) driving the underlying.
     */
    public RandomVariableInterface getAssetIncrement(int timeIndex) {
        return brownianMotion.getBrownianIncrement(timeIndex, 0).mult(correlation)
                .add(brownianMotion.getBrownianIncrement(timeIndex, 1).mult(Math.sqrt(1.0 - correlation * correlation)));
    }

    /**
     * Collects the increments of all paths and time steps.
     *
     * @return The increments as two <code>double[numberOfPaths][numberOfTimeSteps]</code> matrices.
     */
    public BrownianIncrements getIncrements() {
        int numberOfPaths = brownianMotion.getNumberOfPaths();
        int numberOfTimeSteps = brownianMotion.getTimeDiscretization().getNumberOfTimeSteps();

        double[][] varianceIncrements = new double[numberOfPaths][numberOfTimeSteps];
        double[][] assetIncrements = new double[numberOfPaths][numberOfTimeSteps];
        for(int timeIndex = 0; timeIndex < numberOfTimeSteps; timeIndex++) {
            RandomVariableInterface varianceIncrement = getVarianceIncrement(timeIndex);
            RandomVariableInterface assetIncrement = getAssetIncrement(timeIndex);
            for(int path = 0; path < numberOfPaths; path++) {
                varianceIncrements[path][timeIndex] = varianceIncrement.get(path);
                assetIncrements[path][timeIndex] = assetIncrement.get(path);
            }
        }

        return new BrownianIncrements(varianceIncrements, assetIncrements);
    }

    public TimeDiscretizationInterface getTimeDiscretization() {
        return brownianMotion.getTimeDiscretization();
    }

    public BrownianMotionInterface getBrownianMotion() {
        return brownianMotion;
    }

    public double getCorrelation() {
        return correlation;
    }
}
