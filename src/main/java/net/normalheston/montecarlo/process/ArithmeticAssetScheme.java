/*
 * (c) Copyright the normalheston-lib authors. All rights reserved.
 *
 * Created on 19.10.2026
 */
package net.normalheston.montecarlo.process;

import net.finmath.time.TimeDiscretizationInterface;

/**
 * Explicit Euler scheme for the level of the underlying,
 * \[ S_{j+1} = S_{j} + (r-q) \Delta t_{j} + \sqrt{V_{j}} \Delta W_{2,j}, \]
 * where \( V_{j} \) is the effective variance at the start of the interval.
 *
 * @author normalheston-lib authors
 */
public class ArithmeticAssetScheme {

    private final double drift;

    /**
     * @param riskFreeRate The risk free rate \( r \).
     * @param dividendYield The yield \( q \).
     */
    public ArithmeticAssetScheme(double riskFreeRate, double dividendYield) {
        this.drift = riskFreeRate - dividendYield;
    }

    /**
     * Fills the asset series of the path state. The effective variance has to be evolved before.
     *
     * @param state The path state.
     * @param assetIncrements The increments \( \Delta W_{2} \), one row per path.
     * @param timeDiscretization The time discretization, providing the time steps \( \Delta t_{j} \).
     */
    public void evolve(PathState state, double[][] assetIncrements, TimeDiscretizationInterface timeDiscretization) {
        double[][] asset = state.getAssetValue();
        double[][] effective = state.getEffectiveVariance();
        int numberOfTimeSteps = state.getNumberOfTimeSteps();

        double[] driftPerStep = new double[numberOfTimeSteps];
        for(int timeIndex = 0; timeIndex < numberOfTimeSteps; timeIndex++) {
            driftPerStep[timeIndex] = drift * timeDiscretization.getTimeStep(timeIndex);
        }

        for(int path = 0; path < state.getNumberOfPaths(); path++) {
            double[] assetOfPath = asset[path];
            double[] varianceOfPath = effective[path];
            double[] increments = assetIncrements[path];
            for(int timeIndex = 0; timeIndex < numberOfTimeSteps; timeIndex++) {
                assetOfPath[timeIndex + 1] = assetOfPath[timeIndex] + driftPerStep[timeIndex] + Math.sqrt(varianceOfPath[timeIndex]) * increments[timeIndex];
            }
        }
    }
}
