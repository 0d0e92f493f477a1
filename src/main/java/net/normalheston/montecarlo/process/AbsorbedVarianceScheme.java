/*
 * (c) Copyright the normalheston-lib authors. All rights reserved.
 *
 * Created on 19.10.2026
 */
package net.normalheston.montecarlo.process;

import net.finmath.time.TimeDiscretizationInterface;

/**
 * Euler scheme with absorption at zero for the square root variance process
 * \[ dV = \kappa ( \theta - V ) dt + \sigma \sqrt{V} dW_{1}. \]
 *
 * The scheme keeps the raw state \( \tilde{V} \) and the effective state \( V = \max(\tilde{V}, 0) \):
 * \[ \tilde{V}_{j+1} = \tilde{V}_{j} + \kappa ( \theta - \tilde{V}_{j} ) \Delta t + \sigma \sqrt{\max(\tilde{V}_{j}, 0)} \Delta W_{1,j}, \quad V_{j+1} = \max(\tilde{V}_{j+1}, 0). \]
 * The drift acts on the raw state, such that a negative raw state reverts towards \( \theta \).
 * Only the effective state is used by the diffusion of the underlying.
 *
 * @author normalheston-lib authors
 */
public class AbsorbedVarianceScheme {

    private final double longRunVariance;
    private final double meanReversionSpeed;
    private final double volatilityOfVariance;

    public AbsorbedVarianceScheme(double longRunVariance, double meanReversionSpeed, double volatilityOfVariance) {
        this.longRunVariance = longRunVariance;
        this.meanReversionSpeed = meanReversionSpeed;
        this.volatilityOfVariance = volatilityOfVariance;
    }

    /**
     * Fills the raw and effective variance series of the path state for all time steps.
     * The values at time index 0 have to be set.
     *
     * @param state The path state.
     * @param varianceIncrements The increments \( \Delta W_{1} \), one row per path.
     * @param timeDiscretization The time discretization, providing the time steps \( \Delta t_{j} \).
     */
    public void evolve(PathState state, double[][] varianceIncrements, TimeDiscretizationInterface timeDiscretization) {
        double[][] raw = state.getRawVariance();
        double[][] effective = state.getEffectiveVariance();
        int numberOfTimeSteps = state.getNumberOfTimeSteps();

        for(int path = 0; path < state.getNumberOfPaths(); path++) {
            double[] rawOfPath = raw[path];
            double[] effectiveOfPath = effective[path];
            double[] increments = varianceIncrements[path];
            for(int timeIndex = 0; timeIndex < numberOfTimeSteps; timeIndex++) {
                rawOfPath[timeIndex + 1] = step(rawOfPath[timeIndex], increments[timeIndex], timeDiscretization.getTimeStep(timeIndex));
                effectiveOfPath[timeIndex + 1] = Math.max(rawOfPath[timeIndex + 1], 0.0);
            }
        }
    }

    /**
     * Single step of the raw state.
     *
     * @param rawVariance The raw state at the start of the interval (may be negative).
     * @param increment The Brownian increment.
     * @param timeStep The time step.
     * @return The raw state at the end of the interval.
     */
    public double step(double rawVariance, double increment, double timeStep) {
        return rawVariance
                + meanReversionSpeed * (longRunVariance - rawVariance) * timeStep
                + volatilityOfVariance * Math.sqrt(Math.max(rawVariance, 0.0)) * increment;
    }
}
