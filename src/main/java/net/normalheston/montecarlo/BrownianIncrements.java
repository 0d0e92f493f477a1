/*
 * (c) Copyright the normalheston-lib authors. All rights reserved.
 *
 * Created on 19.10.2026
 */
package net.normalheston.montecarlo;

/**
 * Holds the two correlated streams of Brownian increments of a block of paths,
 * given as <code>double[numberOfPaths][numberOfTimeSteps]</code>.
 */
public class BrownianIncrements {

    private final double[][] varianceIncrements;
    private final double[][] assetIncrements;

    public BrownianIncrements(double[][] varianceIncrements, double[][] assetIncrements) {
        this.varianceIncrements = varianceIncrements;
        this.assetIncrements = assetIncrements;
    }

    /**
     * @return The increments \( \Delta W_{1} \) driving the variance.
     */
    public double[][] getVarianceIncrements() {
        return varianceIncrements;
    }

    /**
     * @return The increments \( \Delta W_{2} = \rho \Delta W_{1} + \sqrt{1-\rho^2} \Delta Z \) driving the underlying.
     */
    public double[][] getAssetIncrements() {
        return assetIncrements;
    }

    public int getNumberOfPaths() {
        return varianceIncrements.length;
    }

    public int getNumberOfTimeSteps() {
        return varianceIncrements.length == 0 ? 0 : varianceIncrements[0].length;
    }
}
