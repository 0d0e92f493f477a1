/*
 * (c) Copyright the normalheston-lib authors. All rights reserved.
 *
 * Created on 19.10.2026
 */
package net.normalheston.montecarlo.process;

/**
 * State of a block of simulated paths on the time grid \( t_{0}, \ldots, t_{N} \).
 *
 * The variance is kept in two co-indexed series: the raw Euler state, which may become negative,
 * and the effective variance \( \max(raw, 0) \) used by the diffusion terms.
 * The object is owned by a single simulation task.
 */
public class PathState {

    private final double[][] rawVariance;
    private final double[][] effectiveVariance;
    private final double[][] assetValue;

    /**
     * Allocates the state and sets the initial values for all paths.
     *
     * @param numberOfPaths The number of paths.
     * @param numberOfTimeSteps The number of time steps \( N \); each series has \( N+1 \) entries.
     * @param initialValue Initial level of the underlying.
     * @param initialVariance Initial variance.
     */
    public PathState(int numberOfPaths, int numberOfTimeSteps, double initialValue, double initialVariance) {
        rawVariance = new double[numberOfPaths][numberOfTimeSteps + 1];
        effectiveVariance = new double[numberOfPaths][numberOfTimeSteps + 1];
        assetValue = new double[numberOfPaths][numberOfTimeSteps + 1];

        for(int path = 0; path < numberOfPaths; path++) {
            rawVariance[path][0] = initialVariance;
            effectiveVariance[path][0] = Math.max(initialVariance, 0.0);
            assetValue[path][0] = initialValue;
        }
    }

    public double[][] getRawVariance() {
        return rawVariance;
    }

    public double[][] getEffectiveVariance() {
        return effectiveVariance;
    }

    public double[][] getAssetValue() {
        return assetValue;
    }

    public int getNumberOfPaths() {
        return assetValue.length;
    }

    public int getNumberOfTimeSteps() {
        return assetValue.length == 0 ? 0 : assetValue[0].length - 1;
    }

    /**
     * @param path Path index.
     * @return The value of the underlying at the last time index.
     */
    public double getTerminalAssetValue(int path) {
        return assetValue[path][assetValue[path].length - 1];
    }

    /**
     * Returns the number of paths whose effective variance is zero at the given time index.
     *
     * @param timeIndex The time index.
     * @return Number of paths with absorbed variance.
     */
    public int getNumberOfAbsorbedPaths(int timeIndex) {
        int count = 0;
        for(double[] variance : effectiveVariance) {
            if(variance[timeIndex] == 0.0) count++;
        }
        return count;
    }
}
