/*
 * (c) Copyright the normalheston-lib authors. All rights reserved.
 *
 * Created on 19.10.2026
 */
package net.normalheston.fouriermethod;

import net.normalheston.PropertyUtils;
import net.normalheston.exception.GridConfigurationException;
import org.apache.commons.math3.util.FastMath;

import java.util.Map;

/**
 * Grid of the damped Fourier transform of the call price: \( M \) frequencies \( u_{j} = j \eta \),
 * damping factor \( \alpha \) and the strike grid \( k_{j} = b + j \lambda \) with
 * \( \lambda = 2 \pi / (M \eta) \) and \( b = c - \lambda M / 2 \),
 * where \( c \) is the grid center. By default the grid is centered at the target strike \( k_{u} \).
 *
 * @author normalheston-lib authors
 */
public class FFTGridConfiguration {

    private final int       gridSize;
    private final double    frequencySpacing;
    private final double    dampingFactor;
    private final double    targetStrike;
    private final double    gridCenter;

    /**
     * Create a grid centered at the target strike.
     *
     * @param gridSize Number of grid points \( M \), preferably a power of two.
     * @param frequencySpacing Frequency spacing \( \eta \).
     * @param dampingFactor Damping factor \( \alpha &gt; 0 \).
     * @param targetStrike Target strike \( k_{u} \).
     */
    public FFTGridConfiguration(int gridSize, double frequencySpacing, double dampingFactor, double targetStrike) {
        this(gridSize, frequencySpacing, dampingFactor, targetStrike, targetStrike);
    }

    /**
     * Create a grid with a given center.
     *
     * @param gridSize Number of grid points \( M \), preferably a power of two.
     * @param frequencySpacing Frequency spacing \( \eta \).
     * @param dampingFactor Damping factor \( \alpha &gt; 0 \).
     * @param targetStrike Target strike \( k_{u} \).
     * @param gridCenter The strike \( c \) at grid index \( M/2 \).
     */
    public FFTGridConfiguration(int gridSize, double frequencySpacing, double dampingFactor, double targetStrike, double gridCenter) {
        if(gridSize < 2)                    throw new IllegalArgumentException("Grid size M must be at least 2: " + gridSize);
        if(!(frequencySpacing > 0) || Double.isInfinite(frequencySpacing)) {
            throw new IllegalArgumentException("Frequency spacing eta must be positive and finite: " + frequencySpacing);
        }
        if(!(dampingFactor > 0) || Double.isInfinite(dampingFactor)) {
            throw new IllegalArgumentException("Damping factor alpha must be positive and finite: " + dampingFactor);
        }
        if(!Double.isFinite(targetStrike))  throw new IllegalArgumentException("Target strike must be finite: " + targetStrike);
        if(!Double.isFinite(gridCenter))    throw new IllegalArgumentException("Grid center must be finite: " + gridCenter);

        this.gridSize = gridSize;
        this.frequencySpacing = frequencySpacing;
        this.dampingFactor = dampingFactor;
        this.targetStrike = targetStrike;
        this.gridCenter = gridCenter;
    }

    /**
     * Create the grid from a map of properties. Keys are <code>gridSize, frequencySpacing, dampingFactor,
     * targetStrike</code> (required) and <code>gridCenter</code> (default: target strike).
     *
     * @param properties The properties.
     * @return The grid configuration.
     */
    public static FFTGridConfiguration fromProperties(Map<String, ?> properties) {
        double targetStrike = PropertyUtils.getRequiredDouble(properties, "targetStrike");
        return new FFTGridConfiguration(
                PropertyUtils.getRequiredInt(properties, "gridSize"),
                PropertyUtils.getRequiredDouble(properties, "frequencySpacing"),
                PropertyUtils.getRequiredDouble(properties, "dampingFactor"),
                targetStrike,
                PropertyUtils.getDouble(properties, "gridCenter", targetStrike));
    }

    /**
     * @return The strike spacing \( \lambda = 2 \pi / (M \eta) \).
     */
    public double getStrikeSpacing() {
        return 2.0 * FastMath.PI / (gridSize * frequencySpacing);
    }

    /**
     * @return The first strike of the grid \( b \).
     */
    public double getGridOrigin() {
        return gridCenter - getStrikeSpacing() * gridSize / 2.0;
    }

    public double getFrequency(int index) {
        return index * frequencySpacing;
    }

    public double getStrike(int index) {
        return getGridOrigin() + index * getStrikeSpacing();
    }

    /**
     * Returns the index of the grid strike nearest to a given strike,
     * \( \mathrm{round}((k - b) M \eta / (2 \pi)) \). The result may be outside \( [0, M) \).
     *
     * @param strike The strike \( k \).
     * @return The nearest grid index.
     */
    public long getNearestStrikeIndex(double strike) {
        return Math.round((strike - getGridOrigin()) * gridSize * frequencySpacing / (2.0 * FastMath.PI));
    }

    /**
     * Returns the index of the grid strike nearest to a given strike.
     *
     * @param strike The strike.
     * @return The grid index, \( 0 \leq idx &lt; M \).
     * @throws GridConfigurationException Thrown if the strike is not covered by the grid.
     */
    public int getStrikeIndex(double strike) {
        long index = getNearestStrikeIndex(strike);
        if(index < 0 || index >= gridSize) {
            throw new GridConfigurationException(gridSize, frequencySpacing, strike, index);
        }
        return (int)index;
    }

    /**
     * Checks that the target strike is covered by the grid.
     *
     * @throws GridConfigurationException Thrown if the target strike is not covered by the grid.
     */
    public void validate() {
        getStrikeIndex(targetStrike);
    }

    public int getGridSize() {
        return gridSize;
    }

    public double getFrequencySpacing() {
        return frequencySpacing;
    }

    public double getDampingFactor() {
        return dampingFactor;
    }

    public double getTargetStrike() {
        return targetStrike;
    }

    public double getGridCenter() {
        return gridCenter;
    }

    @Override
    public String toString() {
        return "FFTGridConfiguration [gridSize=" + gridSize + ", frequencySpacing=" + frequencySpacing
                + ", dampingFactor=" + dampingFactor + ", targetStrike=" + targetStrike + ", gridCenter=" + gridCenter + "]";
    }
}
