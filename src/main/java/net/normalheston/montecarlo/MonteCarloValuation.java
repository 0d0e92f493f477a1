/*
 * (c) Copyright the normalheston-lib authors. All rights reserved.
 *
 * Created on 19.10.2026
 */
package net.normalheston.montecarlo;

import net.normalheston.montecarlo.MonteCarloConfiguration.RepetitionReduction;

import java.util.Arrays;

/**
 * Result of a Monte Carlo valuation: the price of every repetition, the reduced price and its standard error.
 */
public class MonteCarloValuation {

    private final double[] repetitionValues;
    private final RepetitionReduction repetitionReduction;
    private final double value;
    private final double standardError;
    private final int numberOfPaths;
    private final int numberOfAbsorbedPaths;

    public MonteCarloValuation(double[] repetitionValues, RepetitionReduction repetitionReduction, double value,
            double standardError, int numberOfPaths, int numberOfAbsorbedPaths) {
        this.repetitionValues = repetitionValues.clone();
        this.repetitionReduction = repetitionReduction;
        this.value = value;
        this.standardError = standardError;
        this.numberOfPaths = numberOfPaths;
        this.numberOfAbsorbedPaths = numberOfAbsorbedPaths;
    }

    /**
     * @return The reduced price.
     */
    public double getValue() {
        return value;
    }

    /**
     * @return Standard error of {@link #getValue()}, estimated from the sample variance of the discounted payoffs.
     */
    public double getStandardError() {
        return standardError;
    }

    public double[] getRepetitionValues() {
        return repetitionValues.clone();
    }

    public int getNumberOfRepetitions() {
        return repetitionValues.length;
    }

    public RepetitionReduction getRepetitionReduction() {
        return repetitionReduction;
    }

    /**
     * @return Number of paths per repetition.
     */
    public int getNumberOfPaths() {
        return numberOfPaths;
    }

    /**
     * @return Number of paths of the last repetition whose effective variance is zero at maturity.
     */
    public int getNumberOfAbsorbedPaths() {
        return numberOfAbsorbedPaths;
    }

    @Override
    public String toString() {
        return "MonteCarloValuation [value=" + value + ", standardError=" + standardError
                + ", repetitionValues=" + Arrays.toString(repetitionValues) + ", repetitionReduction=" + repetitionReduction
                + ", numberOfPaths=" + numberOfPaths + ", numberOfAbsorbedPaths=" + numberOfAbsorbedPaths + "]";
    }
}
