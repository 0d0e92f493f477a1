/*
 * (c) Copyright the normalheston-lib authors. All rights reserved.
 *
 * Created on 19.10.2026
 */
package net.normalheston.validation;

import net.normalheston.montecarlo.MonteCarloValuation;

/**
 * Prices of the same call by Monte Carlo simulation and by Fourier inversion.
 */
public class PricingResult {

    private final MonteCarloValuation monteCarloValuation;
    private final double fourierValue;

    public PricingResult(MonteCarloValuation monteCarloValuation, double fourierValue) {
        this.monteCarloValuation = monteCarloValuation;
        this.fourierValue = fourierValue;
    }

    public double getMonteCarloValue() {
        return monteCarloValuation.getValue();
    }

    public double getFourierValue() {
        return fourierValue;
    }

    /**
     * @return Monte Carlo value minus Fourier value.
     */
    public double getDifference() {
        return monteCarloValuation.getValue() - fourierValue;
    }

    /**
     * Returns the difference in units of the Monte Carlo standard error.
     * If the standard error is zero (all paths pay the same amount) the ratio is not defined and {@link Double#NaN} is returned.
     *
     * @return The difference in units of the Monte Carlo standard error, or {@link Double#NaN} if the standard error is zero.
     */
    public double getDifferenceInStandardErrors() {
        double standardError = monteCarloValuation.getStandardError();
        if(standardError == 0.0) {
            return Double.NaN;
        }
        return getDifference() / standardError;
    }

    public MonteCarloValuation getMonteCarloValuation() {
        return monteCarloValuation;
    }

    @Override
    public String toString() {
        return "PricingResult [monteCarloValue=" + getMonteCarloValue() + ", fourierValue=" + fourierValue
                + ", difference=" + getDifference() + ", monteCarloStandardError=" + monteCarloValuation.getStandardError() + "]";
    }
}
