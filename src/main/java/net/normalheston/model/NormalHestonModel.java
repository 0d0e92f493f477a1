/*
 * (c) Copyright the normalheston-lib authors. All rights reserved.
 *
 * Created on 19.10.2026
 */
package net.normalheston.model;

import net.normalheston.PropertyUtils;

import java.util.Map;

/**
 * Parameters of a European call on an underlying level following a normal (arithmetic) dynamic
 * with square root stochastic variance:
 * \[ dS(t) = (r-q) dt + \sqrt{V(t)} dW_{2}(t), \quad S(0) = S_{0}, \]
 * \[ dV(t) = \kappa ( \theta - V(t) ) dt + \sigma \sqrt{V(t)} dW_{1}(t), \quad V(0) = v_{0}, \]
 * with \( dW_{1} dW_{2} = \rho dt \).
 *
 * The object is immutable and may be shared between concurrent valuations.
 *
 * @author normalheston-lib authors
 */
public class NormalHestonModel {

    private final double initialValue;
    private final double strike;
    private final double maturity;
    private final double riskFreeRate;
    private final double dividendYield;
    private final double initialVariance;
    private final double longRunVariance;
    private final double meanReversionSpeed;
    private final double volatilityOfVariance;
    private final double correlation;

    /**
     * Create the model.
     *
     * @param initialValue \( S_{0} \), the initial level of the underlying.
     * @param strike \( K \), the strike of the call.
     * @param maturity \( T \), the maturity of the call.
     * @param riskFreeRate \( r \).
     * @param dividendYield \( q \).
     * @param initialVariance \( v_{0} \).
     * @param longRunVariance \( \theta \).
     * @param meanReversionSpeed \( \kappa \).
     * @param volatilityOfVariance \( \sigma \).
     * @param correlation \( \rho \), required to be in [-1, 1].
     */
    public NormalHestonModel(
            double initialValue,
            double strike,
            double maturity,
            double riskFreeRate,
            double dividendYield,
            double initialVariance,
            double longRunVariance,
            double meanReversionSpeed,
            double volatilityOfVariance,
            double correlation) {
        this.initialValue = initialValue;
        this.strike = strike;
        this.maturity = maturity;
        this.riskFreeRate = riskFreeRate;
        this.dividendYield = dividendYield;
        this.initialVariance = initialVariance;
        this.longRunVariance = longRunVariance;
        this.meanReversionSpeed = meanReversionSpeed;
        this.volatilityOfVariance = volatilityOfVariance;
        this.correlation = correlation;

        validate();
    }

    /**
     * Create the model from a map of properties. Keys are
     * <code>initialValue, strike, maturity, riskFreeRate, dividendYield, initialVariance, longRunVariance,
     * meanReversionSpeed, volatilityOfVariance, correlation</code>. The keys <code>riskFreeRate</code> and
     * <code>dividendYield</code> default to 0, all others are required. Values may be numbers or strings.
     *
     * @param properties The properties.
     * @return The model.
     */
    public static NormalHestonModel fromProperties(Map<String, ?> properties) {
        return new NormalHestonModel(
                PropertyUtils.getRequiredDouble(properties, "initialValue"),
                PropertyUtils.getRequiredDouble(properties, "strike"),
                PropertyUtils.getRequiredDouble(properties, "maturity"),
                PropertyUtils.getDouble(properties, "riskFreeRate", 0.0),
                PropertyUtils.getDouble(properties, "dividendYield", 0.0),
                PropertyUtils.getRequiredDouble(properties, "initialVariance"),
                PropertyUtils.getRequiredDouble(properties, "longRunVariance"),
                PropertyUtils.getRequiredDouble(properties, "meanReversionSpeed"),
                PropertyUtils.getRequiredDouble(properties, "volatilityOfVariance"),
                PropertyUtils.getRequiredDouble(properties, "correlation"));
    }

    private void validate() {
        double[] values = { initialValue, strike, maturity, riskFreeRate, dividendYield, initialVariance, longRunVariance, meanReversionSpeed, volatilityOfVariance, correlation };
        for(double value : values) {
            if(!Double.isFinite(value)) throw new IllegalArgumentException("Model parameters must be finite.");
        }

        if(Math.abs(correlation) > 1.0) {
            throw new IllegalArgumentException("Correlation " + correlation + " is outside [-1, 1].");
        }
        if(maturity <= 0)              throw new IllegalArgumentException("Maturity must be positive: " + maturity);
        if(initialVariance < 0)        throw new IllegalArgumentException("Initial variance must be non-negative: " + initialVariance);
        if(longRunVariance < 0)        throw new IllegalArgumentException("Long run variance must be non-negative: " + longRunVariance);
        if(meanReversionSpeed < 0)     throw new IllegalArgumentException("Mean reversion speed must be non-negative: " + meanReversionSpeed);
        if(volatilityOfVariance <= 0)  throw new IllegalArgumentException("Volatility of variance must be positive: " + volatilityOfVariance);
    }

    /**
     * Returns true if \( 2 \kappa \theta \geq \sigma^{2} \), i.e., if the variance process stays strictly positive.
     *
     * @return true if the Feller condition holds.
     */
    public boolean isFellerConditionSatisfied() {
        return 2.0 * meanReversionSpeed * longRunVariance >= volatilityOfVariance * volatilityOfVariance;
    }

    /**
     * Returns a clone of this model with a modified strike, all other parameters unchanged.
     *
     * @param strike The new strike.
     * @return A new model.
     */
    public NormalHestonModel getCloneWithModifiedStrike(double strike) {
        return new NormalHestonModel(initialValue, strike, maturity, riskFreeRate, dividendYield,
                initialVariance, longRunVariance, meanReversionSpeed, volatilityOfVariance, correlation);
    }

    public double getInitialValue() {
        return initialValue;
    }

    public double getStrike() {
        return strike;
    }

    public double getMaturity() {
        return maturity;
    }

    public double getRiskFreeRate() {
        return riskFreeRate;
    }

    public double getDividendYield() {
        return dividendYield;
    }

    public double getInitialVariance() {
        return initialVariance;
    }

    public double getLongRunVariance() {
        return longRunVariance;
    }

    public double getMeanReversionSpeed() {
        return meanReversionSpeed;
    }

    public double getVolatilityOfVariance() {
        return volatilityOfVariance;
    }

    public double getCorrelation() {
        return correlation;
    }

    @Override
    public String toString() {
        return "NormalHestonModel [initialValue=" + initialValue + ", strike=" + strike + ", maturity=" + maturity
                + ", riskFreeRate=" + riskFreeRate + ", dividendYield=" + dividendYield
                + ", initialVariance=" + initialVariance + ", longRunVariance=" + longRunVariance
                + ", meanReversionSpeed=" + meanReversionSpeed + ", volatilityOfVariance=" + volatilityOfVariance
                + ", correlation=" + correlation + "]";
    }
}
