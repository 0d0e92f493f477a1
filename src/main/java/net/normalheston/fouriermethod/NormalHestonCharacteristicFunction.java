/*
 * (c) Copyright the normalheston-lib authors. All rights reserved.
 *
 * Created on 19.10.2026
 */
package net.normalheston.fouriermethod;

import net.finmath.exception.CalculationException;
import net.finmath.fouriermethod.CharacteristicFunctionInterface;
import net.normalheston.model.NormalHestonModel;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.util.FastMath;

/**
 * Characteristic function of the level \( S(t) \) of the underlying in the {@link NormalHestonModel},
 * \[ E(\exp(i \phi S(t))) = \exp(C(t) + D(t) v_{0} + i \phi S_{0}), \]
 * where, with \( \beta = \kappa - i \rho \sigma \phi \), \( d = \sqrt{\sigma^2 \phi^2 + \beta^2} \) and
 * \( g = (\beta - d)/(\beta + d) \),
 * \[ D(t) = \frac{\beta - d}{\sigma^2} \frac{1 - e^{-dt}}{1 - g e^{-dt}}, \]
 * \[ C(t) = i \phi (r-q) t + \frac{\kappa \theta}{\sigma^2} \left( (\beta - d) t - 2 \log\left( \frac{1 - g e^{-dt}}{1 - g} \right) \right). \]
 *
 * Square root and logarithm are evaluated on the principal branch. The expression is invariant under \( d \mapsto -d \),
 * such that the jump of the principal square root across the negative real axis does not show in the value.
 *
 * For complex arguments \( \phi = u - i \alpha \) the function exists only as long as the moment
 * \( E(\exp(\alpha S(t))) \) is finite. The moment explodes at the time {@link #getMomentExplosionTime(double)};
 * beyond it the closed form still returns finite numbers which are not the transform. There,
 * {@link #apply(Complex)} returns {@link Complex#NaN} and {@link #getValue(Complex)} throws.
 *
 * @author normalheston-lib authors
 */
public class NormalHestonCharacteristicFunction implements CharacteristicFunctionInterface {

    private static final double DENOMINATOR_TOLERANCE = 1E-14;

    private final double time;
    private final double initialValue;
    private final double drift;
    private final double initialVariance;
    private final double longRunVariance;
    private final double meanReversionSpeed;
    private final double volatilityOfVariance;
    private final double correlation;

    /**
     * Characteristic function of \( S(T) \) where \( T \) is the maturity of the model.
     *
     * @param model The model.
     */
    public NormalHestonCharacteristicFunction(NormalHestonModel model) {
        this(model, model.getMaturity());
    }

    /**
     * Characteristic function of \( S(t) \).
     *
     * @param model The model.
     * @param time The time \( t \).
     */
    public NormalHestonCharacteristicFunction(NormalHestonModel model, double time) {
        this.time = time;
        this.initialValue = model.getInitialValue();
        this.drift = model.getRiskFreeRate() - model.getDividendYield();
        this.initialVariance = model.getInitialVariance();
        this.longRunVariance = model.getLongRunVariance();
        this.meanReversionSpeed = model.getMeanReversionSpeed();
        this.volatilityOfVariance = model.getVolatilityOfVariance();
        this.correlation = model.getCorrelation();
    }

    /**
     * Returns the value of the characteristic function, or {@link Complex#NaN} where it is not defined
     * (moment explosion before \( t \), vanishing denominator).
     *
     * @param argument The argument \( \phi \).
     * @return The value \( E(\exp(i \phi S(t))) \) or {@link Complex#NaN}.
     */
    @Override
    public Complex apply(Complex argument) {
        if(getMomentExplosionTime(-argument.getImaginary()) <= time) {
            return Complex.NaN;
        }
        return evaluate(argument);
    }

    /**
     * Returns the value of the characteristic function.
     *
     * @param argument The argument \( \phi \).
     * @return The value \( E(\exp(i \phi S(t))) \).
     * @throws CalculationException Thrown if the moment \( E(\exp(-Im(\phi) S(t))) \) is infinite or the evaluation is numerically unstable.
     */
    public Complex getValue(Complex argument) throws CalculationException {
        double exponent = -argument.getImaginary();
        double explosionTime = getMomentExplosionTime(exponent);
        if(explosionTime <= time) {
            throw new CalculationException("Characteristic function: the moment E(exp(" + exponent + " S(t))) explodes at t*=" + explosionTime
                    + " before t=" + time + ", phi=" + argument + ".");
        }

        Complex value = evaluate(argument);
        if(value.isNaN() || value.isInfinite()) {
            throw new CalculationException("Characteristic function is not finite at phi=" + argument + " (beta + d or 1 - g vanishes).");
        }
        return value;
    }

    /**
     * Returns the time \( t^{*} \) at which the moment \( E(\exp(a S(t))) \) becomes infinite.
     * With \( \beta = \kappa - \rho \sigma a \) and \( \Delta = \beta^{2} - \sigma^{2} a^{2} \):
     * for \( \Delta &lt; 0 \), \( t^{*} = 2 (\pi - \mathrm{atan2}(\sqrt{-\Delta}, \beta)) / \sqrt{-\Delta} \);
     * for \( \Delta \geq 0 \) and \( \beta &lt; 0 \), \( t^{*} = \log((-\beta + \sqrt{\Delta})/(-\beta - \sqrt{\Delta})) / \sqrt{\Delta} \);
     * otherwise the moment is finite for all times.
     *
     * @param exponent The exponent \( a \).
     * @return The explosion time, {@link Double#POSITIVE_INFINITY} if the moment is finite for all times.
     */
    public double getMomentExplosionTime(double exponent) {
        if(exponent == 0.0 || (initialVariance == 0.0 && meanReversionSpeed * longRunVariance == 0.0)) {
            return Double.POSITIVE_INFINITY;
        }

        double beta = meanReversionSpeed - correlation * volatilityOfVariance * exponent;
        double discriminant = beta * beta - volatilityOfVariance * volatilityOfVariance * exponent * exponent;

        if(discriminant < 0) {
            double gamma = FastMath.sqrt(-discriminant);
            return 2.0 * (FastMath.PI - FastMath.atan2(gamma, beta)) / gamma;
        }
        if(beta >= 0) {
            return Double.POSITIVE_INFINITY;
        }

        double d = FastMath.sqrt(discriminant);
        if(d == 0.0) {
            return 2.0 / -beta;
        }
        return FastMath.log((-beta + d) / (-beta - d)) / d;
    }

    private Complex evaluate(Complex argument) {
        // E(exp(0 S)) = 1 also where beta + d vanishes at the origin (kappa = 0).
        if(argument.getReal() == 0.0 && argument.getImaginary() == 0.0) {
            return Complex.ONE;
        }

        double sigmaSquared = volatilityOfVariance * volatilityOfVariance;

        Complex iPhi = argument.multiply(Complex.I);
        Complex beta = iPhi.multiply(-correlation * volatilityOfVariance).add(meanReversionSpeed);
        Complex d = argument.multiply(argument).multiply(sigmaSquared).add(beta.multiply(beta)).sqrt();

        Complex betaPlusD = beta.add(d);
        if(betaPlusD.abs() < DENOMINATOR_TOLERANCE) {
            return Complex.NaN;
        }
        Complex betaMinusD = beta.subtract(d);
        Complex g = betaMinusD.divide(betaPlusD);

        Complex oneMinusG = Complex.ONE.subtract(g);
        if(oneMinusG.abs() < DENOMINATOR_TOLERANCE) {
            return Complex.NaN;
        }

        Complex expMinusDt = d.multiply(-time).exp();
        Complex oneMinusGExp = Complex.ONE.subtract(g.multiply(expMinusDt));

        Complex dTerm = betaMinusD.divide(sigmaSquared).multiply(Complex.ONE.subtract(expMinusDt)).divide(oneMinusGExp);
        Complex logarithm = oneMinusGExp.divide(oneMinusG).log();

        Complex cTerm = betaMinusD.multiply(time).subtract(logarithm.multiply(2.0))
                .multiply(meanReversionSpeed * longRunVariance / sigmaSquared)
                .add(iPhi.multiply(drift * time));

        return cTerm.add(dTerm.multiply(initialVariance)).add(iPhi.multiply(initialValue)).exp();
    }

    public double getTime() {
        return time;
    }
}
