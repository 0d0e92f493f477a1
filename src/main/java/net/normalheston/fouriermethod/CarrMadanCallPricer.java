/*
 * (c) Copyright the normalheston-lib authors. All rights reserved.
 *
 * Created on 19.10.2026
 */
package net.normalheston.fouriermethod;

import net.finmath.exception.CalculationException;
import net.finmath.fouriermethod.CharacteristicFunctionInterface;
import net.normalheston.functions.FastFourierTransform;
import net.normalheston.model.NormalHestonModel;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Valuation of a European call \( \max(S(T) - k, 0) \) on the level of the underlying by the method of Carr and Madan.
 *
 * The damped call price \( e^{\alpha k} C(k) \) has the Fourier transform
 * \[ \psi(u) = \int e^{i u k} e^{\alpha k} C(k) dk = e^{-rT} \frac{\varphi(u - i \alpha)}{(\alpha + i u)^{2}}, \]
 * where \( \varphi \) is the characteristic function of \( S(T) \). Since the payoff is linear in the level
 * (and not in the logarithm of the level) the characteristic function is evaluated at \( u - i \alpha \).
 * The inversion
 * \[ C(k) = \frac{e^{-\alpha k}}{\pi} \int_{0}^{\infty} Re\left( e^{-i u k} \psi(u) \right) du \]
 * is discretized with Simpson's rule on \( u_{j} = j \eta \) and evaluated on the strike grid \( k_{j} = b + j \lambda \)
 * by a single discrete Fourier transform.
 *
 * @author normalheston-lib authors
 */
public class CarrMadanCallPricer {

    private static final Logger log = LoggerFactory.getLogger(CarrMadanCallPricer.class);

    private final CharacteristicFunctionInterface characteristicFunction;
    private final double maturity;
    private final double riskFreeRate;
    private final FFTGridConfiguration grid;

    /**
     * @param characteristicFunction The characteristic function of \( S(T) \).
     * @param maturity The maturity \( T \).
     * @param riskFreeRate The discount rate \( r \).
     * @param grid The grid configuration.
     */
    public CarrMadanCallPricer(CharacteristicFunctionInterface characteristicFunction, double maturity, double riskFreeRate, FFTGridConfiguration grid) {
        this.characteristicFunction = characteristicFunction;
        this.maturity = maturity;
        this.riskFreeRate = riskFreeRate;
        this.grid = grid;
    }

    /**
     * @param model The model, providing the characteristic function, maturity and discount rate.
     * @param grid The grid configuration.
     */
    public CarrMadanCallPricer(NormalHestonModel model, FFTGridConfiguration grid) {
        this(new NormalHestonCharacteristicFunction(model), model.getMaturity(), model.getRiskFreeRate(), grid);
    }

    /**
     * Returns the value of the call at the target strike of the grid configuration.
     *
     * @return The call value.
     * @throws CalculationException Thrown if the transform is not finite.
     */
    public double getValue() throws CalculationException {
        return getValue(grid.getTargetStrike());
    }

    /**
     * Returns the value of the call at the grid strike nearest to the given strike.
     *
     * @param strike The strike.
     * @return The call value.
     * @throws CalculationException Thrown if the transform is not finite.
     * @throws net.normalheston.exception.GridConfigurationException Thrown if the strike is not covered by the grid.
     */
    public double getValue(double strike) throws CalculationException {
        int strikeIndex = grid.getStrikeIndex(strike);

        double value = getValues()[strikeIndex];
        if(!Double.isFinite(value)) {
            throw new CalculationException("Carr-Madan inversion produced a non-finite value at strike " + grid.getStrike(strikeIndex)
                    + " (index " + strikeIndex + ", damping factor alpha=" + grid.getDampingFactor() + ").");
        }

        log.info("Fourier value of call (T={}, k={}): {}", maturity, grid.getStrike(strikeIndex), value);
        return value;
    }

    /**
     * Returns the strikes \( k_{j} = b + j \lambda \) of the grid.
     *
     * @return The strikes.
     */
    public double[] getStrikes() {
        double[] strikes = new double[grid.getGridSize()];
        for(int j = 0; j < strikes.length; j++) {
            strikes[j] = grid.getStrike(j);
        }
        return strikes;
    }

    /**
     * Returns the call values for all strikes of the grid. Values far away from the grid center may be inaccurate
     * or not finite (the factor \( e^{-\alpha k} \) may overflow).
     *
     * @return The call values \( C(k_{j}) \).
     * @throws CalculationException Thrown if the damped transform is not finite.
     */
    public double[] getValues() throws CalculationException {
        int gridSize = grid.getGridSize();
        double eta = grid.getFrequencySpacing();
        double alpha = grid.getDampingFactor();
        double origin = grid.getGridOrigin();

        if(!FastFourierTransform.isPowerOfTwo(gridSize)) {
            log.debug("Grid size {} is not a power of two, using chirp-z transform.", gridSize);
        }
        log.debug("Carr-Madan grid: {}, strike spacing={}, origin={}", grid, grid.getStrikeSpacing(), origin);

        double discountFactor = FastMath.exp(-riskFreeRate * maturity);

        double[] real = new double[gridSize];
        double[] imaginary = new double[gridSize];
        for(int j = 0; j < gridSize; j++) {
            double u = grid.getFrequency(j);

            // psi(u) = exp(-rT) phi(u - i alpha) / (alpha + i u)^2
            Complex characteristicFunctionValue = characteristicFunction.apply(new Complex(u, -alpha));
            Complex dampingDenominator = new Complex(alpha, u);
            Complex psi = characteristicFunctionValue.divide(dampingDenominator.multiply(dampingDenominator)).multiply(discountFactor);

            if(psi.isNaN() || psi.isInfinite()) {
                if(j == 0) {
                    throw new CalculationException("Carr-Madan pricer: damped transform is not finite at u=0, the damping factor alpha="
                            + alpha + " is outside the domain of the moment generating function of S(T).");
                }
                throw new CalculationException("Carr-Madan pricer: damped transform is not finite at u=" + u
                        + " (damping factor alpha=" + alpha + ").");
            }

            Complex summand = new Complex(FastMath.cos(-origin * u), FastMath.sin(-origin * u)).multiply(psi).multiply(getSimpsonWeight(j, eta));
            real[j] = summand.getReal();
            imaginary[j] = summand.getImaginary();
        }

        double[] transformReal = FastFourierTransform.transform(real, imaginary)[0];

        double[] values = new double[gridSize];
        for(int j = 0; j < gridSize; j++) {
            values[j] = FastMath.exp(-alpha * grid.getStrike(j)) / FastMath.PI * transformReal[j];
        }
        return values;
    }

    /**
     * Simpson weight \( w_{j} = \frac{\eta}{3} (3 + (-1)^{j+1} - \delta_{j,0}) \).
     *
     * @param index The index \( j \).
     * @param eta The frequency spacing.
     * @return The weight.
     */
    static double getSimpsonWeight(int index, double eta) {
        double sign = (index % 2 == 0) ? -1.0 : 1.0;
        double kronecker = (index == 0) ? 1.0 : 0.0;
        return eta / 3.0 * (3.0 + sign - kronecker);
    }

    public FFTGridConfiguration getGrid() {
        return grid;
    }

    public double getMaturity() {
        return maturity;
    }
}
