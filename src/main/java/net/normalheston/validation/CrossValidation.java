/*
 * (c) Copyright the normalheston-lib authors. All rights reserved.
 *
 * Created on 19.10.2026
 */
package net.normalheston.validation;

import net.finmath.exception.CalculationException;
import net.normalheston.fouriermethod.CarrMadanCallPricer;
import net.normalheston.fouriermethod.FFTGridConfiguration;
import net.normalheston.model.NormalHestonModel;
import net.normalheston.montecarlo.MonteCarloConfiguration;
import net.normalheston.montecarlo.MonteCarloNormalHestonModel;
import net.normalheston.montecarlo.MonteCarloValuation;
import net.normalheston.montecarlo.products.EuropeanCallOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Values a European call by Monte Carlo simulation (at the strike of the model) and by the Carr-Madan method
 * (at the target strike of the grid) and reports the difference. No tolerance is applied.
 *
 * All configurations are validated before any path is simulated.
 *
 * @author normalheston-lib authors
 */
public class CrossValidation {

    private static final Logger log = LoggerFactory.getLogger(CrossValidation.class);

    private final NormalHestonModel model;
    private final MonteCarloConfiguration monteCarloConfiguration;
    private final FFTGridConfiguration gridConfiguration;

    public CrossValidation(NormalHestonModel model, MonteCarloConfiguration monteCarloConfiguration, FFTGridConfiguration gridConfiguration) {
        this.model = model;
        this.monteCarloConfiguration = monteCarloConfiguration;
        this.gridConfiguration = gridConfiguration;
    }

    /**
     * Create the cross validation from a single map of properties, holding the keys of
     * {@link NormalHestonModel#fromProperties(Map)}, {@link MonteCarloConfiguration#fromProperties(Map)} and
     * {@link FFTGridConfiguration#fromProperties(Map)}.
     *
     * @param properties The properties.
     * @return The cross validation.
     */
    public static CrossValidation fromProperties(Map<String, ?> properties) {
        return new CrossValidation(
                NormalHestonModel.fromProperties(properties),
                MonteCarloConfiguration.fromProperties(properties),
                FFTGridConfiguration.fromProperties(properties));
    }

    /**
     * Calculates both prices.
     *
     * @return The pricing result.
     * @throws CalculationException Thrown if one of the valuations fails numerically.
     * @throws net.normalheston.exception.GridConfigurationException Thrown if the target strike is not on the grid.
     */
    public PricingResult getPricingResult() throws CalculationException {
        gridConfiguration.validate();

        MonteCarloNormalHestonModel simulation = new MonteCarloNormalHestonModel(model, monteCarloConfiguration);
        CarrMadanCallPricer fourierPricer = new CarrMadanCallPricer(model, gridConfiguration);

        double fourierValue;
        try {
            fourierValue = fourierPricer.getValue();
        }
        catch(CalculationException e) {
            throw new CalculationException("Fourier valuation failed: " + e.getMessage(), e);
        }

        MonteCarloValuation monteCarloValuation;
        try {
            monteCarloValuation = new EuropeanCallOption(model.getMaturity(), model.getStrike()).getValue(simulation);
        }
        catch(CalculationException e) {
            throw new CalculationException("Monte Carlo valuation failed: " + e.getMessage(), e);
        }

        PricingResult result = new PricingResult(monteCarloValuation, fourierValue);
        log.info("Cross validation: {}", result);
        return result;
    }

    public NormalHestonModel getModel() {
        return model;
    }

    public MonteCarloConfiguration getMonteCarloConfiguration() {
        return monteCarloConfiguration;
    }

    public FFTGridConfiguration getGridConfiguration() {
        return gridConfiguration;
    }
}
