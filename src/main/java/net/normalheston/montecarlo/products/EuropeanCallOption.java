/*
 * (c) Copyright the normalheston-lib authors. All rights reserved.
 *
 * Created on 19.10.2026
 */
package net.normalheston.montecarlo.products;

import net.finmath.exception.CalculationException;
import net.normalheston.montecarlo.MonteCarloConfiguration;
import net.normalheston.montecarlo.MonteCarloConfiguration.RepetitionReduction;
import net.normalheston.montecarlo.MonteCarloNormalHestonModel;
import net.normalheston.montecarlo.MonteCarloValuation;
import net.normalheston.montecarlo.process.PathState;
import org.apache.commons.math3.stat.descriptive.AggregateSummaryStatistics;
import org.apache.commons.math3.stat.descriptive.StatisticalSummary;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Implements the valuation of a European call with payoff \( \max(S(T) - K, 0) \) paid in \( T \),
 * discounted with \( e^{-rT} \), by Monte Carlo simulation.
 *
 * Each simulation task reduces its paths to summary statistics of the payoff, the statistics of the tasks are
 * aggregated in task order. The floating point result of the sum thus depends on the partition of the paths
 * into tasks but not on the number of threads.
 *
 * @author normalheston-lib authors
 */
public class EuropeanCallOption {

    private static final Logger log = LoggerFactory.getLogger(EuropeanCallOption.class);

    private final double maturity;
    private final double strike;

    /**
     * @param maturity The maturity \( T \); has to agree with the maturity of the simulated model.
     * @param strike The strike \( K \).
     */
    public EuropeanCallOption(double maturity, double strike) {
        this.maturity = maturity;
        this.strike = strike;
    }

    /**
     * Calculates the value of the call for every repetition of the simulation and reduces the values as specified
     * by the configuration of the simulation.
     *
     * @param simulation The simulation.
     * @return The valuation.
     * @throws CalculationException Thrown if the simulation fails, is interrupted, or produces a non-finite value.
     */
    public MonteCarloValuation getValue(MonteCarloNormalHestonModel simulation) throws CalculationException {
        if(Math.abs(simulation.getModel().getMaturity() - maturity) > 1E-12) {
            throw new IllegalArgumentException("Product maturity " + maturity + " does not agree with the maturity of the simulation " + simulation.getModel().getMaturity() + ".");
        }

        MonteCarloConfiguration configuration = simulation.getConfiguration();
        int numberOfRepetitions = configuration.getNumberOfRepetitions();
        double discountFactor = FastMath.exp(-simulation.getModel().getRiskFreeRate() * maturity);

        double[] repetitionValues = new double[numberOfRepetitions];
        StatisticalSummary[] repetitionStatistics = new StatisticalSummary[numberOfRepetitions];
        int numberOfAbsorbedPaths = 0;

        long startMillis = System.currentTimeMillis();
        for(int repetition = 0; repetition < numberOfRepetitions; repetition++) {
            if(Thread.currentThread().isInterrupted()) {
                throw new CalculationException("Monte Carlo valuation interrupted before repetition " + repetition + ".");
            }

            List<TaskResult> taskResults = simulation.applyToTasks(repetition, this::getTaskResult);

            List<SummaryStatistics> taskStatistics = new ArrayList<>(taskResults.size());
            numberOfAbsorbedPaths = 0;
            for(TaskResult taskResult : taskResults) {
                taskStatistics.add(taskResult.payoffStatistics);
                numberOfAbsorbedPaths += taskResult.numberOfAbsorbedPaths;
            }
            StatisticalSummary payoffStatistics = AggregateSummaryStatistics.aggregate(taskStatistics);

            double value = discountFactor * payoffStatistics.getMean();
            if(!Double.isFinite(value)) {
                throw new CalculationException("Monte Carlo payoff aggregation produced a non-finite value in repetition " + repetition + ".");
            }
            repetitionValues[repetition] = value;
            repetitionStatistics[repetition] = payoffStatistics;

            log.debug("Repetition {} of {}: value={}", repetition + 1, numberOfRepetitions, value);
        }

        int numberOfPaths = configuration.getNumberOfPaths();
        if(numberOfAbsorbedPaths == numberOfPaths) {
            log.warn("The effective variance of all {} paths is zero at maturity {}.", numberOfPaths, maturity);
        }

        double value;
        double standardError;
        if(configuration.getRepetitionReduction() == RepetitionReduction.LAST) {
            value = repetitionValues[numberOfRepetitions - 1];
            standardError = discountFactor * FastMath.sqrt(repetitionStatistics[numberOfRepetitions - 1].getVariance() / numberOfPaths);
        }
        else {
            double sum = 0.0;
            double varianceSum = 0.0;
            for(int repetition = 0; repetition < numberOfRepetitions; repetition++) {
                sum += repetitionValues[repetition];
                varianceSum += repetitionStatistics[repetition].getVariance();
            }
            value = sum / numberOfRepetitions;
            standardError = discountFactor * FastMath.sqrt(varianceSum / numberOfRepetitions / ((double)numberOfPaths * numberOfRepetitions));
        }

        log.info("Monte Carlo value of call (T={}, K={}): {} (standard error {}, {} paths, {} repetitions, {} ms)",
                maturity, strike, value, standardError, numberOfPaths, numberOfRepetitions, System.currentTimeMillis() - startMillis);

        return new MonteCarloValuation(repetitionValues, configuration.getRepetitionReduction(), value, standardError,
                numberOfPaths, numberOfAbsorbedPaths);
    }

    private TaskResult getTaskResult(PathState state) {
        SummaryStatistics payoffStatistics = new SummaryStatistics();
        for(int path = 0; path < state.getNumberOfPaths(); path++) {
            payoffStatistics.addValue(Math.max(state.getTerminalAssetValue(path) - strike, 0.0));
        }
        return new TaskResult(payoffStatistics, state.getNumberOfAbsorbedPaths(state.getNumberOfTimeSteps()));
    }

    public double getMaturity() {
        return maturity;
    }

    public double getStrike() {
        return strike;
    }

    private static class TaskResult {
        private final SummaryStatistics payoffStatistics;
        private final int numberOfAbsorbedPaths;

        TaskResult(SummaryStatistics payoffStatistics, int numberOfAbsorbedPaths) {
            this.payoffStatistics = payoffStatistics;
            this.numberOfAbsorbedPaths = numberOfAbsorbedPaths;
        }
    }
}
