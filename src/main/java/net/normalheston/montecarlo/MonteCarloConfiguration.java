/*
 * (c) Copyright the normalheston-lib authors. All rights reserved.
 *
 * Created on 19.10.2026
 */
package net.normalheston.montecarlo;

import net.finmath.time.TimeDiscretization;
import net.finmath.time.TimeDiscretizationInterface;
import net.normalheston.PropertyUtils;

import java.util.Map;
import java.util.stream.IntStream;

/**
 * Sizing of a Monte Carlo valuation: number of paths, number of time steps, number of independent repetitions and
 * the way the prices of the repetitions are reduced to a single price. The time step is
 * \( \Delta t = T / N \) where \( T \) is the maturity of the model.
 *
 * Paths are simulated in tasks of at most {@link #getPathsPerTask()} paths. Each task draws its random numbers from
 * its own seed, derived from the seed of the configuration, the repetition and the task index. For a given seed and
 * number of paths per task the valuation therefore does not depend on the number of threads.
 *
 * @author normalheston-lib authors
 */
public class MonteCarloConfiguration {

    /**
     * Reduction of the prices of the independent repetitions.
     */
    public enum RepetitionReduction {
        /** Average of the prices of all repetitions. */
        AVERAGE,
        /** Price of the last repetition only; the other repetitions are simulated and discarded. */
        LAST
    }

    public static final int DEFAULT_PATHS_PER_TASK = 5000;
    public static final long DEFAULT_SEED = 3141;

    private final int numberOfPaths;
    private final int numberOfTimeSteps;
    private final int numberOfRepetitions;
    private final RepetitionReduction repetitionReduction;
    private final long seed;
    private final int numberOfThreads;
    private final int pathsPerTask;

    public MonteCarloConfiguration(int numberOfPaths, int numberOfTimeSteps, int numberOfRepetitions,
            RepetitionReduction repetitionReduction, long seed, int numberOfThreads, int pathsPerTask) {
        if(numberOfPaths <= 0)        throw new IllegalArgumentException("Number of paths must be positive: " + numberOfPaths);
        if(numberOfTimeSteps <= 0)    throw new IllegalArgumentException("Number of time steps must be positive: " + numberOfTimeSteps);
        if(numberOfRepetitions <= 0)  throw new IllegalArgumentException("Number of repetitions must be positive: " + numberOfRepetitions);
        if(numberOfThreads <= 0)      throw new IllegalArgumentException("Number of threads must be positive: " + numberOfThreads);
        if(pathsPerTask <= 0)         throw new IllegalArgumentException("Paths per task must be positive: " + pathsPerTask);
        if(repetitionReduction == null) throw new IllegalArgumentException("Repetition reduction must not be null.");

        this.numberOfPaths = numberOfPaths;
        this.numberOfTimeSteps = numberOfTimeSteps;
        this.numberOfRepetitions = numberOfRepetitions;
        this.repetitionReduction = repetitionReduction;
        this.seed = seed;
        this.numberOfThreads = numberOfThreads;
        this.pathsPerTask = pathsPerTask;
    }

    public MonteCarloConfiguration(int numberOfPaths, int numberOfTimeSteps, long seed) {
        this(numberOfPaths, numberOfTimeSteps, 1, RepetitionReduction.AVERAGE, seed,
                Runtime.getRuntime().availableProcessors(), DEFAULT_PATHS_PER_TASK);
    }

    public MonteCarloConfiguration(int numberOfPaths, int numberOfTimeSteps) {
        this(numberOfPaths, numberOfTimeSteps, DEFAULT_SEED);
    }

    /**
     * Create the configuration from a map of properties. Keys are <code>numberOfPaths</code> and
     * <code>numberOfTimeSteps</code> (required), <code>numberOfRepetitions</code> (default 1),
     * <code>repetitionReduction</code> (AVERAGE or LAST, default AVERAGE), <code>seed</code>,
     * <code>numberOfThreads</code> (default: available processors) and <code>pathsPerTask</code>.
     *
     * @param properties The properties.
     * @return The configuration.
     */
    public static MonteCarloConfiguration fromProperties(Map<String, ?> properties) {
        RepetitionReduction reduction;
        String reductionName = PropertyUtils.getString(properties, "repetitionReduction", RepetitionReduction.AVERAGE.name());
        try {
            reduction = RepetitionReduction.valueOf(reductionName.toUpperCase());
        }
        catch(IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown repetition reduction '" + reductionName + "'.", e);
        }

        return new MonteCarloConfiguration(
                PropertyUtils.getRequiredInt(properties, "numberOfPaths"),
                PropertyUtils.getRequiredInt(properties, "numberOfTimeSteps"),
                PropertyUtils.getInt(properties, "numberOfRepetitions", 1),
                reduction,
                PropertyUtils.getLong(properties, "seed", DEFAULT_SEED),
                PropertyUtils.getInt(properties, "numberOfThreads", Runtime.getRuntime().availableProcessors()),
                PropertyUtils.getInt(properties, "pathsPerTask", DEFAULT_PATHS_PER_TASK));
    }

    public MonteCarloConfiguration getCloneWithModifiedSeed(long seed) {
        return new MonteCarloConfiguration(numberOfPaths, numberOfTimeSteps, numberOfRepetitions, repetitionReduction, seed, numberOfThreads, pathsPerTask);
    }

    public MonteCarloConfiguration getCloneWithModifiedNumberOfThreads(int numberOfThreads) {
        return new MonteCarloConfiguration(numberOfPaths, numberOfTimeSteps, numberOfRepetitions, repetitionReduction, seed, numberOfThreads, pathsPerTask);
    }

    public MonteCarloConfiguration getCloneWithModifiedRepetitions(int numberOfRepetitions, RepetitionReduction repetitionReduction) {
        return new MonteCarloConfiguration(numberOfPaths, numberOfTimeSteps, numberOfRepetitions, repetitionReduction, seed, numberOfThreads, pathsPerTask);
    }

    public int getNumberOfPaths() {
        return numberOfPaths;
    }

    public int getNumberOfTimeSteps() {
        return numberOfTimeSteps;
    }

    public int getNumberOfRepetitions() {
        return numberOfRepetitions;
    }

    public RepetitionReduction getRepetitionReduction() {
        return repetitionReduction;
    }

    public long getSeed() {
        return seed;
    }

    public int getNumberOfThreads() {
        return numberOfThreads;
    }

    public int getPathsPerTask() {
        return pathsPerTask;
    }

    public int getNumberOfTasks() {
        return (int)((numberOfPaths + (long)pathsPerTask - 1) / pathsPerTask);
    }

    /**
     * Returns the equidistant time discretization \( t_{i} = i \Delta t \), \( i = 0, \ldots, N \), with \( \Delta t = T / N \).
     * The tick size of the discretization is \( \Delta t \), times are not rounded to the default tick of
     * {@link TimeDiscretization}.
     *
     * @param maturity The maturity \( T \).
     * @return The time discretization.
     */
    public TimeDiscretizationInterface getTimeDiscretization(double maturity) {
        double deltaT = maturity / numberOfTimeSteps;
        return new TimeDiscretization(IntStream.rangeClosed(0, numberOfTimeSteps).mapToDouble(timeIndex -> timeIndex * deltaT), deltaT);
    }

    @Override
    public String toString() {
        return "MonteCarloConfiguration [numberOfPaths=" + numberOfPaths + ", numberOfTimeSteps=" + numberOfTimeSteps
                + ", numberOfRepetitions=" + numberOfRepetitions + ", repetitionReduction=" + repetitionReduction
                + ", seed=" + seed + ", numberOfThreads=" + numberOfThreads + ", pathsPerTask=" + pathsPerTask + "]";
    }
}
