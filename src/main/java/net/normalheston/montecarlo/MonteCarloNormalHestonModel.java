/*
 * (c) Copyright the normalheston-lib authors. All rights reserved.
 *
 * Created on 19.10.2026
 */
package net.normalheston.montecarlo;

import net.finmath.exception.CalculationException;
import net.finmath.time.TimeDiscretizationInterface;
import net.normalheston.model.NormalHestonModel;
import net.normalheston.montecarlo.process.AbsorbedVarianceScheme;
import net.normalheston.montecarlo.process.ArithmeticAssetScheme;
import net.normalheston.montecarlo.process.PathState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Monte Carlo simulation of the normal stochastic variance model {@link NormalHestonModel}.
 *
 * The paths of a repetition are partitioned into tasks of {@link MonteCarloConfiguration#getPathsPerTask()} paths.
 * A task draws its correlated increments from a two factor {@link net.finmath.montecarlo.BrownianMotion} seeded
 * per repetition and task, evolves the variance with the absorption scheme and then the underlying.
 * Tasks are independent and are executed on a fixed thread pool. Results of the tasks are returned in task order,
 * such that a reduction over them is independent of the scheduling.
 *
 * @author normalheston-lib authors
 */
public class MonteCarloNormalHestonModel {

    private static final Logger log = LoggerFactory.getLogger(MonteCarloNormalHestonModel.class);

    private final NormalHestonModel model;
    private final MonteCarloConfiguration configuration;

    private final AbsorbedVarianceScheme varianceScheme;
    private final ArithmeticAssetScheme assetScheme;
    private final TimeDiscretizationInterface timeDiscretization;

    /**
     * Create the simulation. The correlation of the model is checked before any path is simulated.
     *
     * @param model The model parameters.
     * @param configuration The sizing of the simulation.
     */
    public MonteCarloNormalHestonModel(NormalHestonModel model, MonteCarloConfiguration configuration) {
        if(Math.abs(model.getCorrelation()) > 1.0) {
            throw new IllegalArgumentException("Correlation " + model.getCorrelation() + " is outside [-1, 1].");
        }

        this.model = model;
        this.configuration = configuration;
        this.timeDiscretization = configuration.getTimeDiscretization(model.getMaturity());

        this.varianceScheme = new AbsorbedVarianceScheme(model.getLongRunVariance(), model.getMeanReversionSpeed(), model.getVolatilityOfVariance());
        this.assetScheme = new ArithmeticAssetScheme(model.getRiskFreeRate(), model.getDividendYield());

        if(!model.isFellerConditionSatisfied()) {
            log.debug("Feller condition 2 kappa theta >= sigma^2 is violated, variance paths may be absorbed at zero: {}", model);
        }
    }

    /**
     * Simulates the paths of a single task.
     *
     * @param repetition The repetition index, 0 &le; repetition &lt; R.
     * @param taskIndex The task index, 0 &le; taskIndex &lt; {@link MonteCarloConfiguration#getNumberOfTasks()}.
     * @return The path state of the task.
     */
    public PathState getPathState(int repetition, int taskIndex) {
        int numberOfTimeSteps = configuration.getNumberOfTimeSteps();
        int numberOfPaths = getNumberOfPathsOfTask(taskIndex);

        long seed = getSeed(repetition, taskIndex);
        BrownianIncrements increments = new CorrelatedBrownianIncrements(timeDiscretization, model.getCorrelation(), numberOfPaths, (int)(seed ^ (seed >>> 32)))
                .getIncrements();

        PathState state = new PathState(numberOfPaths, numberOfTimeSteps, model.getInitialValue(), model.getInitialVariance());
        varianceScheme.evolve(state, increments.getVarianceIncrements(), timeDiscretization);
        assetScheme.evolve(state, increments.getAssetIncrements(), timeDiscretization);

        return state;
    }

    /**
     * Applies a function to the path state of every task of a repetition and returns the results in task order.
     * The path states are discarded after the function has been applied.
     *
     * @param repetition The repetition index.
     * @param taskFunction Function mapping the path state of a task to a partial result.
     * @param <T> Type of the partial result.
     * @return The partial results, one per task, in task order.
     * @throws CalculationException Thrown if a task fails or the calling thread is interrupted.
     */
    public <T> List<T> applyToTasks(int repetition, Function<PathState, T> taskFunction) throws CalculationException {
        int numberOfTasks = configuration.getNumberOfTasks();
        int numberOfThreads = Math.min(configuration.getNumberOfThreads(), numberOfTasks);

        List<T> results = new ArrayList<>(numberOfTasks);
        if(numberOfThreads <= 1) {
            for(int taskIndex = 0; taskIndex < numberOfTasks; taskIndex++) {
                if(Thread.currentThread().isInterrupted()) {
                    throw new CalculationException("Monte Carlo simulation interrupted in repetition " + repetition + ".");
                }
                try {
                    results.add(taskFunction.apply(getPathState(repetition, taskIndex)));
                }
                catch(RuntimeException e) {
                    throw new CalculationException("Monte Carlo simulation failed in repetition " + repetition + ".", e);
                }
            }
            return results;
        }

        ExecutorService executorService = Executors.newFixedThreadPool(numberOfThreads);
        try {
            List<Future<T>> futures = new ArrayList<>(numberOfTasks);
            for(int taskIndex = 0; taskIndex < numberOfTasks; taskIndex++) {
                final int task = taskIndex;
                futures.add(executorService.submit(() -> taskFunction.apply(getPathState(repetition, task))));
            }
            for(Future<T> future : futures) {
                results.add(future.get());
            }
        }
        catch(InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CalculationException("Monte Carlo simulation interrupted in repetition " + repetition + ".", e);
        }
        catch(ExecutionException e) {
            throw new CalculationException("Monte Carlo simulation failed in repetition " + repetition + ".", e.getCause());
        }
        finally {
            executorService.shutdownNow();
        }

        return results;
    }

    int getNumberOfPathsOfTask(int taskIndex) {
        int pathsPerTask = configuration.getPathsPerTask();
        return Math.min(pathsPerTask, configuration.getNumberOfPaths() - taskIndex * pathsPerTask);
    }

    long getSeed(int repetition, int taskIndex) {
        long seed = configuration.getSeed();
        seed = 1_000_003L * seed + repetition;
        seed = 1_000_003L * seed + taskIndex;
        // Finalizer of SplitMix64, spreads nearby seeds over the whole range.
        seed = (seed ^ (seed >>> 30)) * 0xbf58476d1ce4e5b9L;
        seed = (seed ^ (seed >>> 27)) * 0x94d049bb133111ebL;
        return seed ^ (seed >>> 31);
    }

    public NormalHestonModel getModel() {
        return model;
    }

    public MonteCarloConfiguration getConfiguration() {
        return configuration;
    }

    public TimeDiscretizationInterface getTimeDiscretization() {
        return timeDiscretization;
    }
}
