package org.nowstart.tseval.service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tseval.algorithm.AlgorithmDescriptor;
import org.nowstart.tseval.data.dto.LoadedDataset;
import org.nowstart.tseval.data.dto.MetricScore;
import org.nowstart.tseval.data.dto.TrialKey;
import org.nowstart.tseval.data.dto.TrialResult;
import org.nowstart.tseval.data.exception.AlgorithmInvocationException;
import org.nowstart.tseval.data.property.EvaluationProperties;
import org.nowstart.tseval.data.type.TrialState;
import org.nowstart.tseval.dataset.DatasetRegistry;
import org.nowstart.tseval.result.ResultsStore;
import org.nowstart.tseval.service.EvaluationPlan.PlannedTrial;
import org.springframework.stereotype.Service;

/**
 * Runs every trial of an {@link EvaluationPlan} and records exactly one row per trial.
 * Dataset and algorithm failures are confined to their trial.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionEngine {

    private final DatasetRegistry datasetRegistry;
    private final ScoringService scoringService;
    private final ScoreScaler scoreScaler;
    private final TrialLogService trialLogService;
    private final TrialArtifactWriter trialArtifactWriter;
    private final EvaluationProperties evaluationProperties;

    public ResultsStore run(EvaluationPlan plan) {
        ResultsStore store = new ResultsStore();
        run(plan, store);
        return store;
    }

    /**
     * Runs the plan into an existing store; rows of keys already present are overwritten in place.
     */
    public void run(EvaluationPlan plan, ResultsStore store) {
        List<PlannedTrial> trials = plan.trials();
        for (PlannedTrial trial : trials) {
            store.reserve(trial.key());
        }

        long startedAtNanos = System.nanoTime();
        ExecutorService invocationExecutor = evaluationProperties.hasTrialTimeout()
                ? Executors.newCachedThreadPool(daemonThreads("tseval-algorithm-"))
                : null;
        try {
            int parallelism = evaluationProperties.parallelism();
            if (parallelism <= 1) {
                for (PlannedTrial trial : trials) {
                    store.append(execute(trial, plan.artifactDir(), invocationExecutor));
                }
            } else {
                runParallel(trials, parallelism, plan.artifactDir(), invocationExecutor, store);
            }
        } finally {
            if (invocationExecutor != null) {
                invocationExecutor.shutdownNow();
            }
        }
        trialLogService.logRunSummary(plan, store, Duration.ofNanos(System.nanoTime() - startedAtNanos));
    }

    private void runParallel(
            List<PlannedTrial> trials,
            int parallelism,
            Path artifactDir,
            ExecutorService invocationExecutor,
            ResultsStore store
    ) {
        ForkJoinPool pool = new ForkJoinPool(parallelism);
        try {
            pool.submit(() -> trials.parallelStream()
                    .forEach(trial -> store.append(execute(trial, artifactDir, invocationExecutor))))
                    .get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Evaluation run interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Evaluation run failed", e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    TrialResult execute(PlannedTrial plannedTrial, Path artifactDir, ExecutorService invocationExecutor) {
        TrialKey key = plannedTrial.key();
        Trial trial = new Trial(key);

        moveTo(trial, TrialState.LOADING);
        LoadedDataset dataset;
        try {
            dataset = datasetRegistry.load(key.datasetId());
        } catch (RuntimeException e) {
            moveTo(trial, TrialState.ERROR);
            TrialResult result = TrialResult.datasetError(key, describe(e));
            trialLogService.logTrialFailed(result, e);
            return result;
        }

        moveTo(trial, TrialState.RUNNING);
        AlgorithmDescriptor algorithm = plannedTrial.algorithm();
        long invokedAtNanos = System.nanoTime();
        double[] scores;
        Duration duration;
        try {
            scores = invoke(algorithm, dataset.values(), invocationExecutor);
            duration = Duration.ofNanos(System.nanoTime() - invokedAtNanos);
            if (scores == null) {
                throw new AlgorithmInvocationException("Algorithm " + algorithm.name() + " returned no scores");
            }
            scores = algorithm.postprocessor().apply(scores);
            if (scores == null) {
                throw new AlgorithmInvocationException("Postprocessing of " + algorithm.name() + " returned no scores");
            }
        } catch (RuntimeException | Error e) {
            if (isFatal(e)) {
                throw e;
            }
            moveTo(trial, TrialState.ERROR);
            TrialResult result = TrialResult.algorithmError(
                    key,
                    Duration.ofNanos(System.nanoTime() - invokedAtNanos),
                    describe(e)
            );
            trialLogService.logTrialFailed(result, e);
            return result;
        }

        moveTo(trial, TrialState.SCORING);
        double[] scaled = evaluationProperties.scaleScores() ? scoreScaler.minMaxScale(scores) : scores;
        Map<String, MetricScore> metrics = scoringService.score(scaled, dataset.labels());
        if (artifactDir != null) {
            writeScores(artifactDir, key, scaled);
        }

        moveTo(trial, TrialState.DONE);
        TrialResult result = TrialResult.success(key, duration, metrics);
        trialLogService.logTrialDone(result);
        return result;
    }

    private double[] invoke(AlgorithmDescriptor algorithm, double[][] values, ExecutorService invocationExecutor) {
        Path tempDir = evaluationProperties.resolveTempDir();
        if (invocationExecutor == null) {
            return algorithm.invoke(values, tempDir);
        }

        Duration timeout = evaluationProperties.trialTimeout();
        Future<double[]> future = invocationExecutor.submit(() -> algorithm.invoke(values, tempDir));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AlgorithmInvocationException("Algorithm " + algorithm.name() + " timed out after " + timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AlgorithmInvocationException("Interrupted while waiting for algorithm " + algorithm.name(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new AlgorithmInvocationException("Algorithm " + algorithm.name() + " failed: " + describe(cause), cause);
        }
    }

    private void writeScores(Path artifactDir, TrialKey key, double[] scores) {
        try {
            trialArtifactWriter.writeScores(artifactDir, key, scores);
        } catch (RuntimeException e) {
            log.warn("event=scores_write_failed dataset={} algorithm={} dir={}", key.datasetId(), key.algorithmName(), artifactDir, e);
        }
    }

    private void moveTo(Trial trial, TrialState next) {
        trial.moveTo(next);
        trialLogService.logTransition(trial.getKey(), next);
    }

    // a detector overflowing its own stack leaves the VM usable
    private boolean isFatal(Throwable error) {
        return error instanceof VirtualMachineError && !(error instanceof StackOverflowError);
    }

    private String describe(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }

    private ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
