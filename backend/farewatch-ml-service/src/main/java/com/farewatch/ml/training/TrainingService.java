package com.farewatch.ml.training;

import com.farewatch.ml.model.TrainingOutcome;
import com.farewatch.ml.model.TrainingRequest;
import com.farewatch.ml.store.AnomalyModel;
import com.farewatch.ml.store.ModelStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Entry point for every fit. All work runs on the single training thread, so fits never
 * compete with request threads for CPU and never race each other on the same model id.
 */
@Service
public class TrainingService {

  private static final Logger log = LoggerFactory.getLogger(TrainingService.class);

  static final List<String> RETRAIN_ALL_TIERS = List.of("1", "2");

  private final TrainingPipeline pipeline;
  private final HistoricalDataStore data;
  private final ModelStore models;
  private final AsyncTaskExecutor trainingExecutor;

  public TrainingService(TrainingPipeline pipeline,
                         HistoricalDataStore data,
                         ModelStore models,
                         @Qualifier("trainingExecutor") AsyncTaskExecutor trainingExecutor) {
    this.pipeline = pipeline;
    this.data = data;
    this.models = models;
    this.trainingExecutor = trainingExecutor;
  }

  public TrainingOutcome train(Optional<String> routeId) {
    return runOnTrainingThread(() -> pipeline.train(routeId));
  }

  /**
   * Handle an explicit training request: either global plus every tier 1 and 2 route, or a
   * single route (global when none is given).
   */
  public List<TrainingOutcome> trigger(TrainingRequest request) {
    if (request.retrainAll()) {
      List<TrainingOutcome> outcomes = new ArrayList<>();
      outcomes.add(train(Optional.empty()));
      List<String> routes = data.fetchRoutesByTiers(RETRAIN_ALL_TIERS);
      log.info("[trigger] Retraining global and {} tier {} routes", routes.size(), RETRAIN_ALL_TIERS);
      for (String routeId : routes) {
        outcomes.add(train(Optional.of(routeId)));
      }
      return outcomes;
    }
    Optional<String> routeId = Optional.ofNullable(request.routeId()).filter(id -> !id.isBlank());
    return List.of(train(routeId));
  }

  /**
   * Return the trained model for the id, synthesizing one first if there is none.
   */
  public AnomalyModel synthesizeIfAbsent(String modelId) {
    return runOnTrainingThread(() -> models.get(modelId)
        .filter(AnomalyModel::isTrained)
        .orElseGet(() -> pipeline.synthesizeDefault(modelId)));
  }

  private <T> T runOnTrainingThread(Callable<T> task) {
    Future<T> future = trainingExecutor.submit(task);
    try {
      return future.get();
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for training", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException re) {
        throw re;
      }
      if (cause instanceof Error err) {
        throw err;
      }
      throw new IllegalStateException("Training failed", cause);
    }
  }
}
