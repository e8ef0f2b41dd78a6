package com.farewatch.ml.scheduling;

import com.farewatch.ml.model.TrainingOutcome;
import com.farewatch.ml.store.ModelStore;
import com.farewatch.ml.training.HistoricalDataStore;
import com.farewatch.ml.training.TrainingService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Keeps models fresh: every interval, retrain the global model and then the top-priority
 * routes one by one with a pause between them. The first cycle runs one interval after
 * startup. A failing model is reported and the cycle moves on; a failing cycle is reported
 * and the next one still runs.
 */
@Component
public class RetrainingScheduler {

  private static final Logger log = LoggerFactory.getLogger(RetrainingScheduler.class);

  private final TrainingService training;
  private final HistoricalDataStore data;
  private final TaskScheduler taskScheduler;
  private final RetrainingCycleListener listener;
  private final Sleeper sleeper;
  private final boolean enabled;
  private final Duration interval;
  private final Duration routePacing;
  private final int topRoutes;

  private ScheduledFuture<?> task;

  @Autowired
  public RetrainingScheduler(TrainingService training,
                             HistoricalDataStore data,
                             @Qualifier("retrainingTaskScheduler") TaskScheduler taskScheduler,
                             RetrainingCycleListener listener,
                             @Value("${farewatch.ml.retraining.enabled:true}") boolean enabled,
                             @Value("${farewatch.ml.retraining.interval:PT6H}") Duration interval,
                             @Value("${farewatch.ml.retraining.route-pacing:PT10S}") Duration routePacing,
                             @Value("${farewatch.ml.retraining.top-routes:10}") int topRoutes) {
    this(training, data, taskScheduler, listener, Sleeper.THREAD, enabled, interval, routePacing, topRoutes);
  }

  RetrainingScheduler(TrainingService training,
                      HistoricalDataStore data,
                      TaskScheduler taskScheduler,
                      RetrainingCycleListener listener,
                      Sleeper sleeper,
                      boolean enabled,
                      Duration interval,
                      Duration routePacing,
                      int topRoutes) {
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("retraining interval must be positive, got: " + interval);
    }
    this.training = training;
    this.data = data;
    this.taskScheduler = taskScheduler;
    this.listener = listener;
    this.sleeper = sleeper;
    this.enabled = enabled;
    this.interval = interval;
    this.routePacing = routePacing;
    this.topRoutes = topRoutes;
  }

  @EventListener(ApplicationReadyEvent.class)
  public synchronized void start() {
    if (!enabled) {
      log.info("[retrain] Background retraining disabled");
      return;
    }
    if (task != null) {
      return;
    }
    task = taskScheduler.scheduleWithFixedDelay(this::runScheduledCycle, Instant.now().plus(interval), interval);
    log.info("[retrain] Scheduled every {} ({} routes, {} pacing)", interval, topRoutes, routePacing);
  }

  @PreDestroy
  public synchronized void stop() {
    if (task != null) {
      task.cancel(true);
      task = null;
      log.info("[retrain] Background retraining stopped");
    }
  }

  public synchronized boolean isRunning() {
    return task != null && !task.isCancelled();
  }

  /**
   * Run one cycle on the calling thread.
   */
  public CycleReport runCycle() {
    Instant start = Instant.now();
    log.info("[retrain] Cycle started at {}", start);
    List<TrainingOutcome> outcomes = new ArrayList<>();
    Map<String, String> failures = new LinkedHashMap<>();

    attempt(Optional.empty(), outcomes, failures);

    List<String> routes = data.fetchTopPriorityRoutes(topRoutes);
    for (String routeId : routes.subList(0, Math.min(topRoutes, routes.size()))) {
      try {
        sleeper.sleep(routePacing);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.info("[retrain] Interrupted, abandoning the rest of the cycle");
        break;
      }
      attempt(Optional.of(routeId), outcomes, failures);
    }

    CycleReport report = new CycleReport(start, Duration.between(start, Instant.now()), outcomes, failures);
    listener.onCycleCompleted(report);
    return report;
  }

  void runScheduledCycle() {
    try {
      runCycle();
    } catch (RuntimeException e) {
      listener.onCycleFailed(e);
    }
  }

  private void attempt(Optional<String> routeId, List<TrainingOutcome> outcomes, Map<String, String> failures) {
    try {
      outcomes.add(training.train(routeId));
    } catch (RuntimeException e) {
      String modelId = routeId.orElse(ModelStore.GLOBAL_MODEL_ID);
      log.error("[retrain] Training '{}' failed: {}", modelId, e.getMessage(), e);
      failures.put(modelId, String.valueOf(e.getMessage()));
    }
  }
}
