package com.farewatch.ml.scheduling;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingCycleListener implements RetrainingCycleListener {

  private static final Logger log = LoggerFactory.getLogger(LoggingCycleListener.class);

  private final MeterRegistry metrics;

  public LoggingCycleListener(MeterRegistry metrics) {
    this.metrics = metrics;
  }

  @Override
  public void onCycleCompleted(CycleReport report) {
    if (report.hasFailures()) {
      log.warn("[retrain] Cycle finished in {} ms: trained={} attempted={} failed={}",
          report.elapsed().toMillis(), report.trainedCount(), report.outcomes().size() + report.failures().size(),
          report.failures().keySet());
      metrics.counter("farewatch_retraining_cycles_total", "result", "partial").increment();
    } else {
      log.info("[retrain] Cycle finished in {} ms: trained={} attempted={}",
          report.elapsed().toMillis(), report.trainedCount(), report.outcomes().size());
      metrics.counter("farewatch_retraining_cycles_total", "result", "completed").increment();
    }
  }

  @Override
  public void onCycleFailed(Throwable error) {
    log.error("[retrain] Cycle aborted: {}", error.getMessage(), error);
    metrics.counter("farewatch_retraining_cycles_total", "result", "failed").increment();
  }
}
