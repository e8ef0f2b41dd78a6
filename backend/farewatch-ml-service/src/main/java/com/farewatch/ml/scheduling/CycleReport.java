package com.farewatch.ml.scheduling;

import com.farewatch.ml.model.TrainingOutcome;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one retraining cycle. {@code failures} maps model id to the error message of
 * each attempt that threw.
 */
public record CycleReport(
    Instant startedAt,
    Duration elapsed,
    List<TrainingOutcome> outcomes,
    Map<String, String> failures
) {

  public CycleReport {
    outcomes = List.copyOf(outcomes);
    failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
  }

  public long trainedCount() {
    return outcomes.stream().filter(TrainingOutcome::trained).count();
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }
}
