package com.farewatch.ml.scheduling;

public interface RetrainingCycleListener {

  /** Called after every cycle that ran to the end, including ones with failed models. */
  void onCycleCompleted(CycleReport report);

  /** Called when a cycle could not run to the end. */
  void onCycleFailed(Throwable error);
}
