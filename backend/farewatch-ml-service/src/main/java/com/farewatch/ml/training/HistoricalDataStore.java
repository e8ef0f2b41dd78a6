package com.farewatch.ml.training;

import com.farewatch.ml.model.TrainingRow;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the price history used for training and for picking routes to retrain.
 */
public interface HistoricalDataStore {

  /**
   * Observations from the trailing lookback window with their rolling statistics and labels.
   * Rows whose 30-sample average is undefined are not returned.
   *
   * @param routeId a single route, or empty for every route
   */
  List<TrainingRow> fetchTrainingRows(Optional<String> routeId);

  /**
   * Highest-priority routes of the scheduled tier, best first.
   */
  List<String> fetchTopPriorityRoutes(int limit);

  List<String> fetchRoutesByTiers(Collection<String> tiers);
}
