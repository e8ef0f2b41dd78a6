package com.farewatch.ml.training;

import com.farewatch.ml.model.PriceObservation;
import com.farewatch.ml.model.RouteStatistics;
import com.farewatch.ml.model.TrainingRow;
import com.farewatch.ml.repo.PriceHistoryRepository;
import com.farewatch.ml.repo.RouteRepository;
import com.farewatch.ml.repo.TrainingRowView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Component
public class JpaHistoricalDataStore implements HistoricalDataStore {

  private static final Logger log = LoggerFactory.getLogger(JpaHistoricalDataStore.class);

  private final PriceHistoryRepository priceHistory;
  private final RouteRepository routes;
  private final int lookbackDays;
  private final String scheduledTier;

  public JpaHistoricalDataStore(PriceHistoryRepository priceHistory,
                                RouteRepository routes,
                                @Value("${farewatch.ml.training.lookback-days:180}") int lookbackDays,
                                @Value("${farewatch.ml.retraining.tier:1}") String scheduledTier) {
    this.priceHistory = priceHistory;
    this.routes = routes;
    this.lookbackDays = lookbackDays;
    this.scheduledTier = scheduledTier;
  }

  @Override
  @Transactional(readOnly = true)
  public List<TrainingRow> fetchTrainingRows(Optional<String> routeId) {
    List<TrainingRowView> views = priceHistory.findTrainingRows(routeId.orElse(null), lookbackDays);
    List<TrainingRow> rows = new ArrayList<>(views.size());
    int skipped = 0;
    for (TrainingRowView v : views) {
      if (v.getPrice() == null || v.getDepartureDate() == null || v.getObservedAtMillis() == null) {
        skipped++;
        continue;
      }
      PriceObservation obs = new PriceObservation(
          v.getRouteId(),
          v.getPrice().doubleValue(),
          LocalDate.parse(v.getDepartureDate()),
          v.getReturnDate() != null ? LocalDate.parse(v.getReturnDate()) : null,
          Instant.ofEpochMilli(v.getObservedAtMillis().longValue()));
      RouteStatistics stats = new RouteStatistics(
          toDouble(v.getAvgPrice30d()),
          toDouble(v.getStdPrice30d()),
          toDouble(v.getMinPrice90d()),
          toDouble(v.getMaxPrice90d()));
      rows.add(new TrainingRow(obs, stats, Boolean.TRUE.equals(v.getIsAnomaly())));
    }
    if (skipped > 0) {
      log.debug("Skipped {} incomplete price rows (route={})", skipped, routeId.orElse("*"));
    }
    return rows;
  }

  @Override
  @Transactional(readOnly = true)
  public List<String> fetchTopPriorityRoutes(int limit) {
    return routes.findTopPriorityRouteIds(scheduledTier, limit);
  }

  @Override
  @Transactional(readOnly = true)
  public List<String> fetchRoutesByTiers(Collection<String> tiers) {
    return routes.findRouteIdsByTiers(tiers);
  }

  private static Double toDouble(Number n) {
    return n == null ? null : n.doubleValue();
  }
}
