package com.farewatch.ml.repo;

import com.farewatch.ml.entity.PriceHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface PriceHistoryRepository extends JpaRepository<PriceHistory, String> {

  // Rolling windows exclude the current row; a null routeId selects every route.
  @Query(value = "WITH price_stats AS ( " +
      "SELECT CAST(ph.route_id AS text) AS route_id, ph.price, ph.departure_date, ph.return_date, ph.created_at, " +
      "AVG(ph.price) OVER (PARTITION BY ph.route_id ORDER BY ph.created_at ROWS BETWEEN 30 PRECEDING AND 1 PRECEDING) AS avg_price_30d, " +
      "STDDEV(ph.price) OVER (PARTITION BY ph.route_id ORDER BY ph.created_at ROWS BETWEEN 30 PRECEDING AND 1 PRECEDING) AS std_price_30d, " +
      "MIN(ph.price) OVER (PARTITION BY ph.route_id ORDER BY ph.created_at ROWS BETWEEN 90 PRECEDING AND 1 PRECEDING) AS min_price_90d, " +
      "MAX(ph.price) OVER (PARTITION BY ph.route_id ORDER BY ph.created_at ROWS BETWEEN 90 PRECEDING AND 1 PRECEDING) AS max_price_90d, " +
      "a.id IS NOT NULL AS is_anomaly " +
      "FROM price_history ph " +
      "JOIN routes r ON ph.route_id = r.id " +
      "LEFT JOIN anomalies a ON ph.id = a.price_history_id AND a.status IN ('detected', 'verified') " +
      "WHERE ph.created_at > NOW() - (:lookbackDays * INTERVAL '1 day') " +
      "AND (CAST(:routeId AS text) IS NULL OR CAST(ph.route_id AS text) = CAST(:routeId AS text)) " +
      ") " +
      "SELECT route_id AS \"routeId\", price AS \"price\", " +
      "CAST(CAST(departure_date AS date) AS text) AS \"departureDate\", " +
      "CAST(CAST(return_date AS date) AS text) AS \"returnDate\", " +
      "CAST(EXTRACT(EPOCH FROM created_at) * 1000 AS bigint) AS \"observedAtMillis\", " +
      "avg_price_30d AS \"avgPrice30d\", std_price_30d AS \"stdPrice30d\", " +
      "min_price_90d AS \"minPrice90d\", max_price_90d AS \"maxPrice90d\", is_anomaly AS \"isAnomaly\" " +
      "FROM price_stats WHERE avg_price_30d IS NOT NULL",
      nativeQuery = true)
  List<TrainingRowView> findTrainingRows(@Param("routeId") String routeId,
                                         @Param("lookbackDays") int lookbackDays);
}
