package com.farewatch.ml.repo;

import com.farewatch.ml.entity.MlPrediction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface MlPredictionRepository extends JpaRepository<MlPrediction, Long> {

  /**
   * Copy the anomaly's route and price row into a feedback prediction record.
   *
   * @return number of inserted rows, 0 when the anomaly id is unknown
   */
  @Modifying
  @Transactional
  @Query(value = "INSERT INTO ml_predictions (model_version, route_id, price_history_id, " +
      "predicted_anomaly, actual_anomaly, feedback_received_at) " +
      "SELECT :modelVersion, a.route_id, a.price_history_id, true, :correct, NOW() " +
      "FROM anomalies a WHERE CAST(a.id AS text) = :anomalyId", nativeQuery = true)
  int recordFeedback(@Param("anomalyId") String anomalyId,
                     @Param("correct") boolean correct,
                     @Param("modelVersion") String modelVersion);
}
