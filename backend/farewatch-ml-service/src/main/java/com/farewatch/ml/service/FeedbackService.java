package com.farewatch.ml.service;

import com.farewatch.ml.repo.MlPredictionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class FeedbackService {

  private static final Logger log = LoggerFactory.getLogger(FeedbackService.class);

  private final MlPredictionRepository predictions;
  private final String modelVersion;

  public FeedbackService(MlPredictionRepository predictions,
                         @Value("${farewatch.ml.model-version:v1.0}") String modelVersion) {
    this.predictions = predictions;
    this.modelVersion = modelVersion;
  }

  /**
   * Record whether a flagged anomaly was a real one.
   *
   * @throws NotFoundException if the anomaly id is unknown
   */
  public void recordFeedback(String anomalyId, boolean correct) {
    int inserted = predictions.recordFeedback(anomalyId, correct, modelVersion);
    if (inserted == 0) {
      throw new NotFoundException("Anomaly not found: " + anomalyId);
    }
    log.info("Feedback recorded: anomaly={} correct={} version={}", anomalyId, correct, modelVersion);
  }
}
