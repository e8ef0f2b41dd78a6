package com.farewatch.ml.scoring;

import com.farewatch.ml.model.AnomalyResult;
import com.farewatch.ml.model.FeatureVector;
import com.farewatch.ml.service.ModelUnavailableException;
import com.farewatch.ml.store.AnomalyModel;
import com.farewatch.ml.store.ModelStore;
import com.farewatch.ml.training.TrainingService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Scores feature vectors against published models. Read-only with respect to the store,
 * except under {@link FallbackPolicy#SYNTHESIZE_DEFAULT}.
 */
@Service
public class ScoringEngine {

  private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

  private final ModelStore models;
  private final TrainingService training;
  private final FallbackPolicy fallbackPolicy;
  private final ScoringConvention convention;
  private final Counter detections;

  public ScoringEngine(ModelStore models,
                       TrainingService training,
                       MeterRegistry metrics,
                       @Value("${farewatch.ml.fallback-policy:FALLBACK_TO_GLOBAL}") FallbackPolicy fallbackPolicy,
                       @Value("${farewatch.ml.scoring-convention:SCORE_SAMPLES}") ScoringConvention convention) {
    this.models = models;
    this.training = training;
    this.fallbackPolicy = fallbackPolicy;
    this.convention = convention;
    this.detections = metrics.counter("farewatch_detections_total");
    log.info("Scoring with policy={} convention={}", fallbackPolicy, convention);
  }

  /**
   * @param modelId requested model, null or blank for the global model
   * @throws ModelUnavailableException when no trained model resolves under the fallback policy
   */
  public AnomalyResult score(String modelId, FeatureVector features) {
    if (!features.isFinite()) {
      throw new IllegalArgumentException("feature values must be finite numbers");
    }
    String requested = (modelId == null || modelId.isBlank()) ? ModelStore.GLOBAL_MODEL_ID : modelId;
    AnomalyModel model = resolve(requested);

    double[] scaled = model.scaler().transform(features.toModelInput());
    double score = convention.score(model.detector(), scaled);
    double probability = convention.anomalyProbability(score);
    double predictedPrice = convention.predictedPrice(features.priceRatio());
    double[] band = convention.confidenceInterval(predictedPrice);
    detections.increment();

    log.debug("Scored with '{}' (requested '{}'): score={} probability={}",
        model.modelId(), requested, score, probability);
    return new AnomalyResult(model.modelId(), score, predictedPrice, probability, List.of(band[0], band[1]));
  }

  private AnomalyModel resolve(String modelId) {
    AnomalyModel direct = models.get(modelId).filter(AnomalyModel::isTrained).orElse(null);
    if (direct != null) {
      return direct;
    }
    return switch (fallbackPolicy) {
      case FALLBACK_TO_GLOBAL -> models.get(ModelStore.GLOBAL_MODEL_ID)
          .filter(AnomalyModel::isTrained)
          .orElseThrow(() -> new ModelUnavailableException(
              "No trained model for '" + modelId + "' and no trained global model"));
      case SYNTHESIZE_DEFAULT -> training.synthesizeIfAbsent(modelId);
      case REJECT -> throw new ModelUnavailableException("No trained model for '" + modelId + "'");
    };
  }
}
