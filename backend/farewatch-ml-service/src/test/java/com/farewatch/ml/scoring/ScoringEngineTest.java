package com.farewatch.ml.scoring;

import com.farewatch.ml.detector.AnomalyDetector;
import com.farewatch.ml.feature.StandardScaler;
import com.farewatch.ml.model.AnomalyResult;
import com.farewatch.ml.model.FeatureVector;
import com.farewatch.ml.service.ModelUnavailableException;
import com.farewatch.ml.store.AnomalyModel;
import com.farewatch.ml.store.ModelStore;
import com.farewatch.ml.training.TrainingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScoringEngineTest {

  private static final FeatureVector FEATURES = new FeatureVector(2.0, 3.5, 4, 21, 7, 1.3, 0.1, 0.0);

  @Mock
  private ModelStore models;
  @Mock
  private TrainingService training;

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

  private ScoringEngine engine(FallbackPolicy policy, ScoringConvention convention) {
    return new ScoringEngine(models, training, registry, policy, convention);
  }

  @Test
  @DisplayName("Should score with the requested model when it is trained")
  void shouldScoreWithRequestedModel() {
    when(models.get("r-1")).thenReturn(Optional.of(trained("r-1")));

    AnomalyResult result = engine(FallbackPolicy.FALLBACK_TO_GLOBAL, ScoringConvention.SCORE_SAMPLES)
        .score("r-1", FEATURES);

    assertThat(result.modelId()).isEqualTo("r-1");
    assertThat(result.isolationScore()).isEqualTo(-0.6);
    assertThat(result.anomalyProbability()).isCloseTo(1.0 / (1.0 + Math.exp(-6.0)), within(1e-12));
    assertThat(result.predictedPrice()).isEqualTo(0.5);
    assertThat(result.lower()).isCloseTo(0.425, within(1e-12));
    assertThat(result.upper()).isCloseTo(0.575, within(1e-12));
    assertThat(registry.counter("farewatch_detections_total").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should serve unknown routes with the global model")
  void shouldFallBackToGlobal() {
    when(models.get("unknown")).thenReturn(Optional.empty());
    when(models.get("global")).thenReturn(Optional.of(trained("global")));

    AnomalyResult result = engine(FallbackPolicy.FALLBACK_TO_GLOBAL, ScoringConvention.SCORE_SAMPLES)
        .score("unknown", FEATURES);

    assertThat(result.modelId()).isEqualTo("global");
  }

  @Test
  @DisplayName("Should report unavailable when only the untrained placeholder exists")
  void shouldFailWithoutTrainedGlobal() {
    when(models.get("unknown")).thenReturn(Optional.empty());
    when(models.get("global")).thenReturn(Optional.of(AnomalyModel.placeholder("global")));

    assertThatThrownBy(() -> engine(FallbackPolicy.FALLBACK_TO_GLOBAL, ScoringConvention.SCORE_SAMPLES)
        .score("unknown", FEATURES))
        .isInstanceOf(ModelUnavailableException.class);
  }

  @Test
  @DisplayName("Should score blank model ids against the global model")
  void shouldDefaultToGlobal() {
    when(models.get("global")).thenReturn(Optional.of(trained("global")));

    assertThat(engine(FallbackPolicy.REJECT, ScoringConvention.SCORE_SAMPLES).score(null, FEATURES).modelId())
        .isEqualTo("global");
  }

  @Test
  @DisplayName("Should reject unknown ids under the reject policy")
  void shouldReject() {
    when(models.get("unknown")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> engine(FallbackPolicy.REJECT, ScoringConvention.SCORE_SAMPLES).score("unknown", FEATURES))
        .isInstanceOf(ModelUnavailableException.class);
    verifyNoInteractions(training);
  }

  @Test
  @DisplayName("Should synthesize a model for unknown ids under the synthesize policy")
  void shouldSynthesize() {
    when(models.get("new-route")).thenReturn(Optional.empty());
    when(training.synthesizeIfAbsent("new-route")).thenReturn(trained("new-route"));

    AnomalyResult result = engine(FallbackPolicy.SYNTHESIZE_DEFAULT, ScoringConvention.SCORE_SAMPLES)
        .score("new-route", FEATURES);

    assertThat(result.modelId()).isEqualTo("new-route");
    verify(training).synthesizeIfAbsent("new-route");
  }

  @Test
  @DisplayName("Should use the threshold-relative score under the decision convention")
  void shouldUseDecisionConvention() {
    when(models.get("r-1")).thenReturn(Optional.of(trained("r-1")));

    AnomalyResult result = engine(FallbackPolicy.FALLBACK_TO_GLOBAL, ScoringConvention.DECISION_FUNCTION)
        .score("r-1", FEATURES);

    assertThat(result.isolationScore()).isCloseTo(-0.05, within(1e-12));
    assertThat(result.anomalyProbability()).isCloseTo(1.0 / (1.0 + Math.exp(-0.05)), within(1e-12));
    assertThat(result.predictedPrice()).isEqualTo(200.0);
    assertThat(result.confidenceInterval()).hasSize(2);
  }

  @Test
  @DisplayName("Should refuse non-finite feature values")
  void shouldRejectNonFinite() {
    FeatureVector bad = new FeatureVector(Double.NaN, 0, 0, 0, 0, 1.0, 0, 0);

    assertThatThrownBy(() -> engine(FallbackPolicy.FALLBACK_TO_GLOBAL, ScoringConvention.SCORE_SAMPLES)
        .score("r-1", bad))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static AnomalyModel trained(String id) {
    double[] zeros = new double[FeatureVector.MODEL_FEATURE_COUNT];
    double[] ones = new double[FeatureVector.MODEL_FEATURE_COUNT];
    Arrays.fill(ones, 1.0);
    AnomalyDetector detector = new AnomalyDetector() {
      @Override
      public double scoreSamples(double[] scaledRow) {
        return -0.6;
      }

      @Override
      public double offset() {
        return -0.55;
      }
    };
    return new AnomalyModel(id, detector, StandardScaler.of(zeros, ones), Instant.now(), 500, 0.05);
  }
}
