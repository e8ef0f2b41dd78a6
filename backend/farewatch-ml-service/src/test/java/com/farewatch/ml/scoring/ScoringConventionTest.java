package com.farewatch.ml.scoring;

import com.farewatch.ml.detector.AnomalyDetector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScoringConventionTest {

  @Test
  @DisplayName("Inverse-ratio price: ratio 2.0 gives 0.5 with a 15% band")
  void inverseRatioEstimate() {
    double price = ScoringConvention.SCORE_SAMPLES.predictedPrice(2.0);
    double[] band = ScoringConvention.SCORE_SAMPLES.confidenceInterval(price);

    assertThat(price).isEqualTo(0.5);
    assertThat(band[0]).isCloseTo(0.425, within(1e-12));
    assertThat(band[1]).isCloseTo(0.575, within(1e-12));
  }

  @Test
  @DisplayName("Inverse-ratio price falls back to 1 for non-positive ratios")
  void inverseRatioDefault() {
    assertThat(ScoringConvention.SCORE_SAMPLES.predictedPrice(0.0)).isEqualTo(1.0);
    assertThat(ScoringConvention.SCORE_SAMPLES.predictedPrice(-3.0)).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Linear price uses a 10% band")
  void linearEstimate() {
    double price = ScoringConvention.DECISION_FUNCTION.predictedPrice(2.0);
    double[] band = ScoringConvention.DECISION_FUNCTION.confidenceInterval(price);

    assertThat(price).isEqualTo(200.0);
    assertThat(band[0]).isCloseTo(180.0, within(1e-9));
    assertThat(band[1]).isCloseTo(220.0, within(1e-9));
  }

  @Test
  @DisplayName("Probabilities decrease as scores grow under both conventions")
  void probabilitiesAreMonotonic() {
    for (ScoringConvention c : ScoringConvention.values()) {
      assertThat(c.anomalyProbability(-0.8)).isGreaterThan(c.anomalyProbability(-0.2));
      assertThat(c.anomalyProbability(0.0)).isEqualTo(0.5);
    }
    assertThat(ScoringConvention.SCORE_SAMPLES.anomalyProbability(-0.5))
        .isCloseTo(1.0 / (1.0 + Math.exp(-5.0)), within(1e-12));
  }

  @Test
  @DisplayName("Each convention reads the matching detector output")
  void readsDetectorOutput() {
    AnomalyDetector detector = new AnomalyDetector() {
      @Override
      public double scoreSamples(double[] scaledRow) {
        return -0.6;
      }

      @Override
      public double offset() {
        return -0.5;
      }
    };

    assertThat(ScoringConvention.SCORE_SAMPLES.score(detector, new double[0])).isEqualTo(-0.6);
    assertThat(ScoringConvention.DECISION_FUNCTION.score(detector, new double[0])).isCloseTo(-0.1, within(1e-12));
  }
}
