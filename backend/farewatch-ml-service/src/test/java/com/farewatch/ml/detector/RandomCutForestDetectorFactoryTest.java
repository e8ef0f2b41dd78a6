package com.farewatch.ml.detector;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RandomCutForestDetectorFactoryTest {

  private RandomCutForestDetectorFactory factory;
  private double[][] rows;

  @BeforeEach
  void setUp() {
    factory = new RandomCutForestDetectorFactory(30, 64, 42L);
    Random random = new Random(7);
    rows = new double[300][3];
    for (double[] row : rows) {
      for (int j = 0; j < row.length; j++) {
        row[j] = random.nextGaussian();
      }
    }
  }

  @Test
  @DisplayName("Should flag roughly the contamination share of the training rows")
  void shouldPlaceThresholdAtContamination() {
    AnomalyDetector detector = factory.fit(rows, 0.1);

    long outliers = 0;
    for (double[] row : rows) {
      if (detector.isOutlier(row)) {
        outliers++;
      }
    }
    assertThat(outliers).isBetween(20L, 40L);
  }

  @Test
  @DisplayName("Should score far-away points as less normal than the bulk")
  void shouldRankIsolatedPointsLower() {
    AnomalyDetector detector = factory.fit(rows, 0.05);

    double typical = detector.scoreSamples(new double[] {0.0, 0.0, 0.0});
    double isolated = detector.scoreSamples(new double[] {8.0, -8.0, 8.0});

    assertThat(isolated).isLessThan(typical);
    assertThat(detector.isOutlier(new double[] {8.0, -8.0, 8.0})).isTrue();
  }

  @Test
  @DisplayName("Should restore a detector that scores exactly like the original")
  void shouldRoundTripScores() {
    AnomalyDetector original = factory.fit(rows, 0.05);

    AnomalyDetector restored = factory.deserialize(factory.serialize(original));

    assertThat(restored.offset()).isEqualTo(original.offset());
    double[][] probes = {{0.0, 0.0, 0.0}, {1.5, -0.3, 2.2}, {6.0, 6.0, -6.0}};
    for (double[] probe : probes) {
      assertThat(restored.scoreSamples(probe)).isCloseTo(original.scoreSamples(probe), within(1e-9));
    }
  }

  @Test
  @DisplayName("Should give identical forests for identical data and seed")
  void shouldBeDeterministic() {
    double[] probe = {0.7, -1.2, 0.4};

    double first = factory.fit(rows, 0.05).scoreSamples(probe);
    double second = new RandomCutForestDetectorFactory(30, 64, 42L).fit(rows, 0.05).scoreSamples(probe);

    assertThat(second).isEqualTo(first);
  }

  @Test
  @DisplayName("Should reject contamination outside (0, 0.5]")
  void shouldRejectBadContamination() {
    assertThatThrownBy(() -> factory.fit(rows, 0.0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> factory.fit(rows, 0.6)).isInstanceOf(IllegalArgumentException.class);
  }
}
